package io.lexlink.courier.application.protocol;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import io.lexlink.courier.domain.frame.InboundFrame;
import io.lexlink.courier.domain.frame.OutboundFrame;
import java.util.List;
import org.junit.jupiter.api.Test;

class FrameCodecTest {
  private final FrameCodec codec = new FrameCodec();

  @Test
  void decodesNewMessageWithServerFieldNames() throws Exception {
    InboundFrame frame = codec.decode("""
        {"type":"new_message","message":{"message_id":"m1","sender_id":42,"sender_type":"lawyer",
         "text":"Hello","timestamp":"2024-05-01T10:00:00Z","read_by_user":true,"read_by_lawyer":false}}
        """);

    Message message = assertInstanceOf(InboundFrame.NewMessage.class, frame).message();
    assertEquals("m1", message.id());
    assertEquals(42L, message.senderId());
    assertEquals(SenderRole.COUNTERPART, message.senderRole());
    assertEquals("Hello", message.text());
    assertEquals("2024-05-01T10:00:00Z", message.timestamp());
    assertTrue(message.readByClient());
    assertFalse(message.readByCounterpart());
  }

  @Test
  void acceptsCamelCaseAliases() throws Exception {
    InboundFrame frame = codec.decode("""
        {"type":"new_message","message":{"id":"m2","senderId":5,"senderRole":"user","text":"Hi",
         "timestamp":"t","readByCounterpart":true}}
        """);

    Message message = ((InboundFrame.NewMessage) frame).message();
    assertEquals("m2", message.id());
    assertEquals(SenderRole.CLIENT, message.senderRole());
    assertTrue(message.readByCounterpart());
  }

  @Test
  void decodesTypingAndReadReceipt() throws Exception {
    InboundFrame.TypingIndicator typing = (InboundFrame.TypingIndicator) codec.decode(
        "{\"type\":\"typing_indicator\",\"user_id\":3,\"user_type\":\"user\",\"is_typing\":true}");
    assertEquals(SenderRole.CLIENT, typing.role());
    assertTrue(typing.typing());

    InboundFrame.ReadReceipt receipt = (InboundFrame.ReadReceipt) codec.decode(
        "{\"type\":\"read_receipt\",\"user_type\":\"lawyer\",\"message_ids\":[\"m1\",\"m2\"]}");
    assertEquals(SenderRole.COUNTERPART, receipt.reader().orElseThrow());
    assertEquals(List.of("m1", "m2"), receipt.messageIds());
  }

  @Test
  void errorWithoutTextBecomesUnknownError() throws Exception {
    InboundFrame frame = codec.decode("{\"type\":\"error\"}");
    assertEquals("Unknown error", ((InboundFrame.ServerError) frame).error());
  }

  @Test
  void unknownTypeIsNotAnError() throws Exception {
    InboundFrame frame = codec.decode("{\"type\":\"presence\",\"online\":true}");
    assertEquals("presence", assertInstanceOf(InboundFrame.Unknown.class, frame).type());
  }

  @Test
  void rejectsMalformedPayloads() {
    assertThrows(MalformedFrameException.class, () -> codec.decode("not json"));
    assertThrows(MalformedFrameException.class, () -> codec.decode("[1,2]"));
    assertThrows(MalformedFrameException.class, () -> codec.decode("{\"text\":\"no type\"}"));
    assertThrows(MalformedFrameException.class, () -> codec.decode("{\"type\":\"new_message\"}"));
    assertThrows(MalformedFrameException.class,
        () -> codec.decode("{\"type\":\"new_message\",\"message\":{\"text\":\"no id\"}}"));
    assertThrows(MalformedFrameException.class, () -> codec.decode("{\"type\":\"error\"} trailing"));
  }

  @Test
  void nonObjectNodesAreRejectedWithTheirLocation() {
    MalformedFrameException message = assertThrows(MalformedFrameException.class,
        () -> codec.decode("{\"type\":\"new_message\",\"message\":\"m1\"}"));
    MalformedFrameException item = assertThrows(MalformedFrameException.class,
        () -> codec.decodeHistory("{\"messages\":[{\"message_id\":\"a\",\"text\":\"x\"},42]}"));

    assertEquals("new_message.message must be a JSON object", message.getMessage());
    assertEquals("messages[] must be a JSON object", item.getMessage());
  }

  @Test
  void encodesOutboundFrames() {
    assertEquals("{\"type\":\"send_message\",\"text\":\"Hi \\\"there\\\"\"}",
        codec.encode(new OutboundFrame.SendMessage("Hi \"there\"")));
    assertEquals("{\"type\":\"typing\",\"is_typing\":false}", codec.encode(new OutboundFrame.Typing(false)));
    assertEquals("{\"type\":\"mark_read\"}", codec.encode(OutboundFrame.MarkRead.ALL));
    assertEquals("{\"type\":\"mark_read\",\"message_ids\":[\"m1\"]}",
        codec.encode(new OutboundFrame.MarkRead(List.of("m1"))));
  }

  @Test
  void decodesHistoryDocument() throws Exception {
    List<Message> history = codec.decodeHistory("""
        {"id":9,"title":"Lease","messages":[
          {"message_id":"a","sender_id":1,"sender_type":"user","text":"one","timestamp":"t1"},
          {"message_id":"b","sender_id":2,"sender_type":"lawyer","text":"two","timestamp":"t2"}]}
        """);

    assertEquals(2, history.size());
    assertEquals("a", history.get(0).id());
    assertEquals(SenderRole.COUNTERPART, history.get(1).senderRole());
    assertTrue(codec.decodeHistory("{\"id\":9}").isEmpty());
    assertThrows(MalformedFrameException.class, () -> codec.decodeHistory("{\"messages\":{}}"));
  }
}
