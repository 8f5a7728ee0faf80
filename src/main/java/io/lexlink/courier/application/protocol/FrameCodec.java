package io.lexlink.courier.application.protocol;

import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonToken;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import io.lexlink.courier.domain.frame.InboundFrame;
import io.lexlink.courier.domain.frame.OutboundFrame;
import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> JSON codec for conversation frames and history documents.
 * <p><strong>Why:</strong> Keeps the wire schema (server field names such as {@code message_id} and
 * {@code read_by_lawyer}) out of the connection manager.</p>
 * <p><strong>Role:</strong> Application-side protocol helper used by the connection manager and the history
 * adapter.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the shared {@link JsonFactory}; safe for concurrent use.</p>
 *
 * @implNote Message objects accept both the server's snake_case names and camelCase aliases.
 * @since 1.0.0
 */
public final class FrameCodec {
  private static final String UNKNOWN_ERROR = "Unknown error";

  private final JsonFactory factory = new JsonFactory();

  /**
   * Decodes one inbound frame.
   *
   * @param json raw text frame; never {@code null}
   * @return decoded frame; unknown types decode to {@link InboundFrame.Unknown}
   * @throws MalformedFrameException when the payload is not a JSON object, lacks {@code type}, or a
   *     {@code new_message} frame carries no usable message
   */
  public InboundFrame decode(String json) throws MalformedFrameException {
    Objects.requireNonNull(json, "json");
    Map<?, ?> root = asObject(parse(json), "frame");
    Object rawType = root.get("type");
    if (!(rawType instanceof String type) || type.isBlank()) {
      throw new MalformedFrameException("frame is missing a type");
    }
    return switch (type) {
      case "connection_established" -> new InboundFrame.ConnectionEstablished(
          stringOrNull(root.get("conversation_id")), stringOrNull(root.get("timestamp")));
      case "new_message" -> new InboundFrame.NewMessage(
          toMessage(asObject(root.get("message"), "new_message.message")));
      case "typing_indicator" -> new InboundFrame.TypingIndicator(
          SenderRole.fromWire(stringOrNull(root.get("user_type"))).orElse(null),
          Boolean.TRUE.equals(root.get("is_typing")));
      case "read_receipt" -> new InboundFrame.ReadReceipt(
          SenderRole.fromWire(stringOrNull(root.get("user_type"))).orElse(null),
          stringList(root.get("message_ids")));
      case "error" -> {
        String error = stringOrNull(root.get("error"));
        yield new InboundFrame.ServerError(error == null || error.isBlank() ? UNKNOWN_ERROR : error);
      }
      default -> new InboundFrame.Unknown(type);
    };
  }

  /**
   * Decodes a conversation document such as the REST {@code GET /conversations/{id}} body.
   *
   * @param json document containing a {@code messages} array
   * @return messages in document order; empty when the array is absent
   * @throws MalformedFrameException when the document or one of its messages is invalid
   */
  public List<Message> decodeHistory(String json) throws MalformedFrameException {
    Objects.requireNonNull(json, "json");
    Map<?, ?> root = asObject(parse(json), "conversation");
    Object raw = root.get("messages");
    if (raw == null) {
      return List.of();
    }
    if (!(raw instanceof List<?> items)) {
      throw new MalformedFrameException("messages must be an array");
    }
    List<Message> messages = new ArrayList<>(items.size());
    for (Object item : items) {
      messages.add(toMessage(asObject(item, "messages[]")));
    }
    return List.copyOf(messages);
  }

  /**
   * Encodes an outbound frame.
   *
   * @param frame frame to serialize; never {@code null}
   * @return compact JSON text
   */
  public String encode(OutboundFrame frame) {
    Objects.requireNonNull(frame, "frame");
    StringWriter out = new StringWriter(64);
    try (JsonGenerator gen = factory.createGenerator(out)) {
      gen.writeStartObject();
      gen.writeStringField("type", frame.type());
      if (frame instanceof OutboundFrame.SendMessage send) {
        gen.writeStringField("text", send.text());
      } else if (frame instanceof OutboundFrame.Typing typing) {
        gen.writeBooleanField("is_typing", typing.typing());
      } else if (frame instanceof OutboundFrame.MarkRead markRead && !markRead.messageIds().isEmpty()) {
        gen.writeArrayFieldStart("message_ids");
        for (String id : markRead.messageIds()) {
          gen.writeString(id);
        }
        gen.writeEndArray();
      }
      gen.writeEndObject();
    } catch (IOException ex) {
      throw new UncheckedIOException("Failed to encode " + frame.type() + " frame", ex);
    }
    return out.toString();
  }

  private Message toMessage(Map<?, ?> node) throws MalformedFrameException {
    String id = stringOrNull(first(node, "message_id", "id"));
    if (id == null || id.isBlank()) {
      throw new MalformedFrameException("message is missing an id");
    }
    Object senderId = first(node, "sender_id", "senderId");
    // Roles other than user/lawyer (admin) speak from the platform side.
    SenderRole role = SenderRole.fromWire(stringOrNull(first(node, "sender_type", "senderRole")))
        .orElse(SenderRole.COUNTERPART);
    String text = stringOrNull(node.get("text"));
    String timestamp = stringOrNull(node.get("timestamp"));
    return new Message(
        id,
        senderId instanceof Number number ? number.longValue() : 0L,
        role,
        text == null ? "" : text,
        timestamp == null ? "" : timestamp,
        Boolean.TRUE.equals(first(node, "read_by_user", "readByClient")),
        Boolean.TRUE.equals(first(node, "read_by_lawyer", "readByCounterpart")));
  }

  private Object parse(String json) throws MalformedFrameException {
    try (JsonParser parser = factory.createParser(json)) {
      JsonToken token = parser.nextToken();
      if (token == null) {
        throw new MalformedFrameException("empty payload");
      }
      Object value = readValue(parser, token);
      if (parser.nextToken() != null) {
        throw new MalformedFrameException("payload contains trailing content");
      }
      return value;
    } catch (IOException | IllegalArgumentException ex) {
      throw new MalformedFrameException("invalid JSON payload", ex);
    }
  }

  private Object readValue(JsonParser parser, JsonToken token) throws IOException {
    return switch (token) {
      case START_OBJECT -> readObject(parser);
      case START_ARRAY -> readArray(parser);
      case VALUE_STRING -> parser.getText();
      case VALUE_NUMBER_INT, VALUE_NUMBER_FLOAT -> parser.getNumberValue();
      case VALUE_TRUE -> Boolean.TRUE;
      case VALUE_FALSE -> Boolean.FALSE;
      case VALUE_NULL -> null;
      default -> throw new IllegalArgumentException("Unsupported JSON token: " + token);
    };
  }

  private Map<String, Object> readObject(JsonParser parser) throws IOException {
    Map<String, Object> map = new LinkedHashMap<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_OBJECT) {
      if (token != JsonToken.FIELD_NAME) {
        throw new IllegalArgumentException("Expected field name but found " + token);
      }
      String field = parser.getCurrentName();
      map.put(field, readValue(parser, parser.nextToken()));
    }
    return map;
  }

  private List<Object> readArray(JsonParser parser) throws IOException {
    List<Object> list = new ArrayList<>();
    JsonToken token;
    while ((token = parser.nextToken()) != JsonToken.END_ARRAY) {
      list.add(readValue(parser, token));
    }
    return list;
  }

  private static Map<?, ?> asObject(Object node, String context) throws MalformedFrameException {
    if (!(node instanceof Map<?, ?> map)) {
      throw new MalformedFrameException(context + " must be a JSON object");
    }
    return map;
  }

  private static Object first(Map<?, ?> node, String primary, String alias) {
    Object value = node.get(primary);
    return value != null ? value : node.get(alias);
  }

  private static String stringOrNull(Object value) {
    if (value == null) {
      return null;
    }
    return value instanceof String text ? text : value.toString();
  }

  private static List<String> stringList(Object value) {
    if (!(value instanceof List<?> items)) {
      return List.of();
    }
    List<String> ids = new ArrayList<>(items.size());
    for (Object item : items) {
      if (item != null) {
        ids.add(item.toString());
      }
    }
    return ids;
  }
}
