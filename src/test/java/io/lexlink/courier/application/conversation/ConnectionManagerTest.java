package io.lexlink.courier.application.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lexlink.courier.domain.conversation.CloseCodes;
import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationError;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.ErrorKind;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import io.lexlink.courier.testutil.Frames;
import io.lexlink.courier.testutil.ManualScheduler;
import io.lexlink.courier.testutil.RecordingMetrics;
import io.lexlink.courier.testutil.RecordingTransport;
import io.lexlink.courier.testutil.RecordingTransport.FakeConnection;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ConnectionManagerTest {
  private static final ConversationIdentity C1 = new ConversationIdentity("c1", "t1");
  private static final ConversationIdentity C2 = new ConversationIdentity("c2", "t2");

  private ManualScheduler scheduler;
  private RecordingTransport transport;
  private RecordingMetrics metrics;
  private ConversationStateStore store;
  private ConnectionManager manager;

  @BeforeEach
  void setUp() {
    scheduler = new ManualScheduler();
    transport = new RecordingTransport();
    metrics = new RecordingMetrics();
    store = new ConversationStateStore();
    manager = new ConnectionManager(
        transport,
        scheduler,
        new ConversationEndpoints("http://localhost:8000"),
        store,
        ReconnectPolicy.defaults(),
        new TypingSignalThrottle(scheduler),
        metrics,
        scheduler::now);
  }

  @Test
  void chatSessionSurvivesAbnormalClose() {
    manager.connect(C1);
    FakeConnection first = transport.last();
    assertEquals("ws://localhost:8000/api/v1/ws/conversation/c1?token=t1", first.endpoint().toString());
    assertEquals(ConnectionState.CONNECTING, store.connectionState());

    first.open();
    first.receive(Frames.established("c1"));
    assertEquals(ConnectionState.OPEN, store.connectionState());
    assertTrue(store.isConnected());

    assertTrue(manager.send("  Hello "));
    assertEquals(List.of("{\"type\":\"send_message\",\"text\":\"Hello\"}"), first.sent());

    first.receive(Frames.newMessage("m1", "user", "Hello"));
    assertEquals(List.of("m1"), ids(store.messages()));

    first.serverClose(CloseCodes.ABNORMAL);
    assertEquals(ConnectionState.CLOSED, store.connectionState());
    assertFalse(store.isConnected());
    assertEquals(1, store.reconnectAttempt());
    assertTrue(manager.isReconnectScheduled());

    scheduler.advance(999);
    assertEquals(1, transport.count());
    scheduler.advance(1);
    assertEquals(2, transport.count());
    assertEquals(ConnectionState.CONNECTING, store.connectionState());
    assertEquals(List.of("m1"), ids(store.messages()));
  }

  @Test
  void sendWhileConnectingReportsNotConnectedWithoutWriting() {
    manager.connect(C1);
    FakeConnection connection = transport.last();

    assertFalse(manager.send("Hello"));

    assertTrue(connection.sent().isEmpty());
    ConversationError error = store.error().orElseThrow();
    assertEquals(ErrorKind.NOT_CONNECTED, error.kind());
    assertEquals("Not connected to chat", error.message());
    assertEquals(1, metrics.counter("conversation.send.rejected"));
  }

  @Test
  void sendAfterCloseReportsNotConnectedWithoutWriting() {
    FakeConnection connection = openC1();
    connection.serverClose(CloseCodes.ABNORMAL);
    assertEquals(ConnectionState.CLOSED, store.connectionState());

    assertFalse(manager.send("hi"));

    assertEquals(ErrorKind.NOT_CONNECTED, store.error().orElseThrow().kind());
    assertTrue(connection.sent().isEmpty());
    assertEquals(1, transport.count());
    assertEquals(0, metrics.counter("conversation.frames.outbound"));
  }

  @Test
  void blankMessageIsIgnored() {
    openC1();

    assertFalse(manager.send("   "));

    assertTrue(transport.last().sent().isEmpty());
    assertTrue(store.error().isEmpty());
  }

  @Test
  void openingClearsPreviousError() {
    manager.connect(C1);
    manager.send("too early");
    assertTrue(store.error().isPresent());

    transport.last().open();

    assertTrue(store.error().isEmpty());
  }

  @Test
  void replayedMessageIsAppliedOnce() {
    FakeConnection connection = openC1();
    connection.receive(Frames.newMessage("m1", "lawyer", "Hi"));
    connection.receive(Frames.newMessage("m1", "lawyer", "Hi"));

    assertEquals(1, store.messages().size());
    assertEquals(1, metrics.counter("conversation.messages.duplicate"));
  }

  @Test
  void messagesKeepArrivalOrder() {
    FakeConnection connection = openC1();
    connection.receive(Frames.newMessage("m3", "user", "c"));
    connection.receive(Frames.newMessage("m1", "lawyer", "a"));
    connection.receive(Frames.newMessage("m2", "user", "b"));

    assertEquals(List.of("m3", "m1", "m2"), ids(store.messages()));
  }

  @Test
  void readReceiptSetsFlagOnceAndLeavesOthersAlone() {
    FakeConnection connection = openC1();
    connection.receive(Frames.newMessage("m1", "user", "a"));
    connection.receive(Frames.newMessage("m2", "user", "b"));

    connection.receive(Frames.readReceipt("lawyer", "m1", "missing"));
    List<Message> afterFirst = store.messages();
    connection.receive(Frames.readReceipt("lawyer", "m1"));

    Message m1 = store.message("m1").orElseThrow();
    assertTrue(m1.readByCounterpart());
    assertFalse(m1.readByClient());
    assertFalse(store.message("m2").orElseThrow().readByCounterpart());
    assertTrue(afterFirst == store.messages(), "repeated receipt must not publish a new log");
  }

  @Test
  void readReceiptWithUnknownRoleIsIgnored() {
    FakeConnection connection = openC1();
    connection.receive(Frames.newMessage("m1", "user", "a"));

    connection.receive(Frames.readReceipt("admin", "m1"));

    Message m1 = store.message("m1").orElseThrow();
    assertFalse(m1.readByClient());
    assertFalse(m1.readByCounterpart());
  }

  @Test
  void remoteTypingFollowsIndicatorAndClearsOnClose() {
    FakeConnection connection = openC1();
    connection.receive(Frames.typing("lawyer", true));
    assertTrue(store.isRemoteTyping());

    connection.receive(Frames.typing("lawyer", false));
    assertFalse(store.isRemoteTyping());

    connection.receive(Frames.typing("lawyer", true));
    connection.serverClose(CloseCodes.ABNORMAL);
    assertFalse(store.isRemoteTyping());
  }

  @Test
  void serverErrorFrameSurfacesProtocolError() {
    FakeConnection connection = openC1();
    connection.receive(Frames.error("Conversation is closed"));

    ConversationError error = store.error().orElseThrow();
    assertEquals(ErrorKind.PROTOCOL_ERROR, error.kind());
    assertEquals("Conversation is closed", error.message());
    assertEquals(ConnectionState.OPEN, store.connectionState());
  }

  @Test
  void malformedFrameIsDroppedAndLaterFramesStillApply() {
    FakeConnection connection = openC1();
    connection.receive("{not json");
    connection.receive("{\"message\":{}}");
    connection.receive("{\"type\":\"presence\"}");
    connection.receive(Frames.newMessage("m1", "user", "still here"));

    assertEquals(2, metrics.counter("conversation.frames.malformed"));
    assertEquals(1, metrics.counter("conversation.frames.unknown"));
    assertEquals(List.of("m1"), ids(store.messages()));
    assertTrue(store.error().isEmpty());
  }

  @Test
  void backoffDoublesUpToMaximumThenGivesUp() {
    manager.connect(C1);
    long[] expected = {1_000, 2_000, 4_000, 8_000, 16_000};
    for (int i = 0; i < expected.length; i++) {
      transport.last().serverClose(CloseCodes.ABNORMAL);
      assertEquals(i + 1, store.reconnectAttempt());
      scheduler.advance(expected[i] - 1);
      assertEquals(i + 1, transport.count(), "retry " + (i + 1) + " fired early");
      scheduler.advance(1);
      assertEquals(i + 2, transport.count(), "retry " + (i + 1) + " did not fire");
    }

    transport.last().serverClose(CloseCodes.ABNORMAL);

    assertFalse(manager.isReconnectScheduled());
    assertEquals(ErrorKind.MAX_RECONNECT_EXCEEDED, store.error().orElseThrow().kind());
    assertEquals("Failed to connect after multiple attempts", store.error().orElseThrow().message());
    assertEquals(1, metrics.counter("conversation.reconnect.exhausted"));
    scheduler.advance(60_000);
    assertEquals(6, transport.count());
  }

  @Test
  void successfulOpenResetsAttemptCounter() {
    manager.connect(C1);
    transport.last().serverClose(CloseCodes.ABNORMAL);
    scheduler.advance(1_000);
    transport.last().serverClose(CloseCodes.ABNORMAL);
    assertEquals(2, store.reconnectAttempt());
    scheduler.advance(2_000);

    transport.last().open();
    assertEquals(0, store.reconnectAttempt());

    transport.last().serverClose(CloseCodes.ABNORMAL);
    scheduler.advance(1_000);
    assertEquals(4, transport.count());
  }

  @Test
  void normalCloseIsNotRetried() {
    FakeConnection connection = openC1();
    connection.serverClose(CloseCodes.NORMAL);

    assertEquals(ConnectionState.CLOSED, store.connectionState());
    assertFalse(manager.isReconnectScheduled());
    assertTrue(store.error().isEmpty());
    scheduler.advance(60_000);
    assertEquals(1, transport.count());
  }

  @Test
  void transportErrorIsSurfacedThenRetried() {
    FakeConnection connection = openC1();
    connection.fail(new java.io.IOException("reset"));
    connection.serverClose(CloseCodes.ABNORMAL);

    ConversationError error = store.error().orElseThrow();
    assertEquals(ErrorKind.TRANSPORT_ERROR, error.kind());
    assertEquals("Connection error occurred", error.message());
    assertTrue(manager.isReconnectScheduled());
  }

  @Test
  void openFailureIsTreatedAsAbnormalClose() {
    transport.failNextOpen(new IllegalStateException("no route"));
    manager.connect(C1);

    assertEquals(ConnectionState.CLOSED, store.connectionState());
    assertEquals(ErrorKind.TRANSPORT_ERROR, store.error().orElseThrow().kind());
    assertTrue(manager.isReconnectScheduled());
    scheduler.advance(1_000);
    assertEquals(1, transport.count());
  }

  @Test
  void disconnectClosesNormallyAndCancelsPendingRetry() {
    manager.connect(C1);
    transport.last().serverClose(CloseCodes.ABNORMAL);
    assertTrue(manager.isReconnectScheduled());

    manager.disconnect();
    scheduler.advance(60_000);

    assertEquals(1, transport.count());
    assertEquals(ConnectionState.CLOSED, store.connectionState());
    assertEquals(0, store.reconnectAttempt());
  }

  @Test
  void disconnectSendsNormalCloseCode() {
    FakeConnection connection = openC1();
    manager.disconnect();

    assertEquals(CloseCodes.NORMAL, connection.closeCode());
    connection.serverClose(CloseCodes.NORMAL);
    assertEquals(ConnectionState.CLOSED, store.connectionState());
    assertFalse(manager.isReconnectScheduled());
  }

  @Test
  void connectingTwiceForSameIdentityOpensOneTransport() {
    manager.connect(C1);
    manager.connect(C1);
    assertEquals(1, transport.count());

    transport.last().open();
    manager.connect(C1);
    assertEquals(1, transport.count());
  }

  @Test
  void incompleteIdentityNeverConnects() {
    manager.connect(new ConversationIdentity("c1", null));
    manager.connect(new ConversationIdentity(" ", "t1"));
    manager.connect(null);

    assertEquals(0, transport.count());
    assertEquals(ConnectionState.IDLE, store.connectionState());
  }

  @Test
  void identitySwitchClosesOldConnectionAndIgnoresItsLateCallbacks() {
    FakeConnection old = openC1();
    old.receive(Frames.newMessage("m1", "user", "old"));

    manager.connect(C2);
    FakeConnection current = transport.last();

    assertEquals(CloseCodes.NORMAL, old.closeCode());
    assertEquals("ws://localhost:8000/api/v1/ws/conversation/c2?token=t2", current.endpoint().toString());
    assertTrue(store.messages().isEmpty());

    old.receive(Frames.newMessage("m9", "lawyer", "late"));
    old.serverClose(CloseCodes.ABNORMAL);

    assertTrue(store.messages().isEmpty());
    assertFalse(manager.isReconnectScheduled());
    assertEquals(ConnectionState.CONNECTING, store.connectionState());
  }

  @Test
  void retryTimerForPreviousIdentityIsDiscarded() {
    manager.connect(C1);
    transport.last().serverClose(CloseCodes.ABNORMAL);
    manager.connect(C2);
    assertEquals(2, transport.count());

    scheduler.advance(60_000);

    assertEquals(2, transport.count());
    assertEquals("c2", manager.identity().conversationId());
  }

  @Test
  void manualReconnectBypassesBackoff() {
    manager.connect(C1);
    transport.last().serverClose(CloseCodes.ABNORMAL);

    manager.reconnect();

    assertEquals(2, transport.count());
    assertEquals(0, store.reconnectAttempt());
    scheduler.advance(1_000);
    assertEquals(2, transport.count());
  }

  @Test
  void typingStartIsDebouncedAndStopIsImmediate() {
    FakeConnection connection = openC1();

    manager.signalTyping(true);
    manager.signalTyping(true);
    assertTrue(connection.sent().isEmpty());
    scheduler.advance(300);
    assertEquals(List.of("{\"type\":\"typing\",\"is_typing\":true}"), connection.sent());

    manager.signalTyping(true);
    manager.signalTyping(false);
    assertEquals(List.of(
        "{\"type\":\"typing\",\"is_typing\":true}",
        "{\"type\":\"typing\",\"is_typing\":false}"), connection.sent());
  }

  @Test
  void typingStopCancelsPendingStart() {
    FakeConnection connection = openC1();

    manager.signalTyping(true);
    scheduler.advance(100);
    manager.signalTyping(false);
    scheduler.advance(1_000);

    assertEquals(List.of("{\"type\":\"typing\",\"is_typing\":false}"), connection.sent());
  }

  @Test
  void sendingMessageStopsAnnouncedTyping() {
    FakeConnection connection = openC1();
    manager.signalTyping(true);
    scheduler.advance(300);

    assertTrue(manager.send("done"));

    assertEquals(List.of(
        "{\"type\":\"typing\",\"is_typing\":true}",
        "{\"type\":\"send_message\",\"text\":\"done\"}",
        "{\"type\":\"typing\",\"is_typing\":false}"), connection.sent());
    scheduler.advance(5_000);
    assertEquals(3, connection.sent().size());
  }

  @Test
  void sendingBeforeTypingWentOutDropsThePendingStart() {
    FakeConnection connection = openC1();
    manager.signalTyping(true);

    assertTrue(manager.send("quick"));
    scheduler.advance(5_000);

    assertEquals(List.of("{\"type\":\"send_message\",\"text\":\"quick\"}"), connection.sent());
  }

  @Test
  void typingStopsAfterInactivity() {
    FakeConnection connection = openC1();
    manager.signalTyping(true);
    scheduler.advance(1_500);
    manager.signalTyping(true);

    scheduler.advance(1_999);
    assertEquals(List.of("{\"type\":\"typing\",\"is_typing\":true}"), connection.sent());
    scheduler.advance(1);

    assertEquals(List.of(
        "{\"type\":\"typing\",\"is_typing\":true}",
        "{\"type\":\"typing\",\"is_typing\":false}"), connection.sent());
  }

  @Test
  void historySeededBeforeOpenIsMarkedReadOnceOpen() {
    Message earlier = new Message("m0", 3L, SenderRole.COUNTERPART, "earlier", "2024-05-01T09:00:00Z",
        false, false);
    manager.connect(C1);
    manager.seedHistory(List.of(earlier));
    FakeConnection connection = transport.last();
    assertTrue(connection.sent().isEmpty());

    connection.open();

    assertEquals(List.of("{\"type\":\"mark_read\"}"), connection.sent());
    connection.serverClose(CloseCodes.ABNORMAL);
    scheduler.advance(1_000);
    transport.last().open();
    assertTrue(transport.last().sent().isEmpty());
  }

  @Test
  void historySeededWhileOpenIsMarkedReadAtOnce() {
    FakeConnection connection = openC1();

    manager.seedHistory(List.of(new Message("m0", 3L, SenderRole.COUNTERPART, "earlier", "t0", false, false)));

    assertEquals(List.of("{\"type\":\"mark_read\"}"), connection.sent());
  }

  @Test
  void markReadRequiresOpenConnection() {
    manager.connect(C1);
    assertFalse(manager.markRead());
    assertTrue(store.error().isEmpty());

    transport.last().open();
    assertTrue(manager.markRead());
    assertTrue(manager.markRead(List.of("m1", "m2")));
    assertEquals(List.of(
        "{\"type\":\"mark_read\"}",
        "{\"type\":\"mark_read\",\"message_ids\":[\"m1\",\"m2\"]}"), transport.last().sent());
  }

  @Test
  void historySeedSuppressesLiveReplayOfSameMessage() {
    Message earlier = new Message("m0", 3L, SenderRole.COUNTERPART, "earlier", "2024-05-01T09:00:00Z",
        false, false);
    manager.connect(C1);
    manager.seedHistory(List.of(earlier));
    FakeConnection connection = transport.last();
    connection.open();

    connection.receive(Frames.newMessage("m0", "lawyer", "earlier"));
    connection.receive(Frames.newMessage("m1", "user", "now"));

    assertEquals(List.of("m0", "m1"), ids(store.messages()));
  }

  @Test
  void unbindReturnsToIdle() {
    openC1();
    manager.unbind();

    assertEquals(ConnectionState.IDLE, store.connectionState());
    assertNull(manager.identity());
  }

  @Test
  void handshakeLatencyIsObserved() {
    manager.connect(C1);
    scheduler.advance(42);
    transport.last().open();

    assertEquals(List.of(42L), metrics.observations("conversation.connect.latencyMillis"));
    assertEquals(1, metrics.counter("conversation.connect.opened"));
  }

  private FakeConnection openC1() {
    manager.connect(C1);
    FakeConnection connection = transport.last();
    connection.open();
    return connection;
  }

  private static List<String> ids(List<Message> messages) {
    return messages.stream().map(Message::id).toList();
  }
}
