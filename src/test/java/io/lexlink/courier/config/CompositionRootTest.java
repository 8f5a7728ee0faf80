package io.lexlink.courier.config;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

import io.lexlink.courier.application.port.HistoryPort;
import io.lexlink.courier.domain.conversation.CloseCodes;
import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import io.lexlink.courier.testutil.ManualScheduler;
import io.lexlink.courier.testutil.RecordingMetrics;
import io.lexlink.courier.testutil.RecordingTransport;
import io.lexlink.courier.testutil.RecordingTransport.FakeConnection;
import java.io.IOException;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.Test;

class CompositionRootTest {
  private static final ConversationIdentity IDENTITY = new ConversationIdentity("c1", "t1");
  private static final Message EARLIER = new Message("m1", 7L, SenderRole.COUNTERPART, "Hello", "t0", false, false);

  private final ManualScheduler scheduler = new ManualScheduler();
  private final RecordingTransport transport = new RecordingTransport().autoOpen();
  private final RecordingMetrics metrics = new RecordingMetrics();

  @Test
  void bindingThroughTheLoopOpensTheConnection() {
    try (CompositionRoot root = root(ClientConfig.defaults(), HistoryPort.NONE)) {
      root.onLoop(() -> root.coordinator().bind(IDENTITY));

      assertEquals(ConnectionState.OPEN, root.manager().state());
      assertSame(metrics, root.metrics());
      assertEquals("ws://localhost:8000", root.endpoints().webSocketBase());
    }
  }

  @Test
  void historyIsSeededForTheBoundIdentity() {
    try (CompositionRoot root = root(ClientConfig.defaults(), identity -> List.of(EARLIER))) {
      root.onLoop(() -> root.coordinator().bind(IDENTITY));

      assertEquals(1, root.loadHistory(IDENTITY));
      assertEquals(List.of(EARLIER), root.store().messages());
      assertEquals(List.of("{\"type\":\"mark_read\"}"), transport.last().sent());
    }
  }

  @Test
  void closeWaitsForCloseFrameStillInFlight() {
    transport.holdCloses();
    CompositionRoot root = root(ClientConfig.defaults(), HistoryPort.NONE);
    root.onLoop(() -> root.coordinator().bind(IDENTITY).release());
    FakeConnection connection = transport.last();
    assertEquals(CloseCodes.NORMAL, connection.closeCode().intValue());
    assertFalse(connection.closeResult().isDone());

    CompletableFuture.runAsync(connection::completeClose,
        CompletableFuture.delayedExecutor(100, TimeUnit.MILLISECONDS));
    root.close();

    assertTrue(connection.closeResult().isDone());
  }

  @Test
  void historyForAnotherIdentityIsDropped() {
    try (CompositionRoot root = root(ClientConfig.defaults(), identity -> List.of(EARLIER))) {
      root.onLoop(() -> root.coordinator().bind(new ConversationIdentity("c2", "t1")));

      root.loadHistory(IDENTITY);

      assertTrue(root.store().messages().isEmpty());
    }
  }

  @Test
  void historyFailureLeavesLogEmpty() {
    HistoryPort failing = identity -> {
      throw new IOException("HTTP 500");
    };
    try (CompositionRoot root = root(ClientConfig.defaults(), failing)) {
      root.onLoop(() -> root.coordinator().bind(IDENTITY));

      assertEquals(0, root.loadHistory(IDENTITY));
      assertTrue(root.store().messages().isEmpty());
      assertEquals(ConnectionState.OPEN, root.manager().state());
    }
  }

  @Test
  void disabledHistoryIsNotFetched() {
    ClientConfig config = ClientConfig.fromMap(Map.of(ClientConfig.KEY_LOAD_HISTORY, "false"));
    HistoryPort unexpected = identity -> {
      throw new AssertionError("history should not be fetched");
    };
    try (CompositionRoot root = root(config, unexpected)) {
      assertEquals(0, root.loadHistory(IDENTITY));
    }
  }

  private CompositionRoot root(ClientConfig config, HistoryPort history) {
    return new CompositionRoot(config, metrics, scheduler, transport, history);
  }
}
