package io.lexlink.courier.application.conversation;

import io.lexlink.courier.application.port.ClockPort;
import io.lexlink.courier.application.port.MetricsPort;
import io.lexlink.courier.application.port.SchedulerPort;
import io.lexlink.courier.application.port.SchedulerPort.ScheduledTask;
import io.lexlink.courier.application.port.TransportPort;
import io.lexlink.courier.application.port.TransportPort.TransportConnection;
import io.lexlink.courier.application.port.TransportPort.TransportListener;
import io.lexlink.courier.application.protocol.FrameCodec;
import io.lexlink.courier.application.protocol.MalformedFrameException;
import io.lexlink.courier.domain.conversation.CloseCodes;
import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.ErrorKind;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.frame.InboundFrame;
import io.lexlink.courier.domain.frame.OutboundFrame;
import io.lexlink.courier.logging.Logs;
import java.net.URI;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Owns the single transport connection for the bound conversation identity.
 * <p><strong>Why:</strong> Centralizes the reconnect loop, inbound frame dispatch and outbound sends so that no
 * other component ever touches the transport handle.</p>
 * <p><strong>Role:</strong> Application component driven by {@link LifecycleCoordinator}; publishes everything it
 * learns into the {@link ConversationStateStore}.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Open, replace and close the transport; at most one connecting or open connection exists.</li>
 *   <li>Dispatch inbound frames strictly in arrival order, one at a time.</li>
 *   <li>Schedule backoff retries after abnormal closes and stop once {@link ReconnectPolicy} gives up.</li>
 *   <li>Reject sends while not open instead of queueing them.</li>
 *   <li>Acknowledge a seeded history with a {@code mark_read} as soon as the connection is open.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Public methods must be called on the {@link SchedulerPort} event loop.
 * Transport callbacks arriving on adapter threads are re-dispatched onto that loop.</p>
 * <p><strong>Observability:</strong> Emits {@code conversation.*} counters through {@link MetricsPort}; credentials
 * are redacted from every log line.</p>
 *
 * @since 1.0.0
 */
public final class ConnectionManager {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);
  private static final int LOG_TEXT_CHARS = 64;

  private final TransportPort transport;
  private final SchedulerPort scheduler;
  private final ConversationEndpoints endpoints;
  private final ConversationStateStore store;
  private final ReconnectPolicy policy;
  private final MessageDeduplicator deduplicator;
  private final TypingSignalThrottle typingThrottle;
  private final FrameCodec codec;
  private final MetricsPort metrics;
  private final ClockPort clock;

  private ConversationIdentity identity;
  private String logConversationId;
  private ActiveConnection active;
  private ConnectionState state = ConnectionState.IDLE;
  private int attempt;
  private ScheduledTask reconnectTask;
  private boolean retrySuppressed;
  private boolean markReadOnOpen;
  private CompletableFuture<Void> lastClose = CompletableFuture.completedFuture(null);

  /**
   * Creates a manager.
   *
   * @param transport transport adapter; never {@code null}
   * @param scheduler event loop running callbacks and timers; never {@code null}
   * @param endpoints endpoint composer; never {@code null}
   * @param store state store receiving parsed events; never {@code null}
   * @param policy reconnect backoff policy; never {@code null}
   * @param typingThrottle throttle for outbound typing signals; never {@code null}
   * @param metrics metrics sink; {@code null} disables metrics
   * @param clock clock used for handshake latency; never {@code null}
   */
  public ConnectionManager(
      TransportPort transport,
      SchedulerPort scheduler,
      ConversationEndpoints endpoints,
      ConversationStateStore store,
      ReconnectPolicy policy,
      TypingSignalThrottle typingThrottle,
      MetricsPort metrics,
      ClockPort clock) {
    this.transport = Objects.requireNonNull(transport, "transport");
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    this.endpoints = Objects.requireNonNull(endpoints, "endpoints");
    this.store = Objects.requireNonNull(store, "store");
    this.policy = Objects.requireNonNull(policy, "policy");
    this.typingThrottle = Objects.requireNonNull(typingThrottle, "typingThrottle");
    this.metrics = metrics == null ? MetricsPort.NO_OP : metrics;
    this.clock = Objects.requireNonNull(clock, "clock");
    this.deduplicator = new MessageDeduplicator();
    this.codec = new FrameCodec();
  }

  /**
   * Connects to {@code target}.
   *
   * <p>Incomplete identities are logged and ignored. A connecting or open connection for the same identity makes
   * this a no-op; a connection for a different identity is closed normally first.</p>
   *
   * @param target identity to connect; may be {@code null} or incomplete
   */
  public void connect(ConversationIdentity target) {
    if (target == null || !target.isComplete()) {
      log.info("Skipping connect: {} ({})", ErrorKind.IDENTITY_INCOMPLETE, target);
      return;
    }
    if (!target.equals(identity)) {
      switchIdentity(target);
    } else if (active != null) {
      log.debug("Already {} for conversation {}; connect ignored", state, target.conversationId());
      return;
    }
    retrySuppressed = false;
    cancelReconnect();
    openTransport();
  }

  /**
   * Closes the active connection normally, clears retry and dedup state and suppresses further retries.
   * Idempotent.
   */
  public void disconnect() {
    retrySuppressed = true;
    cancelReconnect();
    resetAttempts();
    deduplicator.reset();
    typingThrottle.reset();
    store.setRemoteTyping(false);
    ActiveConnection closing = active;
    active = null;
    if (closing != null) {
      setState(ConnectionState.CLOSING);
      closeQuietly(closing, CloseCodes.NORMAL, "User disconnected");
      metrics.increment("conversation.close.normal");
    }
    if (state != ConnectionState.IDLE) {
      setState(ConnectionState.CLOSED);
    }
  }

  /**
   * Disconnects and forgets the bound identity, returning to {@link ConnectionState#IDLE}.
   */
  public void unbind() {
    disconnect();
    identity = null;
    markReadOnOpen = false;
    setState(ConnectionState.IDLE);
  }

  /**
   * Explicit user-triggered reconnect: disconnects, resets the retry counter and reconnects at once, bypassing
   * backoff.
   */
  public void reconnect() {
    ConversationIdentity target = identity;
    disconnect();
    if (target == null) {
      log.info("Reconnect requested with no bound identity");
      return;
    }
    log.info("Manual reconnect for conversation {}", target.conversationId());
    store.clearError();
    connect(target);
  }

  /**
   * Sends a chat message and ends any typing episode the message completes.
   *
   * @param text message body; surrounding whitespace is trimmed
   * @return {@code true} when the frame was written; {@code false} with a {@link ErrorKind#NOT_CONNECTED} error
   *     when the connection is not open, and {@code false} without an error when {@code text} is blank
   */
  public boolean send(String text) {
    Objects.requireNonNull(text, "text");
    if (!isOpen()) {
      log.warn("Cannot send message while {}", state);
      metrics.increment("conversation.send.rejected");
      store.setError(ErrorKind.NOT_CONNECTED, "Not connected to chat");
      return false;
    }
    String trimmed = text.trim();
    if (trimmed.isEmpty()) {
      log.debug("Ignoring blank message");
      return false;
    }
    if (!write(new OutboundFrame.SendMessage(trimmed), "Failed to send message")) {
      return false;
    }
    typingThrottle.interrupt(this::writeTyping);
    return true;
  }

  /**
   * Signals the local typing state through the {@link TypingSignalThrottle}. No-op unless open.
   *
   * @param isTyping whether the local user is typing
   */
  public void signalTyping(boolean isTyping) {
    if (!isOpen()) {
      return;
    }
    typingThrottle.signal(isTyping, this::writeTyping);
  }

  /**
   * Marks every message of the conversation as read.
   *
   * @return {@code true} when the frame was written; {@code false} when not open
   */
  public boolean markRead() {
    return markRead(List.of());
  }

  /**
   * Marks the listed messages as read; an empty list acknowledges the whole conversation.
   *
   * @param messageIds ids to acknowledge; never {@code null}
   * @return {@code true} when the frame was written; {@code false} when not open
   */
  public boolean markRead(Collection<String> messageIds) {
    Objects.requireNonNull(messageIds, "messageIds");
    if (!isOpen()) {
      log.debug("Ignoring mark_read while {}", state);
      return false;
    }
    return write(new OutboundFrame.MarkRead(List.copyOf(messageIds)), null);
  }

  /**
   * Merges a history snapshot for the bound conversation into the log and records its ids as applied.
   *
   * @param snapshot messages fetched over REST; never {@code null}
   * @return number of entries added to the log
   */
  public int seedHistory(Collection<Message> snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    for (Message message : snapshot) {
      deduplicator.markSeen(message.id());
    }
    int added = store.seed(snapshot);
    log.debug("Seeded {} of {} history messages", added, snapshot.size());
    if (!snapshot.isEmpty()) {
      if (isOpen()) {
        markRead();
      } else {
        markReadOnOpen = true;
      }
    }
    return added;
  }

  /**
   * Returns the completion of the most recent client-initiated close. Completes immediately when nothing was
   * closed.
   *
   * @return future completing once the close frame was written or the connection dropped
   */
  public CompletableFuture<Void> pendingClose() {
    return lastClose;
  }

  public ConnectionState state() {
    return state;
  }

  public ConversationIdentity identity() {
    return identity;
  }

  /**
   * Returns the number of retries scheduled since the last successful open or identity change.
   *
   * @return reconnect attempt counter
   */
  public int reconnectAttempt() {
    return attempt;
  }

  /**
   * Indicates whether a backoff retry is waiting to fire.
   *
   * @return {@code true} while a reconnect timer is armed
   */
  public boolean isReconnectScheduled() {
    return reconnectTask != null;
  }

  private boolean isOpen() {
    return state == ConnectionState.OPEN && active != null;
  }

  private void switchIdentity(ConversationIdentity target) {
    ActiveConnection previous = active;
    active = null;
    if (previous != null) {
      log.info("Identity changed; closing connection for conversation {}", identity.conversationId());
      setState(ConnectionState.CLOSING);
      closeQuietly(previous, CloseCodes.NORMAL, "Identity changed");
      metrics.increment("conversation.close.normal");
      setState(ConnectionState.CLOSED);
    }
    cancelReconnect();
    resetAttempts();
    deduplicator.reset();
    typingThrottle.reset();
    markReadOnOpen = false;
    store.setRemoteTyping(false);
    if (!target.conversationId().equals(logConversationId)) {
      store.resetConversation();
      logConversationId = target.conversationId();
    }
    identity = target;
  }

  private void openTransport() {
    URI endpoint;
    try {
      endpoint = endpoints.resolve(identity);
    } catch (IllegalArgumentException ex) {
      log.error("Cannot compose endpoint for conversation {}", identity.conversationId(), ex);
      store.setError(ErrorKind.TRANSPORT_ERROR, "Failed to connect");
      return;
    }
    log.info("Connecting to {}", endpoints.describe(identity));
    setState(ConnectionState.CONNECTING);
    metrics.increment("conversation.connect.attempts");
    ActiveConnection connection = new ActiveConnection(clock.nowMillis());
    active = connection;
    try {
      connection.handle = transport.open(endpoint, connection);
    } catch (RuntimeException ex) {
      log.warn("Transport failed to open connection for conversation {}", identity.conversationId(), ex);
      connection.onError(ex);
      connection.onClose(CloseCodes.ABNORMAL, "open failed");
    }
  }

  private void writeTyping(boolean value) {
    if (isOpen()) {
      write(new OutboundFrame.Typing(value), null);
    }
  }

  private boolean write(OutboundFrame frame, String failureMessage) {
    ActiveConnection connection = active;
    try {
      connection.handle.sendText(codec.encode(frame));
      metrics.increment("conversation.frames.outbound");
      return true;
    } catch (RuntimeException ex) {
      log.warn("Failed to send {} frame", frame.type(), ex);
      if (failureMessage != null) {
        store.setError(ErrorKind.TRANSPORT_ERROR, failureMessage);
      }
      return false;
    }
  }

  private void handleOpen(ActiveConnection connection) {
    log.info("Connection open for conversation {}", identity.conversationId());
    setState(ConnectionState.OPEN);
    resetAttempts();
    metrics.increment("conversation.connect.opened");
    metrics.observe("conversation.connect.latencyMillis", clock.nowMillis() - connection.startedAtMillis);
    if (markReadOnOpen) {
      markReadOnOpen = false;
      markRead();
    }
  }

  private void handleText(String text) {
    metrics.increment("conversation.frames.inbound");
    InboundFrame frame;
    try {
      frame = codec.decode(text);
    } catch (MalformedFrameException ex) {
      metrics.increment("conversation.frames.malformed");
      log.warn("Dropping {}: {} payload={}", ErrorKind.MALFORMED_FRAME, ex.getMessage(),
          Logs.truncate(text, LOG_TEXT_CHARS));
      return;
    }
    dispatch(frame);
  }

  private void dispatch(InboundFrame frame) {
    if (frame instanceof InboundFrame.ConnectionEstablished established) {
      log.info("Connection established for conversation {} at {}",
          identity.conversationId(), established.timestamp());
    } else if (frame instanceof InboundFrame.NewMessage newMessage) {
      applyMessage(newMessage.message());
    } else if (frame instanceof InboundFrame.TypingIndicator typing) {
      store.setRemoteTyping(typing.typing());
    } else if (frame instanceof InboundFrame.ReadReceipt receipt) {
      if (receipt.reader().isPresent()) {
        int changed = store.applyReadReceipt(receipt.reader().get(), receipt.messageIds());
        log.debug("Read receipt from {} patched {} messages", receipt.role(), changed);
      } else {
        log.debug("Ignoring read receipt without a client or counterpart role");
      }
    } else if (frame instanceof InboundFrame.ServerError serverError) {
      log.warn("Server reported error: {}", serverError.error());
      store.setError(ErrorKind.PROTOCOL_ERROR, serverError.error());
    } else {
      metrics.increment("conversation.frames.unknown");
      log.info("Ignoring unknown frame type {}", frame.type());
    }
  }

  private void applyMessage(Message message) {
    if (deduplicator.seen(message.id())) {
      metrics.increment("conversation.messages.duplicate");
      log.debug("Dropping replayed message {}", message.id());
      return;
    }
    deduplicator.markSeen(message.id());
    store.append(message);
  }

  private void handleError(Throwable error) {
    log.warn("{} on conversation {}: {}", ErrorKind.TRANSPORT_ERROR, identity.conversationId(),
        error.toString());
    store.setError(ErrorKind.TRANSPORT_ERROR, "Connection error occurred");
  }

  private void handleClose(int code, String reason) {
    active = null;
    typingThrottle.reset();
    store.setRemoteTyping(false);
    setState(ConnectionState.CLOSED);
    boolean normal = CloseCodes.isNormal(code);
    metrics.increment(normal ? "conversation.close.normal" : "conversation.close.abnormal");
    log.info("Connection closed for conversation {}: code={} reason={}",
        identity.conversationId(), code, reason);
    if (retrySuppressed) {
      return;
    }
    if (policy.shouldRetry(attempt, code)) {
      long delay = policy.nextDelay(attempt);
      attempt++;
      store.setReconnectAttempt(attempt);
      metrics.increment("conversation.reconnect.scheduled");
      log.info("Reconnecting in {}ms (attempt {})", delay, attempt);
      ConversationIdentity target = identity;
      reconnectTask = scheduler.schedule(() -> fireReconnect(target), delay);
    } else if (!normal) {
      metrics.increment("conversation.reconnect.exhausted");
      log.warn("{} after {} attempts for conversation {}", ErrorKind.MAX_RECONNECT_EXCEEDED, attempt,
          identity.conversationId());
      store.setError(ErrorKind.MAX_RECONNECT_EXCEEDED, "Failed to connect after multiple attempts");
    }
  }

  private void fireReconnect(ConversationIdentity target) {
    reconnectTask = null;
    if (retrySuppressed || !target.equals(identity)) {
      log.debug("Discarding stale reconnect for conversation {}", target.conversationId());
      return;
    }
    connect(target);
  }

  private void cancelReconnect() {
    if (reconnectTask != null) {
      reconnectTask.cancel();
      reconnectTask = null;
    }
  }

  private void resetAttempts() {
    attempt = 0;
    store.setReconnectAttempt(0);
  }

  private void setState(ConnectionState next) {
    state = next;
    store.setConnectionState(next);
  }

  private void closeQuietly(ActiveConnection connection, int code, String reason) {
    if (connection.handle == null) {
      return;
    }
    try {
      lastClose = connection.handle.close(code, reason);
    } catch (RuntimeException ex) {
      log.warn("Transport close failed", ex);
    }
  }

  /**
   * Listener bound to one transport connection. Callbacks from a connection that is no longer active are
   * discarded so a replaced socket can never drive the state machine.
   */
  private final class ActiveConnection implements TransportListener {
    private final long startedAtMillis;
    private TransportConnection handle;

    private ActiveConnection(long startedAtMillis) {
      this.startedAtMillis = startedAtMillis;
    }

    @Override
    public void onOpen() {
      scheduler.execute(() -> {
        if (active == this) {
          handleOpen(this);
        }
      });
    }

    @Override
    public void onText(String text) {
      scheduler.execute(() -> {
        if (active == this) {
          handleText(text);
        }
      });
    }

    @Override
    public void onClose(int code, String reason) {
      scheduler.execute(() -> {
        if (active == this) {
          handleClose(code, reason);
        }
      });
    }

    @Override
    public void onError(Throwable error) {
      scheduler.execute(() -> {
        if (active == this) {
          handleError(error);
        }
      });
    }
  }
}
