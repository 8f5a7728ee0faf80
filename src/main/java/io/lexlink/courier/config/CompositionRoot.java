package io.lexlink.courier.config;

import io.lexlink.courier.application.conversation.ConnectionManager;
import io.lexlink.courier.application.conversation.ConversationEndpoints;
import io.lexlink.courier.application.conversation.ConversationStateStore;
import io.lexlink.courier.application.conversation.LifecycleCoordinator;
import io.lexlink.courier.application.conversation.TypingSignalThrottle;
import io.lexlink.courier.application.port.HistoryPort;
import io.lexlink.courier.application.port.MetricsPort;
import io.lexlink.courier.application.port.SchedulerPort;
import io.lexlink.courier.application.port.TransportPort;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.infrastructure.exec.EventLoopScheduler;
import io.lexlink.courier.infrastructure.history.HttpHistoryAdapter;
import io.lexlink.courier.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import io.lexlink.courier.infrastructure.time.SystemClockAdapter;
import io.lexlink.courier.infrastructure.transport.JdkWebSocketTransport;
import java.io.IOException;
import java.net.http.HttpClient;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires a Courier session: event loop, transport, state store, connection manager,
 * lifecycle coordinator, history and metrics.
 * <p><strong>Why:</strong> Keeps adapter selection in one place so CLIs and tests share the same graph.</p>
 * <p><strong>Thread-safety:</strong> Construct on one thread. The manager and coordinator are loop-confined; use
 * {@link #onLoop(Runnable)} to drive them from other threads.</p>
 *
 * @since 1.0.0
 */
public final class CompositionRoot implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);
  /** Upper bound {@link #close()} waits for a close frame that is still being written. */
  public static final Duration CLOSE_WAIT = Duration.ofSeconds(2);

  private final ClientConfig config;
  private final MetricsPort metrics;
  private final SchedulerPort scheduler;
  private final AutoCloseable schedulerHandle;
  private final ConversationEndpoints endpoints;
  private final ConversationStateStore store;
  private final ConnectionManager manager;
  private final LifecycleCoordinator coordinator;
  private final HistoryPort history;
  private final AtomicBoolean closed = new AtomicBoolean();

  /**
   * Creates the production graph with OpenTelemetry metrics.
   *
   * @param config client settings; never {@code null}
   */
  public CompositionRoot(ClientConfig config) {
    this(config, new OpenTelemetryMetricsAdapter());
  }

  /**
   * Creates the production graph with an explicit metrics adapter.
   *
   * @param config client settings; never {@code null}
   * @param metrics metrics adapter; never {@code null}
   */
  public CompositionRoot(ClientConfig config, MetricsPort metrics) {
    this(config, metrics, null, null, null);
  }

  /**
   * Creates a graph with substitutable adapters. {@code null} adapters fall back to production ones.
   *
   * @param config client settings; never {@code null}
   * @param metrics metrics adapter; never {@code null}
   * @param scheduler event loop; {@code null} starts a dedicated loop thread
   * @param transport transport adapter; {@code null} uses the JDK WebSocket client
   * @param history history adapter; {@code null} uses HTTP, or nothing when history loading is disabled
   */
  public CompositionRoot(
      ClientConfig config,
      MetricsPort metrics,
      SchedulerPort scheduler,
      TransportPort transport,
      HistoryPort history) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    if (scheduler == null) {
      EventLoopScheduler loop = new EventLoopScheduler();
      this.scheduler = loop;
      this.schedulerHandle = loop;
    } else {
      this.scheduler = scheduler;
      this.schedulerHandle = null;
    }
    HttpClient httpClient = transport == null || history == null
        ? HttpClient.newBuilder().connectTimeout(config.connectTimeout()).build()
        : null;
    TransportPort effectiveTransport = transport != null
        ? transport
        : new JdkWebSocketTransport(httpClient, config.connectTimeout());
    if (history != null) {
      this.history = history;
    } else if (config.loadHistory()) {
      this.history = new HttpHistoryAdapter(httpClient, config.apiBaseUrl(), config.connectTimeout());
    } else {
      this.history = HistoryPort.NONE;
    }
    this.endpoints = new ConversationEndpoints(config.apiBaseUrl());
    this.store = new ConversationStateStore();
    this.manager = new ConnectionManager(
        effectiveTransport,
        this.scheduler,
        endpoints,
        store,
        config.reconnectPolicy(),
        new TypingSignalThrottle(this.scheduler, config.typingDebounceMillis(), config.typingIdleStopMillis()),
        metrics,
        new SystemClockAdapter());
    this.coordinator = new LifecycleCoordinator(manager);
    log.debug("Courier wired against {} with {}", endpoints.webSocketBase(), config.reconnectPolicy());
  }

  public ClientConfig config() {
    return config;
  }

  public ConversationEndpoints endpoints() {
    return endpoints;
  }

  public ConversationStateStore store() {
    return store;
  }

  public ConnectionManager manager() {
    return manager;
  }

  public LifecycleCoordinator coordinator() {
    return coordinator;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Runs {@code task} on the event loop.
   *
   * @param task work touching the manager or coordinator
   */
  public void onLoop(Runnable task) {
    scheduler.execute(task);
  }

  /**
   * Fetches the REST history for {@code identity} on the calling thread and seeds it on the loop once the
   * manager is bound to that identity.
   *
   * <p>Does nothing when history loading is disabled. Failures are logged and leave the log empty; the live
   * channel still delivers new messages.</p>
   *
   * @param identity complete identity
   * @return number of messages fetched
   */
  public int loadHistory(ConversationIdentity identity) {
    if (!config.loadHistory() || !identity.isComplete()) {
      return 0;
    }
    try {
      List<Message> snapshot = history.fetchHistory(identity);
      if (!snapshot.isEmpty()) {
        scheduler.execute(() -> {
          if (identity.equals(manager.identity())) {
            manager.seedHistory(snapshot);
          } else {
            log.debug("Dropping history for conversation {}; binding changed", identity.conversationId());
          }
        });
      }
      return snapshot.size();
    } catch (IOException ex) {
      log.warn("Could not load history for conversation {}: {}", identity.conversationId(), ex.getMessage());
      log.debug("History failure detail", ex);
      return 0;
    }
  }

  /**
   * Waits up to {@link #CLOSE_WAIT} for the last close handshake queued on the loop, then stops the event loop and
   * the metrics adapter. Repeated calls do nothing.
   */
  @Override
  public void close() {
    if (!closed.compareAndSet(false, true)) {
      return;
    }
    awaitPendingClose();
    if (schedulerHandle != null) {
      try {
        schedulerHandle.close();
      } catch (Exception ex) {
        log.warn("Failed to stop event loop cleanly", ex);
      }
    }
    if (metrics instanceof AutoCloseable closeable) {
      try {
        closeable.close();
      } catch (Exception ex) {
        log.warn("Failed to close metrics adapter", ex);
      }
    }
  }

  private void awaitPendingClose() {
    // Queued behind any release still waiting on the loop.
    CompletableFuture<CompletableFuture<Void>> lookup = new CompletableFuture<>();
    scheduler.execute(() -> lookup.complete(manager.pendingClose()));
    try {
      lookup.thenCompose(closing -> closing).get(CLOSE_WAIT.toMillis(), TimeUnit.MILLISECONDS);
    } catch (TimeoutException ex) {
      log.warn("Connection did not finish closing within {}ms", CLOSE_WAIT.toMillis());
    } catch (ExecutionException ex) {
      log.debug("Close handshake failed", ex.getCause());
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.debug("Interrupted while waiting for connection close");
    }
  }
}
