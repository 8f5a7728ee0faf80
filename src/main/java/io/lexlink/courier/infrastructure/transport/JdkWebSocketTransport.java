package io.lexlink.courier.infrastructure.transport;

import io.lexlink.courier.application.port.TransportPort;
import io.lexlink.courier.domain.conversation.CloseCodes;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.WebSocket;
import java.time.Duration;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicBoolean;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link TransportPort} backed by the JDK {@link WebSocket} client.
 * <p><strong>Why:</strong> The conversation server speaks plain text WebSocket frames; the JDK client covers
 * {@code ws}/{@code wss} without extra dependencies.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Reassemble fragmented text messages before handing them to the listener.</li>
 *   <li>Serialize sends, since the JDK client rejects a send while the previous one is in flight.</li>
 *   <li>Report exactly one close per connection, synthesizing {@code 1006} when the socket or a send fails.</li>
 *   <li>Expose the close handshake as a future so shutdown can wait for the close frame.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Listener callbacks arrive on HTTP client threads.</p>
 *
 * @since 1.0.0
 */
public final class JdkWebSocketTransport implements TransportPort {
  private static final Logger log = LoggerFactory.getLogger(JdkWebSocketTransport.class);

  private final HttpClient client;
  private final Duration connectTimeout;

  /**
   * Creates a transport with its own {@link HttpClient}.
   *
   * @param connectTimeout handshake timeout; never {@code null}
   */
  public JdkWebSocketTransport(Duration connectTimeout) {
    this(HttpClient.newHttpClient(), connectTimeout);
  }

  /**
   * Creates a transport over a shared client.
   *
   * @param client HTTP client used to build WebSockets; never {@code null}
   * @param connectTimeout handshake timeout; never {@code null}
   */
  public JdkWebSocketTransport(HttpClient client, Duration connectTimeout) {
    this.client = Objects.requireNonNull(client, "client");
    this.connectTimeout = Objects.requireNonNull(connectTimeout, "connectTimeout");
  }

  @Override
  public TransportConnection open(URI endpoint, TransportListener listener) {
    Objects.requireNonNull(endpoint, "endpoint");
    Objects.requireNonNull(listener, "listener");
    Connection connection = new Connection(listener);
    CompletableFuture<WebSocket> future = client.newWebSocketBuilder()
        .connectTimeout(connectTimeout)
        .buildAsync(endpoint, connection);
    connection.attach(future);
    return connection;
  }

  static final class Connection implements TransportConnection, WebSocket.Listener {
    private final TransportListener listener;
    private final AtomicBoolean closed = new AtomicBoolean();
    private final StringBuilder partial = new StringBuilder();
    private volatile WebSocket webSocket;
    private CompletableFuture<WebSocket> pending;
    private CompletableFuture<?> sendChain = CompletableFuture.completedFuture(null);

    Connection(TransportListener listener) {
      this.listener = listener;
    }

    synchronized void attach(CompletableFuture<WebSocket> future) {
      this.pending = future;
      future.whenComplete((ws, ex) -> {
        if (ex != null) {
          fail(ex);
        }
      });
    }

    @Override
    public synchronized void sendText(String text) {
      Objects.requireNonNull(text, "text");
      WebSocket ws = webSocket;
      if (ws == null || closed.get() || ws.isOutputClosed()) {
        throw new IllegalStateException("WebSocket is not open");
      }
      // The JDK client rejects a send while the previous one is still in flight.
      sendChain = sendChain
          .handle((ignored, ex) -> null)
          .thenCompose(ignored -> ws.sendText(text, true))
          .whenComplete((ignored, ex) -> {
            if (ex != null) {
              log.warn("WebSocket send failed; dropping connection", ex);
              fail(ex);
              ws.abort();
            }
          });
    }

    @Override
    public synchronized CompletableFuture<Void> close(int code, String reason) {
      WebSocket ws = webSocket;
      if (ws == null) {
        if (pending == null) {
          return CompletableFuture.completedFuture(null);
        }
        return pending.handle((opened, ex) -> {
          if (opened != null) {
            opened.abort();
          }
          return null;
        });
      }
      if (ws.isOutputClosed()) {
        return CompletableFuture.completedFuture(null);
      }
      String text = reason == null ? "" : reason;
      CompletableFuture<Void> closing = sendChain
          .handle((ignored, ex) -> null)
          .thenCompose(ignored -> ws.sendClose(code, text))
          .handle((ignored, ex) -> {
            if (ex != null) {
              log.debug("Close handshake failed; aborting", ex);
              ws.abort();
            }
            return null;
          });
      sendChain = closing;
      return closing;
    }

    @Override
    public void onOpen(WebSocket ws) {
      this.webSocket = ws;
      listener.onOpen();
      ws.request(1);
    }

    @Override
    public CompletionStage<?> onText(WebSocket ws, CharSequence data, boolean last) {
      partial.append(data);
      if (last) {
        String text = partial.toString();
        partial.setLength(0);
        listener.onText(text);
      }
      ws.request(1);
      return null;
    }

    @Override
    public CompletionStage<?> onClose(WebSocket ws, int statusCode, String reason) {
      if (closed.compareAndSet(false, true)) {
        listener.onClose(statusCode, reason);
      }
      return null;
    }

    @Override
    public void onError(WebSocket ws, Throwable error) {
      fail(error);
    }

    private void fail(Throwable error) {
      if (closed.compareAndSet(false, true)) {
        listener.onError(error);
        listener.onClose(CloseCodes.ABNORMAL, String.valueOf(error.getMessage()));
      }
    }
  }
}
