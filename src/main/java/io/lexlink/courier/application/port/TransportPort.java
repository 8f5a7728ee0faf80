package io.lexlink.courier.application.port;

import java.net.URI;
import java.util.concurrent.CompletableFuture;

/**
 * <strong>What:</strong> Port opening persistent, bidirectional text channels to the conversation server.
 * <p><strong>Why:</strong> Decouples the connection manager from a concrete WebSocket client so reconnect and
 * dispatch logic can be exercised against in-memory transports.</p>
 * <p><strong>Role:</strong> Domain port implemented by adapters such as {@code JdkWebSocketTransport}.</p>
 * <p><strong>Thread-safety:</strong> Listener callbacks may arrive on adapter threads; consumers re-dispatch them
 * onto their own event loop.</p>
 *
 * @since 1.0.0
 */
public interface TransportPort {

  /**
   * Starts opening a connection. The call returns immediately; the outcome is reported through
   * {@code listener}.
   *
   * @param endpoint fully composed WebSocket URI; never {@code null}
   * @param listener receiver of open, text, close and error events; never {@code null}
   * @return handle used to send frames and close the connection
   */
  TransportConnection open(URI endpoint, TransportListener listener);

  /**
   * Handle to one transport connection. Owned exclusively by the component that opened it.
   */
  interface TransportConnection {

    /**
     * Sends one text frame. Sends may complete asynchronously; a send that fails after this method returned is
     * reported through {@link TransportListener#onError(Throwable)} followed by an abnormal
     * {@link TransportListener#onClose(int, String)}.
     *
     * @param text serialized frame
     * @throws IllegalStateException when the connection is not open
     */
    void sendText(String text);

    /**
     * Requests closure with the given code. Closing an already closed connection is a no-op.
     *
     * @param code WebSocket close code
     * @param reason short human-readable reason
     * @return completes once the close frame has been written or the connection was dropped; never fails
     */
    CompletableFuture<Void> close(int code, String reason);
  }

  /**
   * Receiver of transport events.
   */
  interface TransportListener {

    /** Handshake completed. */
    void onOpen();

    /**
     * One complete text frame arrived.
     *
     * @param text frame payload
     */
    void onText(String text);

    /**
     * Connection terminated. Delivered at most once per connection.
     *
     * @param code close code; {@code 1006} when the transport dropped without a close frame
     * @param reason close reason, possibly empty
     */
    void onClose(int code, String reason);

    /**
     * Low-level failure. A close notification follows when the connection is gone.
     *
     * @param error cause reported by the transport
     */
    void onError(Throwable error);
  }
}
