package io.lexlink.courier.domain.conversation;

/**
 * Lifecycle of the single transport connection owned by the connection manager.
 *
 * <p>Whether a close was intentional is carried by the close code, not by a separate state.</p>
 *
 * @since 1.0.0
 */
public enum ConnectionState {
  /** Nothing bound yet. */
  IDLE,
  /** Transport opening, either explicitly or from the retry path. */
  CONNECTING,
  /** Handshake acknowledged; frames may be sent. */
  OPEN,
  /** Close requested locally, waiting for the transport to finish. */
  CLOSING,
  /** Terminated, normally or abnormally. */
  CLOSED
}
