package io.lexlink.courier.domain.conversation;

/**
 * Failure taxonomy surfaced through the conversation state.
 *
 * @since 1.0.0
 */
public enum ErrorKind {
  /** Connect attempted without both conversation id and credential. */
  IDENTITY_INCOMPLETE,
  /** Low-level connection failure; recovered by the reconnect loop. */
  TRANSPORT_ERROR,
  /** Send or mark-read requested while the connection is not open. */
  NOT_CONNECTED,
  /** Server sent an explicit error frame. */
  PROTOCOL_ERROR,
  /** Retry budget exhausted; requires an explicit reconnect. */
  MAX_RECONNECT_EXCEEDED,
  /** Inbound payload could not be decoded. */
  MALFORMED_FRAME
}
