package io.lexlink.courier.application.protocol;

/**
 * Raised when an inbound payload is not valid JSON or lacks the fields its {@code type} requires.
 *
 * @since 1.0.0
 */
public final class MalformedFrameException extends Exception {
  private static final long serialVersionUID = 1L;

  /**
   * Creates an exception describing the decoding failure.
   *
   * @param message failure description
   */
  public MalformedFrameException(String message) {
    super(message);
  }

  /**
   * Creates an exception wrapping the parser failure.
   *
   * @param message failure description
   * @param cause underlying parser exception
   */
  public MalformedFrameException(String message, Throwable cause) {
    super(message, cause);
  }
}
