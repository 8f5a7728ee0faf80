package io.lexlink.courier.domain.conversation;

import java.util.Objects;

/**
 * Error currently surfaced to the consuming UI.
 *
 * @param kind failure category; never {@code null}
 * @param message human-readable description; never {@code null}
 * @since 1.0.0
 */
public record ConversationError(ErrorKind kind, String message) {

  public ConversationError {
    kind = Objects.requireNonNull(kind, "kind");
    message = Objects.requireNonNull(message, "message");
  }

  /**
   * Indicates whether the error requires a user-triggered reconnect.
   *
   * @return {@code true} for {@link ErrorKind#MAX_RECONNECT_EXCEEDED}
   */
  public boolean isTerminal() {
    return kind == ErrorKind.MAX_RECONNECT_EXCEEDED;
  }
}
