package io.lexlink.courier.application.conversation;

import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationError;
import io.lexlink.courier.domain.conversation.Message;
import java.util.List;

/**
 * Observer of {@link ConversationStateStore} changes. Callbacks run on the event loop that mutated the store;
 * every method defaults to a no-op so observers override only what they render.
 *
 * @since 1.0.0
 */
public interface ConversationStateListener {

  /**
   * The message log changed (append, patch, seed or reset).
   *
   * @param messages immutable snapshot of the full log
   */
  default void onMessagesChanged(List<Message> messages) {}

  /**
   * The connection state changed.
   *
   * @param state new state
   */
  default void onConnectionStateChanged(ConnectionState state) {}

  /**
   * The counterpart started or stopped typing.
   *
   * @param typing new remote-typing flag
   */
  default void onRemoteTypingChanged(boolean typing) {}

  /**
   * The surfaced error changed.
   *
   * @param error new error, or {@code null} when cleared
   */
  default void onErrorChanged(ConversationError error) {}

  /**
   * The reconnect attempt counter changed.
   *
   * @param attempt retries scheduled since the last successful open
   */
  default void onReconnectAttemptChanged(int attempt) {}
}
