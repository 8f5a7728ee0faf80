package io.lexlink.courier.application.conversation;

import io.lexlink.courier.domain.conversation.ConnectionState;
import io.lexlink.courier.domain.conversation.ConversationError;
import io.lexlink.courier.domain.conversation.ErrorKind;
import io.lexlink.courier.domain.conversation.Message;
import io.lexlink.courier.domain.conversation.SenderRole;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Observable state of the active conversation.
 * <p><strong>Why:</strong> The rest of the application renders from this store instead of wiring callbacks into
 * the transport, and it is the only component allowed to mutate the message log.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Keep the message log id-unique and in arrival order; a repeated id patches in place.</li>
 *   <li>Expose connection state, remote typing, current error and reconnect attempt.</li>
 *   <li>Notify {@link ConversationStateListener}s after every effective change.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Mutators are confined to the event loop. Readers on any thread see immutable,
 * safely published snapshots.</p>
 *
 * @since 1.0.0
 */
public final class ConversationStateStore {
  private static final Logger log = LoggerFactory.getLogger(ConversationStateStore.class);

  private final List<ConversationStateListener> listeners = new CopyOnWriteArrayList<>();

  private volatile List<Message> messages = List.of();
  private volatile ConnectionState connectionState = ConnectionState.IDLE;
  private volatile boolean remoteTyping;
  private volatile ConversationError error;
  private volatile int reconnectAttempt;

  /**
   * Returns the message log.
   *
   * @return immutable snapshot in arrival order
   */
  public List<Message> messages() {
    return messages;
  }

  /**
   * Looks up a message by id.
   *
   * @param id message id
   * @return matching message, if present
   */
  public Optional<Message> message(String id) {
    for (Message message : messages) {
      if (message.id().equals(id)) {
        return Optional.of(message);
      }
    }
    return Optional.empty();
  }

  public ConnectionState connectionState() {
    return connectionState;
  }

  /**
   * Indicates whether frames can currently be sent.
   *
   * @return {@code true} while {@link ConnectionState#OPEN}
   */
  public boolean isConnected() {
    return connectionState == ConnectionState.OPEN;
  }

  public boolean isRemoteTyping() {
    return remoteTyping;
  }

  /**
   * Returns the error currently surfaced to the UI.
   *
   * @return current error, if any
   */
  public Optional<ConversationError> error() {
    return Optional.ofNullable(error);
  }

  public int reconnectAttempt() {
    return reconnectAttempt;
  }

  /**
   * Appends a message, or patches the existing entry when its id is already in the log.
   *
   * <p>A patch only ever raises read flags; an entry never moves and is never duplicated.</p>
   *
   * @param message message to apply; never {@code null}
   * @return {@code true} when a new entry was appended
   */
  public boolean append(Message message) {
    Objects.requireNonNull(message, "message");
    List<Message> current = messages;
    for (int i = 0; i < current.size(); i++) {
      Message existing = current.get(i);
      if (existing.id().equals(message.id())) {
        Message merged = merge(existing, message);
        if (merged != existing) {
          List<Message> patched = new ArrayList<>(current);
          patched.set(i, merged);
          publishMessages(patched);
        }
        log.debug("Message {} already in log; patched in place", message.id());
        return false;
      }
    }
    List<Message> appended = new ArrayList<>(current.size() + 1);
    appended.addAll(current);
    appended.add(message);
    publishMessages(appended);
    return true;
  }

  /**
   * Merges a history snapshot into the log. Snapshot entries whose ids are not yet present are placed ahead of
   * entries received live, in snapshot order.
   *
   * @param snapshot messages fetched from the server; never {@code null}
   * @return number of entries added
   */
  public int seed(Collection<Message> snapshot) {
    Objects.requireNonNull(snapshot, "snapshot");
    Map<String, Message> byId = new LinkedHashMap<>();
    for (Message message : snapshot) {
      byId.putIfAbsent(message.id(), message);
    }
    List<Message> current = messages;
    Set<String> live = new HashSet<>();
    for (Message message : current) {
      live.add(message.id());
    }
    List<Message> seeded = new ArrayList<>(byId.size() + current.size());
    for (Message message : byId.values()) {
      if (!live.contains(message.id())) {
        seeded.add(message);
      }
    }
    int added = seeded.size();
    if (added == 0) {
      return 0;
    }
    seeded.addAll(current);
    publishMessages(seeded);
    return added;
  }

  /**
   * Sets the read flag of {@code reader} on every listed message present in the log.
   *
   * @param reader acknowledging side; never {@code null}
   * @param ids acknowledged message ids; never {@code null}
   * @return number of entries whose flag changed
   */
  public int applyReadReceipt(SenderRole reader, Collection<String> ids) {
    Objects.requireNonNull(reader, "reader");
    Objects.requireNonNull(ids, "ids");
    if (ids.isEmpty()) {
      return 0;
    }
    Set<String> wanted = new HashSet<>(ids);
    List<Message> current = messages;
    List<Message> patched = null;
    int changed = 0;
    for (int i = 0; i < current.size(); i++) {
      Message existing = current.get(i);
      if (!wanted.contains(existing.id()) || existing.isReadBy(reader)) {
        continue;
      }
      if (patched == null) {
        patched = new ArrayList<>(current);
      }
      patched.set(i, existing.withReadBy(reader));
      changed++;
    }
    if (patched != null) {
      publishMessages(patched);
    }
    return changed;
  }

  /**
   * Updates the connection state. Entering {@link ConnectionState#OPEN} clears any surfaced error.
   *
   * @param state new state; never {@code null}
   */
  public void setConnectionState(ConnectionState state) {
    Objects.requireNonNull(state, "state");
    if (state == connectionState) {
      return;
    }
    connectionState = state;
    notifyListeners(listener -> listener.onConnectionStateChanged(state));
    if (state == ConnectionState.OPEN) {
      clearError();
    }
  }

  public void setRemoteTyping(boolean typing) {
    if (typing == remoteTyping) {
      return;
    }
    remoteTyping = typing;
    notifyListeners(listener -> listener.onRemoteTypingChanged(typing));
  }

  /**
   * Surfaces an error to observers.
   *
   * @param kind failure category
   * @param message human-readable description
   */
  public void setError(ErrorKind kind, String message) {
    ConversationError next = new ConversationError(kind, message);
    if (next.equals(error)) {
      return;
    }
    error = next;
    notifyListeners(listener -> listener.onErrorChanged(next));
  }

  /** Clears the surfaced error, if any. */
  public void clearError() {
    if (error == null) {
      return;
    }
    error = null;
    notifyListeners(listener -> listener.onErrorChanged(null));
  }

  public void setReconnectAttempt(int attempt) {
    if (attempt == reconnectAttempt) {
      return;
    }
    reconnectAttempt = attempt;
    notifyListeners(listener -> listener.onReconnectAttemptChanged(attempt));
  }

  /**
   * Drops conversation-scoped state (log, typing flag, error) when a different conversation is bound. The
   * connection state is left to the connection manager.
   */
  public void resetConversation() {
    if (!messages.isEmpty()) {
      publishMessages(List.of());
    }
    setRemoteTyping(false);
    clearError();
    setReconnectAttempt(0);
  }

  /**
   * Registers an observer.
   *
   * @param listener observer to notify; never {@code null}
   * @return handle that removes the observer when closed
   */
  public Subscription subscribe(ConversationStateListener listener) {
    Objects.requireNonNull(listener, "listener");
    listeners.add(listener);
    return () -> listeners.remove(listener);
  }

  private void publishMessages(List<Message> next) {
    List<Message> snapshot = List.copyOf(next);
    messages = snapshot;
    notifyListeners(listener -> listener.onMessagesChanged(snapshot));
  }

  private static Message merge(Message existing, Message incoming) {
    Message merged = existing;
    if (incoming.readByClient()) {
      merged = merged.withReadBy(SenderRole.CLIENT);
    }
    if (incoming.readByCounterpart()) {
      merged = merged.withReadBy(SenderRole.COUNTERPART);
    }
    return merged;
  }

  private void notifyListeners(Consumer<ConversationStateListener> event) {
    for (ConversationStateListener listener : listeners) {
      try {
        event.accept(listener);
      } catch (RuntimeException ex) {
        log.warn("Conversation state listener {} failed", listener.getClass().getName(), ex);
      }
    }
  }

  /**
   * Handle returned by {@link #subscribe(ConversationStateListener)}.
   */
  @FunctionalInterface
  public interface Subscription extends AutoCloseable {
    @Override
    void close();
  }
}
