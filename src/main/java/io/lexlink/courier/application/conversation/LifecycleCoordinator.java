package io.lexlink.courier.application.conversation;

import io.lexlink.courier.domain.conversation.ConversationIdentity;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Binds the {@link ConnectionManager} to the identity currently observed by the host
 * (active screen, route, token store).
 * <p><strong>Why:</strong> Hosting frameworks may run setup and teardown hooks twice in quick succession. The
 * coordinator keeps that from opening two connections or leaking one.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>On every identity change, disconnect the previous identity before anything else.</li>
 *   <li>Connect only when both conversation id and credential are present; otherwise stay idle.</li>
 *   <li>Skip teardowns whose generation has been superseded by a later bind.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the event loop, like the manager it drives.</p>
 *
 * @since 1.0.0
 */
public final class LifecycleCoordinator {
  private static final Logger log = LoggerFactory.getLogger(LifecycleCoordinator.class);

  private final ConnectionManager manager;

  private long generation;
  private ConversationIdentity current = ConversationIdentity.EMPTY;

  /**
   * Creates a coordinator driving {@code manager}.
   *
   * @param manager connection manager to bind; never {@code null}
   */
  public LifecycleCoordinator(ConnectionManager manager) {
    this.manager = Objects.requireNonNull(manager, "manager");
  }

  /**
   * Setup hook: binds {@code next} as the current identity.
   *
   * <p>Binding the identity that is already current performs no teardown and leaves an existing connection in
   * place.</p>
   *
   * @param next identity observed by the host; {@code null} is treated as empty
   * @return binding whose {@link Binding#release()} is the paired teardown hook
   */
  public Binding bind(ConversationIdentity next) {
    ConversationIdentity target = next == null ? ConversationIdentity.EMPTY : next;
    long captured = ++generation;
    if (!target.equals(current)) {
      if (current.isComplete()) {
        log.debug("Generation {}: releasing conversation {}", captured, current.conversationId());
        manager.unbind();
      }
      current = target;
    }
    if (target.isComplete()) {
      log.debug("Generation {}: binding conversation {}", captured, target.conversationId());
      manager.connect(target);
    } else {
      log.debug("Generation {}: identity incomplete, staying idle ({})", captured, target);
    }
    return new Binding(this, captured, target);
  }

  /**
   * Teardown hook for a binding created by {@link #bind(ConversationIdentity)}.
   *
   * @param binding binding to release; never {@code null}
   * @return {@code true} when the teardown did real work, {@code false} when it was stale or repeated
   */
  public boolean release(Binding binding) {
    Objects.requireNonNull(binding, "binding");
    if (binding.coordinator() != this || binding.generation() != generation) {
      log.debug("Skipping stale teardown for generation {} (current {})", binding.generation(), generation);
      return false;
    }
    // Advance so a repeated release of the same binding is recognized as stale.
    generation++;
    current = ConversationIdentity.EMPTY;
    manager.unbind();
    log.debug("Generation {}: released conversation {}", binding.generation(),
        binding.identity().conversationId());
    return true;
  }

  /**
   * Returns the identity most recently bound and not yet released.
   *
   * @return current identity; {@link ConversationIdentity#EMPTY} when nothing is bound
   */
  public ConversationIdentity current() {
    return current;
  }

  public long generation() {
    return generation;
  }

  /**
   * Result of one setup invocation.
   *
   * @param coordinator coordinator that issued the binding
   * @param generation generation captured at bind time
   * @param identity identity bound at that generation
   */
  public record Binding(LifecycleCoordinator coordinator, long generation, ConversationIdentity identity) {

    /**
     * Runs the paired teardown.
     *
     * @return {@code true} when the teardown did real work
     */
    public boolean release() {
      return coordinator.release(this);
    }

    @Override
    public String toString() {
      return "Binding[generation=" + generation + ", identity=" + identity + "]";
    }
  }
}
