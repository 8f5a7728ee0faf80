package io.lexlink.courier.application.conversation;

import java.util.HashSet;
import java.util.Objects;
import java.util.Set;

/**
 * Tracks message ids already applied to the log for the currently bound conversation.
 *
 * <p>Ids are only unique within one conversation, so the owner calls {@link #reset()} whenever the bound identity
 * changes. Confined to the event loop; not thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class MessageDeduplicator {
  private final Set<String> seen = new HashSet<>();

  /**
   * Indicates whether {@code id} was already applied.
   *
   * @param id message id; never {@code null}
   * @return {@code true} when the id was marked before
   */
  public boolean seen(String id) {
    return seen.contains(Objects.requireNonNull(id, "id"));
  }

  /**
   * Records {@code id} as applied.
   *
   * @param id message id; never {@code null}
   */
  public void markSeen(String id) {
    seen.add(Objects.requireNonNull(id, "id"));
  }

  /** Forgets every recorded id. */
  public void reset() {
    seen.clear();
  }

  /**
   * Returns the number of ids recorded since the last reset.
   *
   * @return tracked id count
   */
  public int size() {
    return seen.size();
  }
}
