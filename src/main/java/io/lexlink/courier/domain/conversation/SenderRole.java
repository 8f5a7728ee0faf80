package io.lexlink.courier.domain.conversation;

import java.util.Locale;
import java.util.Optional;

/**
 * <strong>What:</strong> Party that authored a message or acknowledged a read receipt.
 * <p><strong>Why:</strong> The server speaks {@code user}/{@code lawyer}; the client models the two sides of
 * a consultation as {@link #CLIENT} and {@link #COUNTERPART}.</p>
 * <p><strong>Thread-safety:</strong> Enum constants are immutable.</p>
 *
 * @since 1.0.0
 */
public enum SenderRole {
  /** End user seeking legal advice. */
  CLIENT("user", "client"),
  /** Legal professional answering the consultation. */
  COUNTERPART("lawyer", "counterpart");

  private final String wireName;
  private final String alias;

  SenderRole(String wireName, String alias) {
    this.wireName = wireName;
    this.alias = alias;
  }

  /**
   * Returns the role name the server uses on the wire.
   *
   * @return {@code user} or {@code lawyer}
   */
  public String wireName() {
    return wireName;
  }

  /**
   * Resolves a wire role name, accepting both server and client spellings.
   *
   * @param value raw role text; may be {@code null}
   * @return resolved role, or empty for unknown roles such as {@code admin}
   */
  public static Optional<SenderRole> fromWire(String value) {
    if (value == null || value.isBlank()) {
      return Optional.empty();
    }
    String normalized = value.trim().toLowerCase(Locale.ROOT);
    for (SenderRole role : values()) {
      if (role.wireName.equals(normalized) || role.alias.equals(normalized)) {
        return Optional.of(role);
      }
    }
    return Optional.empty();
  }
}
