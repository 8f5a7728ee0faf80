package io.lexlink.courier.logging;

/**
 * <strong>What:</strong> Logging hygiene helpers for conversation traffic.
 * <p><strong>Why:</strong> Message bodies can be long and personal, and endpoints carry bearer tokens in the
 * query string; neither belongs verbatim in operator logs.</p>
 * <p><strong>Thread-safety:</strong> Stateless utilities safe for concurrent use.</p>
 *
 * @since 1.0.0
 * @see LoggingConfigurator
 */
public final class Logs {
  private static final String NULL_PLACEHOLDER = "<null>";
  private static final String ABSENT_PLACEHOLDER = "<absent>";
  private static final String REDACTED_PLACEHOLDER = "[REDACTED]";

  private Logs() {
    // Utility
  }

  /**
   * Shortens {@code value} to at most {@code maxChars} characters, never splitting a surrogate pair.
   *
   * @param value text to shorten; {@code null} results in {@code "<null>"}
   * @param maxChars maximum number of characters kept; must be positive
   * @return {@code value} unchanged when short enough, otherwise the prefix followed by
   *     {@code "... (truncated, N chars)"}
   * @throws IllegalArgumentException if {@code maxChars} is not positive
   */
  public static String truncate(String value, int maxChars) {
    if (value == null) {
      return NULL_PLACEHOLDER;
    }
    if (maxChars <= 0) {
      throw new IllegalArgumentException("maxChars must be positive");
    }
    if (value.length() <= maxChars) {
      return value;
    }
    int end = maxChars;
    if (Character.isHighSurrogate(value.charAt(end - 1))) {
      end--;
    }
    return value.substring(0, end) + "... (truncated, " + value.length() + " chars)";
  }

  /**
   * Returns a placeholder standing in for a secret.
   *
   * @param value secret being hidden
   * @return {@code "<absent>"} when {@code value} is {@code null} or blank, {@code "[REDACTED]"} otherwise
   */
  public static String redact(String value) {
    return value == null || value.isBlank() ? ABSENT_PLACEHOLDER : REDACTED_PLACEHOLDER;
  }
}
