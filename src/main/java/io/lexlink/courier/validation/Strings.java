package io.lexlink.courier.validation;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;
import java.util.Objects;

/**
 * <strong>What:</strong> String validation for Courier configuration and CLI input.
 * <p><strong>Why:</strong> Conversation ids and tokens end up in URLs; rejecting blank or control-character input
 * early keeps malformed endpoints off the wire.</p>
 * <p><strong>Thread-safety:</strong> Stateless; safe for concurrent access.</p>
 *
 * @since 1.0.0
 * @see Numbers
 */
public final class Strings {
  private Strings() {
    // Utility
  }

  /**
   * Ensures a candidate string is non-null, non-blank and free of control characters.
   *
   * @param name logical parameter name for diagnostics; {@code null} defaults to {@code "value"}
   * @param value candidate text
   * @return trimmed input
   * @throws NullPointerException if {@code value} is {@code null}
   * @throws IllegalArgumentException if the trimmed value is blank or contains ISO control characters
   */
  public static String requireNonBlank(String name, String value) {
    String raw = Objects.requireNonNull(value, name == null ? "value" : name);
    String trimmed = raw.trim();
    if (trimmed.isEmpty()) {
      throw new IllegalArgumentException(message(name, "must not be blank"));
    }
    for (int i = 0; i < trimmed.length(); i++) {
      if (Character.isISOControl(trimmed.charAt(i))) {
        throw new IllegalArgumentException(message(name, "must not contain control characters"));
      }
    }
    return trimmed;
  }

  /**
   * Validates an absolute {@code http} or {@code https} URL with a host.
   *
   * @param name logical parameter name for diagnostics
   * @param value candidate URL
   * @return trimmed URL without trailing slashes
   * @throws IllegalArgumentException if the URL is malformed or uses another scheme
   */
  public static String requireHttpUrl(String name, String value) {
    String trimmed = requireNonBlank(name, value);
    URI uri;
    try {
      uri = new URI(trimmed);
    } catch (URISyntaxException ex) {
      throw new IllegalArgumentException(message(name, "is not a valid URL: " + ex.getMessage()), ex);
    }
    String scheme = uri.getScheme() == null ? "" : uri.getScheme().toLowerCase(Locale.ROOT);
    if (!scheme.equals("http") && !scheme.equals("https")) {
      throw new IllegalArgumentException(message(name, "must use http or https (was " + trimmed + ")"));
    }
    if (uri.getHost() == null) {
      throw new IllegalArgumentException(message(name, "must include a host (was " + trimmed + ")"));
    }
    int end = trimmed.length();
    while (end > 0 && trimmed.charAt(end - 1) == '/') {
      end--;
    }
    return trimmed.substring(0, end);
  }

  private static String message(String name, String suffix) {
    String label = (name == null || name.isBlank()) ? "value" : name;
    return label + " " + suffix;
  }
}
