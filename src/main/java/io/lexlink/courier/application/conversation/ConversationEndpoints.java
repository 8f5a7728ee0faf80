package io.lexlink.courier.application.conversation;

import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.logging.Logs;
import java.net.URI;
import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Objects;

/**
 * Composes WebSocket endpoints from the REST API base URL.
 *
 * <p>{@code http://host} becomes {@code ws://host/api/v1/ws/conversation/{id}?token={credential}}; {@code https}
 * maps to {@code wss}. Immutable and thread-safe.</p>
 *
 * @since 1.0.0
 */
public final class ConversationEndpoints {
  static final String CONVERSATION_PATH = "/api/v1/ws/conversation/";

  private final String webSocketBase;

  /**
   * Creates a composer for the given REST API base URL.
   *
   * @param apiBaseUrl {@code http} or {@code https} URL, e.g. {@code http://localhost:8000}
   * @throws IllegalArgumentException when the URL is blank or uses another scheme
   */
  public ConversationEndpoints(String apiBaseUrl) {
    this.webSocketBase = toWebSocketBase(apiBaseUrl);
  }

  /**
   * Derives the WebSocket base by scheme substitution.
   *
   * @param apiBaseUrl REST API base URL
   * @return base URL with {@code ws} or {@code wss} scheme and no trailing slash
   */
  public static String toWebSocketBase(String apiBaseUrl) {
    Objects.requireNonNull(apiBaseUrl, "apiBaseUrl");
    String trimmed = apiBaseUrl.trim();
    while (trimmed.endsWith("/")) {
      trimmed = trimmed.substring(0, trimmed.length() - 1);
    }
    String lower = trimmed.toLowerCase(Locale.ROOT);
    if (lower.startsWith("https://") && trimmed.length() > "https://".length()) {
      return "wss://" + trimmed.substring("https://".length());
    }
    if (lower.startsWith("http://") && trimmed.length() > "http://".length()) {
      return "ws://" + trimmed.substring("http://".length());
    }
    throw new IllegalArgumentException("apiBaseUrl must be an http or https URL (was '" + apiBaseUrl + "')");
  }

  /**
   * Composes the endpoint for a complete identity.
   *
   * @param identity identity whose conversation id and credential are embedded
   * @return endpoint URI
   * @throws IllegalArgumentException when the identity is incomplete
   */
  public URI resolve(ConversationIdentity identity) {
    String prefix = prefix(identity);
    return URI.create(prefix + encode(identity.credential().trim()));
  }

  /**
   * Renders the endpoint for logs and dry runs with the credential redacted.
   *
   * @param identity identity to describe
   * @return endpoint text safe to log
   */
  public String describe(ConversationIdentity identity) {
    String prefix = prefix(identity);
    return prefix + Logs.redact(identity.credential());
  }

  public String webSocketBase() {
    return webSocketBase;
  }

  private String prefix(ConversationIdentity identity) {
    if (identity == null || !identity.isComplete()) {
      throw new IllegalArgumentException("identity must carry a conversation id and a credential");
    }
    return webSocketBase + CONVERSATION_PATH + encode(identity.conversationId().trim()) + "?token=";
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8).replace("+", "%20");
  }
}
