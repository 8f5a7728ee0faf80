package io.lexlink.courier.infrastructure.history;

import io.lexlink.courier.application.port.HistoryPort;
import io.lexlink.courier.application.protocol.FrameCodec;
import io.lexlink.courier.application.protocol.MalformedFrameException;
import io.lexlink.courier.domain.conversation.ConversationIdentity;
import io.lexlink.courier.domain.conversation.Message;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link HistoryPort} reading {@code GET {api}/api/v1/conversations/{id}} with bearer authentication.
 *
 * @since 1.0.0
 */
public final class HttpHistoryAdapter implements HistoryPort {
  private static final Logger log = LoggerFactory.getLogger(HttpHistoryAdapter.class);
  private static final String CONVERSATIONS_PATH = "/api/v1/conversations/";

  private final HttpClient client;
  private final String apiBaseUrl;
  private final Duration timeout;
  private final FrameCodec codec = new FrameCodec();

  /**
   * Creates an adapter.
   *
   * @param client HTTP client; never {@code null}
   * @param apiBaseUrl REST API base, e.g. {@code http://localhost:8000}
   * @param timeout request timeout; never {@code null}
   */
  public HttpHistoryAdapter(HttpClient client, String apiBaseUrl, Duration timeout) {
    this.client = Objects.requireNonNull(client, "client");
    String base = Objects.requireNonNull(apiBaseUrl, "apiBaseUrl").trim();
    this.apiBaseUrl = base.endsWith("/") ? base.substring(0, base.length() - 1) : base;
    this.timeout = Objects.requireNonNull(timeout, "timeout");
  }

  @Override
  public List<Message> fetchHistory(ConversationIdentity identity) throws IOException {
    Objects.requireNonNull(identity, "identity");
    if (!identity.isComplete()) {
      throw new IllegalArgumentException("identity must carry a conversation id and a credential");
    }
    URI uri = URI.create(apiBaseUrl + CONVERSATIONS_PATH
        + URLEncoder.encode(identity.conversationId().trim(), StandardCharsets.UTF_8));
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(timeout)
        .header("Accept", "application/json")
        .header("Authorization", "Bearer " + identity.credential().trim())
        .GET()
        .build();
    HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while fetching history for conversation "
          + identity.conversationId(), ex);
    }
    int status = response.statusCode();
    if (status < 200 || status >= 300) {
      throw new IOException("History request for conversation " + identity.conversationId()
          + " failed with HTTP " + status);
    }
    try {
      List<Message> messages = codec.decodeHistory(response.body());
      log.debug("Fetched {} history messages for conversation {}", messages.size(), identity.conversationId());
      return messages;
    } catch (MalformedFrameException ex) {
      throw new IOException("Malformed history document for conversation " + identity.conversationId(), ex);
    }
  }
}
