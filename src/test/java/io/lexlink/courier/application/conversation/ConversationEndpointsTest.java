package io.lexlink.courier.application.conversation;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;

import io.lexlink.courier.domain.conversation.ConversationIdentity;
import org.junit.jupiter.api.Test;

class ConversationEndpointsTest {

  @Test
  void httpsMapsToSecureWebSocket() {
    assertEquals("wss://api.example.com", ConversationEndpoints.toWebSocketBase("https://api.example.com/"));
    assertEquals("ws://localhost:8000", ConversationEndpoints.toWebSocketBase("http://localhost:8000"));
    assertEquals("wss://example.com/base", ConversationEndpoints.toWebSocketBase(" HTTPS://example.com/base// "));
  }

  @Test
  void otherSchemesAreRejected() {
    assertThrows(IllegalArgumentException.class, () -> new ConversationEndpoints("ftp://example.com"));
    assertThrows(IllegalArgumentException.class, () -> new ConversationEndpoints("ws://example.com"));
    assertThrows(IllegalArgumentException.class, () -> new ConversationEndpoints("http://"));
  }

  @Test
  void resolveEncodesConversationAndToken() {
    ConversationEndpoints endpoints = new ConversationEndpoints("http://localhost:8000");

    String uri = endpoints.resolve(new ConversationIdentity("room 1", "a+b/c=")).toString();

    assertEquals("ws://localhost:8000/api/v1/ws/conversation/room%201?token=a%2Bb%2Fc%3D", uri);
  }

  @Test
  void describeRedactsToken() {
    ConversationEndpoints endpoints = new ConversationEndpoints("https://api.example.com");

    String text = endpoints.describe(new ConversationIdentity("c1", "secret-token"));

    assertEquals("wss://api.example.com/api/v1/ws/conversation/c1?token=[REDACTED]", text);
    assertFalse(text.contains("secret"));
  }

  @Test
  void incompleteIdentityCannotBeResolved() {
    ConversationEndpoints endpoints = new ConversationEndpoints("http://localhost:8000");
    assertThrows(IllegalArgumentException.class, () -> endpoints.resolve(new ConversationIdentity("c1", "")));
    assertThrows(IllegalArgumentException.class, () -> endpoints.describe(ConversationIdentity.EMPTY));
  }
}
