package io.lexlink.courier.domain.conversation;

/**
 * <strong>What:</strong> The (conversation id, credential) pair a connection is bound to.
 * <p><strong>Why:</strong> At most one connecting or open transport may exist per identity, and a connection
 * never outlives the identity it was opened for.</p>
 * <p><strong>Security:</strong> {@link #toString()} never renders the credential.</p>
 *
 * @param conversationId conversation to join; may be {@code null} while the hosting screen is loading
 * @param credential bearer token; may be {@code null} until the token store has loaded
 *
 * @since 1.0.0
 */
public record ConversationIdentity(String conversationId, String credential) {

  /** Identity with neither field populated. */
  public static final ConversationIdentity EMPTY = new ConversationIdentity(null, null);

  /**
   * Indicates whether both fields are present and non-blank.
   *
   * @return {@code true} when a connection may be attempted
   */
  public boolean isComplete() {
    return present(conversationId) && present(credential);
  }

  private static boolean present(String value) {
    return value != null && !value.isBlank();
  }

  @Override
  public String toString() {
    return "ConversationIdentity[conversationId=" + conversationId
        + ", credential=" + (present(credential) ? "[REDACTED]" : "<absent>") + "]";
  }
}
