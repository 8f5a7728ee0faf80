package io.lexlink.courier.domain.conversation;

/**
 * WebSocket close codes interpreted by the client.
 *
 * @since 1.0.0
 */
public final class CloseCodes {
  /** Normal, intentional closure. Never retried. */
  public static final int NORMAL = 1000;
  /** Connection dropped without a close frame. */
  public static final int ABNORMAL = 1006;
  /** Server rejected the credential or the conversation access check. */
  public static final int POLICY_VIOLATION = 1008;

  private CloseCodes() {
    // Constants
  }

  /**
   * Indicates whether {@code code} denotes an intentional closure.
   *
   * @param code close code reported by the transport
   * @return {@code true} only for {@link #NORMAL}
   */
  public static boolean isNormal(int code) {
    return code == NORMAL;
  }
}
