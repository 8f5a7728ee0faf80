package io.lexlink.courier.application.conversation;

import io.lexlink.courier.domain.conversation.CloseCodes;

/**
 * <strong>What:</strong> Exponential backoff schedule for reconnect attempts.
 * <p><strong>Why:</strong> Spreads retries after abnormal closures while never retrying an intentional close.</p>
 * <p><strong>Role:</strong> Pure calculator consulted by {@link ConnectionManager}; the attempt counter lives in the
 * caller.</p>
 * <p><strong>Thread-safety:</strong> Immutable; safe for concurrent use.</p>
 *
 * @since 1.0.0
 */
public final class ReconnectPolicy {
  /** Delay before the first retry. */
  public static final long DEFAULT_BASE_DELAY_MILLIS = 1_000L;
  /** Upper bound for any single delay. */
  public static final long DEFAULT_CAP_DELAY_MILLIS = 30_000L;
  /** Retries allowed before giving up. */
  public static final int DEFAULT_MAX_ATTEMPTS = 5;

  private final long baseDelayMillis;
  private final long capDelayMillis;
  private final int maxAttempts;

  /**
   * Creates a policy with explicit parameters.
   *
   * @param baseDelayMillis delay for attempt zero; must be positive
   * @param capDelayMillis maximum delay; must be at least {@code baseDelayMillis}
   * @param maxAttempts retries allowed; must not be negative
   */
  public ReconnectPolicy(long baseDelayMillis, long capDelayMillis, int maxAttempts) {
    if (baseDelayMillis <= 0) {
      throw new IllegalArgumentException("baseDelayMillis must be positive");
    }
    if (capDelayMillis < baseDelayMillis) {
      throw new IllegalArgumentException("capDelayMillis must be >= baseDelayMillis");
    }
    if (maxAttempts < 0) {
      throw new IllegalArgumentException("maxAttempts must not be negative");
    }
    this.baseDelayMillis = baseDelayMillis;
    this.capDelayMillis = capDelayMillis;
    this.maxAttempts = maxAttempts;
  }

  /**
   * Returns the policy with 1s base delay, 30s cap and five attempts.
   *
   * @return default policy
   */
  public static ReconnectPolicy defaults() {
    return new ReconnectPolicy(DEFAULT_BASE_DELAY_MILLIS, DEFAULT_CAP_DELAY_MILLIS, DEFAULT_MAX_ATTEMPTS);
  }

  /**
   * Computes {@code min(base * 2^attempt, cap)}.
   *
   * @param attempt zero-based retry index; negative values are treated as zero
   * @return delay in milliseconds
   */
  public long nextDelay(int attempt) {
    int exponent = Math.max(0, attempt);
    // Shifting past 62 bits overflows; any such delay is capped anyway.
    if (exponent >= 62 || baseDelayMillis > (capDelayMillis >> exponent)) {
      return capDelayMillis;
    }
    return Math.min(baseDelayMillis << exponent, capDelayMillis);
  }

  /**
   * Decides whether a close should be followed by another attempt.
   *
   * @param attempt retries already scheduled for the current identity
   * @param closeCode close code reported by the transport
   * @return {@code false} for a normal closure or once {@code attempt} reaches the maximum
   */
  public boolean shouldRetry(int attempt, int closeCode) {
    if (CloseCodes.isNormal(closeCode)) {
      return false;
    }
    return attempt < maxAttempts;
  }

  public int maxAttempts() {
    return maxAttempts;
  }

  @Override
  public String toString() {
    return "ReconnectPolicy[base=" + baseDelayMillis + "ms, cap=" + capDelayMillis
        + "ms, maxAttempts=" + maxAttempts + "]";
  }
}
