package io.lexlink.courier.application.port;

/**
 * Port supplying wall-clock time, used to measure handshake latency.
 *
 * @since 1.0.0
 * @see io.lexlink.courier.infrastructure.time.SystemClockAdapter
 */
public interface ClockPort {
  /**
   * Returns the current epoch time in milliseconds.
   *
   * @return milliseconds since 1970-01-01T00:00:00Z
   */
  long nowMillis();
}
