package io.lexlink.courier.application.conversation;

import io.lexlink.courier.application.port.SchedulerPort;
import io.lexlink.courier.application.port.SchedulerPort.ScheduledTask;
import java.util.Objects;
import java.util.function.Consumer;

/**
 * <strong>What:</strong> Rate-limits and coalesces outbound typing signals.
 * <p><strong>Why:</strong> Keystrokes arrive far faster than the counterpart needs to hear about them; starting to
 * type is debounced while stopping is sent at once.</p>
 * <p><strong>Rules:</strong>
 * <ul>
 *   <li>A value equal to the last value actually sent produces no traffic.</li>
 *   <li>{@code false} is sent immediately and cancels any pending {@code true}.</li>
 *   <li>{@code true} arms a debounce timer; further {@code true} calls restart it instead of stacking.</li>
 *   <li>Every {@code true} also restarts an idle timer; when it fires the episode is interrupted as if the user
 *   stopped typing.</li>
 *   <li>An interrupt cancels a pending {@code true} and sends {@code false} only when {@code true} went out.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> Confined to the {@link SchedulerPort} event loop.</p>
 *
 * @since 1.0.0
 */
public final class TypingSignalThrottle {
  /** Debounce applied before a {@code true} signal goes out. */
  public static final long DEFAULT_DEBOUNCE_MILLIS = 300L;
  /** Inactivity after the last {@code true} request before typing is stopped automatically. */
  public static final long DEFAULT_IDLE_STOP_MILLIS = 2_000L;

  private final SchedulerPort scheduler;
  private final long debounceMillis;
  private final long idleStopMillis;

  // null until something has been sent on the current channel
  private Boolean lastSent;
  private ScheduledTask pending;
  private ScheduledTask idleStop;

  /**
   * Creates a throttle using the default 300ms debounce and 2s idle stop.
   *
   * @param scheduler event loop running the timers
   */
  public TypingSignalThrottle(SchedulerPort scheduler) {
    this(scheduler, DEFAULT_DEBOUNCE_MILLIS, DEFAULT_IDLE_STOP_MILLIS);
  }

  /**
   * Creates a throttle with explicit timings.
   *
   * @param scheduler event loop running the timers
   * @param debounceMillis delay before a {@code true} signal is sent; must not be negative
   * @param idleStopMillis inactivity before typing is stopped automatically; {@code 0} disables the idle stop
   */
  public TypingSignalThrottle(SchedulerPort scheduler, long debounceMillis, long idleStopMillis) {
    this.scheduler = Objects.requireNonNull(scheduler, "scheduler");
    if (debounceMillis < 0) {
      throw new IllegalArgumentException("debounceMillis must not be negative");
    }
    if (idleStopMillis < 0) {
      throw new IllegalArgumentException("idleStopMillis must not be negative");
    }
    this.debounceMillis = debounceMillis;
    this.idleStopMillis = idleStopMillis;
  }

  /**
   * Requests that the typing state {@code isTyping} be signalled.
   *
   * @param isTyping desired remote-visible typing state
   * @param send writer invoked with the value when it actually goes out
   */
  public void signal(boolean isTyping, Consumer<Boolean> send) {
    Objects.requireNonNull(send, "send");
    if (!isTyping) {
      cancelPending();
      cancelIdleStop();
      if (!Boolean.FALSE.equals(lastSent)) {
        lastSent = Boolean.FALSE;
        send.accept(Boolean.FALSE);
      }
      return;
    }
    restartIdleStop(send);
    if (Boolean.TRUE.equals(lastSent)) {
      return;
    }
    cancelPending();
    pending = scheduler.schedule(() -> {
      pending = null;
      lastSent = Boolean.TRUE;
      send.accept(Boolean.TRUE);
    }, debounceMillis);
  }

  /**
   * Ends the current typing episode, as after a message was sent. Sends {@code false} only when {@code true} was
   * the last value sent; a pending {@code true} is dropped silently.
   *
   * @param send writer invoked with {@code false} when it actually goes out
   */
  public void interrupt(Consumer<Boolean> send) {
    Objects.requireNonNull(send, "send");
    cancelPending();
    cancelIdleStop();
    if (Boolean.TRUE.equals(lastSent)) {
      lastSent = Boolean.FALSE;
      send.accept(Boolean.FALSE);
    }
  }

  /** Cancels any pending signal or idle stop and forgets the last sent value. */
  public void reset() {
    cancelPending();
    cancelIdleStop();
    lastSent = null;
  }

  /**
   * Indicates whether a debounced {@code true} is waiting to be sent.
   *
   * @return {@code true} while the debounce timer is armed
   */
  public boolean hasPending() {
    return pending != null;
  }

  /**
   * Indicates whether typing will be stopped automatically after inactivity.
   *
   * @return {@code true} while the idle timer is armed
   */
  public boolean hasIdleStop() {
    return idleStop != null;
  }

  private void restartIdleStop(Consumer<Boolean> send) {
    cancelIdleStop();
    if (idleStopMillis == 0) {
      return;
    }
    idleStop = scheduler.schedule(() -> {
      idleStop = null;
      interrupt(send);
    }, idleStopMillis);
  }

  private void cancelIdleStop() {
    if (idleStop != null) {
      idleStop.cancel();
      idleStop = null;
    }
  }

  private void cancelPending() {
    if (pending != null) {
      pending.cancel();
      pending = null;
    }
  }
}
