package io.lexlink.courier.application.port;

/**
 * <strong>What:</strong> Cooperative event loop running frame handling and timer callbacks one at a time.
 * <p><strong>Why:</strong> All mutation of conversation state happens on this loop, so components need no locks,
 * only ordering discipline.</p>
 * <p><strong>Role:</strong> Domain port; {@code EventLoopScheduler} implements it with a single thread, tests use
 * a virtual-time implementation.</p>
 * <p><strong>Thread-safety:</strong> {@link #execute(Runnable)} and {@link #schedule(Runnable, long)} may be called
 * from any thread; tasks run sequentially in submission order.</p>
 *
 * @since 1.0.0
 */
public interface SchedulerPort {

  /**
   * Queues {@code task} to run on the loop after every task already queued.
   *
   * @param task work to run; never {@code null}
   */
  void execute(Runnable task);

  /**
   * Runs {@code task} on the loop after {@code delayMillis}.
   *
   * @param task work to run; never {@code null}
   * @param delayMillis delay in milliseconds; zero or negative runs as soon as possible
   * @return handle that can cancel the task before it runs
   */
  ScheduledTask schedule(Runnable task, long delayMillis);

  /**
   * Cancellable handle to a delayed task.
   */
  interface ScheduledTask {

    /**
     * Prevents the task from running if it has not started yet. Idempotent.
     */
    void cancel();

    /**
     * Indicates whether {@link #cancel()} was called.
     *
     * @return {@code true} once cancelled
     */
    boolean isCancelled();
  }
}
