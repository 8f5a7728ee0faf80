package io.lexlink.courier.infrastructure.exec;

import io.lexlink.courier.application.port.SchedulerPort;
import java.util.Objects;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link SchedulerPort} backed by a single-threaded {@link ScheduledExecutorService}.
 *
 * <p>Tasks run one at a time in submission order. A failing task is logged and does not stop the loop.</p>
 *
 * @since 1.0.0
 */
public final class EventLoopScheduler implements SchedulerPort, AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(EventLoopScheduler.class);

  private final ScheduledExecutorService executor;

  /**
   * Creates a scheduler with its own loop thread named {@code courier-loop-N}.
   */
  public EventLoopScheduler() {
    this(ExecutorFactories.newEventLoop("courier-loop",
        (thread, ex) -> log.error("Uncaught failure on {}", thread.getName(), ex)));
  }

  /**
   * Creates a scheduler over an existing single-threaded executor.
   *
   * @param executor executor whose single thread acts as the event loop
   */
  public EventLoopScheduler(ScheduledExecutorService executor) {
    this.executor = Objects.requireNonNull(executor, "executor");
  }

  @Override
  public void execute(Runnable task) {
    Objects.requireNonNull(task, "task");
    try {
      executor.execute(guard(task));
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop shut down; dropping task");
    }
  }

  @Override
  public ScheduledTask schedule(Runnable task, long delayMillis) {
    Objects.requireNonNull(task, "task");
    try {
      ScheduledFuture<?> future =
          executor.schedule(guard(task), Math.max(0L, delayMillis), TimeUnit.MILLISECONDS);
      return new FutureTask(future);
    } catch (RejectedExecutionException ex) {
      log.debug("Event loop shut down; dropping timer");
      return CancelledTask.INSTANCE;
    }
  }

  /**
   * Stops the loop. Tasks already queued still run; pending timers are discarded.
   *
   * @throws InterruptedException when interrupted while waiting
   */
  public void shutdown() throws InterruptedException {
    executor.shutdown();
    if (!executor.awaitTermination(5, TimeUnit.SECONDS)) {
      log.warn("Event loop did not drain within 5s; interrupting");
      executor.shutdownNow();
    }
  }

  @Override
  public void close() {
    try {
      shutdown();
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping event loop");
    }
  }

  private static Runnable guard(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException ex) {
        log.error("Event loop task failed", ex);
      }
    };
  }

  private static final class FutureTask implements ScheduledTask {
    private final ScheduledFuture<?> future;

    private FutureTask(ScheduledFuture<?> future) {
      this.future = future;
    }

    @Override
    public void cancel() {
      future.cancel(false);
    }

    @Override
    public boolean isCancelled() {
      return future.isCancelled();
    }
  }

  private enum CancelledTask implements ScheduledTask {
    INSTANCE;

    @Override
    public void cancel() {
      // already inert
    }

    @Override
    public boolean isCancelled() {
      return true;
    }
  }
}
