package com.gentoro.jobwatch.engine;

import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;

/** {@link TaskScheduler} backed by a single daemon thread. */
public final class EventLoopScheduler implements TaskScheduler, AutoCloseable {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(EventLoopScheduler.class);

  private final ScheduledThreadPoolExecutor executor;

  public EventLoopScheduler() {
    this("jobwatch-events");
  }

  public EventLoopScheduler(String threadName) {
    this.executor =
        new ScheduledThreadPoolExecutor(
            1,
            r -> {
              Thread t = new Thread(r, threadName);
              t.setDaemon(true);
              return t;
            });
    this.executor.setRemoveOnCancelPolicy(true);
  }

  @Override
  public ScheduledTask schedule(Runnable task, long delayMs) {
    ScheduledFuture<?> future =
        executor.schedule(guarded(task), Math.max(0, delayMs), TimeUnit.MILLISECONDS);
    return () -> future.cancel(false);
  }

  @Override
  public void execute(Runnable task) {
    executor.execute(guarded(task));
  }

  @Override
  public long nowMillis() {
    return System.currentTimeMillis();
  }

  @Override
  public void close() {
    executor.shutdownNow();
  }

  /** Uncaught exceptions would otherwise vanish inside the executor's futures. */
  private static Runnable guarded(Runnable task) {
    return () -> {
      try {
        task.run();
      } catch (RuntimeException e) {
        log.error("Event loop task failed", e);
      }
    };
  }
}
