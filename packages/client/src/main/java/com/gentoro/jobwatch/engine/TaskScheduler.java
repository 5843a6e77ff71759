package com.gentoro.jobwatch.engine;

/**
 * Cooperative scheduling substrate. All engine state is mutated from tasks run by one scheduler,
 * one task at a time.
 */
public interface TaskScheduler {

  /** Run {@code task} once after {@code delayMs}. */
  ScheduledTask schedule(Runnable task, long delayMs);

  /** Run {@code task} as soon as possible, after already queued work. */
  void execute(Runnable task);

  /** Current time as seen by this scheduler, in epoch milliseconds. */
  long nowMillis();

  /** A pending delayed task. */
  @FunctionalInterface
  interface ScheduledTask {
    void cancel();
  }
}
