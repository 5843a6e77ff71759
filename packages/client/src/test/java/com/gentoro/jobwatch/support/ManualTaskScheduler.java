package com.gentoro.jobwatch.support;

import com.gentoro.jobwatch.engine.TaskScheduler;
import java.util.Comparator;
import java.util.PriorityQueue;

/** Deterministic {@link TaskScheduler} with a virtual clock. Nothing runs until the test says so. */
public class ManualTaskScheduler implements TaskScheduler {

  private final PriorityQueue<Task> queue =
      new PriorityQueue<>(Comparator.comparingLong(Task::dueAt).thenComparingLong(Task::seq));
  private long now;
  private long seq;

  public ManualTaskScheduler() {
    this(1_000_000L);
  }

  public ManualTaskScheduler(long start) {
    this.now = start;
  }

  private static final class Task {
    private final long dueAt;
    private final long seq;
    private final Runnable runnable;
    private boolean cancelled;

    private Task(long dueAt, long seq, Runnable runnable) {
      this.dueAt = dueAt;
      this.seq = seq;
      this.runnable = runnable;
    }

    long dueAt() {
      return dueAt;
    }

    long seq() {
      return seq;
    }
  }

  @Override
  public synchronized ScheduledTask schedule(Runnable task, long delayMs) {
    Task t = new Task(now + Math.max(0, delayMs), seq++, task);
    queue.add(t);
    return () -> cancel(t);
  }

  @Override
  public synchronized void execute(Runnable task) {
    queue.add(new Task(now, seq++, task));
  }

  @Override
  public synchronized long nowMillis() {
    return now;
  }

  /** Run everything that is due now, including work those tasks enqueue for now. */
  public void runUntilIdle() {
    advanceBy(0);
  }

  /** Move the clock forward, running due tasks in time order. */
  public void advanceBy(long millis) {
    long target;
    synchronized (this) {
      target = now + millis;
    }
    while (true) {
      Task next;
      synchronized (this) {
        next = queue.peek();
        if (next == null || next.dueAt > target) {
          now = target;
          return;
        }
        queue.poll();
        now = Math.max(now, next.dueAt);
        if (next.cancelled) continue;
      }
      next.runnable.run();
    }
  }

  /** Tasks waiting to run, cancelled ones excluded. */
  public synchronized int pendingCount() {
    return (int) queue.stream().filter(t -> !t.cancelled).count();
  }

  private synchronized void cancel(Task task) {
    task.cancelled = true;
  }
}
