package com.gentoro.jobwatch.engine;

/**
 * The recurring poll timer of one {@link Operation}. The monitor re-arms it after every tick; once
 * {@link #cancel()} is called it stays cancelled and any task armed later is cancelled at once.
 */
public final class PollHandle {
  private TaskScheduler.ScheduledTask current;
  private boolean cancelled;

  public synchronized void cancel() {
    cancelled = true;
    if (current != null) {
      current.cancel();
      current = null;
    }
  }

  public synchronized boolean isCancelled() {
    return cancelled;
  }

  /** Whether a tick is currently armed. */
  public synchronized boolean isArmed() {
    return !cancelled && current != null;
  }

  synchronized void arm(TaskScheduler.ScheduledTask next) {
    if (cancelled) {
      next.cancel();
      return;
    }
    current = next;
  }

  /** Called by the tick itself once it starts running. */
  synchronized void fired() {
    current = null;
  }
}
