package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.config.MonitorSettings;
import com.gentoro.jobwatch.exception.StateException;
import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * One remote job tracked from start acknowledgement until finalization.
 *
 * <p>Mutated from the event loop; status reads and the control-request gate are synchronized so
 * callers on other threads see a consistent view.
 */
public final class Operation {
  private final String id;
  private final OperationClass operationClass;
  private final OperationRegistry.OperationHandle handle;
  private final long startedAt;
  private final MonitorSettings settings;
  private final List<Item> items;
  private final PollHandle pollHandle = new PollHandle();
  private final AtomicBoolean finalized = new AtomicBoolean(false);

  private OperationStatus status = OperationStatus.RUNNING;
  private volatile int consecutiveErrorCount;
  private volatile long pollCount;
  private volatile ProgressSnapshot lastSnapshot;
  private boolean controlRequestInFlight;
  private long pauseStateVersion;

  public Operation(
      String id,
      OperationClass operationClass,
      OperationRegistry.OperationHandle handle,
      long startedAt,
      MonitorSettings settings,
      List<Item> items) {
    this.id = Objects.requireNonNull(id, "id");
    this.operationClass = Objects.requireNonNull(operationClass, "operationClass");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.startedAt = startedAt;
    this.settings = Objects.requireNonNull(settings, "settings");
    this.items = List.copyOf(items);
  }

  public String id() {
    return id;
  }

  public OperationClass operationClass() {
    return operationClass;
  }

  public OperationRegistry.OperationHandle handle() {
    return handle;
  }

  public long startedAt() {
    return startedAt;
  }

  public MonitorSettings settings() {
    return settings;
  }

  /** The caller's items, in submission order. */
  public List<Item> items() {
    return items;
  }

  public PollHandle pollHandle() {
    return pollHandle;
  }

  public synchronized OperationStatus status() {
    return status;
  }

  /** Still running or paused. */
  public synchronized boolean isActive() {
    return !status.isTerminal();
  }

  /**
   * Move to {@code next}.
   *
   * @return the previous status
   * @throws StateException when the move is not a legal lifecycle transition
   */
  public synchronized OperationStatus transitionTo(OperationStatus next) {
    if (!status.canTransitionTo(next)) {
      throw new StateException("Operation " + id + " cannot move from " + status + " to " + next)
          .withContext("operationId", id)
          .withContext("from", status)
          .withContext("to", next);
    }
    OperationStatus previous = status;
    status = next;
    return previous;
  }

  public boolean isFinalized() {
    return finalized.get();
  }

  /** Claim the one-shot finalization guard. Only the first caller gets {@code true}. */
  boolean markFinalized() {
    return finalized.compareAndSet(false, true);
  }

  public int consecutiveErrorCount() {
    return consecutiveErrorCount;
  }

  public long pollCount() {
    return pollCount;
  }

  public ProgressSnapshot lastSnapshot() {
    return lastSnapshot;
  }

  public long elapsedMillis(long now) {
    return now - startedAt;
  }

  void pollDispatched() {
    pollCount++;
  }

  int recordPollFailure() {
    return ++consecutiveErrorCount;
  }

  void recordPollSuccess(ProgressSnapshot snapshot) {
    consecutiveErrorCount = 0;
    lastSnapshot = snapshot;
  }

  /**
   * Open the pause/resume gate when the operation is in {@code required} status and no other
   * control request is outstanding.
   */
  synchronized boolean beginControlRequest(OperationStatus required) {
    if (controlRequestInFlight || status != required) return false;
    controlRequestInFlight = true;
    return true;
  }

  synchronized void endControlRequest() {
    controlRequestInFlight = false;
  }

  public synchronized boolean isControlRequestInFlight() {
    return controlRequestInFlight;
  }

  /** Bumped on every pause-state change so polls dispatched before it can be recognized. */
  synchronized long pauseStateVersion() {
    return pauseStateVersion;
  }

  /**
   * Apply a pause-state change if the operation is still active and currently in {@code from}.
   *
   * @return whether the status moved
   */
  synchronized boolean changePauseState(OperationStatus from, OperationStatus to) {
    if (status != from) return false;
    transitionTo(to);
    pauseStateVersion++;
    return true;
  }

  @Override
  public String toString() {
    return "Operation{" + operationClass.wireName() + ":" + id + ", " + status() + "}";
  }
}
