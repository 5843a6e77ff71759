package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.ItemStatus;
import com.gentoro.jobwatch.model.OperationSummary;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import com.gentoro.jobwatch.model.RemoteStatus;
import java.util.List;
import org.slf4j.Logger;

/**
 * Ends an operation exactly once, either from a terminal snapshot ({@link #finalize(Operation,
 * ProgressSnapshot)}) or without one ({@link #abort(Operation, AbortReason, String)}). Both paths
 * share one guard, so an operation emits exactly one of {@code TERMINAL} and {@code ABORTED}.
 *
 * <p>The registry slot is released before the event is published, so a listener may immediately
 * start a new operation of the same class.
 */
public class CompletionFinalizer {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(CompletionFinalizer.class);

  private final OperationRegistry registry;
  private final ItemStatusReconciler reconciler;
  private final OperationEventBus eventBus;

  public CompletionFinalizer(
      OperationRegistry registry, ItemStatusReconciler reconciler, OperationEventBus eventBus) {
    this.registry = registry;
    this.reconciler = reconciler;
    this.eventBus = eventBus;
  }

  /**
   * Apply the terminal snapshot, settle every item, release the class slot and publish {@code
   * TERMINAL}.
   *
   * @return {@code false} when the operation was already finalized or aborted
   */
  public boolean finalize(Operation operation, ProgressSnapshot last) {
    if (!last.isTerminal()) {
      throw new IllegalArgumentException("Snapshot is not terminal: " + last.status());
    }
    if (!operation.markFinalized()) {
      log.debug("Operation {} already finalized, ignoring terminal snapshot", operation.id());
      return false;
    }
    operation.pollHandle().cancel();

    List<Item> items = operation.items();
    reconciler.reconcile(items, last.itemStatuses());
    boolean completed = last.status() == RemoteStatus.COMPLETED;
    reconciler.converge(items, completed ? ItemStatus.COMPLETED : ItemStatus.ERROR);

    OperationSummary summary = summarize(items, last);
    operation.transitionTo(completed ? OperationStatus.COMPLETED : OperationStatus.ERROR);
    registry.release(operation.handle());

    log.info(
        "Operation {} ({}) finished {}: {}/{} succeeded, {} failed",
        operation.id(),
        operation.operationClass().wireName(),
        last.status(),
        summary.successCount(),
        summary.totalCount(),
        summary.failureCount());
    eventBus.publish(OperationEvent.terminal(operation, last, summary));
    return true;
  }

  /**
   * End monitoring without a terminal snapshot. Items keep their last reconciled state.
   *
   * @return {@code false} when the operation was already finalized or aborted
   */
  public boolean abort(Operation operation, AbortReason reason, String message) {
    if (!operation.markFinalized()) {
      log.debug("Operation {} already finalized, ignoring abort ({})", operation.id(), reason);
      return false;
    }
    operation.pollHandle().cancel();
    operation.transitionTo(reason.resultingStatus());
    registry.release(operation.handle());

    if (reason == AbortReason.STOPPED) {
      log.info("Operation {} stopped", operation.id());
    } else {
      log.warn(
          "Operation {} ({}) aborted: {} {}",
          operation.id(),
          operation.operationClass().wireName(),
          reason.wireName(),
          message == null ? "" : message);
    }
    eventBus.publish(OperationEvent.aborted(operation, reason, message));
    return true;
  }

  private static OperationSummary summarize(List<Item> items, ProgressSnapshot last) {
    int success = 0;
    int failure = 0;
    for (Item item : items) {
      if (item.status() == ItemStatus.COMPLETED) success++;
      else if (item.status() == ItemStatus.ERROR) failure++;
    }
    int total = items.size();
    if (total == 0) {
      success = last.completedCount();
      failure = last.failedCount();
      total = last.totalCount();
    }
    String message =
        last.status() == RemoteStatus.COMPLETED
            ? "Completed " + success + " of " + total + " items"
            : last.errorMessage() != null ? last.errorMessage() : "Operation failed";
    return new OperationSummary(success, failure, total, last.status(), message);
  }
}
