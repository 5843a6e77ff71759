package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.OperationSummary;
import com.gentoro.jobwatch.model.ProgressSnapshot;

/**
 * Notification about one operation. Fields not relevant to {@code type} are {@code null} (or
 * {@code false}).
 *
 * @param changed for {@link OperationEventType#TICK}, whether any item changed
 */
public record OperationEvent(
    OperationEventType type,
    String operationId,
    OperationClass operationClass,
    ProgressSnapshot snapshot,
    boolean changed,
    OperationSummary summary,
    AbortReason reason,
    String message) {

  static OperationEvent tick(Operation op, ProgressSnapshot snapshot, boolean changed) {
    return new OperationEvent(
        OperationEventType.TICK, op.id(), op.operationClass(), snapshot, changed, null, null, null);
  }

  static OperationEvent paused(Operation op) {
    return new OperationEvent(
        OperationEventType.PAUSED, op.id(), op.operationClass(), null, false, null, null, null);
  }

  static OperationEvent resumed(Operation op) {
    return new OperationEvent(
        OperationEventType.RESUMED, op.id(), op.operationClass(), null, false, null, null, null);
  }

  static OperationEvent terminal(
      Operation op, ProgressSnapshot snapshot, OperationSummary summary) {
    return new OperationEvent(
        OperationEventType.TERMINAL,
        op.id(),
        op.operationClass(),
        snapshot,
        true,
        summary,
        null,
        summary.message());
  }

  static OperationEvent aborted(Operation op, AbortReason reason, String message) {
    return new OperationEvent(
        OperationEventType.ABORTED,
        op.id(),
        op.operationClass(),
        op.lastSnapshot(),
        false,
        null,
        reason,
        message);
  }
}
