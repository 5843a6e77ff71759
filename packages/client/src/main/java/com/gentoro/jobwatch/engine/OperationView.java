package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import java.util.List;

/** Read-only copy of an operation's state for callers outside the event loop. */
public record OperationView(
    String operationId,
    OperationClass operationClass,
    OperationStatus status,
    long startedAt,
    long elapsedMillis,
    int consecutiveErrorCount,
    long pollCount,
    List<Item.ItemView> items,
    ProgressSnapshot lastSnapshot) {

  static OperationView of(Operation operation, long now) {
    return new OperationView(
        operation.id(),
        operation.operationClass(),
        operation.status(),
        operation.startedAt(),
        operation.elapsedMillis(now),
        operation.consecutiveErrorCount(),
        operation.pollCount(),
        operation.items().stream().map(Item::view).toList(),
        operation.lastSnapshot());
  }
}
