package com.gentoro.jobwatch.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Canonical result of one progress poll, produced once at the transport boundary. All engine logic
 * works on this shape only.
 *
 * @param status overall operation status
 * @param progress overall progress 0-100
 * @param paused backend pause flag, independent of {@code status}
 * @param itemStatuses per-item state keyed by the item's stable index
 * @param completedCount items reported as completed
 * @param failedCount items reported as failed
 * @param totalCount items the backend knows about
 * @param currentStage human-readable stage of the operation
 * @param errorMessage failure detail, if any
 */
public record ProgressSnapshot(
    RemoteStatus status,
    int progress,
    boolean paused,
    Map<Integer, ItemSnapshot> itemStatuses,
    int completedCount,
    int failedCount,
    int totalCount,
    String currentStage,
    String errorMessage) {

  public ProgressSnapshot {
    itemStatuses =
        itemStatuses == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(itemStatuses));
  }

  public boolean isTerminal() {
    return status != null && status.isTerminal();
  }
}
