package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.ItemSnapshot;
import com.gentoro.jobwatch.model.ItemStatus;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Merges backend per-item snapshots into the caller's {@link Item}s.
 *
 * <p>Items are joined on their stable {@code index}. Once an item reached a terminal status it is
 * never touched again. Non-terminal items mirror the backend verbatim, including progress moving
 * backwards.
 */
public class ItemStatusReconciler {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(ItemStatusReconciler.class);

  /** Result of one pass. */
  public record ReconcileOutcome(boolean changed, int updatedCount) {
    static final ReconcileOutcome UNCHANGED = new ReconcileOutcome(false, 0);
  }

  public ReconcileOutcome reconcile(List<Item> items, Map<Integer, ItemSnapshot> snapshot) {
    if (items.isEmpty() || snapshot == null || snapshot.isEmpty()) {
      return ReconcileOutcome.UNCHANGED;
    }
    Map<Integer, Item> byIndex = new HashMap<>();
    for (Item item : items) {
      byIndex.put(item.index(), item);
    }

    int updated = 0;
    for (Map.Entry<Integer, ItemSnapshot> entry : snapshot.entrySet()) {
      Item item = byIndex.get(entry.getKey());
      if (item == null) {
        log.trace("No item at index {}, ignoring", entry.getKey());
        continue;
      }
      if (item.isTerminalReached()) continue;
      if (apply(item, entry.getValue())) {
        updated++;
      }
    }
    return new ReconcileOutcome(updated > 0, updated);
  }

  /**
   * Force every item that has not reached a terminal status into {@code terminalStatus}. Used once
   * at finalization for items the backend never reported on.
   */
  public ReconcileOutcome converge(List<Item> items, ItemStatus terminalStatus) {
    if (!terminalStatus.isTerminal()) {
      throw new IllegalArgumentException("Not a terminal item status: " + terminalStatus);
    }
    int updated = 0;
    for (Item item : items) {
      if (item.isTerminalReached()) continue;
      int progress = terminalStatus == ItemStatus.COMPLETED ? 100 : item.progress();
      if (item.update(terminalStatus, progress, item.stage(), true)) {
        updated++;
      }
    }
    return new ReconcileOutcome(updated > 0, updated);
  }

  private static boolean apply(Item item, ItemSnapshot remote) {
    String stage = remote.stage() != null ? remote.stage() : item.stage();
    return switch (remote.status()) {
      case COMPLETED -> item.update(ItemStatus.COMPLETED, 100, stage, true);
      case ERROR -> {
        int progress = remote.progress() != null ? remote.progress() : item.progress();
        yield item.update(ItemStatus.ERROR, progress, stage, true);
      }
      case PENDING, STARTING, PROCESSING -> {
        int progress = remote.progress() != null ? remote.progress() : item.progress();
        yield item.update(remote.status(), progress, stage, false);
      }
    };
  }
}
