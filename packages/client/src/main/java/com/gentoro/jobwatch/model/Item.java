package com.gentoro.jobwatch.model;

import java.util.Objects;

/**
 * One unit of work (a file). Owned by the caller's file list; the engine mutates it in place while
 * an operation is active and never afterwards.
 *
 * <p>Once {@link #isTerminalReached()} is true the item is frozen for the rest of the operation:
 * the mutators below refuse to change it. {@link #reset()} clears the flag before the item is
 * handed to a new operation.
 */
public final class Item {
  private final int index;
  private final String path;

  private volatile ItemStatus status = ItemStatus.PENDING;
  private volatile int progress;
  private volatile String stage = "";
  private volatile boolean terminalReached;

  public Item(int index, String path) {
    if (index < 0) {
      throw new IllegalArgumentException("Item index must be >= 0: " + index);
    }
    this.index = index;
    this.path = Objects.requireNonNull(path, "path");
  }

  public static Item pending(int index, String path) {
    return new Item(index, path);
  }

  public int index() {
    return index;
  }

  public String path() {
    return path;
  }

  public ItemStatus status() {
    return status;
  }

  public int progress() {
    return progress;
  }

  public String stage() {
    return stage;
  }

  public boolean isTerminalReached() {
    return terminalReached;
  }

  /**
   * Overwrite the observable fields. Returns whether anything changed; a frozen item is never
   * changed.
   */
  public boolean update(ItemStatus newStatus, int newProgress, String newStage, boolean terminal) {
    if (terminalReached) return false;
    int clamped = Math.max(0, Math.min(100, newProgress));
    String normalizedStage = newStage == null ? "" : newStage;
    boolean changed =
        terminal
            || status != newStatus
            || progress != clamped
            || !stage.equals(normalizedStage);
    status = newStatus;
    progress = clamped;
    stage = normalizedStage;
    if (terminal) {
      terminalReached = true;
    }
    return changed;
  }

  /** Return the item to {@code pending} so it can take part in a new operation. */
  public void reset() {
    status = ItemStatus.PENDING;
    progress = 0;
    stage = "";
    terminalReached = false;
  }

  public ItemView view() {
    return new ItemView(index, path, status, progress, stage, terminalReached);
  }

  @Override
  public String toString() {
    return "Item{" + index + ", " + status + ", " + progress + "%, '" + stage + "'}";
  }

  /** Immutable copy of an item, safe to hand to readers. */
  public record ItemView(
      int index,
      String path,
      ItemStatus status,
      int progress,
      String stage,
      boolean terminalReached) {}
}
