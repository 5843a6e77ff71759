package com.gentoro.jobwatch.model;

import java.util.Locale;

/** Lifecycle state of a single item inside an operation. */
public enum ItemStatus {
  PENDING,
  STARTING,
  PROCESSING,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  public String wireName() {
    return name().toLowerCase(Locale.ROOT);
  }

  /**
   * Map a backend status string. The worker also uses {@code initializing}, {@code running},
   * {@code failed} and {@code stopped}; these fold into the five local states. Returns {@code
   * null} for unknown or blank input.
   */
  public static ItemStatus fromWire(String raw) {
    if (raw == null || raw.isBlank()) return null;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "pending", "queued", "waiting" -> PENDING;
      case "starting", "initializing" -> STARTING;
      case "processing", "running", "converting" -> PROCESSING;
      case "completed", "done", "success" -> COMPLETED;
      case "error", "failed", "stopped" -> ERROR;
      default -> null;
    };
  }
}
