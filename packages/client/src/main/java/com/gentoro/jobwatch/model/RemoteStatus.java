package com.gentoro.jobwatch.model;

import java.util.Locale;

/** Overall operation status as reported by a poll. */
public enum RemoteStatus {
  RUNNING,
  PAUSED,
  COMPLETED,
  ERROR;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR;
  }

  /** Returns {@code null} for unknown or blank input. */
  public static RemoteStatus fromWire(String raw) {
    if (raw == null || raw.isBlank()) return null;
    return switch (raw.trim().toLowerCase(Locale.ROOT)) {
      case "running", "processing", "initializing", "starting", "pending" -> RUNNING;
      case "paused" -> PAUSED;
      case "completed", "done" -> COMPLETED;
      case "error", "failed", "stopped" -> ERROR;
      default -> null;
    };
  }
}
