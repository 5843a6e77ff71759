package com.gentoro.jobwatch.engine;

/** Local lifecycle state of an {@link Operation}. */
public enum OperationStatus {
  RUNNING,
  PAUSED,
  COMPLETED,
  ERROR,
  TIMED_OUT;

  public boolean isTerminal() {
    return this == COMPLETED || this == ERROR || this == TIMED_OUT;
  }

  /**
   * Legal moves: {@code RUNNING -> PAUSED | COMPLETED | ERROR | TIMED_OUT}, {@code PAUSED ->
   * RUNNING | COMPLETED | ERROR | TIMED_OUT}. Nothing leaves a terminal status.
   */
  public boolean canTransitionTo(OperationStatus next) {
    return switch (this) {
      case RUNNING -> next != RUNNING;
      case PAUSED -> next != PAUSED;
      case COMPLETED, ERROR, TIMED_OUT -> false;
    };
  }
}
