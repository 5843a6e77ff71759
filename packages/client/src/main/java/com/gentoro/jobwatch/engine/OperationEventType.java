package com.gentoro.jobwatch.engine;

/** Kinds of notifications emitted while an operation is monitored. */
public enum OperationEventType {
  /** A non-terminal poll was processed. */
  TICK,
  PAUSED,
  RESUMED,
  /** The backend reported a terminal status; carries the summary. Emitted at most once. */
  TERMINAL,
  /** Monitoring ended without a terminal snapshot; carries the reason. Emitted at most once. */
  ABORTED
}
