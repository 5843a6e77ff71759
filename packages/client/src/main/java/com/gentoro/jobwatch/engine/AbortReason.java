package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.exception.JobWatchErrorCode;

/** Why an operation ended without a terminal snapshot. */
public enum AbortReason {
  PERSISTENT_ERROR("persistent-error", OperationStatus.ERROR, JobWatchErrorCode.PERSISTENT_ERROR),
  TIMEOUT("timeout", OperationStatus.TIMED_OUT, JobWatchErrorCode.TIMEOUT),
  /** Stopped on request of the caller. */
  STOPPED("stopped", OperationStatus.ERROR, null);

  private final String wireName;
  private final OperationStatus resultingStatus;
  private final JobWatchErrorCode errorCode;

  AbortReason(String wireName, OperationStatus resultingStatus, JobWatchErrorCode errorCode) {
    this.wireName = wireName;
    this.resultingStatus = resultingStatus;
    this.errorCode = errorCode;
  }

  public String wireName() {
    return wireName;
  }

  public OperationStatus resultingStatus() {
    return resultingStatus;
  }

  /** Error code surfaced for this reason, {@code null} for a caller-requested stop. */
  public JobWatchErrorCode errorCode() {
    return errorCode;
  }
}
