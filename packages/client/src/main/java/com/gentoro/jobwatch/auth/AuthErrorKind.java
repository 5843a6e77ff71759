package com.gentoro.jobwatch.auth;

import com.gentoro.jobwatch.exception.JobWatchErrorCode;

/** Why an auth step did not succeed. */
public enum AuthErrorKind {
  /** Rejected locally before any request was sent. */
  INVALID_INPUT(JobWatchErrorCode.UNKNOWN),
  /** The step does not apply to the current phase. */
  ILLEGAL_STATE(JobWatchErrorCode.STATE_ERROR),
  /** Another auth request is still outstanding. */
  BUSY(JobWatchErrorCode.ALREADY_ACTIVE),
  /** The backend answered with an error, e.g. a wrong code. */
  REJECTED(JobWatchErrorCode.REMOTE_JOB_ERROR),
  /** The backend stayed locked after every retry. */
  RESOURCE_LOCKED(JobWatchErrorCode.TRANSIENT_AUTH_ERROR),
  /** The request did not produce a usable answer. */
  TRANSPORT(JobWatchErrorCode.TRANSPORT_ERROR);

  private final JobWatchErrorCode code;

  AuthErrorKind(JobWatchErrorCode code) {
    this.code = code;
  }

  public JobWatchErrorCode code() {
    return code;
  }
}
