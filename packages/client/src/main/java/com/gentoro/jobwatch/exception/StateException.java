package com.gentoro.jobwatch.exception;

/** Illegal state-machine transition or misuse of a lifecycle object. */
public class StateException extends JobWatchException {
  public StateException(String message) {
    super(JobWatchErrorCode.STATE_ERROR, message);
  }

  public StateException(String message, Throwable cause) {
    super(JobWatchErrorCode.STATE_ERROR, message, cause);
  }
}
