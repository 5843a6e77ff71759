package com.gentoro.jobwatch.exception;

/** Error taxonomy shared by typed results and exceptions. */
public enum JobWatchErrorCode {
  /** Network or parse failure on a single request. Recovered locally up to a threshold. */
  TRANSPORT_ERROR,
  /** Consecutive transport failures reached the configured threshold. */
  PERSISTENT_ERROR,
  /** The backend reported {@code error} for the operation or for an item. */
  REMOTE_JOB_ERROR,
  /** Wall-clock budget of the operation was exceeded. */
  TIMEOUT,
  /** Another operation of the same class is still in flight. */
  ALREADY_ACTIVE,
  /** The auth backend reported its session store as locked. */
  TRANSIENT_AUTH_ERROR,
  /** A state machine was asked to perform an illegal transition. */
  STATE_ERROR,
  /** Configuration is missing or malformed. */
  CONFIGURATION_ERROR,
  UNKNOWN
}
