package com.gentoro.jobwatch.transport;

import com.gentoro.jobwatch.exception.JobWatchErrorCode;

/**
 * Failure of a single request.
 *
 * @param kind what went wrong
 * @param message human-readable detail; for {@link Kind#REJECTED} the backend's own error text
 * @param httpStatus HTTP status code, or 0 when no response was received
 */
public record TransportError(Kind kind, String message, int httpStatus) {

  public enum Kind {
    /** Request not sent or no response: connection refused, timeout, reset. */
    NETWORK,
    /** Non-2xx response. */
    HTTP_STATUS,
    /** Response body does not have the expected shape. */
    MALFORMED,
    /** Well-formed response with {@code success: false}. */
    REJECTED
  }

  public static TransportError network(String message) {
    return new TransportError(Kind.NETWORK, message, 0);
  }

  public static TransportError malformed(String message) {
    return new TransportError(Kind.MALFORMED, message, 0);
  }

  public static TransportError rejected(String message) {
    return new TransportError(Kind.REJECTED, message, 200);
  }

  public JobWatchErrorCode code() {
    return JobWatchErrorCode.TRANSPORT_ERROR;
  }
}
