package com.gentoro.jobwatch.transport;

import java.util.Objects;

/** Tagged result of a transport call: a value on success, a {@link TransportError} otherwise. */
public record TransportResult<T>(T value, TransportError error) {

  public static <T> TransportResult<T> ok(T value) {
    return new TransportResult<>(value, null);
  }

  public static <T> TransportResult<T> failure(TransportError error) {
    return new TransportResult<>(null, Objects.requireNonNull(error, "error"));
  }

  public boolean isSuccess() {
    return error == null;
  }

  /** Re-type a failure; only valid when {@link #isSuccess()} is false. */
  public <R> TransportResult<R> asFailure() {
    if (isSuccess()) {
      throw new IllegalStateException("Result is not a failure");
    }
    return failure(error);
  }
}
