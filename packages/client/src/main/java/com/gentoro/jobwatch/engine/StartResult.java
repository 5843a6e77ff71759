package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.transport.TransportError;

/**
 * Outcome of {@link OperationEngine#startOperation}.
 *
 * @param operationId backend id, set when {@code outcome} is {@link Outcome#STARTED}
 * @param alreadyActive set when {@code outcome} is {@link Outcome#ALREADY_ACTIVE}
 * @param error set when {@code outcome} is {@link Outcome#START_FAILED}
 */
public record StartResult(
    Outcome outcome,
    OperationClass operationClass,
    String operationId,
    OperationRegistry.AlreadyActiveError alreadyActive,
    TransportError error) {

  public enum Outcome {
    STARTED,
    /** Rejected locally; no request was sent. */
    ALREADY_ACTIVE,
    START_FAILED
  }

  static StartResult started(OperationClass operationClass, String operationId) {
    return new StartResult(Outcome.STARTED, operationClass, operationId, null, null);
  }

  static StartResult alreadyActive(OperationRegistry.AlreadyActiveError error) {
    return new StartResult(Outcome.ALREADY_ACTIVE, error.operationClass(), null, error, null);
  }

  static StartResult failed(OperationClass operationClass, TransportError error) {
    return new StartResult(Outcome.START_FAILED, operationClass, null, null, error);
  }

  public boolean isStarted() {
    return outcome == Outcome.STARTED;
  }

  public String message() {
    return switch (outcome) {
      case STARTED -> "Started " + operationClass.wireName() + " operation " + operationId;
      case ALREADY_ACTIVE -> alreadyActive.message();
      case START_FAILED -> "Could not start " + operationClass.wireName() + ": " + error.message();
    };
  }
}
