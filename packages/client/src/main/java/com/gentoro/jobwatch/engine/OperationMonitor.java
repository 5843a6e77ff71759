package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import com.gentoro.jobwatch.transport.Transport;
import com.gentoro.jobwatch.transport.TransportError;
import com.gentoro.jobwatch.transport.TransportResult;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Polls one {@link Operation} until it is finalized.
 *
 * <p>Every tick runs on the {@link TaskScheduler}: check the time budget, request progress, and
 * only when the response has been fully processed arm the next tick. Responses arriving after the
 * operation was stopped or unregistered are dropped.
 */
final class OperationMonitor {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(OperationMonitor.class);

  private final Operation operation;
  private final Transport transport;
  private final TaskScheduler scheduler;
  private final ItemStatusReconciler reconciler;
  private final CompletionFinalizer finalizer;
  private final OperationEventBus eventBus;
  private final OperationRegistry registry;

  OperationMonitor(
      Operation operation,
      Transport transport,
      TaskScheduler scheduler,
      ItemStatusReconciler reconciler,
      CompletionFinalizer finalizer,
      OperationEventBus eventBus,
      OperationRegistry registry) {
    this.operation = operation;
    this.transport = transport;
    this.scheduler = scheduler;
    this.reconciler = reconciler;
    this.finalizer = finalizer;
    this.eventBus = eventBus;
    this.registry = registry;
  }

  Operation operation() {
    return operation;
  }

  void start() {
    long delay = operation.settings().immediateFirstPoll() ? 0 : interval();
    log.debug("Monitoring {} every {} ms (first poll in {} ms)", operation, interval(), delay);
    arm(delay);
  }

  /** Abort monitoring. Idempotent; returns whether this call ended the operation. */
  boolean stop(AbortReason reason, String message) {
    return finalizer.abort(operation, reason, message);
  }

  CompletableFuture<Boolean> pause() {
    return control(
        OperationStatus.RUNNING, OperationStatus.PAUSED, transport::pause, OperationEvent::paused);
  }

  CompletableFuture<Boolean> resume() {
    return control(
        OperationStatus.PAUSED, OperationStatus.RUNNING, transport::resume, OperationEvent::resumed);
  }

  // --------------------------------------------------------------------
  // polling
  // --------------------------------------------------------------------

  private long interval() {
    return operation.settings().pollIntervalMs();
  }

  private void arm(long delayMs) {
    if (!isLive()) return;
    operation.pollHandle().arm(scheduler.schedule(this::tick, delayMs));
  }

  private boolean isLive() {
    return operation.isActive()
        && !operation.isFinalized()
        && !operation.pollHandle().isCancelled()
        && registry.isRegistered(operation.id());
  }

  private void tick() {
    operation.pollHandle().fired();
    if (!isLive()) return;

    long elapsed = operation.elapsedMillis(scheduler.nowMillis());
    if (elapsed > operation.settings().maxDurationMs()) {
      finalizer.abort(
          operation,
          AbortReason.TIMEOUT,
          "No terminal status after " + elapsed + " ms (limit "
              + operation.settings().maxDurationMs() + " ms)");
      return;
    }

    operation.pollDispatched();
    long version = operation.pauseStateVersion();
    CompletableFuture<TransportResult<ProgressSnapshot>> response;
    try {
      response =
          Objects.requireNonNull(
              transport.progress(operation.id()), "Transport returned no progress future");
    } catch (RuntimeException e) {
      onPollResult(null, e, version);
      return;
    }
    response.whenComplete(
        (result, failure) -> scheduler.execute(() -> onPollResult(result, failure, version)));
  }

  private void onPollResult(
      TransportResult<ProgressSnapshot> result, Throwable failure, long dispatchVersion) {
    if (!isLive()) {
      log.debug("Discarding poll result for {}", operation);
      return;
    }
    if (failure != null) {
      result =
          TransportResult.failure(
              TransportError.network(
                  ExceptionUtil.extractErrorMessage(ExceptionUtil.unwrap(failure))));
    }

    if (!result.isSuccess()) {
      int errors = operation.recordPollFailure();
      int max = operation.settings().maxConsecutiveErrors();
      log.debug(
          "Poll {}/{} of {} failed: {} {}",
          errors,
          max,
          operation.id(),
          result.error().kind(),
          result.error().message());
      if (errors >= max) {
        finalizer.abort(
            operation,
            AbortReason.PERSISTENT_ERROR,
            errors + " consecutive poll failures, last: " + result.error().message());
        return;
      }
      arm(interval());
      return;
    }

    ProgressSnapshot snapshot = result.value();
    operation.recordPollSuccess(snapshot);
    if (snapshot.isTerminal()) {
      finalizer.finalize(operation, snapshot);
      return;
    }

    ItemStatusReconciler.ReconcileOutcome outcome =
        reconciler.reconcile(operation.items(), snapshot.itemStatuses());
    syncPauseState(snapshot, dispatchVersion);
    eventBus.publish(OperationEvent.tick(operation, snapshot, outcome.changed()));
    arm(interval());
  }

  /**
   * Follow a pause state changed elsewhere. Skipped while a local request is outstanding or when
   * the local state changed after this poll was sent.
   */
  private void syncPauseState(ProgressSnapshot snapshot, long dispatchVersion) {
    if (operation.isControlRequestInFlight()
        || operation.pauseStateVersion() != dispatchVersion) {
      return;
    }
    if (snapshot.paused()
        && operation.changePauseState(OperationStatus.RUNNING, OperationStatus.PAUSED)) {
      log.info("Operation {} reported paused by backend", operation.id());
      eventBus.publish(OperationEvent.paused(operation));
    } else if (!snapshot.paused()
        && operation.changePauseState(OperationStatus.PAUSED, OperationStatus.RUNNING)) {
      log.info("Operation {} reported resumed by backend", operation.id());
      eventBus.publish(OperationEvent.resumed(operation));
    }
  }

  // --------------------------------------------------------------------
  // pause / resume
  // --------------------------------------------------------------------

  private CompletableFuture<Boolean> control(
      OperationStatus from,
      OperationStatus to,
      Function<String, CompletableFuture<TransportResult<Void>>> request,
      Function<Operation, OperationEvent> event) {
    String verb = to == OperationStatus.PAUSED ? "pause" : "resume";
    if (!isLive() || !operation.beginControlRequest(from)) {
      log.debug("Ignoring {} request for {}", verb, operation);
      return CompletableFuture.completedFuture(false);
    }
    CompletableFuture<TransportResult<Void>> response;
    try {
      response =
          Objects.requireNonNull(
              request.apply(operation.id()), "Transport returned no " + verb + " future");
    } catch (RuntimeException e) {
      operation.endControlRequest();
      log.warn("The {} request for {} could not be sent", verb, operation.id(), e);
      return CompletableFuture.completedFuture(false);
    }
    CompletableFuture<Boolean> done = new CompletableFuture<>();
    response.whenComplete(
        (result, failure) ->
            scheduler.execute(
                () -> done.complete(onControlResult(from, to, verb, event, result, failure))));
    return done;
  }

  private boolean onControlResult(
      OperationStatus from,
      OperationStatus to,
      String verb,
      Function<Operation, OperationEvent> event,
      TransportResult<Void> result,
      Throwable failure) {
    operation.endControlRequest();
    if (failure != null || !result.isSuccess()) {
      log.warn(
          "The {} request for {} failed: {}",
          verb,
          operation.id(),
          failure != null ? ExceptionUtil.extractErrorMessage(failure) : result.error().message());
      return false;
    }
    if (!isLive() || !operation.changePauseState(from, to)) {
      return false;
    }
    log.info("Operation {} {}d", operation.id(), verb);
    eventBus.publish(event.apply(operation));
    return true;
  }
}
