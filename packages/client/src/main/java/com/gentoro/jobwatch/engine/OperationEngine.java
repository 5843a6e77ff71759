package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.config.MonitorSettings;
import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.transport.StartRequest;
import com.gentoro.jobwatch.transport.Transport;
import com.gentoro.jobwatch.transport.TransportError;
import com.gentoro.jobwatch.transport.TransportResult;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Function;
import org.slf4j.Logger;

/**
 * Entry point for starting and controlling remote operations.
 *
 * <p>Each {@link OperationClass} runs at most one operation at a time. Starting a class that is
 * already active is rejected locally, without a network call. Progress, pause state and the final
 * outcome are delivered as {@link OperationEvent}s on the scheduler thread.
 */
public class OperationEngine implements AutoCloseable {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(OperationEngine.class);

  private final Transport transport;
  private final TaskScheduler scheduler;
  private final OperationRegistry registry;
  private final Function<OperationClass, MonitorSettings> settings;
  private final ItemStatusReconciler reconciler = new ItemStatusReconciler();
  private final OperationEventBus eventBus = new OperationEventBus();
  private final CompletionFinalizer finalizer;
  private final Map<String, OperationMonitor> monitors = new ConcurrentHashMap<>();

  public OperationEngine(
      Transport transport,
      TaskScheduler scheduler,
      OperationRegistry registry,
      Function<OperationClass, MonitorSettings> settings) {
    this.transport = transport;
    this.scheduler = scheduler;
    this.registry = registry;
    this.settings = settings;
    this.finalizer = new CompletionFinalizer(registry, reconciler, eventBus);
    eventBus.subscribe(OperationEventType.TERMINAL, e -> monitors.remove(e.operationId()));
    eventBus.subscribe(OperationEventType.ABORTED, e -> monitors.remove(e.operationId()));
  }

  /**
   * Start a remote operation over {@code items}. Once the backend accepts, the items are reset to
   * pending and updated in place while the operation runs.
   *
   * @param parameters class-specific request fields, sent as-is
   * @return completes once the backend accepted or refused the request; already completed when the
   *     class is busy
   */
  public CompletableFuture<StartResult> startOperation(
      OperationClass operationClass, List<Item> items, Map<String, Object> parameters) {
    if (!operationClass.isPolled()) {
      throw new IllegalArgumentException(operationClass + " operations cannot be started here");
    }
    if (items == null || items.isEmpty()) {
      throw new IllegalArgumentException("At least one item is required");
    }

    List<Item> snapshot = List.copyOf(items);
    List<String> paths = new ArrayList<>();
    snapshot.forEach(item -> paths.add(item.path()));
    StartRequest request = new StartRequest(requestedId(operationClass), paths, parameters);

    OperationRegistry.AcquireResult acquired = registry.tryAcquire(operationClass);
    if (!acquired.isAcquired()) {
      log.info("{}", acquired.error().message());
      return CompletableFuture.completedFuture(StartResult.alreadyActive(acquired.error()));
    }
    OperationRegistry.OperationHandle handle = acquired.handle();

    log.info(
        "Starting {} operation over {} item(s), requested id {}",
        operationClass.wireName(),
        snapshot.size(),
        request.requestedId());
    CompletableFuture<TransportResult<String>> response;
    try {
      response =
          Objects.requireNonNull(
              transport.start(operationClass, request), "Transport returned no start future");
    } catch (RuntimeException e) {
      registry.release(handle);
      log.warn("Start request for {} could not be sent", operationClass.wireName(), e);
      return CompletableFuture.completedFuture(
          StartResult.failed(
              operationClass,
              TransportError.network(
                  "Start request could not be sent: " + ExceptionUtil.extractErrorMessage(e))));
    }
    CompletableFuture<StartResult> result = new CompletableFuture<>();
    response.whenComplete(
        (value, failure) ->
            scheduler.execute(
                () -> {
                  try {
                    result.complete(onStarted(handle, snapshot, value, failure));
                  } catch (RuntimeException e) {
                    registry.release(handle);
                    result.completeExceptionally(e);
                    throw e;
                  }
                }));
    return result;
  }

  private StartResult onStarted(
      OperationRegistry.OperationHandle handle,
      List<Item> items,
      TransportResult<String> response,
      Throwable failure) {
    OperationClass operationClass = handle.operationClass();
    if (failure != null) {
      response =
          TransportResult.failure(
              TransportError.network(
                  ExceptionUtil.extractErrorMessage(ExceptionUtil.unwrap(failure))));
    }
    if (!response.isSuccess()) {
      registry.release(handle);
      log.warn("Start of {} failed: {}", operationClass.wireName(), response.error().message());
      return StartResult.failed(operationClass, response.error());
    }

    items.forEach(Item::reset);
    Operation operation =
        new Operation(
            response.value(),
            operationClass,
            handle,
            scheduler.nowMillis(),
            settings.apply(operationClass),
            items);
    registry.bind(handle, operation);
    OperationMonitor monitor =
        new OperationMonitor(
            operation, transport, scheduler, reconciler, finalizer, eventBus, registry);
    monitors.put(operation.id(), monitor);
    monitor.start();
    log.info("Started {}", operation);
    return StartResult.started(operationClass, operation.id());
  }

  /** Ask the backend to pause the active operation; {@code false} when not applicable. */
  public CompletableFuture<Boolean> pause(OperationClass operationClass) {
    return monitor(operationClass)
        .map(OperationMonitor::pause)
        .orElseGet(() -> CompletableFuture.completedFuture(false));
  }

  public CompletableFuture<Boolean> resume(OperationClass operationClass) {
    return monitor(operationClass)
        .map(OperationMonitor::resume)
        .orElseGet(() -> CompletableFuture.completedFuture(false));
  }

  /**
   * Stop monitoring the active operation of {@code operationClass} and ask the backend to cancel
   * it. Completes with whether an operation was stopped.
   */
  public CompletableFuture<Boolean> stop(OperationClass operationClass) {
    Optional<OperationMonitor> monitor = monitor(operationClass);
    if (monitor.isEmpty()) {
      return CompletableFuture.completedFuture(false);
    }
    CompletableFuture<Boolean> done = new CompletableFuture<>();
    scheduler.execute(() -> done.complete(stopNow(monitor.get(), "Stopped by request")));
    return done;
  }

  private boolean stopNow(OperationMonitor monitor, String message) {
    if (!monitor.stop(AbortReason.STOPPED, message)) return false;
    String id = monitor.operation().id();
    CompletableFuture<TransportResult<Void>> response;
    try {
      response = Objects.requireNonNull(transport.stop(id), "Transport returned no stop future");
    } catch (RuntimeException e) {
      log.warn("Remote stop of {} could not be sent", id, e);
      return true;
    }
    response.whenComplete(
        (result, failure) -> {
          if (failure != null) {
            log.warn("Remote stop of {} failed", id, failure);
          } else if (!result.isSuccess()) {
            log.warn("Remote stop of {} failed: {}", id, result.error().message());
          }
        });
    return true;
  }

  public OperationEventBus.Subscription subscribe(
      OperationEventType type, OperationListener listener) {
    return eventBus.subscribe(type, listener);
  }

  public OperationEventBus.Subscription subscribe(OperationListener listener) {
    return eventBus.subscribeAll(listener);
  }

  /** State of the active operation of {@code operationClass}, if any. */
  public Optional<OperationView> currentSnapshot(OperationClass operationClass) {
    return registry.active(operationClass).map(op -> OperationView.of(op, scheduler.nowMillis()));
  }

  public OperationRegistry registry() {
    return registry;
  }

  /**
   * Stop every active operation. The stops run on the scheduler thread.
   *
   * @return completes once every stop has run
   */
  public CompletableFuture<Void> stopAll(String message) {
    List<CompletableFuture<Boolean>> stops = new ArrayList<>();
    for (OperationMonitor monitor : List.copyOf(monitors.values())) {
      CompletableFuture<Boolean> done = new CompletableFuture<>();
      scheduler.execute(
          () -> {
            try {
              done.complete(stopNow(monitor, message));
            } catch (RuntimeException e) {
              done.completeExceptionally(e);
              throw e;
            }
          });
      stops.add(done);
    }
    return CompletableFuture.allOf(stops.toArray(new CompletableFuture<?>[0]));
  }

  /** Posts a stop for every active operation; see {@link #stopAll(String)} to wait for them. */
  @Override
  public void close() {
    stopAll("Engine shut down");
  }

  private Optional<OperationMonitor> monitor(OperationClass operationClass) {
    return registry.active(operationClass).map(op -> monitors.get(op.id()));
  }

  private String requestedId(OperationClass operationClass) {
    return operationClass.wireName()
        + "_"
        + scheduler.nowMillis()
        + "_"
        + UUID.randomUUID().toString().substring(0, 8);
  }
}
