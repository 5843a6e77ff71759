package com.gentoro.jobwatch.engine;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import org.slf4j.Logger;

/** Fan-out of {@link OperationEvent}s to subscribers, in subscription order. */
public class OperationEventBus {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(OperationEventBus.class);

  private final Map<OperationEventType, List<OperationListener>> listeners =
      new EnumMap<>(OperationEventType.class);

  /** Handle returned by {@code subscribe}; unsubscribing twice is harmless. */
  @FunctionalInterface
  public interface Subscription extends AutoCloseable {
    void unsubscribe();

    @Override
    default void close() {
      unsubscribe();
    }
  }

  public OperationEventBus() {
    for (OperationEventType type : OperationEventType.values()) {
      listeners.put(type, new CopyOnWriteArrayList<>());
    }
  }

  public Subscription subscribe(OperationEventType type, OperationListener listener) {
    List<OperationListener> list = listeners.get(type);
    list.add(listener);
    return () -> list.remove(listener);
  }

  /** Subscribe to every event type. */
  public Subscription subscribeAll(OperationListener listener) {
    for (List<OperationListener> list : listeners.values()) {
      list.add(listener);
    }
    return () -> listeners.values().forEach(list -> list.remove(listener));
  }

  /** Deliver {@code event}. A failing listener is logged and does not stop delivery. */
  public void publish(OperationEvent event) {
    for (OperationListener listener : listeners.get(event.type())) {
      try {
        listener.onEvent(event);
      } catch (RuntimeException e) {
        log.warn(
            "Listener failed on {} event of operation {}", event.type(), event.operationId(), e);
      }
    }
  }
}
