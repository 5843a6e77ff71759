package com.gentoro.jobwatch.engine;

import com.gentoro.jobwatch.exception.JobWatchErrorCode;
import com.gentoro.jobwatch.exception.StateException;
import com.gentoro.jobwatch.model.OperationClass;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import org.slf4j.Logger;

/**
 * Process-wide gate allowing at most one active operation per {@link OperationClass}. Different
 * classes never block each other.
 *
 * <p>A slot is acquired before any network call, bound to the {@link Operation} once the backend
 * returned its id, and released on finalization or start failure.
 */
public final class OperationRegistry {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(OperationRegistry.class);

  private final Map<OperationClass, Slot> slots = new EnumMap<>(OperationClass.class);
  private final Map<String, Operation> byId = new HashMap<>();
  private final AtomicLong tokens = new AtomicLong();

  /** Ownership token of an acquired slot. */
  public record OperationHandle(OperationClass operationClass, long token, long acquiredAt) {}

  /** Returned when the class already has an active operation. */
  public record AlreadyActiveError(OperationClass operationClass, String activeOperationId) {
    public JobWatchErrorCode code() {
      return JobWatchErrorCode.ALREADY_ACTIVE;
    }

    public String message() {
      return activeOperationId == null
          ? "A " + operationClass.wireName() + " operation is already starting"
          : "A " + operationClass.wireName() + " operation is already active: " + activeOperationId;
    }
  }

  /** Exactly one of {@code handle} and {@code error} is set. */
  public record AcquireResult(OperationHandle handle, AlreadyActiveError error) {
    public boolean isAcquired() {
      return handle != null;
    }
  }

  private static final class Slot {
    private final OperationHandle handle;
    private Operation operation;

    private Slot(OperationHandle handle) {
      this.handle = handle;
    }
  }

  public synchronized AcquireResult tryAcquire(OperationClass operationClass) {
    Slot current = slots.get(operationClass);
    if (current != null) {
      String activeId = current.operation == null ? null : current.operation.id();
      log.debug("Rejecting {} acquire, slot held by {}", operationClass.wireName(), activeId);
      return new AcquireResult(null, new AlreadyActiveError(operationClass, activeId));
    }
    OperationHandle handle =
        new OperationHandle(operationClass, tokens.incrementAndGet(), System.currentTimeMillis());
    slots.put(operationClass, new Slot(handle));
    return new AcquireResult(handle, null);
  }

  /**
   * Record the operation started under {@code handle}.
   *
   * @throws StateException when the handle no longer owns its slot
   */
  public synchronized void bind(OperationHandle handle, Operation operation) {
    Slot slot = slots.get(handle.operationClass());
    if (slot == null || !slot.handle.equals(handle)) {
      throw new StateException("Handle " + handle + " does not own the slot");
    }
    slot.operation = operation;
    byId.put(operation.id(), operation);
  }

  /** Free the class slot. Idempotent; returns whether a slot was held. */
  public synchronized boolean release(OperationClass operationClass) {
    Slot slot = slots.remove(operationClass);
    if (slot == null) return false;
    if (slot.operation != null) {
      byId.remove(slot.operation.id());
    }
    return true;
  }

  /** Free the slot only if {@code handle} still owns it. */
  public synchronized boolean release(OperationHandle handle) {
    Slot slot = slots.get(handle.operationClass());
    if (slot == null || !slot.handle.equals(handle)) return false;
    return release(handle.operationClass());
  }

  public synchronized Optional<Operation> find(String operationId) {
    return Optional.ofNullable(byId.get(operationId));
  }

  public synchronized Optional<Operation> active(OperationClass operationClass) {
    Slot slot = slots.get(operationClass);
    return slot == null ? Optional.empty() : Optional.ofNullable(slot.operation);
  }

  /** Whether the class slot is held, including while a start request is still outstanding. */
  public synchronized boolean isHeld(OperationClass operationClass) {
    return slots.containsKey(operationClass);
  }

  public synchronized boolean isRegistered(String operationId) {
    return byId.containsKey(operationId);
  }

  public synchronized List<Operation> activeOperations() {
    return new ArrayList<>(byId.values());
  }
}
