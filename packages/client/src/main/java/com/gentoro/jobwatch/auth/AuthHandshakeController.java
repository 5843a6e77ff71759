package com.gentoro.jobwatch.auth;

import com.gentoro.jobwatch.config.AuthSettings;
import com.gentoro.jobwatch.engine.OperationRegistry;
import com.gentoro.jobwatch.engine.TaskScheduler;
import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.model.Credentials;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.transport.AuthResponse;
import com.gentoro.jobwatch.transport.Transport;
import com.gentoro.jobwatch.transport.TransportError;
import com.gentoro.jobwatch.transport.TransportResult;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Supplier;
import org.slf4j.Logger;

/**
 * Drives the multi-step login: credentials, then an optional verification code, then an optional
 * password.
 *
 * <p>While a request is outstanding the controller holds the {@link OperationClass#AUTH} registry
 * slot, so concurrent submissions are answered with {@link AuthErrorKind#BUSY}. A connect attempt
 * that fails because the backend's session store is locked is retried with a linear backoff.
 */
public class AuthHandshakeController {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(AuthHandshakeController.class);

  static final String RESOURCE_LOCKED_MARKER = "database is locked";

  private final Transport transport;
  private final TaskScheduler scheduler;
  private final OperationRegistry registry;
  private final AuthSettings settings;
  private final List<AuthPhaseListener> listeners = new CopyOnWriteArrayList<>();

  private AuthPhase phase = AuthPhase.DISCONNECTED;
  private int retryCount;
  /** Incremented by {@link #disconnect()}; answers from an older session are dropped. */
  private long session;

  public AuthHandshakeController(
      Transport transport,
      TaskScheduler scheduler,
      OperationRegistry registry,
      AuthSettings settings) {
    this.transport = transport;
    this.scheduler = scheduler;
    this.registry = registry;
    this.settings = settings;
  }

  public synchronized AuthPhase phase() {
    return phase;
  }

  /** Resource-locked retries used by the current connect attempt. */
  public synchronized int retryCount() {
    return retryCount;
  }

  public void addListener(AuthPhaseListener listener) {
    listeners.add(listener);
  }

  public void removeListener(AuthPhaseListener listener) {
    listeners.remove(listener);
  }

  /** Begin the handshake. Only valid while {@link AuthPhase#DISCONNECTED}. */
  public CompletableFuture<AuthOutcome> submit(Credentials credentials) {
    if (credentials == null || !credentials.isComplete()) {
      return rejectInput("API id, API hash and phone number are required");
    }
    OperationRegistry.OperationHandle handle;
    long current;
    synchronized (this) {
      if (phase != AuthPhase.DISCONNECTED) {
        return illegalState("connect");
      }
      handle = acquire();
      if (handle == null) return busy();
      retryCount = 0;
      current = session;
      setPhase(AuthPhase.CONNECTING);
    }
    log.info("Connecting as {}", credentials);
    CompletableFuture<AuthOutcome> done = new CompletableFuture<>();
    attemptConnect(new ConnectAttempt(credentials, handle, current, done));
    return done;
  }

  /** Send the verification code. Only valid while {@link AuthPhase#AWAITING_CODE}. */
  public CompletableFuture<AuthOutcome> submitCode(String code) {
    if (code == null || !settings.codePattern().matcher(code.trim()).matches()) {
      return rejectInput("The verification code must match " + settings.codePattern().pattern());
    }
    return verify(AuthPhase.AWAITING_CODE, "code", () -> transport.verifyCode(code.trim()));
  }

  /** Send the two-factor password. Only valid while {@link AuthPhase#AWAITING_PASSWORD}. */
  public CompletableFuture<AuthOutcome> submitPassword(String password) {
    if (password == null || password.isBlank()) {
      return rejectInput("The password is required");
    }
    return verify(AuthPhase.AWAITING_PASSWORD, "password", () -> transport.verifyPassword(password));
  }

  /**
   * Reset the session locally, free the auth slot and ask the backend to drop its session. The
   * local reset always happens; a failed cleanup is only logged. Answers to requests still
   * outstanding are ignored.
   *
   * @return completes with whether the backend confirmed the cleanup; already {@code false} when
   *     there was no session
   */
  public CompletableFuture<Boolean> disconnect() {
    synchronized (this) {
      session++;
      retryCount = 0;
      registry.release(OperationClass.AUTH);
      if (phase == AuthPhase.DISCONNECTED) {
        return CompletableFuture.completedFuture(false);
      }
      log.info("Auth session reset from {}", phase);
      setPhase(AuthPhase.DISCONNECTED);
    }
    CompletableFuture<TransportResult<Void>> response;
    try {
      response =
          Objects.requireNonNull(
              transport.cleanupSession(), "Transport returned no cleanup future");
    } catch (RuntimeException e) {
      log.warn("Session cleanup could not be sent", e);
      return CompletableFuture.completedFuture(false);
    }
    return response.handle(
        (result, failure) -> {
          if (failure != null) {
            log.warn("Session cleanup failed", failure);
            return false;
          }
          if (!result.isSuccess()) {
            log.warn("Session cleanup failed: {}", result.error().message());
            return false;
          }
          return true;
        });
  }

  // --------------------------------------------------------------------
  // connect with retries
  // --------------------------------------------------------------------

  private record ConnectAttempt(
      Credentials credentials,
      OperationRegistry.OperationHandle handle,
      long session,
      CompletableFuture<AuthOutcome> done) {}

  private void attemptConnect(ConnectAttempt attempt) {
    synchronized (this) {
      if (attempt.session() != session) {
        registry.release(attempt.handle());
        attempt.done().complete(
            AuthOutcome.failed(phase, AuthErrorKind.ILLEGAL_STATE, "Session was reset"));
        return;
      }
    }
    transport
        .connect(attempt.credentials())
        .whenComplete(
            (result, failure) ->
                scheduler.execute(() -> onConnectResult(attempt, normalize(result, failure))));
  }

  private synchronized void onConnectResult(
      ConnectAttempt attempt, TransportResult<AuthResponse> result) {
    CompletableFuture<AuthOutcome> done = attempt.done();
    if (attempt.session() != session || phase != AuthPhase.CONNECTING) {
      registry.release(attempt.handle());
      done.complete(AuthOutcome.failed(phase, AuthErrorKind.ILLEGAL_STATE, "Session was reset"));
      return;
    }
    if (result.isSuccess()) {
      registry.release(attempt.handle());
      AuthPhase next = nextPhase(result.value());
      setPhase(next);
      log.info("Connect answered, now {}", next);
      done.complete(AuthOutcome.ok(next));
      return;
    }
    TransportError error = result.error();
    if (isResourceLocked(error)) {
      if (retryCount < settings.maxRetries()) {
        retryCount++;
        long delay = retryCount * settings.backoffStepMs();
        log.info(
            "Backend session store locked, retry {}/{} in {} ms",
            retryCount,
            settings.maxRetries(),
            delay);
        scheduler.schedule(() -> attemptConnect(attempt), delay);
        return;
      }
      registry.release(attempt.handle());
      setPhase(AuthPhase.DISCONNECTED);
      log.warn("Backend session store still locked after {} retries", retryCount);
      done.complete(
          AuthOutcome.failed(
              AuthPhase.DISCONNECTED,
              AuthErrorKind.RESOURCE_LOCKED,
              "Backend is busy, try again later: " + error.message()));
      return;
    }
    registry.release(attempt.handle());
    setPhase(AuthPhase.DISCONNECTED);
    log.warn("Connect failed: {}", error.message());
    done.complete(AuthOutcome.failed(AuthPhase.DISCONNECTED, kindOf(error), error.message()));
  }

  // --------------------------------------------------------------------
  // code / password
  // --------------------------------------------------------------------

  private CompletableFuture<AuthOutcome> verify(
      AuthPhase required,
      String step,
      Supplier<CompletableFuture<TransportResult<AuthResponse>>> request) {
    OperationRegistry.OperationHandle handle;
    long current;
    synchronized (this) {
      if (phase != required) {
        return illegalState(step);
      }
      handle = acquire();
      if (handle == null) return busy();
      current = session;
    }
    CompletableFuture<AuthOutcome> done = new CompletableFuture<>();
    request
        .get()
        .whenComplete(
            (result, failure) ->
                scheduler.execute(
                    () -> {
                      TransportResult<AuthResponse> normalized = normalize(result, failure);
                      done.complete(onVerifyResult(required, step, handle, current, normalized));
                    }));
    return done;
  }

  private synchronized AuthOutcome onVerifyResult(
      AuthPhase required,
      String step,
      OperationRegistry.OperationHandle handle,
      long requestSession,
      TransportResult<AuthResponse> result) {
    registry.release(handle);
    if (requestSession != session || phase != required) {
      return AuthOutcome.failed(phase, AuthErrorKind.ILLEGAL_STATE, "Session was reset");
    }
    if (!result.isSuccess()) {
      log.warn("Verification of {} failed: {}", step, result.error().message());
      return AuthOutcome.failed(phase, kindOf(result.error()), result.error().message());
    }
    AuthResponse response = result.value();
    AuthPhase next =
        required == AuthPhase.AWAITING_CODE && response.needsPassword()
            ? AuthPhase.AWAITING_PASSWORD
            : AuthPhase.CONNECTED;
    setPhase(next);
    log.info("Verification of {} accepted, now {}", step, next);
    return AuthOutcome.ok(next);
  }

  // --------------------------------------------------------------------
  // helpers
  // --------------------------------------------------------------------

  private OperationRegistry.OperationHandle acquire() {
    OperationRegistry.AcquireResult acquired = registry.tryAcquire(OperationClass.AUTH);
    return acquired.isAcquired() ? acquired.handle() : null;
  }

  private static AuthPhase nextPhase(AuthResponse response) {
    if (response.needsCode()) return AuthPhase.AWAITING_CODE;
    if (response.needsPassword()) return AuthPhase.AWAITING_PASSWORD;
    return AuthPhase.CONNECTED;
  }

  static boolean isResourceLocked(TransportError error) {
    return error.message() != null
        && error.message().toLowerCase(Locale.ROOT).contains(RESOURCE_LOCKED_MARKER);
  }

  private static AuthErrorKind kindOf(TransportError error) {
    return switch (error.kind()) {
      case REJECTED, HTTP_STATUS -> AuthErrorKind.REJECTED;
      case NETWORK, MALFORMED -> AuthErrorKind.TRANSPORT;
    };
  }

  private static <T> TransportResult<T> normalize(TransportResult<T> result, Throwable failure) {
    if (failure == null) return result;
    return TransportResult.failure(
        TransportError.network(ExceptionUtil.extractErrorMessage(ExceptionUtil.unwrap(failure))));
  }

  private void setPhase(AuthPhase next) {
    AuthPhase previous = phase;
    phase = next;
    if (previous == next) return;
    for (AuthPhaseListener listener : listeners) {
      try {
        listener.onPhaseChange(previous, next);
      } catch (RuntimeException e) {
        log.warn("Auth phase listener failed on {} -> {}", previous, next, e);
      }
    }
  }

  private CompletableFuture<AuthOutcome> rejectInput(String message) {
    return CompletableFuture.completedFuture(
        AuthOutcome.failed(phase(), AuthErrorKind.INVALID_INPUT, message));
  }

  private CompletableFuture<AuthOutcome> illegalState(String step) {
    return CompletableFuture.completedFuture(
        AuthOutcome.failed(phase, AuthErrorKind.ILLEGAL_STATE, "Cannot " + step + " while " + phase));
  }

  private CompletableFuture<AuthOutcome> busy() {
    return CompletableFuture.completedFuture(
        AuthOutcome.failed(phase, AuthErrorKind.BUSY, "Another auth request is in progress"));
  }
}
