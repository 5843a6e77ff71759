package com.gentoro.jobwatch.transport;

import com.gentoro.jobwatch.model.Credentials;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import java.util.concurrent.CompletableFuture;

/**
 * Request/response contract with the worker process. Implementations never complete a future
 * exceptionally for expected failures; they return a failed {@link TransportResult} instead.
 */
public interface Transport {

  /** Start a remote job; the value is the opaque operation id. */
  CompletableFuture<TransportResult<String>> start(
      OperationClass operationClass, StartRequest request);

  CompletableFuture<TransportResult<ProgressSnapshot>> progress(String operationId);

  CompletableFuture<TransportResult<Void>> pause(String operationId);

  CompletableFuture<TransportResult<Void>> resume(String operationId);

  /** Hard-stop a remote job. */
  CompletableFuture<TransportResult<Void>> stop(String operationId);

  CompletableFuture<TransportResult<AuthResponse>> connect(Credentials credentials);

  CompletableFuture<TransportResult<AuthResponse>> verifyCode(String code);

  CompletableFuture<TransportResult<AuthResponse>> verifyPassword(String password);

  /** Log the backend out of the remote account and drop its stored session. */
  CompletableFuture<TransportResult<Void>> cleanupSession();

  CompletableFuture<TransportResult<Void>> health();
}
