package com.gentoro.jobwatch.support;

import com.gentoro.jobwatch.model.Credentials;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import com.gentoro.jobwatch.transport.AuthResponse;
import com.gentoro.jobwatch.transport.StartRequest;
import com.gentoro.jobwatch.transport.Transport;
import com.gentoro.jobwatch.transport.TransportError;
import com.gentoro.jobwatch.transport.TransportResult;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.concurrent.CompletableFuture;

/**
 * {@link Transport} answering from queued results. Futures complete synchronously, except when the
 * relevant queue is empty: the call then stays outstanding in {@link #pending()} until the test
 * completes it.
 */
public class ScriptedTransport implements Transport {

  private final Deque<TransportResult<String>> startResults = new ArrayDeque<>();
  private final Deque<TransportResult<ProgressSnapshot>> progressResults = new ArrayDeque<>();
  private final Deque<TransportResult<Void>> pauseResults = new ArrayDeque<>();
  private final Deque<TransportResult<Void>> resumeResults = new ArrayDeque<>();
  private final Deque<TransportResult<AuthResponse>> authResults = new ArrayDeque<>();
  private final Deque<TransportResult<Void>> cleanupResults = new ArrayDeque<>();
  private final Deque<RuntimeException> pollThrows = new ArrayDeque<>();
  private final Deque<RuntimeException> pauseThrows = new ArrayDeque<>();
  private final Deque<RuntimeException> stopThrows = new ArrayDeque<>();
  private final List<String> calls = new ArrayList<>();
  private final List<StartRequest> startRequests = new ArrayList<>();
  private final Deque<CompletableFuture<?>> pending = new ArrayDeque<>();

  public ScriptedTransport willStart(String operationId) {
    startResults.add(TransportResult.ok(operationId));
    return this;
  }

  public ScriptedTransport willFailStart(TransportError error) {
    startResults.add(TransportResult.failure(error));
    return this;
  }

  public ScriptedTransport willReport(ProgressSnapshot snapshot) {
    progressResults.add(TransportResult.ok(snapshot));
    return this;
  }

  public ScriptedTransport willFailPoll(TransportError error) {
    progressResults.add(TransportResult.failure(error));
    return this;
  }

  public ScriptedTransport willAcknowledgePause() {
    pauseResults.add(TransportResult.ok(null));
    return this;
  }

  public ScriptedTransport willAcknowledgeResume() {
    resumeResults.add(TransportResult.ok(null));
    return this;
  }

  public ScriptedTransport willAnswerAuth(AuthResponse response) {
    authResults.add(TransportResult.ok(response));
    return this;
  }

  public ScriptedTransport willFailAuth(TransportError error) {
    authResults.add(TransportResult.failure(error));
    return this;
  }

  /** The next poll throws {@code failure} instead of returning a future. */
  public ScriptedTransport willThrowOnPoll(RuntimeException failure) {
    pollThrows.add(failure);
    return this;
  }

  public ScriptedTransport willThrowOnPause(RuntimeException failure) {
    pauseThrows.add(failure);
    return this;
  }

  public ScriptedTransport willThrowOnStop(RuntimeException failure) {
    stopThrows.add(failure);
    return this;
  }

  public ScriptedTransport willFailCleanup(TransportError error) {
    cleanupResults.add(TransportResult.failure(error));
    return this;
  }

  public synchronized List<String> calls() {
    return List.copyOf(calls);
  }

  public synchronized long count(String prefix) {
    return calls.stream().filter(c -> c.startsWith(prefix)).count();
  }

  public List<StartRequest> startRequests() {
    return startRequests;
  }

  /** Calls that found no scripted answer, oldest first. */
  public Deque<CompletableFuture<?>> pending() {
    return pending;
  }

  @SuppressWarnings("unchecked")
  public <T> CompletableFuture<TransportResult<T>> takePending() {
    return (CompletableFuture<TransportResult<T>>) (CompletableFuture<?>) pending.removeFirst();
  }

  @Override
  public CompletableFuture<TransportResult<String>> start(
      OperationClass operationClass, StartRequest request) {
    note("start:" + operationClass.wireName());
    startRequests.add(request);
    if (startResults.isEmpty()) {
      return CompletableFuture.completedFuture(TransportResult.ok(request.requestedId()));
    }
    return CompletableFuture.completedFuture(startResults.removeFirst());
  }

  @Override
  public CompletableFuture<TransportResult<ProgressSnapshot>> progress(String operationId) {
    note("progress:" + operationId);
    throwIfScripted(pollThrows);
    return answer(progressResults);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> pause(String operationId) {
    note("pause:" + operationId);
    throwIfScripted(pauseThrows);
    return answer(pauseResults);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> resume(String operationId) {
    note("resume:" + operationId);
    return answer(resumeResults);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> stop(String operationId) {
    note("stop:" + operationId);
    throwIfScripted(stopThrows);
    return CompletableFuture.completedFuture(TransportResult.ok(null));
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> connect(Credentials credentials) {
    note("connect");
    return answer(authResults);
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> verifyCode(String code) {
    note("verify-code:" + code);
    return answer(authResults);
  }

  @Override
  public CompletableFuture<TransportResult<AuthResponse>> verifyPassword(String password) {
    note("verify-password");
    return answer(authResults);
  }

  @Override
  public CompletableFuture<TransportResult<Void>> health() {
    note("health");
    return CompletableFuture.completedFuture(TransportResult.ok(null));
  }

  @Override
  public CompletableFuture<TransportResult<Void>> cleanupSession() {
    note("cleanup-session");
    if (cleanupResults.isEmpty()) {
      return CompletableFuture.completedFuture(TransportResult.ok(null));
    }
    return CompletableFuture.completedFuture(cleanupResults.removeFirst());
  }

  private static void throwIfScripted(Deque<RuntimeException> failures) {
    if (!failures.isEmpty()) {
      throw failures.removeFirst();
    }
  }

  private synchronized void note(String call) {
    calls.add(call);
  }

  private <T> CompletableFuture<TransportResult<T>> answer(Deque<TransportResult<T>> queue) {
    if (queue.isEmpty()) {
      CompletableFuture<TransportResult<T>> future = new CompletableFuture<>();
      pending.add(future);
      return future;
    }
    return CompletableFuture.completedFuture(queue.removeFirst());
  }
}
