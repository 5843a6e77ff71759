package com.gentoro.jobwatch.engine;

import static com.gentoro.jobwatch.support.Snapshots.*;
import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

import com.gentoro.jobwatch.config.MonitorSettings;
import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.ItemStatus;
import com.gentoro.jobwatch.model.OperationClass;
import com.gentoro.jobwatch.support.ManualTaskScheduler;
import com.gentoro.jobwatch.support.ScriptedTransport;
import com.gentoro.jobwatch.transport.StartRequest;
import com.gentoro.jobwatch.transport.Transport;
import com.gentoro.jobwatch.transport.TransportError;
import com.gentoro.jobwatch.transport.TransportResult;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

class OperationEngineTest {

  private final ManualTaskScheduler scheduler = new ManualTaskScheduler();

  private static List<Item> files(String... paths) {
    List<Item> list = new ArrayList<>();
    for (int i = 0; i < paths.length; i++) {
      list.add(Item.pending(i, paths[i]));
    }
    return list;
  }

  private OperationEngine engine(Transport transport) {
    return new OperationEngine(
        transport, scheduler, new OperationRegistry(), MonitorSettings::defaults);
  }

  @Test
  @DisplayName("a second start of a busy class is rejected without a network call")
  void alreadyActiveMakesNoCall() {
    Transport transport = mock(Transport.class);
    when(transport.start(any(), any())).thenReturn(new CompletableFuture<>());
    var engine = engine(transport);

    var first = engine.startOperation(OperationClass.CONVERT, files("a.mp4"), Map.of());
    var second = engine.startOperation(OperationClass.CONVERT, files("b.mp4"), Map.of());

    assertFalse(first.isDone());
    assertTrue(second.isDone());
    assertEquals(StartResult.Outcome.ALREADY_ACTIVE, second.join().outcome());
    assertEquals(OperationClass.CONVERT, second.join().alreadyActive().operationClass());
    verify(transport, times(1)).start(eq(OperationClass.CONVERT), any());
    verifyNoMoreInteractions(transport);
  }

  @Test
  @DisplayName("different classes can run at the same time")
  void classesRunConcurrently() {
    var transport = new ScriptedTransport().willStart("c-1").willStart("p-1");
    var engine = engine(transport);

    var convert = engine.startOperation(OperationClass.CONVERT, files("a.mp4"), Map.of());
    var patch = engine.startOperation(OperationClass.PATCH, files("b.webm"), Map.of());
    scheduler.runUntilIdle();

    assertTrue(convert.join().isStarted());
    assertTrue(patch.join().isStarted());
    assertEquals(2, engine.registry().activeOperations().size());
  }

  @Test
  @DisplayName("a failed start frees the slot and reports the backend error")
  void failedStartReleasesSlot() {
    Transport transport = mock(Transport.class);
    when(transport.start(any(), any()))
        .thenReturn(
            CompletableFuture.completedFuture(
                TransportResult.failure(TransportError.rejected("No files provided"))));
    var engine = engine(transport);

    var result = engine.startOperation(OperationClass.PUBLISH, files("s.webm"), Map.of());
    scheduler.runUntilIdle();

    assertEquals(StartResult.Outcome.START_FAILED, result.join().outcome());
    assertEquals("No files provided", result.join().error().message());
    assertFalse(engine.registry().isHeld(OperationClass.PUBLISH));
    verify(transport, never()).progress(any());
  }

  @Test
  @DisplayName("start sends item paths, parameters and a requested id, and resets items on accept")
  void startRequestContent() {
    Transport transport = mock(Transport.class);
    CompletableFuture<TransportResult<String>> accepted = new CompletableFuture<>();
    when(transport.start(any(), any())).thenReturn(accepted);
    when(transport.progress(any())).thenReturn(new CompletableFuture<>());
    var engine = engine(transport);
    var items = files("one.mp4", "two.mp4");
    items.get(1).update(ItemStatus.ERROR, 30, "old", true);

    var result =
        engine.startOperation(OperationClass.CONVERT, items, Map.of("output_dir", "/out"));

    ArgumentCaptor<StartRequest> captor = ArgumentCaptor.forClass(StartRequest.class);
    verify(transport).start(eq(OperationClass.CONVERT), captor.capture());
    StartRequest request = captor.getValue();
    assertEquals(List.of("one.mp4", "two.mp4"), request.itemPaths());
    assertEquals("/out", request.parameters().get("output_dir"));
    assertTrue(request.requestedId().startsWith("convert_"));
    assertEquals(ItemStatus.ERROR, items.get(1).status());

    accepted.complete(TransportResult.ok("srv-1"));
    scheduler.runUntilIdle();

    assertTrue(result.join().isStarted());
    assertEquals(ItemStatus.PENDING, items.get(1).status());
    assertFalse(items.get(1).isTerminalReached());
  }

  @Test
  @DisplayName("null parameter values are left out of the start request")
  void nullParameterIsDropped() {
    var transport = new ScriptedTransport().willStart("c-3");
    var engine = engine(transport);
    Map<String, Object> parameters = new HashMap<>();
    parameters.put("output_dir", null);
    parameters.put("quality", "high");

    var result = engine.startOperation(OperationClass.CONVERT, files("a.mp4"), parameters);
    scheduler.runUntilIdle();

    assertTrue(result.join().isStarted());
    assertEquals(Map.of("quality", "high"), transport.startRequests().get(0).parameters());
  }

  @Test
  @DisplayName("a start request that cannot be sent frees the slot and leaves items alone")
  void unsendableStartReleasesSlot() {
    Transport transport = mock(Transport.class);
    when(transport.start(any(), any()))
        .thenThrow(new IllegalArgumentException("Cannot serialize parameter"))
        .thenReturn(new CompletableFuture<>());
    var engine = engine(transport);
    var items = files("a.mp4");
    items.get(0).update(ItemStatus.COMPLETED, 100, "done", true);

    var first = engine.startOperation(OperationClass.CONVERT, items, Map.of("x", new Object()));

    assertTrue(first.isDone());
    assertEquals(StartResult.Outcome.START_FAILED, first.join().outcome());
    assertEquals(TransportError.Kind.NETWORK, first.join().error().kind());
    assertFalse(engine.registry().isHeld(OperationClass.CONVERT));
    assertEquals(ItemStatus.COMPLETED, items.get(0).status());

    var second = engine.startOperation(OperationClass.CONVERT, files("b.mp4"), Map.of());
    assertFalse(second.isDone());
    assertTrue(engine.registry().isHeld(OperationClass.CONVERT));
  }

  @Test
  @DisplayName("currentSnapshot exposes the active operation")
  void currentSnapshot() {
    var transport =
        new ScriptedTransport().willStart("c-9").willReport(running(items(0, processing(25))));
    var engine = engine(transport);
    engine.startOperation(OperationClass.CONVERT, files("a.mp4"), Map.of());
    scheduler.runUntilIdle();

    scheduler.advanceBy(MonitorSettings.defaults(OperationClass.CONVERT).pollIntervalMs());

    OperationView view = engine.currentSnapshot(OperationClass.CONVERT).orElseThrow();
    assertEquals("c-9", view.operationId());
    assertEquals(OperationStatus.RUNNING, view.status());
    assertEquals(25, view.items().get(0).progress());
    assertEquals(1, view.pollCount());
    assertNotNull(view.lastSnapshot());
    assertTrue(engine.currentSnapshot(OperationClass.PATCH).isEmpty());
  }

  @Test
  @DisplayName("a failing listener does not stop delivery to others")
  void failingListenerIsIsolated() {
    var transport = new ScriptedTransport().willStart("p-2").willReport(completed(items()));
    var engine = engine(transport);
    List<OperationEvent> received = new ArrayList<>();
    engine.subscribe(
        OperationEventType.TERMINAL,
        e -> {
          throw new IllegalStateException("boom");
        });
    engine.subscribe(OperationEventType.TERMINAL, received::add);

    engine.startOperation(OperationClass.PATCH, files("x.webm"), Map.of());
    scheduler.runUntilIdle();

    assertEquals(1, received.size());
    assertEquals(1, received.get(0).summary().successCount());
  }

  @Test
  @DisplayName("unsubscribed listeners receive nothing")
  void unsubscribe() {
    var transport = new ScriptedTransport().willStart("p-3").willReport(completed(items()));
    var engine = engine(transport);
    List<OperationEvent> received = new ArrayList<>();
    var subscription = engine.subscribe(received::add);
    subscription.unsubscribe();

    engine.startOperation(OperationClass.PATCH, files("x.webm"), Map.of());
    scheduler.runUntilIdle();

    assertTrue(received.isEmpty());
  }

  @Test
  @DisplayName("closing the engine stops active operations on the scheduler thread")
  void closeStopsActive() {
    var transport = new ScriptedTransport().willStart("c-10");
    var engine = engine(transport);
    engine.startOperation(OperationClass.CONVERT, files("a.mp4"), Map.of());
    scheduler.runUntilIdle();

    engine.close();
    assertTrue(engine.registry().isHeld(OperationClass.CONVERT));
    assertFalse(transport.calls().contains("stop:c-10"));

    scheduler.runUntilIdle();

    assertTrue(transport.calls().contains("stop:c-10"));
    assertFalse(engine.registry().isHeld(OperationClass.CONVERT));
  }

  @Test
  @DisplayName("stopAll completes once every stop has run on the scheduler")
  void stopAllCompletesAfterLoopRuns() {
    var transport = new ScriptedTransport().willStart("c-11").willStart("p-11");
    var engine = engine(transport);
    engine.startOperation(OperationClass.CONVERT, files("a.mp4"), Map.of());
    engine.startOperation(OperationClass.PATCH, files("b.webm"), Map.of());
    scheduler.runUntilIdle();

    var stopped = engine.stopAll("Shutting down");
    assertFalse(stopped.isDone());

    scheduler.runUntilIdle();

    assertTrue(stopped.isDone());
    assertTrue(engine.registry().activeOperations().isEmpty());
    assertEquals(2, transport.count("stop:"));
  }

  @Test
  @DisplayName("auth cannot be started as a polled operation")
  void rejectsAuthClass() {
    var engine = engine(new ScriptedTransport());
    assertThrows(
        IllegalArgumentException.class,
        () -> engine.startOperation(OperationClass.AUTH, files("x"), Map.of()));
    assertThrows(
        IllegalArgumentException.class,
        () -> engine.startOperation(OperationClass.CONVERT, List.of(), Map.of()));
  }
}
