package com.gentoro.jobwatch;

import com.gentoro.jobwatch.config.StartupParameters;
import com.gentoro.jobwatch.engine.OperationEvent;
import com.gentoro.jobwatch.engine.OperationEventType;
import com.gentoro.jobwatch.engine.StartResult;
import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.model.Item;
import com.gentoro.jobwatch.model.OperationClass;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Command line runner: starts one operation over the given files and waits for its outcome.
 *
 * <pre>
 * jobwatch --class=convert|patch|publish [--config=app.yaml] [--output=dir]
 *          [--pack-name=name] [--sticker-type=video|image] file...
 * </pre>
 *
 * Exit codes: 0 all items succeeded, 1 could not start, 2 finished with failures, 3 aborted.
 */
public class JobWatchApp {

  private static final org.slf4j.Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(JobWatchApp.class);

  static final int EXIT_OK = 0;
  static final int EXIT_NOT_STARTED = 1;
  static final int EXIT_PARTIAL = 2;
  static final int EXIT_ABORTED = 3;

  public static void main(String[] args) {
    JobWatch app = new JobWatch(args);
    Runtime.getRuntime().addShutdownHook(new Thread(app::shutdown, "jobwatch-shutdown-hook"));
    int exitCode;
    try {
      app.initialize();
      exitCode = run(app);
    } catch (Exception e) {
      log.error("Application failed: {}", ExceptionUtil.toErrorDetails(e));
      log.debug("Failure trace: {}", ExceptionUtil.formatCompactStackTrace(e));
      exitCode = EXIT_NOT_STARTED;
    } finally {
      app.shutdown();
    }
    System.exit(exitCode);
  }

  static int run(JobWatch app) throws InterruptedException {
    StartupParameters parameters = app.startupParameters();
    OperationClass operationClass =
        OperationClass.fromString(parameters.getParameter("class", String.class, "convert"));
    List<String> files = parameters.positional();
    if (files.isEmpty()) {
      log.error("No input files given");
      return EXIT_NOT_STARTED;
    }
    if (!app.checkBackend().join()) {
      log.error("Worker is not reachable");
      return EXIT_NOT_STARTED;
    }

    List<Item> items = new ArrayList<>();
    for (int i = 0; i < files.size(); i++) {
      items.add(Item.pending(i, files.get(i)));
    }

    CompletableFuture<OperationEvent> outcome = new CompletableFuture<>();
    app.engine()
        .subscribe(
            event -> {
              switch (event.type()) {
                case TICK -> {
                  if (event.changed()) {
                    log.info(
                        "{}% {} ({}/{} done)",
                        event.snapshot().progress(),
                        event.snapshot().currentStage(),
                        event.snapshot().completedCount(),
                        event.snapshot().totalCount());
                  }
                }
                case PAUSED -> log.info("Paused");
                case RESUMED -> log.info("Resumed");
                case TERMINAL, ABORTED -> outcome.complete(event);
              }
            });

    StartResult started =
        app.engine()
            .startOperation(operationClass, items, requestParameters(operationClass, parameters))
            .join();
    if (!started.isStarted()) {
      log.error("{}", started.message());
      return EXIT_NOT_STARTED;
    }
    log.info("{}", started.message());

    long maxWaitMinutes = app.configuration().getLong("cli.max-wait-minutes", 120);
    OperationEvent last;
    try {
      last = outcome.get(maxWaitMinutes, TimeUnit.MINUTES);
    } catch (ExecutionException | TimeoutException e) {
      log.error("Gave up waiting for {}", started.operationId(), e);
      app.engine().stop(operationClass).join();
      return EXIT_ABORTED;
    }

    for (Item item : items) {
      log.info(
          "  [{}] {} {} {}%", item.index(), item.path(), item.status().wireName(), item.progress());
    }
    if (last.type() == OperationEventType.ABORTED) {
      log.error("Operation aborted ({}): {}", last.reason().wireName(), last.message());
      return EXIT_ABORTED;
    }
    log.info("{}", last.summary().message());
    return last.summary().isFullySuccessful() ? EXIT_OK : EXIT_PARTIAL;
  }

  static Map<String, Object> requestParameters(
      OperationClass operationClass, StartupParameters parameters) {
    Map<String, Object> request = new LinkedHashMap<>();
    switch (operationClass) {
      case CONVERT, PATCH -> {
        String output = parameters.getParameter("output", String.class);
        if (output == null || output.isBlank()) {
          throw new IllegalArgumentException(
              "--output is required for " + operationClass.wireName());
        }
        request.put("output_dir", output);
      }
      case PUBLISH -> {
        String packName = parameters.getParameter("pack-name", String.class);
        if (packName == null || packName.isBlank()) {
          throw new IllegalArgumentException("--pack-name is required for publish");
        }
        request.put("pack_name", packName);
        request.put("sticker_type", parameters.getParameter("sticker-type", String.class, "video"));
      }
      case AUTH -> throw new IllegalArgumentException("auth is not a batch operation");
    }
    return request;
  }
}
