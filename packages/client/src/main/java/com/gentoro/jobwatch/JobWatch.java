package com.gentoro.jobwatch;

import com.gentoro.jobwatch.auth.AuthHandshakeController;
import com.gentoro.jobwatch.config.AuthSettings;
import com.gentoro.jobwatch.config.ConfigurationProvider;
import com.gentoro.jobwatch.config.MonitorSettings;
import com.gentoro.jobwatch.config.StartupParameters;
import com.gentoro.jobwatch.config.TransportSettings;
import com.gentoro.jobwatch.engine.EventLoopScheduler;
import com.gentoro.jobwatch.engine.OperationEngine;
import com.gentoro.jobwatch.engine.OperationRegistry;
import com.gentoro.jobwatch.engine.TaskScheduler;
import com.gentoro.jobwatch.exception.ExceptionUtil;
import com.gentoro.jobwatch.exception.StateException;
import com.gentoro.jobwatch.transport.HttpTransport;
import com.gentoro.jobwatch.transport.Transport;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.commons.configuration2.Configuration;

/**
 * Wires configuration, logging, transport, the operation engine and the auth controller. Owns the
 * event loop every component runs on.
 */
public class JobWatch implements AutoCloseable {

  private static final org.slf4j.Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(JobWatch.class);

  private final StartupParameters startupParameters;
  private ConfigurationProvider configurationProvider;
  private EventLoopScheduler eventLoop;
  private Transport transport;
  private OperationRegistry registry;
  private OperationEngine engine;
  private AuthHandshakeController auth;
  private final AtomicBoolean shuttingDown = new AtomicBoolean(false);

  static final long SHUTDOWN_WAIT_MS = 2_000;

  public JobWatch(String[] applicationArgs) {
    this.startupParameters = new StartupParameters(applicationArgs);
  }

  public void initialize() {
    initialize(new ConfigurationProvider(startupParameters.configFile()));
  }

  /** Initialize against an already loaded configuration. */
  public void initialize(ConfigurationProvider provider) {
    this.configurationProvider = provider;
    com.gentoro.jobwatch.logging.LoggingService.applyConfiguration(configuration());
    wire(configuration());
  }

  private void wire(Configuration configuration) {
    TransportSettings transportSettings = TransportSettings.fromConfiguration(configuration);
    log.info("Using worker at {}", transportSettings.baseUrl());

    this.eventLoop = new EventLoopScheduler();
    this.transport = createTransport(transportSettings);
    this.registry = new OperationRegistry();
    this.engine =
        new OperationEngine(
            transport,
            eventLoop,
            registry,
            operationClass -> MonitorSettings.fromConfiguration(configuration, operationClass));
    this.auth =
        new AuthHandshakeController(
            transport, eventLoop, registry, AuthSettings.fromConfiguration(configuration));
  }

  protected Transport createTransport(TransportSettings settings) {
    return new HttpTransport(settings);
  }

  /** Completes with whether the worker answered its health endpoint. */
  public CompletableFuture<Boolean> checkBackend() {
    return transport()
        .health()
        .handle(
            (result, failure) -> {
              if (failure != null) {
                log.warn("Health check failed: {}", ExceptionUtil.extractErrorMessage(failure));
                return false;
              }
              if (!result.isSuccess()) {
                log.warn("Health check failed: {}", result.error().message());
                return false;
              }
              return true;
            });
  }

  /** Stop active operations and release resources. Safe to call multiple times. */
  public void shutdown() {
    if (!shuttingDown.compareAndSet(false, true)) return;
    log.info("Shutting down");
    try {
      if (engine != null) {
        engine.stopAll("Engine shut down").get(SHUTDOWN_WAIT_MS, TimeUnit.MILLISECONDS);
      }
    } catch (TimeoutException e) {
      log.warn("Active operations not stopped within {} ms", SHUTDOWN_WAIT_MS);
    } catch (ExecutionException | RuntimeException e) {
      log.warn("Failed to stop active operations", e);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while stopping active operations");
    } finally {
      if (eventLoop != null) eventLoop.close();
    }
  }

  @Override
  public void close() {
    shutdown();
  }

  public Configuration configuration() {
    if (configurationProvider == null) {
      throw new StateException("JobWatch not initialized. Call initialize() first.");
    }
    return configurationProvider.configuration();
  }

  public StartupParameters startupParameters() {
    return startupParameters;
  }

  public TaskScheduler scheduler() {
    return requireInitialized(eventLoop);
  }

  public Transport transport() {
    return requireInitialized(transport);
  }

  public OperationRegistry registry() {
    return requireInitialized(registry);
  }

  public OperationEngine engine() {
    return requireInitialized(engine);
  }

  public AuthHandshakeController auth() {
    return requireInitialized(auth);
  }

  private static <T> T requireInitialized(T component) {
    if (component == null) {
      throw new StateException("JobWatch not initialized. Call initialize() first.");
    }
    return component;
  }
}
