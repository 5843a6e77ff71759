package com.gentoro.jobwatch.config;

import com.gentoro.jobwatch.model.OperationClass;
import org.apache.commons.configuration2.Configuration;

/**
 * Relative paths of the worker endpoints. {@code {id}} in {@link #progress} stands for one whole
 * path segment and is replaced by the encoded operation id.
 */
public record EndpointPaths(
    String startConvert,
    String startPatch,
    String startPublish,
    String progress,
    String pause,
    String resume,
    String stop,
    String connect,
    String verifyCode,
    String verifyPassword,
    String cleanupSession,
    String health) {
  public static final String ID_PLACEHOLDER = "{id}";

  public static EndpointPaths defaults() {
    return new EndpointPaths(
        "/api/convert-videos",
        "/api/hex-edit",
        "/api/sticker/create-pack",
        "/api/conversion-progress/{id}",
        "/api/pause-operation",
        "/api/resume-operation",
        "/api/stop-process",
        "/api/telegram/connect",
        "/api/telegram/verify-code",
        "/api/telegram/verify-password",
        "/api/telegram/cleanup-session",
        "/api/health");
  }

  public static EndpointPaths fromConfiguration(Configuration configuration) {
    EndpointPaths d = defaults();
    if (configuration == null) return d;
    Configuration c = configuration.subset("transport.paths");
    return new EndpointPaths(
        c.getString("start-convert", d.startConvert()),
        c.getString("start-patch", d.startPatch()),
        c.getString("start-publish", d.startPublish()),
        c.getString("progress", d.progress()),
        c.getString("pause", d.pause()),
        c.getString("resume", d.resume()),
        c.getString("stop", d.stop()),
        c.getString("connect", d.connect()),
        c.getString("verify-code", d.verifyCode()),
        c.getString("verify-password", d.verifyPassword()),
        c.getString("cleanup-session", d.cleanupSession()),
        c.getString("health", d.health()));
  }

  public String startPath(OperationClass operationClass) {
    return switch (operationClass) {
      case CONVERT -> startConvert;
      case PATCH -> startPatch;
      case PUBLISH -> startPublish;
      case AUTH -> connect;
    };
  }
}
