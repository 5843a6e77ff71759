package com.gentoro.jobwatch.config;

import com.gentoro.jobwatch.exception.ConfigurationException;
import com.gentoro.jobwatch.model.OperationClass;
import org.apache.commons.configuration2.Configuration;

/**
 * Polling policy of one operation class.
 *
 * @param pollIntervalMs delay between the end of one poll and the start of the next
 * @param maxConsecutiveErrors failed polls in a row that abort the operation
 * @param maxDurationMs wall-clock budget measured from the start of the operation
 * @param immediateFirstPoll poll right away instead of waiting one interval; used by classes whose
 *     remote job usually finishes before the first interval elapses
 */
public record MonitorSettings(
    long pollIntervalMs, int maxConsecutiveErrors, long maxDurationMs, boolean immediateFirstPoll) {

  public MonitorSettings {
    if (pollIntervalMs <= 0) {
      throw new ConfigurationException("poll-interval-ms must be > 0, got " + pollIntervalMs);
    }
    if (maxConsecutiveErrors < 1) {
      throw new ConfigurationException(
          "max-consecutive-errors must be >= 1, got " + maxConsecutiveErrors);
    }
    if (maxDurationMs <= 0) {
      throw new ConfigurationException("max-duration-ms must be > 0, got " + maxDurationMs);
    }
  }

  public static MonitorSettings defaults(OperationClass operationClass) {
    return switch (operationClass) {
      case CONVERT -> new MonitorSettings(2_000, 3, 30 * 60_000L, false);
      case PATCH -> new MonitorSettings(500, 8, 10 * 60_000L, true);
      case PUBLISH -> new MonitorSettings(1_500, 5, 60 * 60_000L, false);
      case AUTH -> throw new IllegalArgumentException("auth operations are not polled");
    };
  }

  /** Read {@code operations.<class>.*}, falling back to {@link #defaults(OperationClass)}. */
  public static MonitorSettings fromConfiguration(
      Configuration configuration, OperationClass operationClass) {
    MonitorSettings d = defaults(operationClass);
    if (configuration == null) return d;
    String prefix = "operations." + operationClass.wireName() + ".";
    return new MonitorSettings(
        configuration.getLong(prefix + "poll-interval-ms", d.pollIntervalMs()),
        configuration.getInt(prefix + "max-consecutive-errors", d.maxConsecutiveErrors()),
        configuration.getLong(prefix + "max-duration-ms", d.maxDurationMs()),
        configuration.getBoolean(prefix + "immediate-first-poll", d.immediateFirstPoll()));
  }

  public MonitorSettings withMaxDurationMs(long value) {
    return new MonitorSettings(pollIntervalMs, maxConsecutiveErrors, value, immediateFirstPoll);
  }
}
