package com.gentoro.jobwatch.exception;

/** Configuration could not be loaded or contains invalid values. */
public class ConfigurationException extends JobWatchException {
  public ConfigurationException(String message) {
    super(JobWatchErrorCode.CONFIGURATION_ERROR, message);
  }

  public ConfigurationException(String message, Throwable cause) {
    super(JobWatchErrorCode.CONFIGURATION_ERROR, message, cause);
  }
}
