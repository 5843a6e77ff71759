package com.gentoro.jobwatch.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Base unchecked exception. Carries an {@link JobWatchErrorCode} and an optional context map that
 * is rendered by {@link ExceptionUtil#toErrorDetails(Throwable)}.
 *
 * <p>Expected failures (a failed poll, a rejected start) are reported as values, not thrown. This
 * hierarchy is for programmer errors and broken configuration.
 */
public class JobWatchException extends RuntimeException {
  private final JobWatchErrorCode code;
  private final Map<String, Object> context = new LinkedHashMap<>();

  public JobWatchException(JobWatchErrorCode code, String message) {
    super(message);
    this.code = code;
  }

  public JobWatchException(JobWatchErrorCode code, String message, Throwable cause) {
    super(message, cause);
    this.code = code;
  }

  public JobWatchErrorCode getCode() {
    return code;
  }

  public Map<String, Object> getContext() {
    return Collections.unmodifiableMap(context);
  }

  public JobWatchException withContext(String key, Object value) {
    context.put(key, value);
    return this;
  }
}
