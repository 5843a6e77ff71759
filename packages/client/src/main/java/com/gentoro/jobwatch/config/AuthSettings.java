package com.gentoro.jobwatch.config;

import com.gentoro.jobwatch.exception.ConfigurationException;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import org.apache.commons.configuration2.Configuration;

/**
 * Retry and validation policy of the auth handshake.
 *
 * @param maxRetries resource-locked retries before the connect attempt is surfaced as a failure
 * @param backoffStepMs the n-th retry waits {@code n * backoffStepMs}
 * @param codePattern accepted shape of the verification code
 */
public record AuthSettings(int maxRetries, long backoffStepMs, Pattern codePattern) {
  public static final String DEFAULT_CODE_PATTERN = "^\\d{5}$";

  public AuthSettings {
    if (maxRetries < 0) {
      throw new ConfigurationException("auth.max-retries must be >= 0, got " + maxRetries);
    }
    if (backoffStepMs < 0) {
      throw new ConfigurationException("auth.backoff-step-ms must be >= 0, got " + backoffStepMs);
    }
  }

  public static AuthSettings defaults() {
    return new AuthSettings(3, 1_000, Pattern.compile(DEFAULT_CODE_PATTERN));
  }

  public static AuthSettings fromConfiguration(Configuration configuration) {
    AuthSettings d = defaults();
    if (configuration == null) return d;
    String pattern = configuration.getString("auth.code-pattern", DEFAULT_CODE_PATTERN);
    try {
      return new AuthSettings(
          configuration.getInt("auth.max-retries", d.maxRetries()),
          configuration.getLong("auth.backoff-step-ms", d.backoffStepMs()),
          Pattern.compile(pattern));
    } catch (PatternSyntaxException e) {
      throw new ConfigurationException("auth.code-pattern is not a valid regex: " + pattern, e);
    }
  }
}
