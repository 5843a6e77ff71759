package com.gentoro.jobwatch.config;

import com.gentoro.jobwatch.exception.ConfigurationException;
import org.apache.commons.configuration2.Configuration;

/** Connection settings of the HTTP transport. */
public record TransportSettings(
    String baseUrl, long connectTimeoutMs, long readTimeoutMs, EndpointPaths paths) {
  public static final String DEFAULT_BASE_URL = "http://127.0.0.1:5000";

  public TransportSettings {
    if (baseUrl == null || baseUrl.isBlank()) {
      throw new ConfigurationException("transport.base-url is required");
    }
    if (paths == null) {
      paths = EndpointPaths.defaults();
    }
  }

  public static TransportSettings fromConfiguration(Configuration configuration) {
    if (configuration == null) {
      return new TransportSettings(DEFAULT_BASE_URL, 10_000, 20_000, EndpointPaths.defaults());
    }
    return new TransportSettings(
        configuration.getString("transport.base-url", DEFAULT_BASE_URL),
        configuration.getLong("transport.connect-timeout-ms", 10_000),
        configuration.getLong("transport.read-timeout-ms", 20_000),
        EndpointPaths.fromConfiguration(configuration));
  }
}
