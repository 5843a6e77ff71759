package com.gentoro.jobwatch.config;

import static org.junit.jupiter.api.Assertions.*;

import com.gentoro.jobwatch.exception.ConfigurationException;
import com.gentoro.jobwatch.model.OperationClass;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class ConfigurationProviderTest {

  @TempDir Path tempDir;

  @Test
  @DisplayName("bundled configuration matches the built-in defaults")
  void bundledDefaults() {
    var config = new ConfigurationProvider(null).configuration();

    for (OperationClass operationClass :
        List.of(OperationClass.CONVERT, OperationClass.PATCH, OperationClass.PUBLISH)) {
      assertEquals(
          MonitorSettings.defaults(operationClass),
          MonitorSettings.fromConfiguration(config, operationClass));
    }
    var transport = TransportSettings.fromConfiguration(config);
    assertEquals(TransportSettings.DEFAULT_BASE_URL, transport.baseUrl());
    assertEquals(EndpointPaths.defaults(), transport.paths());
    var auth = AuthSettings.fromConfiguration(config);
    assertEquals(3, auth.maxRetries());
    assertTrue(auth.codePattern().matcher("12345").matches());
  }

  @Test
  @DisplayName("a configuration file overrides selected values")
  void fileOverrides() throws Exception {
    Path file = tempDir.resolve("jobwatch.yaml");
    Files.writeString(
        file,
        """
        transport:
          base-url: http://worker.local:8080
          paths:
            progress: /v2/progress/{id}
        operations:
          convert:
            poll-interval-ms: 750
        """);

    var config = new ConfigurationProvider(file.toString()).configuration();

    var convert = MonitorSettings.fromConfiguration(config, OperationClass.CONVERT);
    assertEquals(750, convert.pollIntervalMs());
    assertEquals(3, convert.maxConsecutiveErrors());
    var transport = TransportSettings.fromConfiguration(config);
    assertEquals("http://worker.local:8080", transport.baseUrl());
    assertEquals("/v2/progress/{id}", transport.paths().progress());
    assertEquals("/api/telegram/cleanup-session", transport.paths().cleanupSession());
    assertEquals("/api/hex-edit", transport.paths().startPath(OperationClass.PATCH));
  }

  @Test
  @DisplayName("invalid values are configuration errors")
  void invalidValues() {
    var yaml =
        """
        operations:
          patch:
            max-consecutive-errors: 0
        auth:
          code-pattern: "["
        """;
    var config = ConfigurationProvider.fromYaml(yaml).configuration();

    assertThrows(
        ConfigurationException.class,
        () -> MonitorSettings.fromConfiguration(config, OperationClass.PATCH));
    assertThrows(ConfigurationException.class, () -> AuthSettings.fromConfiguration(config));
    assertThrows(
        IllegalArgumentException.class, () -> MonitorSettings.defaults(OperationClass.AUTH));
  }

  @Test
  @DisplayName("a missing configuration file is reported")
  void missingFile() {
    assertThrows(
        ConfigurationException.class,
        () -> new ConfigurationProvider(tempDir.resolve("absent.yaml").toString()));
  }
}
