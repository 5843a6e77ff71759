package com.gentoro.jobwatch.config;

import com.gentoro.jobwatch.exception.ConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.apache.commons.configuration2.Configuration;
import org.apache.commons.configuration2.YAMLConfiguration;
import org.slf4j.Logger;

/**
 * Loads the application configuration from a YAML file, falling back to the {@code
 * application.yaml} bundled on the classpath.
 */
public class ConfigurationProvider {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(ConfigurationProvider.class);

  static final String DEFAULT_RESOURCE = "application.yaml";

  private final YAMLConfiguration configuration;

  public ConfigurationProvider(String configFile) {
    this.configuration = configFile == null || configFile.isBlank()
        ? loadClasspath(DEFAULT_RESOURCE)
        : loadFile(Path.of(configFile));
  }

  private ConfigurationProvider(YAMLConfiguration configuration) {
    this.configuration = configuration;
  }

  /** Build a provider from inline YAML; mostly useful for tests and embedding. */
  public static ConfigurationProvider fromYaml(String yaml) {
    return new ConfigurationProvider(read(new StringReader(yaml), "inline YAML"));
  }

  public Configuration configuration() {
    return configuration;
  }

  private static YAMLConfiguration loadFile(Path file) {
    if (!Files.isRegularFile(file)) {
      throw new ConfigurationException("Configuration file not found: " + file.toAbsolutePath());
    }
    log.info("Loading configuration from {}", file.toAbsolutePath());
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
      return read(reader, file.toString());
    } catch (IOException e) {
      throw new ConfigurationException("Could not read configuration file " + file, e);
    }
  }

  private static YAMLConfiguration loadClasspath(String resource) {
    InputStream in = ConfigurationProvider.class.getClassLoader().getResourceAsStream(resource);
    if (in == null) {
      log.warn("No {} on classpath, using built-in defaults", resource);
      return new YAMLConfiguration();
    }
    try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
      return read(reader, "classpath:" + resource);
    } catch (IOException e) {
      throw new ConfigurationException("Could not read classpath resource " + resource, e);
    }
  }

  private static YAMLConfiguration read(Reader reader, String source) {
    YAMLConfiguration yaml = new YAMLConfiguration();
    try {
      yaml.read(reader);
    } catch (org.apache.commons.configuration2.ex.ConfigurationException e) {
      throw new ConfigurationException("Malformed YAML configuration in " + source, e);
    }
    return yaml;
  }
}
