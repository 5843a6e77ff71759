package com.gentoro.jobwatch.config;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Command line arguments in {@code --key=value} form. A bare {@code --flag} is stored as {@code
 * true}; anything not starting with {@code --} is a positional argument.
 */
public class StartupParameters {
  private final Map<String, String> parameters = new LinkedHashMap<>();
  private final List<String> positional = new ArrayList<>();

  public StartupParameters(String[] args) {
    if (args == null) return;
    for (String arg : args) {
      if (arg == null || arg.isBlank()) continue;
      if (arg.startsWith("--")) {
        String body = arg.substring(2);
        int eq = body.indexOf('=');
        if (eq < 0) {
          parameters.put(body, "true");
        } else {
          parameters.put(body.substring(0, eq), body.substring(eq + 1));
        }
      } else {
        positional.add(arg);
      }
    }
  }

  public boolean has(String name) {
    return parameters.containsKey(name);
  }

  public <T> T getParameter(String name, Class<T> type) {
    return getParameter(name, type, null);
  }

  /** Typed lookup supporting String, Integer, Long and Boolean. */
  public <T> T getParameter(String name, Class<T> type, T defaultValue) {
    String raw = parameters.get(name);
    if (raw == null) return defaultValue;
    Object value;
    if (type == String.class) {
      value = raw;
    } else if (type == Integer.class) {
      value = Integer.valueOf(raw.trim());
    } else if (type == Long.class) {
      value = Long.valueOf(raw.trim());
    } else if (type == Boolean.class) {
      value = Boolean.valueOf(raw.trim());
    } else {
      throw new IllegalArgumentException("Unsupported parameter type: " + type.getName());
    }
    return type.cast(value);
  }

  /** Path of the YAML configuration file, or {@code null} to use the bundled defaults. */
  public String configFile() {
    return parameters.get("config");
  }

  public List<String> positional() {
    return Collections.unmodifiableList(positional);
  }
}
