package com.gentoro.jobwatch.utility;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

/** Shared Jackson mapper and small helpers around it. */
public final class JacksonUtility {
  private static final ObjectMapper MAPPER =
      new ObjectMapper()
          .findAndRegisterModules()
          .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

  private JacksonUtility() {}

  public static ObjectMapper getJsonMapper() {
    return MAPPER;
  }

  public static ObjectNode createObjectNode() {
    return MAPPER.createObjectNode();
  }

  public static String toJson(Object value) {
    try {
      return MAPPER.writeValueAsString(value);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Failed to serialize JSON", e);
    }
  }

  /** Parse a JSON document; throws {@link JsonProcessingException} on malformed input. */
  public static JsonNode readTree(String json) throws JsonProcessingException {
    return MAPPER.readTree(json);
  }
}
