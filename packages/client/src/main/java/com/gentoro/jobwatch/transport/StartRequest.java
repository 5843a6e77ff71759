package com.gentoro.jobwatch.transport;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Payload of a start call.
 *
 * @param requestedId client-generated id proposed to the backend as {@code process_id}
 * @param itemPaths item paths in index order
 * @param parameters class-specific parameters merged into the request body (for example {@code
 *     output_dir}, {@code settings}, {@code pack_name}); entries with a {@code null} value are
 *     dropped
 */
public record StartRequest(String requestedId, List<String> itemPaths, Map<String, Object> parameters) {

  public StartRequest {
    itemPaths = itemPaths == null ? List.of() : List.copyOf(itemPaths);
    parameters = withoutNullValues(parameters);
  }

  private static Map<String, Object> withoutNullValues(Map<String, Object> parameters) {
    if (parameters == null) return Map.of();
    Map<String, Object> copy = new LinkedHashMap<>();
    parameters.forEach(
        (key, value) -> {
          if (key != null && value != null) copy.put(key, value);
        });
    return Collections.unmodifiableMap(copy);
  }
}
