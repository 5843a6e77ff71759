package com.gentoro.jobwatch.transport;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gentoro.jobwatch.model.ItemSnapshot;
import com.gentoro.jobwatch.model.ItemStatus;
import com.gentoro.jobwatch.model.ProgressSnapshot;
import com.gentoro.jobwatch.model.RemoteStatus;
import com.gentoro.jobwatch.utility.JacksonUtility;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;

/**
 * Turns raw worker responses into the canonical typed shapes used by the engine.
 *
 * <p>The worker wraps payloads inconsistently: the interesting object may sit at the root, under
 * {@code data}, or under {@code data.data}. That probing happens here and nowhere else.
 *
 * <p>Every method returns a failed {@link TransportResult} instead of throwing:
 *
 * <ul>
 *   <li>{@link TransportError.Kind#MALFORMED} when the body is not JSON, is not an object, has no
 *       boolean {@code success} flag, or lacks a required field.
 *   <li>{@link TransportError.Kind#REJECTED} when {@code success} is {@code false}; the message is
 *       the backend's {@code error} text.
 * </ul>
 */
public class ResponseNormalizer {
  private static final Logger log =
      com.gentoro.jobwatch.logging.LoggingService.getLogger(ResponseNormalizer.class);

  private static final String[] ID_FIELDS = {"process_id", "operation_id", "id"};

  /** Parse the common {@code {success, data?, error?}} envelope. */
  public TransportResult<JsonNode> envelope(String body) {
    if (body == null || body.isBlank()) {
      return TransportResult.failure(TransportError.malformed("Empty response body"));
    }
    JsonNode root;
    try {
      root = JacksonUtility.readTree(body);
    } catch (JsonProcessingException e) {
      return TransportResult.failure(
          TransportError.malformed("Response is not valid JSON: " + e.getOriginalMessage()));
    }
    if (root == null || !root.isObject()) {
      return TransportResult.failure(TransportError.malformed("Response is not a JSON object"));
    }
    JsonNode success = root.get("success");
    if (success == null || !success.isBoolean()) {
      return TransportResult.failure(
          TransportError.malformed("Response has no boolean 'success' flag"));
    }
    if (!success.booleanValue()) {
      return TransportResult.failure(TransportError.rejected(errorText(root)));
    }
    return TransportResult.ok(root);
  }

  /** Best-effort error text of a body, used for non-2xx responses. */
  public String errorMessage(String body, String fallback) {
    if (body == null || body.isBlank()) return fallback;
    try {
      JsonNode root = JacksonUtility.readTree(body);
      if (root != null && root.isObject()) {
        String text = errorText(root);
        return text.isEmpty() ? fallback : text;
      }
    } catch (JsonProcessingException e) {
      log.debug("Error body is not JSON: {}", e.getOriginalMessage());
    }
    return fallback;
  }

  /**
   * Resolve the operation id of a start response. Falls back to {@code requestedId} when the
   * backend accepted the request without echoing an id.
   */
  public TransportResult<String> operationId(String body, String requestedId) {
    TransportResult<JsonNode> env = envelope(body);
    if (!env.isSuccess()) return env.asFailure();
    JsonNode root = env.value();
    String id = findId(payload(root));
    if (id == null) id = findId(root);
    if (id == null && requestedId != null && !requestedId.isBlank()) {
      log.debug("Start response carried no id, using requested id {}", requestedId);
      id = requestedId;
    }
    if (id == null) {
      return TransportResult.failure(TransportError.malformed("Start response has no process id"));
    }
    return TransportResult.ok(id);
  }

  public TransportResult<ProgressSnapshot> progress(String body) {
    TransportResult<JsonNode> env = envelope(body);
    if (!env.isSuccess()) return env.asFailure();
    JsonNode data = payload(env.value());

    String rawStatus = text(data, "status");
    RemoteStatus status = RemoteStatus.fromWire(rawStatus);
    if (status == null) {
      return TransportResult.failure(
          TransportError.malformed("Unknown or missing operation status: " + rawStatus));
    }
    boolean paused = data.path("paused").asBoolean(false) || status == RemoteStatus.PAUSED;

    Map<Integer, ItemSnapshot> items = new LinkedHashMap<>();
    JsonNode statuses = firstObject(data, "file_statuses", "item_statuses", "itemStatuses");
    if (statuses != null) {
      Iterator<Map.Entry<String, JsonNode>> fields = statuses.fields();
      while (fields.hasNext()) {
        Map.Entry<String, JsonNode> entry = fields.next();
        Integer index = parseIndex(entry.getKey());
        ItemSnapshot item = index == null ? null : item(entry.getValue());
        if (item == null) {
          log.debug("Skipping unusable item status {}={}", entry.getKey(), entry.getValue());
          continue;
        }
        items.put(index, item);
      }
    }

    return TransportResult.ok(
        new ProgressSnapshot(
            status,
            clampPercent(number(data, "progress")),
            paused,
            items,
            intOr(data, 0, "completed_files", "completedCount"),
            intOr(data, 0, "failed_files", "failedCount"),
            intOr(data, items.size(), "total_files", "totalCount"),
            textOr(data, "", "current_stage", "stage"),
            nullIfBlank(textOr(data, "", "error", "error_message", "errorMessage"))));
  }

  public TransportResult<AuthResponse> auth(String body) {
    TransportResult<JsonNode> env = envelope(body);
    if (!env.isSuccess()) return env.asFailure();
    JsonNode data = payload(env.value());
    JsonNode root = env.value();
    boolean needsCode = flag(data, "needs_code") || flag(root, "needs_code");
    boolean needsPassword = flag(data, "needs_password") || flag(root, "needs_password");
    return TransportResult.ok(new AuthResponse(needsCode, needsPassword));
  }

  public TransportResult<Void> ack(String body) {
    TransportResult<JsonNode> env = envelope(body);
    if (!env.isSuccess()) return env.asFailure();
    return TransportResult.ok(null);
  }

  // --------------------------------------------------------------------
  // helpers
  // --------------------------------------------------------------------

  private static JsonNode payload(JsonNode root) {
    JsonNode data = root.get("data");
    if (data != null && data.isObject()) {
      JsonNode nested = data.get("data");
      if (nested != null && nested.isObject()) return nested;
      return data;
    }
    return root;
  }

  private static ItemSnapshot item(JsonNode node) {
    if (node == null || !node.isObject()) return null;
    ItemStatus status = ItemStatus.fromWire(text(node, "status"));
    if (status == null) return null;
    Double progress = number(node, "progress");
    Integer percent = progress == null ? null : clampPercent(progress);
    return new ItemSnapshot(status, percent, text(node, "stage"));
  }

  private static Integer parseIndex(String key) {
    try {
      int index = Integer.parseInt(key.trim());
      return index < 0 ? null : index;
    } catch (NumberFormatException e) {
      return null;
    }
  }

  private static String findId(JsonNode node) {
    for (String field : ID_FIELDS) {
      String value = text(node, field);
      if (value != null && !value.isBlank()) return value;
    }
    return null;
  }

  private static String errorText(JsonNode root) {
    String text = text(root, "error");
    if (text == null) text = text(root, "message");
    return text == null ? "" : text;
  }

  private static JsonNode firstObject(JsonNode node, String... fields) {
    for (String field : fields) {
      JsonNode value = node.get(field);
      if (value != null && value.isObject()) return value;
    }
    return null;
  }

  private static String text(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull() || value.isContainerNode()) return null;
    return value.asText();
  }

  private static String textOr(JsonNode node, String fallback, String... fields) {
    for (String field : fields) {
      String value = text(node, field);
      if (value != null) return value;
    }
    return fallback;
  }

  /** Numeric value of a field, accepting numeric strings; {@code null} when absent or not numeric. */
  private static Double number(JsonNode node, String field) {
    JsonNode value = node.get(field);
    if (value == null || value.isNull()) return null;
    if (value.isNumber()) return value.doubleValue();
    if (value.isTextual()) {
      try {
        return Double.parseDouble(value.textValue().trim());
      } catch (NumberFormatException e) {
        return null;
      }
    }
    return null;
  }

  private static int intOr(JsonNode node, int fallback, String... fields) {
    for (String field : fields) {
      Double value = number(node, field);
      if (value != null) return value.intValue();
    }
    return fallback;
  }

  private static boolean flag(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && value.asBoolean(false);
  }

  private static int clampPercent(Double value) {
    if (value == null || value.isNaN()) return 0;
    return (int) Math.max(0, Math.min(100, Math.round(value)));
  }

  private static String nullIfBlank(String s) {
    return s == null || s.isBlank() ? null : s;
  }
}
