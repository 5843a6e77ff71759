package com.gentoro.jobwatch.model;

/** Kind of remote operation. Also the mutual-exclusion key of the operation registry. */
public enum OperationClass {
  CONVERT("convert", "files"),
  PATCH("patch", "files"),
  PUBLISH("publish", "media_files"),
  AUTH("auth", null);

  private final String wireName;
  private final String itemsField;

  OperationClass(String wireName, String itemsField) {
    this.wireName = wireName;
    this.itemsField = itemsField;
  }

  public String wireName() {
    return wireName;
  }

  /** JSON field carrying the item paths in the start request, or {@code null} for auth. */
  public String itemsField() {
    return itemsField;
  }

  /** Whether this class is driven by the polling monitor. */
  public boolean isPolled() {
    return this != AUTH;
  }

  public static OperationClass fromString(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("Operation class is required");
    }
    for (OperationClass value : values()) {
      if (value.name().equalsIgnoreCase(raw) || value.wireName.equalsIgnoreCase(raw)) {
        return value;
      }
    }
    throw new IllegalArgumentException("Unknown operation class: " + raw);
  }
}
