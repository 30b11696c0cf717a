package io.intellixity.pagesync.source;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public record PageRecord(String id, String databaseId, Map<String, PropertyValue> properties) {
  public PageRecord {
    Objects.requireNonNull(id, "id");
    // Keep declaration order; column order follows it.
    properties = properties == null
        ? Map.of()
        : Collections.unmodifiableMap(new LinkedHashMap<>(properties));
  }
}
