package io.intellixity.pagesync.schema;

import java.util.Map;
import java.util.Optional;

/** Page-store property type to SQL column type. */
public final class SqlTypes {
  public static final String UUID = "UUID";

  private static final Map<String, String> BY_PROPERTY_TYPE = Map.ofEntries(
      Map.entry("title", "VARCHAR(255)"),
      Map.entry("rich_text", "TEXT"),
      Map.entry("number", "FLOAT"),
      Map.entry("select", "VARCHAR(255)"),
      Map.entry("status", "VARCHAR(255)"),
      Map.entry("multi_select", "TEXT[]"),
      Map.entry("date", "TIMESTAMP"),
      Map.entry("people", "TEXT[]"),
      Map.entry("files", "TEXT[]"),
      Map.entry("checkbox", "BOOLEAN"),
      Map.entry("url", "TEXT"),
      Map.entry("email", "VARCHAR(255)"),
      Map.entry("phone_number", "VARCHAR(255)"),
      Map.entry("formula", "TEXT"),
      Map.entry("unique_id", "TEXT"),
      Map.entry("rollup", "TEXT"),
      Map.entry("array", "TEXT[]"),
      Map.entry("incomplete", "TEXT"),
      Map.entry("unsupported", "TEXT"),
      Map.entry("created_time", "TIMESTAMP"),
      Map.entry("created_by", "TEXT"),
      Map.entry("last_edited_time", "TIMESTAMP"),
      Map.entry("last_edited_by", "TEXT")
  );

  private SqlTypes() {}

  /** Empty for relation properties, which live in join tables rather than columns. */
  public static Optional<String> forPropertyType(String propertyType) {
    if ("relation".equals(propertyType)) return Optional.empty();
    if (propertyType == null) return Optional.of("TEXT");
    return Optional.of(BY_PROPERTY_TYPE.getOrDefault(propertyType, "TEXT"));
  }
}
