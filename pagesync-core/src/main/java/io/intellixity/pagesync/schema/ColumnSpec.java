package io.intellixity.pagesync.schema;

import java.util.Objects;
import java.util.regex.Pattern;

/**
 * @param type SQL type text, rendered into DDL as-is (so restricted to type-name characters)
 */
public record ColumnSpec(String name, String type, boolean primaryKey) {
  private static final Pattern SQL_TYPE = Pattern.compile("[A-Za-z][A-Za-z0-9_ ,()\\[\\]]*");

  public ColumnSpec {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(type, "type");
    if (name.isBlank()) throw new IllegalArgumentException("column name is blank");
    if (!SQL_TYPE.matcher(type).matches()) throw new IllegalArgumentException("Invalid SQL type for column '" + name + "': " + type);
  }

  public ColumnSpec(String name, String type) {
    this(name, type, false);
  }
}
