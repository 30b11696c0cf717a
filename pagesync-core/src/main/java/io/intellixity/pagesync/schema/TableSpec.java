package io.intellixity.pagesync.schema;

import java.util.*;

/**
 * Declared shape of an entity table. Evolution is additive: columns are only ever added.
 */
public record TableSpec(String schema, String table, List<ColumnSpec> columns) {
  public TableSpec {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    Set<String> seen = new HashSet<>();
    for (ColumnSpec c : columns) {
      if (!seen.add(c.name())) {
        throw new IllegalArgumentException("Duplicate column '" + c.name() + "' in table " + schema + "." + table);
      }
    }
  }

  public List<String> primaryKey() {
    return columns.stream().filter(ColumnSpec::primaryKey).map(ColumnSpec::name).toList();
  }

  public Optional<ColumnSpec> column(String name) {
    return columns.stream().filter(c -> c.name().equals(name)).findFirst();
  }
}
