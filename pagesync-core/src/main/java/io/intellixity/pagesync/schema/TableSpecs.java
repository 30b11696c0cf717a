package io.intellixity.pagesync.schema;

import io.intellixity.pagesync.source.DatabaseSchema;
import io.intellixity.pagesync.source.PageRecordParser;
import io.intellixity.pagesync.source.PropertyDef;

import java.util.*;

public final class TableSpecs {
  private TableSpecs() {}

  /**
   * Derives the entity table for a page-store database: {@code primary_key_id UUID} first, then one
   * column per stored property in declaration order. Relation and rollup properties get no column.
   * A property whose name collides with an earlier column gets a {@code _dup} suffix.
   */
  public static TableSpec fromDatabase(String schema, String table, DatabaseSchema database) {
    Objects.requireNonNull(database, "database");
    List<ColumnSpec> cols = new ArrayList<>();
    Set<String> used = new HashSet<>();
    cols.add(new ColumnSpec(PageRecordParser.PRIMARY_KEY_COLUMN, SqlTypes.UUID, true));
    used.add(PageRecordParser.PRIMARY_KEY_COLUMN);

    for (PropertyDef p : database.properties()) {
      if (!p.isStored()) continue;
      String sqlType = SqlTypes.forPropertyType(p.type()).orElse(null);
      if (sqlType == null) continue;
      String name = p.name();
      while (!used.add(name)) name = name + "_dup";
      cols.add(new ColumnSpec(name, sqlType));
    }
    return new TableSpec(schema, table, cols);
  }
}
