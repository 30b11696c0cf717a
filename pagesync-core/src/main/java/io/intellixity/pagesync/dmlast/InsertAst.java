package io.intellixity.pagesync.dmlast;

import io.intellixity.pagesync.compile.Bind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/** Single- or multi-row insert; every row carries one bind per column. */
public record InsertAst(
    String schema,
    String table,
    List<String> columns,
    List<List<Bind>> rows
) implements DmlAst {
  public InsertAst {
    Objects.requireNonNull(table, "table");
    columns = columns == null ? List.of() : List.copyOf(columns);
    List<List<Bind>> copy = new ArrayList<>();
    if (rows != null) {
      for (List<Bind> r : rows) {
        if (r.size() != columns.size()) {
          throw new IllegalArgumentException("Row has " + r.size() + " binds for " + columns.size() + " columns");
        }
        copy.add(List.copyOf(r));
      }
    }
    rows = List.copyOf(copy);
  }
}
