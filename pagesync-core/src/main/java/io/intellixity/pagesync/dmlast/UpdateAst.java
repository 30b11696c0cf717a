package io.intellixity.pagesync.dmlast;

import io.intellixity.pagesync.query.FilterGroup;

import java.util.List;
import java.util.Objects;

public record UpdateAst(
    String schema,
    String table,
    List<ColumnBind> sets,
    List<FilterGroup> where
) implements DmlAst {
  public UpdateAst {
    Objects.requireNonNull(table, "table");
    sets = sets == null ? List.of() : List.copyOf(sets);
    where = where == null ? List.of() : List.copyOf(where);
  }
}
