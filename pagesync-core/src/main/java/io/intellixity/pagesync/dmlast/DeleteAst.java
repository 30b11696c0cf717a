package io.intellixity.pagesync.dmlast;

import io.intellixity.pagesync.query.FilterGroup;

import java.util.List;
import java.util.Objects;

public record DeleteAst(
    String schema,
    String table,
    List<FilterGroup> where
) implements DmlAst {
  public DeleteAst {
    Objects.requireNonNull(table, "table");
    where = where == null ? List.of() : List.copyOf(where);
  }
}
