package io.intellixity.pagesync.dmlast;

import java.util.List;
import java.util.Objects;

public record UpsertAst(
    InsertAst insert,
    List<String> conflictColumns,
    ConflictStrategy strategy
) implements DmlAst {
  public UpsertAst {
    Objects.requireNonNull(insert, "insert");
    conflictColumns = conflictColumns == null ? List.of() : List.copyOf(conflictColumns);
    strategy = strategy == null ? ConflictStrategy.OVERWRITE : strategy;
    if (strategy != ConflictStrategy.NONE && conflictColumns.isEmpty()) {
      throw new IllegalArgumentException("Upsert has no conflict columns");
    }
  }

  @Override public String schema() { return insert.schema(); }
  @Override public String table() { return insert.table(); }

  /** Non-key columns, in insert order. Empty when every column is part of the conflict target. */
  public List<String> updateColumns() {
    return insert.columns().stream().filter(c -> !conflictColumns.contains(c)).toList();
  }
}
