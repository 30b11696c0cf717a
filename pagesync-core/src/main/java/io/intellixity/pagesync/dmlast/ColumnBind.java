package io.intellixity.pagesync.dmlast;

import io.intellixity.pagesync.compile.Bind;

import java.util.Objects;

public record ColumnBind(String column, Bind bind) {
  public ColumnBind {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(bind, "bind");
  }
}
