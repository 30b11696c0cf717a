package io.intellixity.pagesync.jdbc.dialect;

import io.intellixity.pagesync.dmlast.UpsertAst;
import io.intellixity.pagesync.jdbc.SqlStatement;

/**
 * ANSI-only dialect. Conflict-aware upserts need vendor syntax, so only
 * {@link io.intellixity.pagesync.dmlast.ConflictStrategy#NONE} is supported.
 */
public final class StandardDialect extends AbstractJdbcSqlDialect {
  @Override public String id() { return "standard"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected SqlStatement renderConflictInsert(UpsertAst ups) {
    throw new UnsupportedOperationException("Dialect '" + id() + "' has no conflict-aware insert: " + ups.strategy());
  }
}
