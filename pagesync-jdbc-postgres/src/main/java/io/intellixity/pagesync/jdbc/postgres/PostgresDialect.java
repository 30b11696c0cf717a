package io.intellixity.pagesync.jdbc.postgres;

import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.dmlast.UpsertAst;
import io.intellixity.pagesync.jdbc.SqlStatement;
import io.intellixity.pagesync.jdbc.dialect.AbstractJdbcSqlDialect;
import io.intellixity.pagesync.jdbc.dialect.JdbcDialect;

import java.util.List;

/**
 * Postgres dialect implementation for JDBC.
 *
 * Keeps only Postgres-specific overrides and bind behavior.
 * Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect implements JdbcDialect {
  public PostgresDialect() {
    super(new PostgresParameterBinder(), new PostgresErrorClassifier());
  }

  @Override public String id() { return "postgres"; }

  @Override
  public String quoteIdent(String ident) {
    if (ident == null) return null;
    return "\"" + ident.replace("\"", "\"\"") + "\"";
  }

  @Override
  protected String renderPattern(String expr, String placeholder, boolean not) {
    return expr + (not ? " NOT ILIKE " : " ILIKE ") + placeholder;
  }

  @Override
  protected String applyLimit(String sql, int limit) {
    return sql + " LIMIT " + limit;
  }

  @Override
  protected SqlStatement renderConflictInsert(UpsertAst ups) {
    if (ups.conflictColumns().isEmpty()) throw new IllegalArgumentException("Upsert has no conflict columns");
    SqlStatement insertBase = renderInsert(ups.insert());

    StringBuilder sql = new StringBuilder(insertBase.sql());
    sql.append(" ON CONFLICT (");
    sql.append(String.join(", ", ups.conflictColumns().stream().map(this::quoteIdent).toList()));
    sql.append(')');

    List<String> updateCols = ups.updateColumns();
    if (ups.strategy() == ConflictStrategy.IGNORE || updateCols.isEmpty()) {
      sql.append(" DO NOTHING");
    } else {
      sql.append(" DO UPDATE SET ");
      sql.append(String.join(", ", updateCols.stream()
          .map(c -> quoteIdent(c) + " = EXCLUDED." + quoteIdent(c))
          .toList()));
    }
    return new SqlStatement(sql.toString(), insertBase.binds(), insertBase.execKind());
  }
}
