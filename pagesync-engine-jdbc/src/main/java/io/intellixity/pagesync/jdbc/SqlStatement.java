package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.compile.Bind;

import java.util.List;

/** Rendered statement: SQL with {@code :name} placeholders plus binds in placeholder order. */
public record SqlStatement(String sql, List<Bind> binds, ExecKind execKind) {
  public enum ExecKind {
    /** Execute via PreparedStatement.executeQuery(). */
    QUERY,
    /** Execute via PreparedStatement.executeUpdate(); also used for DDL. */
    UPDATE
  }

  public SqlStatement {
    binds = binds == null ? List.of() : List.copyOf(binds);
    execKind = (execKind == null) ? ExecKind.QUERY : execKind;
  }

  public SqlStatement(String sql, List<Bind> binds) {
    this(sql, binds, ExecKind.QUERY);
  }

  public static SqlStatement ddl(String sql) {
    return new SqlStatement(sql, List.of(), ExecKind.UPDATE);
  }
}
