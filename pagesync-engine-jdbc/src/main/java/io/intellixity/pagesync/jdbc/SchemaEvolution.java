package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.jdbc.dialect.JdbcDialect;
import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.schema.TableSpec;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Additive, idempotent DDL: every statement is {@code IF NOT EXISTS}, so repeating a call with
 * the same spec is a no-op. Nothing is ever dropped or altered in type.
 */
public final class SchemaEvolution {
  private static final Logger log = LoggerFactory.getLogger(SchemaEvolution.class);

  private final ConnectionManager connections;

  public SchemaEvolution(ConnectionManager connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  public void ensureTable(JdbcSession session, TableSpec spec) {
    Objects.requireNonNull(spec, "spec");
    JdbcDialect d = connections.dialect();
    connections.withConnection(s -> {
      s.update(d.renderCreateSchema(spec.schema()));
      s.update(d.renderCreateTable(spec));
      for (ColumnSpec c : spec.columns()) s.update(d.renderAddColumn(spec.schema(), spec.table(), c));
      return null;
    }, session);
    log.info("pagesync.schema ensured table={}.{} columns={}", spec.schema(), spec.table(), spec.columns().size());
  }

  public void ensureJoinTable(JdbcSession session, JoinTableSpec spec, String primaryKeyColumn) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(primaryKeyColumn, "primaryKeyColumn");
    JdbcDialect d = connections.dialect();
    connections.withConnection(s -> {
      s.update(d.renderCreateSchema(spec.schema()));
      s.update(d.renderCreateJoinTable(spec, primaryKeyColumn));
      return null;
    }, session);
    log.info("pagesync.schema ensured joinTable={}.{} columns=({}, {})",
        spec.schema(), spec.tableName(), spec.column1Name(), spec.column2Name());
  }

  /** Existing columns (name to data type) in ordinal order; empty when the table does not exist. */
  public Map<String, String> listColumns(JdbcSession session, String schema, String table) {
    JdbcDialect d = connections.dialect();
    return connections.withConnection(s -> {
      Map<String, String> out = new LinkedHashMap<>();
      for (Map<String, Object> row : s.query(d.renderListColumns(schema, table))) {
        out.put(String.valueOf(row.get("column_name")), String.valueOf(row.get("data_type")));
      }
      return out;
    }, session);
  }
}
