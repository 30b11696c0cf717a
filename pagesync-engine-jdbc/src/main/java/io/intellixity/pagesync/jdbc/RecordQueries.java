package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.query.FilterGroup;
import io.intellixity.pagesync.query.FilterGroups;
import io.intellixity.pagesync.query.TableQuery;

import java.util.*;

/** Filtered reads, deletes and updates executed through the connection manager. */
public final class RecordQueries {
  private final ConnectionManager connections;

  public RecordQueries(ConnectionManager connections) {
    this.connections = Objects.requireNonNull(connections, "connections");
  }

  public List<Map<String, Object>> select(JdbcSession session, TableQuery query) {
    SqlStatement stmt = connections.dialect().renderSelect(query);
    return connections.withConnection(s -> s.query(stmt), session);
  }

  /** Rows whose {@code column} is any of {@code values}; no rows for an empty set. */
  public List<Map<String, Object>> selectWhereIn(JdbcSession session, String schema, String table, String column,
                                                 Collection<?> values, List<String> projection) {
    if (values == null || values.isEmpty()) return List.of();
    TableQuery q = TableQuery.from(schema, table)
        .withColumns(projection)
        .withFilter(FilterGroups.and(FilterGroups.equalTo(column, new ArrayList<>(values))));
    return select(session, q);
  }

  public int deleteWhere(JdbcSession session, String schema, String table, List<FilterGroup> filters) {
    SqlStatement stmt = connections.dialect().renderDelete(schema, table, filters);
    return connections.withConnection(s -> s.update(stmt), session);
  }

  public int updateWhere(JdbcSession session, String schema, String table, Map<String, ?> sets, List<FilterGroup> filters) {
    SqlStatement stmt = connections.dialect().renderUpdate(schema, table, sets, filters);
    return connections.withConnection(s -> s.update(stmt), session);
  }
}
