package io.intellixity.pagesync.sync.jdbc;

import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.jdbc.RecordQueries;
import io.intellixity.pagesync.jdbc.UpsertEngine;
import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.store.UndefinedTableException;
import io.intellixity.pagesync.sync.NameMapStore;
import io.intellixity.pagesync.sync.SyncConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * Name map in {@code <metaSchema>.<nameMapTable> (db_id TEXT PRIMARY KEY, table_name TEXT)}.
 * The table is created on first write.
 */
public final class JdbcNameMapStore implements NameMapStore {
  private static final Logger log = LoggerFactory.getLogger(JdbcNameMapStore.class);

  static final String DB_ID = "db_id";
  static final String TABLE_NAME = "table_name";

  private final RecordQueries queries;
  private final UpsertEngine upserts;
  private final TableSpec spec;

  public JdbcNameMapStore(RecordQueries queries, UpsertEngine upserts, SyncConfig config) {
    this.queries = Objects.requireNonNull(queries, "queries");
    this.upserts = Objects.requireNonNull(upserts, "upserts");
    this.spec = new TableSpec(config.getMetaSchema(), config.getNameMapTable(), List.of(
        new ColumnSpec(DB_ID, "TEXT", true),
        new ColumnSpec(TABLE_NAME, "TEXT")));
  }

  @Override
  public Optional<String> find(String databaseId) {
    List<Map<String, Object>> rows;
    try {
      rows = queries.selectWhereIn(null, spec.schema(), spec.table(), DB_ID, List.of(databaseId), List.of(TABLE_NAME));
    } catch (UndefinedTableException e) {
      log.debug("pagesync.namemap table {}.{} does not exist yet (sqlState={})", spec.schema(), spec.table(), e.sqlState());
      return Optional.empty();
    }
    return rows.stream()
        .map(r -> r.get(TABLE_NAME))
        .filter(Objects::nonNull)
        .map(String::valueOf)
        .findFirst();
  }

  @Override
  public void save(String databaseId, String tableName) {
    upserts.upsertEvolving(null, spec, List.of(DB_ID, TABLE_NAME), List.of(databaseId, tableName),
        List.of(DB_ID), ConflictStrategy.OVERWRITE);
  }
}
