package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.compile.Bind;
import io.intellixity.pagesync.compile.Binds;
import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.dmlast.InsertAst;
import io.intellixity.pagesync.dmlast.UpsertAst;
import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.store.ArityMismatchException;
import io.intellixity.pagesync.store.StoreException;
import io.intellixity.pagesync.store.UndefinedColumnException;
import io.intellixity.pagesync.store.UndefinedTableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

public final class UpsertEngine {
  private static final Logger log = LoggerFactory.getLogger(UpsertEngine.class);

  public static final String DEFAULT_CONFLICT_COLUMN = "primary_key_id";

  private final ConnectionManager connections;
  private final SchemaEvolution schema;

  public UpsertEngine(ConnectionManager connections, SchemaEvolution schema) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.schema = Objects.requireNonNull(schema, "schema");
  }

  /** Overwriting upsert keyed on {@code primary_key_id}. */
  public int upsert(JdbcSession session, String schemaName, String table, List<String> columns, List<?> values) {
    return upsert(session, schemaName, table, columns, values, List.of(DEFAULT_CONFLICT_COLUMN), ConflictStrategy.OVERWRITE);
  }

  public int upsert(JdbcSession session, String schemaName, String table, List<String> columns, List<?> values,
                    List<String> conflictTarget, ConflictStrategy strategy) {
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(values, "values");
    return upsertAll(session, schemaName, table, columns, List.of(values), conflictTarget, strategy);
  }

  /**
   * Multi-row form; one statement for all rows. Runs in the session's transaction, which is
   * rolled back before a driver error propagates.
   */
  public int upsertAll(JdbcSession session, String schemaName, String table, List<String> columns,
                       List<? extends List<?>> rows, List<String> conflictTarget, ConflictStrategy strategy) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(columns, "columns");
    Objects.requireNonNull(rows, "rows");
    if (columns.isEmpty()) throw new IllegalArgumentException("No columns to insert into " + table);
    if (rows.isEmpty()) return 0;

    List<List<Bind>> bound = new ArrayList<>();
    for (List<?> row : rows) {
      if (row.size() != columns.size()) throw new ArityMismatchException(columns.size(), row.size());
      List<Bind> b = new ArrayList<>(row.size());
      for (Object v : row) b.add(Binds.of(v));
      bound.add(b);
    }

    ConflictStrategy effective = (strategy == null) ? ConflictStrategy.OVERWRITE : strategy;
    List<String> target = (conflictTarget == null || conflictTarget.isEmpty())
        ? List.of(DEFAULT_CONFLICT_COLUMN)
        : conflictTarget;
    InsertAst insert = new InsertAst(schemaName, table, columns, bound);
    UpsertAst ast = new UpsertAst(insert, effective == ConflictStrategy.NONE ? List.of() : target, effective);
    SqlStatement stmt = connections.dialect().renderUpsert(ast);

    return connections.withConnection(s -> {
      try {
        return s.update(stmt);
      } catch (StoreException e) {
        rollbackAfter(s, e);
        throw e;
      }
    }, session);
  }

  /**
   * Upsert that tolerates schema drift: a missing table or column triggers
   * {@link SchemaEvolution#ensureTable} and exactly one retry.
   */
  public int upsertEvolving(JdbcSession session, TableSpec spec, List<String> columns, List<?> values,
                            List<String> conflictTarget, ConflictStrategy strategy) {
    Objects.requireNonNull(spec, "spec");
    try {
      return upsert(session, spec.schema(), spec.table(), columns, values, conflictTarget, strategy);
    } catch (UndefinedTableException | UndefinedColumnException e) {
      log.info("pagesync.upsert schema drift table={}.{} sqlState={}; evolving and retrying once",
          spec.schema(), spec.table(), e.sqlState());
      schema.ensureTable(session, spec);
      return upsert(session, spec.schema(), spec.table(), columns, values, conflictTarget, strategy);
    }
  }

  public int upsertEvolving(JdbcSession session, TableSpec spec, List<String> columns, List<?> values) {
    return upsertEvolving(session, spec, columns, values, List.of(DEFAULT_CONFLICT_COLUMN), ConflictStrategy.OVERWRITE);
  }

  private static void rollbackAfter(JdbcSession s, StoreException cause) {
    try {
      s.rollback();
    } catch (RuntimeException re) {
      cause.addSuppressed(re);
    }
  }
}
