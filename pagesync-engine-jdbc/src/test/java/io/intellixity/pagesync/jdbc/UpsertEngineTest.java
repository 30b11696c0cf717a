package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.jdbc.dialect.StandardDialect;
import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.source.ParsedRow;
import io.intellixity.pagesync.store.ArityMismatchException;
import io.intellixity.pagesync.store.UndefinedColumnException;
import io.intellixity.pagesync.store.UniqueViolationException;
import org.junit.jupiter.api.Test;

import java.sql.PreparedStatement;
import java.sql.Types;
import java.time.LocalDate;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

final class UpsertEngineTest {
  private static final TableSpec TASKS = new TableSpec("public", "tasks", List.of(
      new ColumnSpec("primary_key_id", "UUID", true),
      new ColumnSpec("Name", "VARCHAR(255)"),
      new ColumnSpec("Notes", "TEXT")));

  @Test
  void arityMismatchFailsBeforeTouchingTheStore() throws Exception {
    RecordingJdbc jdbc = new RecordingJdbc();
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));

    assertThrows(ArityMismatchException.class,
        () -> engine.upsert(null, "public", "tasks", List.of("a", "b"), List.of(1), List.of("a"), ConflictStrategy.NONE));
    verify(jdbc.dataSource, never()).getConnection();
  }

  @Test
  void plainInsertSurfacesUniqueViolationAfterRollback() throws Exception {
    RecordingJdbc jdbc = new RecordingJdbc().failWhen(sql -> RecordingJdbc.sqlState("23505", "duplicate key"));
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));
    JdbcSession mine = cm.open();

    assertThrows(UniqueViolationException.class,
        () -> engine.upsert(mine, "public", "tasks", List.of("a"), List.of(1), List.of(), ConflictStrategy.NONE));

    assertEquals("INSERT INTO \"public\".\"tasks\" (\"a\") VALUES (?)", jdbc.prepared.get(0));
    verify(jdbc.connection).rollback();
    verify(jdbc.connection, never()).close();
  }

  @Test
  void emptyNumberAndDateValuesBindAsUntypedNulls() throws Exception {
    RecordingJdbc jdbc = new RecordingJdbc();
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));
    Map<String, Object> values = new LinkedHashMap<>();
    values.put("primary_key_id", UUID.fromString("aaaaaaaa-0000-4000-8000-000000000002"));
    values.put("Points", null);
    values.put("Due", null);
    values.put("Start", LocalDate.of(2024, 7, 1));
    ParsedRow row = new ParsedRow("aaaaaaaa000040008000000000000002", values);

    engine.upsert(null, "public", "tasks", row.columns(), row.valueList(), List.of(), ConflictStrategy.NONE);

    PreparedStatement ps = jdbc.statements.get(0);
    verify(ps).setObject(1, UUID.fromString("aaaaaaaa-0000-4000-8000-000000000002"));
    verify(ps).setNull(2, Types.OTHER);
    verify(ps).setNull(3, Types.OTHER);
    verify(ps).setObject(4, LocalDate.of(2024, 7, 1));
    verify(ps, never()).setNull(anyInt(), eq(Types.VARCHAR));
  }

  @Test
  void evolvesSchemaAndRetriesExactlyOnce() {
    AtomicInteger inserts = new AtomicInteger();
    RecordingJdbc jdbc = new RecordingJdbc().failWhen(sql ->
        sql.startsWith("INSERT") && inserts.incrementAndGet() == 1
            ? RecordingJdbc.sqlState("42703", "column \"Notes\" does not exist")
            : null);
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));

    int n = engine.upsertEvolving(null, TASKS, List.of("Name", "Notes"), List.of("n", "x"), List.of(), ConflictStrategy.NONE);

    assertEquals(1, n);
    assertEquals(2, inserts.get());
    assertTrue(jdbc.prepared.contains("CREATE SCHEMA IF NOT EXISTS \"public\""));
    assertTrue(jdbc.prepared.contains("ALTER TABLE \"public\".\"tasks\" ADD COLUMN IF NOT EXISTS \"Notes\" TEXT"));
  }

  @Test
  void secondDriftPropagates() {
    RecordingJdbc jdbc = new RecordingJdbc().failWhen(sql ->
        sql.startsWith("INSERT") ? RecordingJdbc.sqlState("42703", "column \"Other\" does not exist") : null);
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));

    assertThrows(UndefinedColumnException.class, () ->
        engine.upsertEvolving(null, TASKS, List.of("Other"), List.of("x"), List.of(), ConflictStrategy.NONE));
    assertEquals(2, jdbc.prepared.stream().filter(s -> s.startsWith("INSERT")).count());
  }

  @Test
  void emptyRowsIsNoOp() throws Exception {
    RecordingJdbc jdbc = new RecordingJdbc();
    ConnectionManager cm = new ConnectionManager(jdbc.dataSource, new StandardDialect());
    UpsertEngine engine = new UpsertEngine(cm, new SchemaEvolution(cm));
    assertEquals(0, engine.upsertAll(null, "s", "t", List.of("a"), List.of(), List.of("a"), ConflictStrategy.IGNORE));
    verify(jdbc.dataSource, never()).getConnection();
  }
}
