package io.intellixity.pagesync.jdbc.dialect;

import io.intellixity.pagesync.compile.Binds;
import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.dmlast.InsertAst;
import io.intellixity.pagesync.dmlast.UpsertAst;
import io.intellixity.pagesync.jdbc.SqlStatement;
import io.intellixity.pagesync.jdbc.postgres.PostgresDialect;
import io.intellixity.pagesync.query.FilterGroups;
import io.intellixity.pagesync.query.SortField;
import io.intellixity.pagesync.query.TableQuery;
import org.junit.jupiter.api.Test;

import java.util.List;

import static io.intellixity.pagesync.query.FilterGroups.*;
import static org.junit.jupiter.api.Assertions.*;

final class PostgresDialectTest {
  private final PostgresDialect d = new PostgresDialect();

  private static InsertAst tasks(List<String> cols, List<Object> values) {
    return new InsertAst("public", "tasks", cols, List.of(values.stream().map(Binds::of).toList()));
  }

  @Test
  void overwriteUpdatesEveryNonKeyColumn() {
    UpsertAst ups = new UpsertAst(tasks(List.of("primary_key_id", "Name", "Done"), List.of("k", "n", true)),
        List.of("primary_key_id"), ConflictStrategy.OVERWRITE);

    SqlStatement s = d.renderUpsert(ups);

    assertEquals("INSERT INTO \"public\".\"tasks\" (\"primary_key_id\", \"Name\", \"Done\") VALUES (:b1, :b2, :b3)"
        + " ON CONFLICT (\"primary_key_id\") DO UPDATE SET \"Name\" = EXCLUDED.\"Name\", \"Done\" = EXCLUDED.\"Done\"",
        s.sql());
    assertEquals(3, s.binds().size());
    assertEquals(SqlStatement.ExecKind.UPDATE, s.execKind());
  }

  @Test
  void ignoreAndKeyOnlyRowsDoNothing() {
    UpsertAst ignore = new UpsertAst(tasks(List.of("a", "b"), List.of(1, 2)), List.of("a"), ConflictStrategy.IGNORE);
    UpsertAst keyOnly = new UpsertAst(tasks(List.of("a", "b"), List.of(1, 2)), List.of("a", "b"), ConflictStrategy.OVERWRITE);

    assertTrue(d.renderUpsert(ignore).sql().endsWith(" ON CONFLICT (\"a\") DO NOTHING"));
    assertTrue(d.renderUpsert(keyOnly).sql().endsWith(" ON CONFLICT (\"a\", \"b\") DO NOTHING"));
  }

  @Test
  void noneIsAPlainInsert() {
    UpsertAst ups = new UpsertAst(tasks(List.of("a"), List.of(1)), List.of(), ConflictStrategy.NONE);
    assertEquals("INSERT INTO \"public\".\"tasks\" (\"a\") VALUES (:b1)", d.renderUpsert(ups).sql());
  }

  @Test
  void multiRowInsertNumbersBindsAcrossRows() {
    InsertAst ins = new InsertAst("Join", "public_a_b", List.of("a_id", "b_id"), List.of(
        List.of(Binds.of("x"), Binds.of("y")),
        List.of(Binds.of("x"), Binds.of("z"))));
    SqlStatement s = d.renderUpsert(new UpsertAst(ins, List.of("a_id", "b_id"), ConflictStrategy.IGNORE));
    assertEquals("INSERT INTO \"Join\".\"public_a_b\" (\"a_id\", \"b_id\") VALUES (:b1, :b2), (:b3, :b4)"
        + " ON CONFLICT (\"a_id\", \"b_id\") DO NOTHING", s.sql());
  }

  @Test
  void patternsUseIlikeAndLimitIsNative() {
    TableQuery q = TableQuery.from("public", "tasks")
        .withFilter(FilterGroups.and(contains("Name", "bug"), notContains("Name", "wont%fix"), startsWith("Tag", "P")))
        .withSort(List.of(SortField.desc("Due")))
        .withLimit(10);

    SqlStatement s = d.renderSelect(q);

    assertEquals("SELECT * FROM \"public\".\"tasks\" WHERE (\"Name\" ILIKE :b1 AND \"Name\" NOT ILIKE :b2 AND \"Tag\" ILIKE :b3)"
        + " ORDER BY \"Due\" DESC NULLS LAST LIMIT 10", s.sql());
    assertEquals(List.of("%bug%", "wont%fix", "P%"), s.binds().stream().map(b -> b.value()).toList());
  }

  @Test
  void discoveredThroughFactories() {
    JdbcDialect found = JdbcDialects.forId("postgres");
    assertInstanceOf(PostgresDialect.class, found);
    assertInstanceOf(StandardDialect.class, JdbcDialects.forId("standard"));
  }
}
