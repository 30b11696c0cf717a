package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.DatabaseSchema;
import io.intellixity.pagesync.source.PageJson;
import io.intellixity.pagesync.source.PageRecord;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RecordIngestorTest {
  private static final String TASKS_DB = "6f1c2d3e4a5b4c6d8e9f0a1b2c3d4e5f";
  private static final String PROJECTS_DB = "11111111222243338444555555555555";
  private static final String T1 = "aaaaaaaa000040008000000000000001";
  private static final String T2 = "aaaaaaaa000040008000000000000002";
  private static final String PA = "111111110000400080000000000000aa";
  private static final String PB = "111111110000400080000000000000bb";

  private final InMemoryJoinTables store = new InMemoryJoinTables();
  private final FakePageSource source = new FakePageSource();
  private final InMemoryNameMap nameStore = new InMemoryNameMap();
  private final RecordingEntityWriter writer = new RecordingEntityWriter();

  static String fixture(String name) {
    try (InputStream in = RecordIngestorTest.class.getResourceAsStream("/pages/" + name)) {
      assertNotNull(in, "missing fixture " + name);
      return new String(in.readAllBytes(), StandardCharsets.UTF_8);
    } catch (IOException e) {
      throw new IllegalStateException(e);
    }
  }

  private RecordIngestor ingestor() {
    DatabaseSchema tasks = PageJson.database(fixture("tasks-database.json"));
    source.databases.put(tasks.id(), tasks);
    TableNameMap names = new TableNameMap(nameStore, source);
    RelationSynchronizer sync = new RelationSynchronizer(new SyncConfig(), store, new ForeignKeyHealer(source, names, writer));
    return new RecordIngestor(source, names, writer, sync);
  }

  private static List<PageRecord> pages() {
    return PageJson.pages(fixture("tasks-query.json"));
  }

  @Test
  void writesRowsAndSynchronizesEveryRelation() {
    source.database(PROJECTS_DB, "projects");
    RecordIngestor ingestor = ingestor();

    IngestReport report = ingestor.ingest("public", "tasks", TASKS_DB, pages());

    assertEquals(2, report.rowsWritten());
    assertTrue(report.skippedRelations().isEmpty());
    assertTrue(report.relations().succeeded());

    assertEquals(List.of("primary_key_id", "Name", "Status", "Estimate", "Done", "Tags", "Due"),
        writer.ensured.get(0).columns().stream().map(ColumnSpec::name).toList());
    assertEquals(List.of("public.tasks:" + T1, "public.tasks:" + T2), writer.writes);

    JoinTableSpec taskProjects = JoinTableSpec.derive("Join", "public", "tasks", "projects");
    JoinTableSpec blockedBy = JoinTableSpec.derive("Join", "public", "tasks", "tasks");
    assertEquals(Set.of(new JoinPair(PA, T1), new JoinPair(PA, T2), new JoinPair(PB, T2)), store.rows(taskProjects));
    assertEquals(Set.of(new JoinPair(T2, T1)), store.rows(blockedBy));
    assertEquals(2, store.ensureCalls);

    assertEquals("tasks", nameStore.rows.get(TASKS_DB));
    assertEquals("projects", nameStore.rows.get(PROJECTS_DB));
  }

  @Test
  void emptyRelationPurgesPreviousRows() {
    source.database(PROJECTS_DB, "projects");
    JoinTableSpec blockedBy = JoinTableSpec.derive("Join", "public", "tasks", "tasks");
    store.create(blockedBy, new JoinPair(T1, T2));

    IngestReport report = ingestor().ingest("public", "tasks", TASKS_DB, pages());

    assertEquals(1, report.relations().table(blockedBy.tableName()).orElseThrow().purged());
    assertEquals(Set.of(new JoinPair(T2, T1)), store.rows(blockedBy));
  }

  @Test
  void unresolvableRelationTargetIsSkippedNotFatal() {
    IngestReport report = ingestor().ingest("public", "tasks", TASKS_DB, pages());

    assertEquals(List.of("Project"), report.skippedRelations());
    assertEquals(1, report.relations().tables().size());
    assertEquals(Set.of(new JoinPair(T2, T1)), store.rows(JoinTableSpec.derive("Join", "public", "tasks", "tasks")));
  }

  @Test
  void unknownDatabaseIsRejected() {
    RecordIngestor ingestor = ingestor();
    assertThrows(IllegalArgumentException.class, () -> ingestor.ingest("public", "tasks", PROJECTS_DB, pages()));
    assertTrue(writer.writes.isEmpty());
  }
}
