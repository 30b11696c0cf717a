package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.RelationEdge;
import io.intellixity.pagesync.store.ForeignKeyViolationException;
import io.intellixity.pagesync.sync.SyncReport.TableResult;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

final class RelationSynchronizerTest {
  private static final String PROJECTS_DB = id(0xd1);
  private static final String T1 = id(1);
  private static final String T2 = id(2);
  private static final String P1 = id(11);
  private static final String P2 = id(12);
  private static final String P3 = id(13);
  private static final JoinTableSpec TASKS_PROJECTS = JoinTableSpec.derive("Join", "public", "tasks", "projects");
  private static final JoinTableSpec TASKS_TASKS = JoinTableSpec.derive("Join", "public", "tasks", "tasks");

  private final InMemoryJoinTables store = new InMemoryJoinTables();
  private final FakePageSource source = new FakePageSource().database(PROJECTS_DB, "projects");
  private final InMemoryNameMap nameStore = new InMemoryNameMap();
  private final RecordingEntityWriter writer = new RecordingEntityWriter();
  private final SyncConfig config = new SyncConfig();

  static String id(int n) {
    return String.format("%032x", n);
  }

  private RelationSynchronizer sync() {
    TableNameMap names = new TableNameMap(nameStore, source);
    return new RelationSynchronizer(config, store, new ForeignKeyHealer(source, names, writer));
  }

  private static RelationEdge edge(String record, String related) {
    return new RelationEdge(record, related);
  }

  @Test
  void recordLandsInTheColumnOfItsOwnTable() {
    store.create(TASKS_PROJECTS);
    RelationSynchronizer sync = sync();
    PendingJoin join = sync.register("public", "tasks", "projects", "Project");
    sync.stage(join, List.of(edge(T1, P1)));

    SyncReport report = sync.flush();

    assertEquals("public_projects_tasks", TASKS_PROJECTS.tableName());
    assertEquals("tasks_id", join.recordColumn());
    assertEquals("projects_id", join.relatedColumn());
    assertEquals(Set.of(new JoinPair(P1, T1)), store.rows(TASKS_PROJECTS));
    assertEquals(1, report.inserted());
    assertTrue(report.succeeded());
    assertTrue(sync.state().isEmpty());
  }

  @Test
  void selfRelationUsesFirstColumnForTheRecord() {
    store.create(TASKS_TASKS);
    RelationSynchronizer sync = sync();
    PendingJoin join = sync.register("public", "tasks", "tasks", "Blocked By");
    sync.stage(join, List.of(edge(T2, T1)));

    sync.flush();

    assertEquals("tasks_id", join.recordColumn());
    assertEquals("tasks_id2", join.relatedColumn());
    assertEquals(Set.of(new JoinPair(T2, T1)), store.rows(TASKS_TASKS));
  }

  @Test
  void repeatedFlushOfSameEdgesChangesNothing() {
    store.create(TASKS_PROJECTS);
    RelationSynchronizer sync = sync();
    List<RelationEdge> edges = List.of(edge(T1, P1), edge(T1, P2), edge(T2, P1));
    sync.stage(sync.register("public", "tasks", "projects", "Project"), edges);
    sync.flush();
    Set<JoinPair> after = Set.copyOf(store.rows(TASKS_PROJECTS));
    store.calls.clear();

    sync.stage(sync.register("public", "tasks", "projects", "Project"), edges);
    TableResult second = sync.flush().table("public_projects_tasks").orElseThrow();

    assertEquals(after, store.rows(TASKS_PROJECTS));
    assertEquals(0, second.inserted());
    assertEquals(0, second.deleted());
    assertEquals(List.of("read " + T1, "read " + T2), store.calls);
  }

  @Test
  void diffDeletesOnlyStaleAndInsertsOnlyMissing() {
    store.create(TASKS_PROJECTS, new JoinPair(P1, T1), new JoinPair(P2, T1), new JoinPair(P1, T2));
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P2), edge(T1, P3)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    assertEquals(1, r.deleted());
    assertEquals(1, r.inserted());
    assertEquals(Set.of(new JoinPair(P2, T1), new JoinPair(P3, T1), new JoinPair(P1, T2)), store.rows(TASKS_PROJECTS));
    assertEquals(List.of("read " + T1, "delete " + T1 + " [" + P1 + "]", "insert 1"), store.calls);
  }

  @Test
  void purgeRemovesEveryRowOfTheRecordOnly() {
    store.create(TASKS_PROJECTS, new JoinPair(P1, T1), new JoinPair(P2, T1), new JoinPair(P1, T2));
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(RelationEdge.purge(T1)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    assertEquals(2, r.purged());
    assertEquals(Set.of(new JoinPair(P1, T2)), store.rows(TASKS_PROJECTS));
  }

  @Test
  void purgeSignalIsIgnoredWhenAnotherPropertyGivesRealEdges() {
    store.create(TASKS_PROJECTS, new JoinPair(P1, T1));
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(RelationEdge.purge(T1)));
    sync.stage(sync.register("public", "tasks", "projects", "Other Project"), List.of(edge(T1, P1)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    assertEquals(0, r.purged());
    assertEquals(Set.of(new JoinPair(P1, T1)), store.rows(TASKS_PROJECTS));
  }

  @Test
  void missingJoinTableIsCreatedOnceAndRetried() {
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P1)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    assertTrue(r.succeeded());
    assertEquals(1, store.ensureCalls);
    assertEquals(Set.of(new JoinPair(P1, T1)), store.rows(TASKS_PROJECTS));
  }

  @Test
  void insertsAreBatched() {
    config.setInsertBatchSize(2);
    store.create(TASKS_PROJECTS);
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"),
        List.of(edge(T1, id(21)), edge(T1, id(22)), edge(T1, id(23)), edge(T1, id(24)), edge(T1, id(25))));

    assertEquals(5, sync.flush().inserted());
    assertEquals(3, store.calls.stream().filter(c -> c.startsWith("insert")).count());
  }

  @Test
  void missingReferencedRecordIsFetchedAndMaterialized() {
    Set<String> entities = new HashSet<>(Set.of(T1, P1));
    store.entities = entities;
    writer.entities = entities;
    source.page(P3, PROJECTS_DB);
    store.create(TASKS_PROJECTS);
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P1), edge(T1, P3)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    assertTrue(r.succeeded());
    assertEquals(1, r.healed());
    assertEquals(2, r.inserted());
    assertEquals(List.of("public.projects:" + P3), writer.writes);
    assertEquals("projects", nameStore.rows.get(PROJECTS_DB));
  }

  @Test
  void unfetchableRecordFailsOnlyItsJoinTable() {
    store.entities = new HashSet<>(Set.of(T1, T2));
    store.create(TASKS_PROJECTS);
    store.create(TASKS_TASKS);
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P3)));
    sync.stage(sync.register("public", "tasks", "tasks", "Blocked By"), List.of(edge(T2, T1)));

    SyncReport report = sync.flush();

    TableResult failed = report.table("public_projects_tasks").orElseThrow();
    UnresolvableForeignKeyException e = assertInstanceOf(UnresolvableForeignKeyException.class, failed.failure());
    assertEquals(P3, e.keyValue());
    assertTrue(report.table("public_tasks_tasks").orElseThrow().succeeded());
    assertEquals(Set.of(new JoinPair(T2, T1)), store.rows(TASKS_TASKS));
    assertEquals(1, report.failures().size());
  }

  @Test
  void pageSourceErrorsSurfaceAsUnresolvable() {
    store.entities = new HashSet<>(Set.of(T1));
    source.failure = new IllegalStateException("page store unavailable");
    store.create(TASKS_PROJECTS);
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P3)));

    TableResult r = sync.flush().table("public_projects_tasks").orElseThrow();

    UnresolvableForeignKeyException e = assertInstanceOf(UnresolvableForeignKeyException.class, r.failure());
    assertSame(source.failure, e.getCause());
  }

  @Test
  void secondViolationOnSameKeyIsFatalForThatTable() {
    // The write succeeds but never satisfies the key.
    store.entities = new HashSet<>(Set.of(T1, T2));
    source.page(P3, PROJECTS_DB);
    store.create(TASKS_PROJECTS);
    store.create(TASKS_TASKS);
    RelationSynchronizer sync = sync();
    sync.stage(sync.register("public", "tasks", "projects", "Project"), List.of(edge(T1, P3)));
    sync.stage(sync.register("public", "tasks", "tasks", "Blocked By"), List.of(edge(T1, T2)));

    SyncReport report = sync.flush();

    TableResult failed = report.table("public_projects_tasks").orElseThrow();
    assertInstanceOf(ForeignKeyViolationException.class, failed.failure());
    assertEquals(1, failed.healed());
    assertEquals(0, failed.inserted());
    assertTrue(report.table("public_tasks_tasks").orElseThrow().succeeded());
  }

  @Test
  void stagingWithoutRegistrationIsRejected() {
    RelationSynchronizer sync = sync();
    PendingJoin join = sync.register("public", "tasks", "projects", "Project");
    sync.flush();
    assertThrows(IllegalArgumentException.class, () -> sync.stage(join, List.of(edge(T1, P1))));
  }
}
