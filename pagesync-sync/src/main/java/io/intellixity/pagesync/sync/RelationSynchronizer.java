package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.Ids;
import io.intellixity.pagesync.source.RelationEdge;
import io.intellixity.pagesync.store.ForeignKeyViolationException;
import io.intellixity.pagesync.store.UndefinedTableException;
import io.intellixity.pagesync.sync.SyncReport.TableResult;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;
import java.util.function.Supplier;

/**
 * Reconciles staged relation edges against join tables.
 * <p>
 * Per join table and flush: purge records whose relation is empty, delete stored pairs that are no
 * longer desired, then insert the missing ones in batches, materializing missing referenced records
 * on foreign-key violations. Join tables fail independently; there is no cross-table rollback.
 * Not thread-safe: one instance per ingestion run.
 */
public final class RelationSynchronizer {
  private static final Logger log = LoggerFactory.getLogger(RelationSynchronizer.class);

  private final SyncConfig config;
  private final JoinTableStore store;
  private final ForeignKeyHealer healer;
  private final SyncState state = new SyncState();

  public RelationSynchronizer(SyncConfig config, JoinTableStore store, ForeignKeyHealer healer) {
    this.config = Objects.requireNonNull(config, "config");
    this.store = Objects.requireNonNull(store, "store");
    this.healer = Objects.requireNonNull(healer, "healer");
  }

  /**
   * Registers a relation property of {@code table} pointing at {@code relatedTable}. Properties that
   * resolve to the same join table share one pending entry.
   */
  public PendingJoin register(String schema, String table, String relatedTable, String property) {
    JoinTableSpec spec = JoinTableSpec.derive(config.getJoinSchema(), schema, table, relatedTable);
    PendingJoin join = state.register(spec, spec.columnFor(table), property);
    log.debug("pagesync.sync registered property={} joinTable={}.{} recordColumn={}",
        property, spec.schema(), spec.tableName(), join.recordColumn());
    return join;
  }

  public void stage(PendingJoin join, Collection<RelationEdge> edges) {
    Objects.requireNonNull(join, "join");
    if (edges == null || edges.isEmpty()) return;
    state.stage(join.spec().tableName(), edges);
  }

  public SyncState state() { return state; }

  /** Applies and clears everything staged so far. */
  public SyncReport flush() {
    List<TableResult> results = new ArrayList<>();
    try {
      for (PendingJoin join : state.pending()) results.add(new Run(join).execute());
    } finally {
      state.clear();
    }
    SyncReport report = new SyncReport(results);
    log.info("pagesync.sync flushed joinTables={} failed={} inserted={}",
        results.size(), report.failures().size(), report.inserted());
    return report;
  }

  private final class Run {
    private final PendingJoin join;
    private final JoinTableSpec spec;
    private int purged;
    private int deleted;
    private int inserted;
    private int healed;
    private boolean ensured;

    Run(PendingJoin join) {
      this.join = join;
      this.spec = join.spec();
    }

    TableResult execute() {
      try {
        apply();
      } catch (RuntimeException e) {
        log.error("pagesync.sync joinTable={}.{} failed purged={} deleted={} inserted={} healed={}",
            spec.schema(), spec.tableName(), purged, deleted, inserted, healed, e);
        return new TableResult(spec.tableName(), purged, deleted, inserted, healed, e);
      }
      log.info("pagesync.sync joinTable={}.{} purged={} deleted={} inserted={} healed={}",
          spec.schema(), spec.tableName(), purged, deleted, inserted, healed);
      return new TableResult(spec.tableName(), purged, deleted, inserted, healed, null);
    }

    private void apply() {
      String recordColumn = join.recordColumn();
      Set<String> purges = new LinkedHashSet<>();
      Map<String, Set<String>> desired = new LinkedHashMap<>();
      for (RelationEdge e : join.edges()) {
        String recordId = Ids.normalize(e.recordId());
        if (e.isPurge()) {
          purges.add(recordId);
        } else {
          desired.computeIfAbsent(recordId, k -> new LinkedHashSet<>()).add(Ids.normalize(e.relatedId()));
        }
      }
      // A record with real edges from another property is reconciled by the diff instead.
      purges.removeAll(desired.keySet());

      for (String recordId : purges) {
        purged += withJoinTable(() -> store.deleteAll(spec, recordColumn, recordId));
      }

      List<JoinPair> missing = new ArrayList<>();
      for (Map.Entry<String, Set<String>> e : desired.entrySet()) {
        String recordId = e.getKey();
        Set<String> want = e.getValue();
        Set<String> current = withJoinTable(() -> store.relatedIds(spec, recordColumn, recordId));
        List<String> stale = current.stream().filter(id -> !want.contains(id)).toList();
        if (!stale.isEmpty()) {
          deleted += withJoinTable(() -> store.deleteRelated(spec, recordColumn, recordId, stale));
        }
        for (String relatedId : want) {
          if (!current.contains(relatedId)) missing.add(join.pair(recordId, relatedId));
        }
      }

      int size = config.getInsertBatchSize();
      for (int i = 0; i < missing.size(); i += size) {
        insertBatch(missing.subList(i, Math.min(missing.size(), i + size)));
      }
    }

    /** Retries after each successful heal; a second violation on the same key is fatal. */
    private void insertBatch(List<JoinPair> batch) {
      Set<String> attempted = new HashSet<>();
      while (true) {
        try {
          inserted += withJoinTable(() -> store.insertIgnoringDuplicates(spec, batch));
          return;
        } catch (ForeignKeyViolationException e) {
          String key = e.keyValue();
          if (!Ids.isId(key)) {
            throw new UnresolvableForeignKeyException(key, "Foreign key violation without a usable key value on "
                + spec.tableName(), e);
          }
          String id = Ids.normalize(key);
          if (!attempted.add(id)) throw e;
          log.warn("pagesync.sync joinTable={}.{} foreign key violation key={} referencedTable={}; healing",
              spec.schema(), spec.tableName(), id, e.referencedTable());
          healer.heal(spec.referenceSchema(), id);
          healed++;
        }
      }
    }

    private <T> T withJoinTable(Supplier<T> op) {
      try {
        return op.get();
      } catch (UndefinedTableException e) {
        if (ensured) throw e;
        ensured = true;
        log.info("pagesync.sync joinTable={}.{} missing; creating and retrying", spec.schema(), spec.tableName());
        store.ensure(spec);
        return op.get();
      }
    }
  }
}
