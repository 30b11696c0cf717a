package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.RelationEdge;

import java.util.*;

/** Join table name to its staged edges, accumulated across records until the next flush. */
public final class SyncState {
  private final Map<String, PendingJoin> joins = new LinkedHashMap<>();

  PendingJoin register(JoinTableSpec spec, String recordColumn, String property) {
    PendingJoin join = joins.get(spec.tableName());
    if (join == null) {
      join = new PendingJoin(spec, recordColumn);
      joins.put(spec.tableName(), join);
    } else if (!join.recordColumn().equals(recordColumn)) {
      throw new IllegalStateException("Join table " + spec.tableName() + " already staged from column "
          + join.recordColumn() + ", not " + recordColumn);
    }
    join.addProperty(property);
    return join;
  }

  void stage(String joinTable, Collection<RelationEdge> edges) {
    PendingJoin join = joins.get(joinTable);
    if (join == null) throw new IllegalArgumentException("Join table not registered: " + joinTable);
    join.addEdges(edges);
  }

  public Optional<PendingJoin> get(String joinTable) {
    return Optional.ofNullable(joins.get(joinTable));
  }

  public Collection<PendingJoin> pending() { return Collections.unmodifiableCollection(joins.values()); }

  public boolean isEmpty() { return joins.isEmpty(); }

  void clear() { joins.clear(); }
}
