package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.RelationEdge;

import java.util.*;

/**
 * Edges staged for one join table, oriented from the record's side: the record id goes in
 * {@link #recordColumn()}, the related id in {@link #relatedColumn()}.
 */
public final class PendingJoin {
  private final JoinTableSpec spec;
  private final String recordColumn;
  private final String relatedColumn;
  private final Set<String> properties = new LinkedHashSet<>();
  private final List<RelationEdge> edges = new ArrayList<>();

  PendingJoin(JoinTableSpec spec, String recordColumn) {
    this.spec = Objects.requireNonNull(spec, "spec");
    this.recordColumn = Objects.requireNonNull(recordColumn, "recordColumn");
    this.relatedColumn = spec.otherColumn(recordColumn);
  }

  public JoinTableSpec spec() { return spec; }
  public String recordColumn() { return recordColumn; }
  public String relatedColumn() { return relatedColumn; }
  public Set<String> properties() { return Collections.unmodifiableSet(properties); }
  public List<RelationEdge> edges() { return Collections.unmodifiableList(edges); }

  void addProperty(String property) { properties.add(property); }
  void addEdges(Collection<RelationEdge> more) { edges.addAll(more); }

  /** Join row for an edge in column order. */
  JoinPair pair(String recordId, String relatedId) {
    return recordColumn.equals(spec.column1Name())
        ? new JoinPair(recordId, relatedId)
        : new JoinPair(relatedId, recordId);
  }
}
