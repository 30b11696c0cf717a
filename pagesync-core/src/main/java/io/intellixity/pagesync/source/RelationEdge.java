package io.intellixity.pagesync.source;

import java.util.Objects;

/**
 * One desired join row. A {@code null} related id means "this record has no relations": purge it.
 */
public record RelationEdge(String recordId, String relatedId) {
  public RelationEdge {
    Objects.requireNonNull(recordId, "recordId");
  }

  public static RelationEdge purge(String recordId) {
    return new RelationEdge(recordId, null);
  }

  public boolean isPurge() { return relatedId == null; }
}
