package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.JoinTableSpec;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * Row-level access to join tables. Ids are normalized 32-char hex strings.
 * <p>
 * Operations against a join table that does not exist throw
 * {@link io.intellixity.pagesync.store.UndefinedTableException}.
 */
public interface JoinTableStore {
  /** Related ids currently stored for {@code recordId} in {@code recordColumn}. */
  Set<String> relatedIds(JoinTableSpec spec, String recordColumn, String recordId);

  int deleteAll(JoinTableSpec spec, String recordColumn, String recordId);

  int deleteRelated(JoinTableSpec spec, String recordColumn, String recordId, Collection<String> relatedIds);

  /** Inserts in one statement, skipping rows that already exist. */
  int insertIgnoringDuplicates(JoinTableSpec spec, List<JoinPair> rows);

  void ensure(JoinTableSpec spec);
}
