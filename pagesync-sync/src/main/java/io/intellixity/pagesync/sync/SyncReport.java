package io.intellixity.pagesync.sync;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/** Outcome of one flush, per join table. */
public record SyncReport(List<TableResult> tables) {
  public SyncReport {
    tables = List.copyOf(tables);
  }

  /**
   * @param failure the error that stopped this join table, or {@code null}; counters cover the
   *                work done before it
   */
  public record TableResult(String joinTable, int purged, int deleted, int inserted, int healed, RuntimeException failure) {
    public TableResult {
      Objects.requireNonNull(joinTable, "joinTable");
    }

    public boolean succeeded() { return failure == null; }
  }

  public Optional<TableResult> table(String joinTable) {
    return tables.stream().filter(t -> t.joinTable().equals(joinTable)).findFirst();
  }

  public List<TableResult> failures() {
    return tables.stream().filter(t -> !t.succeeded()).toList();
  }

  public boolean succeeded() { return failures().isEmpty(); }

  public int inserted() { return tables.stream().mapToInt(TableResult::inserted).sum(); }
}
