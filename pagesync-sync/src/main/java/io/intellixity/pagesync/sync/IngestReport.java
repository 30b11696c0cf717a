package io.intellixity.pagesync.sync;

import java.util.List;
import java.util.Objects;

/**
 * @param skippedRelations relation properties that could not be registered (logged, not fatal)
 */
public record IngestReport(String schema, String table, int rowsWritten, List<String> skippedRelations, SyncReport relations) {
  public IngestReport {
    Objects.requireNonNull(table, "table");
    skippedRelations = List.copyOf(skippedRelations);
    Objects.requireNonNull(relations, "relations");
  }
}
