package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.source.ParsedRow;

/** Materializes parsed pages as entity-table rows. */
public interface EntityWriter {
  void ensureTable(TableSpec spec);

  /** Overwriting upsert keyed on the primary key; evolves the table when columns are missing. */
  void write(TableSpec spec, ParsedRow row);
}
