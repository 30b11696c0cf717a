package io.intellixity.pagesync.sync;

import java.util.Optional;

/** Persistent database id to table name mapping. */
public interface NameMapStore {
  Optional<String> find(String databaseId);

  void save(String databaseId, String tableName);
}
