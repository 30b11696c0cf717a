package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.source.DatabaseSchema;
import io.intellixity.pagesync.source.Ids;
import io.intellixity.pagesync.source.PageSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Database id to table name, cached in memory.
 * <p>
 * A miss consults the persistent {@link NameMapStore}, then the page source's database title, and
 * writes the result back to both. Safe for concurrent readers; concurrent misses for the same id
 * may resolve twice, with the same result.
 */
public final class TableNameMap {
  private static final Logger log = LoggerFactory.getLogger(TableNameMap.class);

  private final NameMapStore store;
  private final PageSource source;
  private final Map<String, String> cache = new HashMap<>();
  private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

  public TableNameMap(NameMapStore store, PageSource source) {
    this.store = Objects.requireNonNull(store, "store");
    this.source = Objects.requireNonNull(source, "source");
  }

  public String resolve(String databaseId) {
    String id = Ids.normalize(Objects.requireNonNull(databaseId, "databaseId"));
    String cached = cached(id);
    if (cached != null) return cached;

    Optional<String> stored = store.find(id);
    if (stored.isPresent()) {
      cache(id, stored.get());
      return stored.get();
    }

    DatabaseSchema db = source.database(id)
        .orElseThrow(() -> new IllegalArgumentException("Database " + id + " not found in page source"));
    String table = db.title();
    if (table == null || table.isBlank()) throw new IllegalStateException("Database " + id + " has no title");
    store.save(id, table);
    cache(id, table);
    log.info("pagesync.namemap resolved databaseId={} table={} from page source", id, table);
    return table;
  }

  /** Records a known mapping, e.g. the table an ingestion run writes to. */
  public void remember(String databaseId, String table) {
    String id = Ids.normalize(Objects.requireNonNull(databaseId, "databaseId"));
    Objects.requireNonNull(table, "table");
    if (table.equals(cached(id))) return;
    if (!table.equals(store.find(id).orElse(null))) store.save(id, table);
    cache(id, table);
  }

  private String cached(String id) {
    lock.readLock().lock();
    try {
      return cache.get(id);
    } finally {
      lock.readLock().unlock();
    }
  }

  private void cache(String id, String table) {
    lock.writeLock().lock();
    try {
      cache.put(id, table);
    } finally {
      lock.writeLock().unlock();
    }
  }
}
