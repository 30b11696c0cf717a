package io.intellixity.pagesync.source;

import java.util.Optional;

/**
 * Read access to the external page store.
 * <p>
 * Implementations return {@link Optional#empty()} for ids the store does not know and throw
 * for transport failures.
 */
public interface PageSource {
  Optional<PageRecord> page(String id);

  Optional<DatabaseSchema> database(String id);
}
