package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.schema.TableSpecs;
import io.intellixity.pagesync.source.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * Materializes a record that a join row references but the entity table lacks: fetch it from the
 * page source, find its table through the name map and upsert it.
 */
public final class ForeignKeyHealer {
  private static final Logger log = LoggerFactory.getLogger(ForeignKeyHealer.class);

  private final PageSource source;
  private final TableNameMap names;
  private final EntityWriter writer;

  public ForeignKeyHealer(PageSource source, TableNameMap names, EntityWriter writer) {
    this.source = Objects.requireNonNull(source, "source");
    this.names = Objects.requireNonNull(names, "names");
    this.writer = Objects.requireNonNull(writer, "writer");
  }

  /**
   * @param schema   schema of the entity tables
   * @param keyValue the missing id, dashed or not
   * @return the table the record was written to
   * @throws UnresolvableForeignKeyException when the record or its database cannot be loaded
   */
  public String heal(String schema, String keyValue) {
    if (!Ids.isId(keyValue)) {
      throw new UnresolvableForeignKeyException(keyValue, "Foreign key value is not a page id: " + keyValue);
    }
    String id = Ids.normalize(keyValue);

    PageRecord page;
    DatabaseSchema db;
    String table;
    try {
      page = source.page(id)
          .orElseThrow(() -> new UnresolvableForeignKeyException(id, "Page " + id + " not found in page source"));
      if (page.databaseId() == null) {
        throw new UnresolvableForeignKeyException(id, "Page " + id + " does not belong to a database");
      }
      db = source.database(page.databaseId())
          .orElseThrow(() -> new UnresolvableForeignKeyException(id, "Database " + page.databaseId() + " not found"));
      table = names.resolve(db.id());
    } catch (UnresolvableForeignKeyException e) {
      throw e;
    } catch (RuntimeException e) {
      throw new UnresolvableForeignKeyException(id, "Failed to fetch page " + id + ": " + e.getMessage(), e);
    }

    TableSpec spec = TableSpecs.fromDatabase(schema, table, db);
    ParsedRow row = PageRecordParser.parse(List.of(page)).rows().get(0);
    writer.write(spec, row);
    log.info("pagesync.heal materialized record={} table={}.{}", id, schema, table);
    return table;
  }
}
