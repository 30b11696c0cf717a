package io.intellixity.pagesync.sync;

import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.schema.TableSpecs;
import io.intellixity.pagesync.source.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Writes one batch of pages from a single page-store database into its entity table and
 * synchronizes their relations.
 */
public final class RecordIngestor {
  private static final Logger log = LoggerFactory.getLogger(RecordIngestor.class);

  private final PageSource source;
  private final TableNameMap names;
  private final EntityWriter writer;
  private final RelationSynchronizer relations;

  public RecordIngestor(PageSource source, TableNameMap names, EntityWriter writer, RelationSynchronizer relations) {
    this.source = Objects.requireNonNull(source, "source");
    this.names = Objects.requireNonNull(names, "names");
    this.writer = Objects.requireNonNull(writer, "writer");
    this.relations = Objects.requireNonNull(relations, "relations");
  }

  public IngestReport ingest(String schema, String table, String databaseId, List<PageRecord> pages) {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(pages, "pages");
    DatabaseSchema db = source.database(databaseId)
        .orElseThrow(() -> new IllegalArgumentException("Database " + databaseId + " not found in page source"));
    names.remember(db.id(), table);

    TableSpec spec = TableSpecs.fromDatabase(schema, table, db);
    writer.ensureTable(spec);

    ParsedRecords parsed = PageRecordParser.parse(pages);
    for (ParsedRow row : parsed.rows()) writer.write(spec, row);

    List<String> skipped = new ArrayList<>();
    for (PropertyDef p : db.relations()) {
      List<RelationEdge> edges = parsed.relations().get(p.name());
      if (edges == null || edges.isEmpty()) continue;
      try {
        String relatedTable = names.resolve(p.relationDatabaseId());
        PendingJoin join = relations.register(schema, table, relatedTable, p.name());
        relations.stage(join, edges);
      } catch (RuntimeException e) {
        log.warn("pagesync.ingest table={}.{} skipping relation property={}: {}", schema, table, p.name(), e.toString());
        skipped.add(p.name());
      }
    }
    for (String name : parsed.relations().keySet()) {
      if (db.properties().stream().noneMatch(p -> p.isRelation() && p.name().equals(name))) {
        log.warn("pagesync.ingest table={}.{} relation property={} not in database schema", schema, table, name);
        skipped.add(name);
      }
    }

    SyncReport report = relations.flush();
    log.info("pagesync.ingest table={}.{} rows={} joinTables={} skippedRelations={}",
        schema, table, parsed.rows().size(), report.tables().size(), skipped.size());
    return new IngestReport(schema, table, parsed.rows().size(), skipped, report);
  }
}
