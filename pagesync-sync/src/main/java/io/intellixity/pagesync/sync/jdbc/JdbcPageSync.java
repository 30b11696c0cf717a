package io.intellixity.pagesync.sync.jdbc;

import io.intellixity.pagesync.jdbc.ConnectionManager;
import io.intellixity.pagesync.jdbc.JdbcConfig;
import io.intellixity.pagesync.jdbc.RecordQueries;
import io.intellixity.pagesync.jdbc.SchemaEvolution;
import io.intellixity.pagesync.jdbc.UpsertEngine;
import io.intellixity.pagesync.source.PageSource;
import io.intellixity.pagesync.sync.*;

import java.util.Objects;
import java.util.Properties;

/**
 * Wires the JDBC stores, name map and synchronizer for one page source.
 * <p>
 * Shares the connection manager and the name map cache across runs; every
 * {@link #newIngestor()} gets its own {@link RelationSynchronizer}.
 */
public final class JdbcPageSync implements AutoCloseable {
  private final ConnectionManager connections;
  private final SyncConfig config;
  private final PageSource source;
  private final UpsertEngine upserts;
  private final TableNameMap names;
  private final JdbcJoinTableStore joins;
  private final JdbcEntityWriter writer;

  public JdbcPageSync(ConnectionManager connections, SyncConfig config, PageSource source) {
    this.connections = Objects.requireNonNull(connections, "connections");
    this.config = Objects.requireNonNull(config, "config");
    this.source = Objects.requireNonNull(source, "source");
    SchemaEvolution schema = new SchemaEvolution(connections);
    RecordQueries queries = new RecordQueries(connections);
    this.upserts = new UpsertEngine(connections, schema);
    this.names = new TableNameMap(new JdbcNameMapStore(queries, upserts, config), source);
    this.joins = new JdbcJoinTableStore(queries, upserts, schema, config.getPrimaryKeyColumn());
    this.writer = new JdbcEntityWriter(schema, upserts);
  }

  /** Reads {@code pagesync.db.*} and {@code pagesync.sync.*}. */
  public static JdbcPageSync fromProperties(Properties p, PageSource source) {
    ConnectionManager cm = new ConnectionManager(JdbcConfig.fromProperties(p, JdbcConfig.DEFAULT_PREFIX));
    return new JdbcPageSync(cm, SyncConfig.fromProperties(p, SyncConfig.DEFAULT_PREFIX), source);
  }

  public RelationSynchronizer newSynchronizer() {
    return new RelationSynchronizer(config, joins, new ForeignKeyHealer(source, names, writer));
  }

  public RecordIngestor newIngestor() {
    return new RecordIngestor(source, names, writer, newSynchronizer());
  }

  public TableNameMap names() { return names; }
  public UpsertEngine upserts() { return upserts; }
  public ConnectionManager connections() { return connections; }

  @Override
  public void close() {
    connections.close();
  }
}
