package io.intellixity.pagesync.sync.jdbc;

import io.intellixity.pagesync.jdbc.SchemaEvolution;
import io.intellixity.pagesync.jdbc.UpsertEngine;
import io.intellixity.pagesync.schema.TableSpec;
import io.intellixity.pagesync.source.ParsedRow;
import io.intellixity.pagesync.sync.EntityWriter;

import java.util.Objects;

public final class JdbcEntityWriter implements EntityWriter {
  private final SchemaEvolution schema;
  private final UpsertEngine upserts;

  public JdbcEntityWriter(SchemaEvolution schema, UpsertEngine upserts) {
    this.schema = Objects.requireNonNull(schema, "schema");
    this.upserts = Objects.requireNonNull(upserts, "upserts");
  }

  @Override
  public void ensureTable(TableSpec spec) {
    schema.ensureTable(null, spec);
  }

  @Override
  public void write(TableSpec spec, ParsedRow row) {
    upserts.upsertEvolving(null, spec, row.columns(), row.valueList());
  }
}
