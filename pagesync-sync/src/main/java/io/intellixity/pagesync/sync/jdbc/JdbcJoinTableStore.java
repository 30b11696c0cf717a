package io.intellixity.pagesync.sync.jdbc;

import io.intellixity.pagesync.dmlast.ConflictStrategy;
import io.intellixity.pagesync.jdbc.RecordQueries;
import io.intellixity.pagesync.jdbc.SchemaEvolution;
import io.intellixity.pagesync.jdbc.UpsertEngine;
import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.source.Ids;
import io.intellixity.pagesync.sync.JoinPair;
import io.intellixity.pagesync.sync.JoinTableStore;

import java.util.*;

import static io.intellixity.pagesync.query.FilterGroups.and;
import static io.intellixity.pagesync.query.FilterGroups.equalTo;

/** Join tables over JDBC; ids are bound as UUIDs and each call commits on its own. */
public final class JdbcJoinTableStore implements JoinTableStore {
  private final RecordQueries queries;
  private final UpsertEngine upserts;
  private final SchemaEvolution schema;
  private final String primaryKeyColumn;

  public JdbcJoinTableStore(RecordQueries queries, UpsertEngine upserts, SchemaEvolution schema, String primaryKeyColumn) {
    this.queries = Objects.requireNonNull(queries, "queries");
    this.upserts = Objects.requireNonNull(upserts, "upserts");
    this.schema = Objects.requireNonNull(schema, "schema");
    this.primaryKeyColumn = Objects.requireNonNull(primaryKeyColumn, "primaryKeyColumn");
  }

  @Override
  public Set<String> relatedIds(JoinTableSpec spec, String recordColumn, String recordId) {
    String relatedColumn = spec.otherColumn(recordColumn);
    Set<String> out = new LinkedHashSet<>();
    for (Map<String, Object> row : queries.selectWhereIn(null, spec.schema(), spec.tableName(), recordColumn,
        List.of(Ids.toUuid(recordId)), List.of(relatedColumn))) {
      String id = Ids.fromStored(row.get(relatedColumn));
      if (id != null) out.add(id);
    }
    return out;
  }

  @Override
  public int deleteAll(JoinTableSpec spec, String recordColumn, String recordId) {
    return queries.deleteWhere(null, spec.schema(), spec.tableName(),
        List.of(and(equalTo(recordColumn, Ids.toUuid(recordId)))));
  }

  @Override
  public int deleteRelated(JoinTableSpec spec, String recordColumn, String recordId, Collection<String> relatedIds) {
    if (relatedIds.isEmpty()) return 0;
    List<UUID> related = relatedIds.stream().map(Ids::toUuid).toList();
    return queries.deleteWhere(null, spec.schema(), spec.tableName(), List.of(and(
        equalTo(recordColumn, Ids.toUuid(recordId)),
        equalTo(spec.otherColumn(recordColumn), related))));
  }

  @Override
  public int insertIgnoringDuplicates(JoinTableSpec spec, List<JoinPair> rows) {
    if (rows.isEmpty()) return 0;
    List<String> columns = List.of(spec.column1Name(), spec.column2Name());
    List<List<UUID>> values = new ArrayList<>(rows.size());
    for (JoinPair p : rows) values.add(List.of(Ids.toUuid(p.first()), Ids.toUuid(p.second())));
    return upserts.upsertAll(null, spec.schema(), spec.tableName(), columns, values, columns, ConflictStrategy.IGNORE);
  }

  @Override
  public void ensure(JoinTableSpec spec) {
    schema.ensureJoinTable(null, spec, primaryKeyColumn);
  }
}
