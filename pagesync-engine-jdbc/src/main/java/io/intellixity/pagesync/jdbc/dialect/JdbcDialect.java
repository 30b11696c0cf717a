package io.intellixity.pagesync.jdbc.dialect;

import io.intellixity.pagesync.compile.Binds;
import io.intellixity.pagesync.dmlast.ColumnBind;
import io.intellixity.pagesync.dmlast.DeleteAst;
import io.intellixity.pagesync.dmlast.InsertAst;
import io.intellixity.pagesync.dmlast.UpdateAst;
import io.intellixity.pagesync.dmlast.UpsertAst;
import io.intellixity.pagesync.jdbc.SqlErrorClassifier;
import io.intellixity.pagesync.jdbc.SqlStatement;
import io.intellixity.pagesync.jdbc.bind.ParameterBinder;
import io.intellixity.pagesync.query.FilterGroup;
import io.intellixity.pagesync.query.TableQuery;
import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.schema.TableSpec;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

public interface JdbcDialect {
  String id();

  SqlStatement renderSelect(TableQuery query);

  SqlStatement renderInsert(InsertAst insert);

  SqlStatement renderUpsert(UpsertAst upsert);

  SqlStatement renderUpdate(UpdateAst update);

  SqlStatement renderDelete(DeleteAst delete);

  default SqlStatement renderUpdate(String schema, String table, Map<String, ?> sets, List<FilterGroup> filters) {
    List<ColumnBind> cbs = new ArrayList<>();
    if (sets != null) sets.forEach((col, v) -> cbs.add(new ColumnBind(col, Binds.of(v))));
    return renderUpdate(new UpdateAst(schema, table, cbs, filters));
  }

  default SqlStatement renderDelete(String schema, String table, List<FilterGroup> filters) {
    return renderDelete(new DeleteAst(schema, table, filters));
  }

  SqlStatement renderCreateSchema(String schema);

  SqlStatement renderCreateTable(TableSpec table);

  SqlStatement renderAddColumn(String schema, String table, ColumnSpec column);

  SqlStatement renderCreateJoinTable(JoinTableSpec join, String primaryKeyColumn);

  SqlStatement renderListColumns(String schema, String table);

  String quoteIdent(String ident);

  ParameterBinder parameterBinder();

  SqlErrorClassifier errorClassifier();
}
