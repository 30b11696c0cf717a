package io.intellixity.pagesync.jdbc.dialect;

import io.intellixity.pagesync.compile.Bind;
import io.intellixity.pagesync.compile.Binds;
import io.intellixity.pagesync.dmlast.*;
import io.intellixity.pagesync.jdbc.SqlErrorClassifier;
import io.intellixity.pagesync.jdbc.SqlStatement;
import io.intellixity.pagesync.jdbc.SqlStatement.ExecKind;
import io.intellixity.pagesync.jdbc.bind.DefaultParameterBinder;
import io.intellixity.pagesync.jdbc.bind.ParameterBinder;
import io.intellixity.pagesync.query.*;
import io.intellixity.pagesync.schema.ColumnSpec;
import io.intellixity.pagesync.schema.JoinTableSpec;
import io.intellixity.pagesync.schema.TableSpec;

import java.util.*;

/**
 * JDBC-generic SQL dialect base.
 *
 * Provides common rendering for:
 * - select: projection + filter groups + sort + limit
 * - DML: insert/update/delete from DmlAst, plain inserts for {@link ConflictStrategy#NONE}
 * - additive DDL: schemas, tables, columns, join tables
 *
 * DB-specific dialects override hooks for quoting, pattern matching, limits and upsert syntax.
 * Identifiers are always quoted; values always travel as binds.
 */
public abstract class AbstractJdbcSqlDialect implements JdbcDialect {
  protected static final class RenderCtx {
    private int n = 1;
    private final List<Bind> binds = new ArrayList<>();
    public String add(Bind b) {
      binds.add(b);
      return ":b" + (n++);
    }
    public List<Bind> binds() { return binds; }
  }

  private final ParameterBinder binder;
  private final SqlErrorClassifier errors;

  protected AbstractJdbcSqlDialect() {
    this(new DefaultParameterBinder(), new SqlErrorClassifier());
  }

  protected AbstractJdbcSqlDialect(ParameterBinder binder, SqlErrorClassifier errors) {
    this.binder = Objects.requireNonNull(binder, "binder");
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  @Override public ParameterBinder parameterBinder() { return binder; }
  @Override public SqlErrorClassifier errorClassifier() { return errors; }

  @Override
  public final SqlStatement renderSelect(TableQuery q) {
    Objects.requireNonNull(q, "query");
    String projection = q.columns().isEmpty()
        ? "*"
        : String.join(", ", q.columns().stream().map(this::quoteIdent).toList());
    StringBuilder sql = new StringBuilder("SELECT ").append(projection).append(" FROM ").append(qualify(q.schema(), q.table()));

    RenderCtx ctx = new RenderCtx();
    String where = renderFilters(q.filters(), ctx);
    if (!where.isBlank()) sql.append(" WHERE ").append(where);
    sql.append(renderSort(q.sort()));
    String out = (q.limit() == null) ? sql.toString() : applyLimit(sql.toString(), q.limit());
    return new SqlStatement(out, ctx.binds(), ExecKind.QUERY);
  }

  @Override
  public SqlStatement renderInsert(InsertAst ins) {
    if (ins.columns().isEmpty()) throw new IllegalArgumentException("Insert has no columns");
    if (ins.rows().isEmpty()) throw new IllegalArgumentException("Insert has no rows");
    List<String> cols = ins.columns().stream().map(this::quoteIdent).toList();
    RenderCtx ctx = new RenderCtx();
    List<String> tuples = new ArrayList<>();
    for (List<Bind> row : ins.rows()) {
      List<String> ph = new ArrayList<>();
      for (Bind b : row) ph.add(ctx.add(b));
      tuples.add("(" + String.join(", ", ph) + ")");
    }
    String sql = "INSERT INTO " + qualify(ins.schema(), ins.table()) +
        " (" + String.join(", ", cols) + ") VALUES " + String.join(", ", tuples);
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public final SqlStatement renderUpsert(UpsertAst ups) {
    if (ups.strategy() == ConflictStrategy.NONE) return renderInsert(ups.insert());
    return renderConflictInsert(ups);
  }

  /** DB-specific {@code INSERT ... ON CONFLICT} (or equivalent) for OVERWRITE and IGNORE. */
  protected abstract SqlStatement renderConflictInsert(UpsertAst ups);

  @Override
  public SqlStatement renderUpdate(UpdateAst upd) {
    if (upd.sets().isEmpty()) throw new IllegalArgumentException("Update has no SET columns");
    RenderCtx ctx = new RenderCtx();
    List<String> sets = new ArrayList<>();
    for (ColumnBind cb : upd.sets()) sets.add(quoteIdent(cb.column()) + " = " + ctx.add(cb.bind()));
    String where = renderFilters(upd.where(), ctx);
    if (where.isBlank()) throw new QueryValidationException("UPDATE without filters is not allowed: " + upd.table());
    String sql = "UPDATE " + qualify(upd.schema(), upd.table()) + " SET " + String.join(", ", sets) + " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderDelete(DeleteAst del) {
    RenderCtx ctx = new RenderCtx();
    String where = renderFilters(del.where(), ctx);
    if (where.isBlank()) throw new QueryValidationException("DELETE without filters is not allowed: " + del.table());
    String sql = "DELETE FROM " + qualify(del.schema(), del.table()) + " WHERE " + where;
    return new SqlStatement(sql, ctx.binds(), ExecKind.UPDATE);
  }

  @Override
  public SqlStatement renderCreateSchema(String schema) {
    return SqlStatement.ddl("CREATE SCHEMA IF NOT EXISTS " + quoteIdent(schema));
  }

  @Override
  public SqlStatement renderCreateTable(TableSpec t) {
    if (t.columns().isEmpty()) throw new IllegalArgumentException("Table has no columns: " + t.table());
    List<String> defs = new ArrayList<>();
    for (ColumnSpec c : t.columns()) defs.add(quoteIdent(c.name()) + " " + c.type());
    List<String> pk = t.primaryKey();
    if (!pk.isEmpty()) defs.add("PRIMARY KEY (" + String.join(", ", pk.stream().map(this::quoteIdent).toList()) + ")");
    return SqlStatement.ddl("CREATE TABLE IF NOT EXISTS " + qualify(t.schema(), t.table()) + " (" + String.join(", ", defs) + ")");
  }

  @Override
  public SqlStatement renderAddColumn(String schema, String table, ColumnSpec c) {
    return SqlStatement.ddl("ALTER TABLE " + qualify(schema, table) +
        " ADD COLUMN IF NOT EXISTS " + quoteIdent(c.name()) + " " + c.type());
  }

  @Override
  public SqlStatement renderCreateJoinTable(JoinTableSpec j, String primaryKeyColumn) {
    String ref = quoteIdent(primaryKeyColumn);
    String sql = "CREATE TABLE IF NOT EXISTS " + qualify(j.schema(), j.tableName()) + " (" +
        quoteIdent(j.column1Name()) + " UUID, " +
        quoteIdent(j.column2Name()) + " UUID, " +
        "FOREIGN KEY (" + quoteIdent(j.column1Name()) + ") REFERENCES " +
        qualify(j.referenceSchema(), j.column1Table()) + " (" + ref + ") ON DELETE CASCADE, " +
        "FOREIGN KEY (" + quoteIdent(j.column2Name()) + ") REFERENCES " +
        qualify(j.referenceSchema(), j.column2Table()) + " (" + ref + ") ON DELETE CASCADE, " +
        "PRIMARY KEY (" + quoteIdent(j.column1Name()) + ", " + quoteIdent(j.column2Name()) + "))";
    return SqlStatement.ddl(sql);
  }

  @Override
  public SqlStatement renderListColumns(String schema, String table) {
    RenderCtx ctx = new RenderCtx();
    String sql = "SELECT column_name, data_type FROM information_schema.columns WHERE table_schema = " +
        ctx.add(Binds.of(schema)) + " AND table_name = " + ctx.add(Binds.of(table)) + " ORDER BY ordinal_position";
    return new SqlStatement(sql, ctx.binds(), ExecKind.QUERY);
  }

  public String qualify(String schema, String table) {
    return (schema == null || schema.isBlank()) ? quoteIdent(table) : quoteIdent(schema) + "." + quoteIdent(table);
  }

  /**
   * Renders a filter-group list. Each non-empty group is parenthesized and joined by its own
   * logic; a group's logic also joins it to the preceding rendered group. Blank when nothing renders.
   */
  protected String renderFilters(List<FilterGroup> groups, RenderCtx ctx) {
    if (groups == null || groups.isEmpty()) return "";
    StringBuilder out = new StringBuilder();
    for (FilterGroup g : groups) {
      if (g == null || g.isEmpty()) continue;
      List<String> parts = new ArrayList<>();
      for (FilterRule r : g.rules()) parts.add(renderRule(r, ctx));
      if (out.length() > 0) out.append(g.logic().sql());
      out.append('(').append(String.join(g.logic().sql(), parts)).append(')');
    }
    return out.toString();
  }

  protected String renderRule(FilterRule r, RenderCtx ctx) {
    String col = quoteIdent(r.property());
    Object value = r.value();
    return switch (r.operator()) {
      case EQUALS -> equality(col, value, false, ctx);
      case NOT_EQUALS -> equality(col, value, true, ctx);
      case GREATER_THAN -> ordering(r, col, ">", ctx);
      case LESS_THAN -> ordering(r, col, "<", ctx);
      case GREATER_OR_EQUAL -> ordering(r, col, ">=", ctx);
      case LESS_OR_EQUAL -> ordering(r, col, "<=", ctx);
      case CONTAINS -> renderPattern(col, ctx.add(Binds.of(containsPattern(r))), false);
      case NOT_CONTAINS -> renderPattern(col, ctx.add(Binds.of(containsPattern(r))), true);
      case STARTS_WITH -> renderPattern(col, ctx.add(Binds.of(escapeLike(patternText(r)) + "%")), false);
      case ENDS_WITH -> renderPattern(col, ctx.add(Binds.of("%" + escapeLike(patternText(r)))), false);
      case IS_NULL -> col + " IS NULL";
      case IS_NOT_NULL -> col + " IS NOT NULL";
      case IS_EMPTY -> "(" + col + " IS NULL OR " + col + " = '')";
      case IS_NOT_EMPTY -> "(" + col + " IS NOT NULL AND " + col + " <> '')";
    };
  }

  /**
   * Case-insensitive pattern match. Generic form lower-cases both sides; the escape character is
   * backslash, matching {@link #escapeLike}.
   */
  protected String renderPattern(String expr, String placeholder, boolean not) {
    return "LOWER(" + expr + ")" + (not ? " NOT LIKE " : " LIKE ") + "LOWER(" + placeholder + ") ESCAPE '\\'";
  }

  protected String applyLimit(String sql, int limit) {
    return sql + " FETCH FIRST " + limit + " ROWS ONLY";
  }

  protected String renderSort(List<SortField> sort) {
    if (sort == null || sort.isEmpty()) return "";
    List<String> parts = new ArrayList<>();
    for (SortField sf : sort) {
      parts.add(quoteIdent(sf.field()) + (sf.direction() == SortField.Direction.DESC ? " DESC" : " ASC")
          + (sf.nullsLast() ? " NULLS LAST" : " NULLS FIRST"));
    }
    return " ORDER BY " + String.join(", ", parts);
  }

  private String equality(String col, Object value, boolean not, RenderCtx ctx) {
    if (value == null) return col + (not ? " IS NOT NULL" : " IS NULL");
    if (value instanceof Collection<?> c) {
      if (c.isEmpty()) return not ? "TRUE" : "FALSE";
      List<String> ph = new ArrayList<>();
      for (Object x : c) ph.add(ctx.add(Binds.of(x)));
      return col + (not ? " NOT IN (" : " IN (") + String.join(", ", ph) + ")";
    }
    return col + (not ? " <> " : " = ") + ctx.add(Binds.of(value));
  }

  private static String ordering(FilterRule r, String col, String op, RenderCtx ctx) {
    if (r.value() == null) {
      throw new MalformedRuleException("Operator '" + r.operator().wireName() + "' on '" + r.property() + "' requires a value");
    }
    return col + " " + op + " " + ctx.add(Binds.of(r.value()));
  }

  /** Wrapped in %...% unless the caller already placed a wildcard; otherwise the text is literal. */
  private static String containsPattern(FilterRule r) {
    String v = patternText(r);
    return v.contains("%") ? v : "%" + escapeLike(v) + "%";
  }

  /** Escapes LIKE metacharacters so the text matches literally. */
  protected static String escapeLike(String s) {
    return s.replace("\\", "\\\\").replace("%", "\\%").replace("_", "\\_");
  }

  private static String patternText(FilterRule r) {
    if (r.value() == null) {
      throw new MalformedRuleException("Operator '" + r.operator().wireName() + "' on '" + r.property() + "' requires a value");
    }
    return String.valueOf(r.value());
  }
}
