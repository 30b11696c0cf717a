package io.intellixity.pagesync.query;

import java.util.*;

/** Structured SELECT description: target table, projection, filter groups, sort and limit. */
public final class TableQuery {
  private final String schema;
  private final String table;
  private List<String> columns = new ArrayList<>();
  private List<FilterGroup> filters = new ArrayList<>();
  private List<SortField> sort = new ArrayList<>();
  private Integer limit;

  public TableQuery(String schema, String table) {
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.table = Objects.requireNonNull(table, "table");
    if (table.isBlank()) throw new IllegalArgumentException("table is blank");
  }

  public String schema() { return schema; }
  public String table() { return table; }
  /** Empty means all columns. */
  public List<String> columns() { return columns; }
  public List<FilterGroup> filters() { return filters; }
  public List<SortField> sort() { return sort; }
  public Integer limit() { return limit; }

  public TableQuery withColumns(List<String> columns) { this.columns = new ArrayList<>(columns == null ? List.of() : columns); return this; }
  public TableQuery withFilters(List<FilterGroup> filters) { this.filters = new ArrayList<>(filters == null ? List.of() : filters); return this; }
  public TableQuery withFilter(FilterGroup group) { this.filters.add(Objects.requireNonNull(group, "group")); return this; }
  public TableQuery withSort(List<SortField> sort) { this.sort = new ArrayList<>(sort == null ? List.of() : sort); return this; }
  public TableQuery withLimit(Integer limit) {
    if (limit != null && limit < 0) throw new IllegalArgumentException("limit must be >= 0");
    this.limit = limit;
    return this;
  }

  public static TableQuery from(String schema, String table) {
    return new TableQuery(schema, table);
  }
}
