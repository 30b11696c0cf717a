package io.intellixity.pagesync.schema;

import java.util.Objects;

/**
 * Many-to-many join table between two entity tables.
 * <p>
 * {@link #derive} is deterministic in the unordered pair of table names, so both sides of a
 * relation land in the same join table.
 */
public record JoinTableSpec(
    String schema,
    String tableName,
    String column1Name,
    String column1Table,
    String column2Name,
    String column2Table,
    String referenceSchema
) {
  public JoinTableSpec {
    Objects.requireNonNull(schema, "schema");
    Objects.requireNonNull(tableName, "tableName");
    Objects.requireNonNull(column1Name, "column1Name");
    Objects.requireNonNull(column1Table, "column1Table");
    Objects.requireNonNull(column2Name, "column2Name");
    Objects.requireNonNull(column2Table, "column2Table");
    Objects.requireNonNull(referenceSchema, "referenceSchema");
    if (column1Name.equals(column2Name)) throw new IllegalArgumentException("Join columns must differ: " + column1Name);
  }

  public static JoinTableSpec derive(String joinSchema, String referenceSchema, String tableA, String tableB) {
    Objects.requireNonNull(tableA, "tableA");
    Objects.requireNonNull(tableB, "tableB");
    String first = tableA.compareTo(tableB) <= 0 ? tableA : tableB;
    String second = first.equals(tableA) ? tableB : tableA;
    String col1 = first + "_id";
    String col2 = first.equals(second) ? second + "_id2" : second + "_id";
    return new JoinTableSpec(joinSchema, referenceSchema + "_" + first + "_" + second,
        col1, first, col2, second, referenceSchema);
  }

  /** Column holding ids of {@code table}; for a self-relation this is the first column. */
  public String columnFor(String table) {
    if (column1Table.equals(table)) return column1Name;
    if (column2Table.equals(table)) return column2Name;
    throw new IllegalArgumentException("Table '" + table + "' is not part of join table " + tableName);
  }

  public String otherColumn(String column) {
    if (column1Name.equals(column)) return column2Name;
    if (column2Name.equals(column)) return column1Name;
    throw new IllegalArgumentException("Column '" + column + "' is not part of join table " + tableName);
  }
}
