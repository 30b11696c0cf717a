package io.intellixity.pagesync.store;

/**
 * Insert referenced a row that does not exist.
 * <p>
 * {@link #keyValue()} is the offending referenced id when the driver reported it, else {@code null}.
 */
public final class ForeignKeyViolationException extends StoreException {
  private final String keyColumn;
  private final String keyValue;
  private final String referencedTable;

  public ForeignKeyViolationException(String message, String sqlState, Throwable cause,
                                      String keyColumn, String keyValue, String referencedTable) {
    super(message, sqlState, cause);
    this.keyColumn = keyColumn;
    this.keyValue = keyValue;
    this.referencedTable = referencedTable;
  }

  public String keyColumn() { return keyColumn; }
  public String keyValue() { return keyValue; }
  public String referencedTable() { return referencedTable; }
}
