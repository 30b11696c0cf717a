package io.intellixity.pagesync.store;

/** Base type for translated relational-store failures. */
public class StoreException extends RuntimeException {
  private final String sqlState;

  public StoreException(String message) {
    this(message, null, null);
  }

  public StoreException(String message, String sqlState, Throwable cause) {
    super(message, cause);
    this.sqlState = sqlState;
  }

  /** Driver SQLState, or {@code null} when the failure did not come from the driver. */
  public String sqlState() { return sqlState; }
}
