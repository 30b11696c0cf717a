package io.intellixity.pagesync.store;

/** Table or schema does not exist (SQLState 42P01 / 3F000). */
public final class UndefinedTableException extends StoreException {
  public UndefinedTableException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
