package io.intellixity.pagesync.store;

public final class UndefinedColumnException extends StoreException {
  public UndefinedColumnException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
