package io.intellixity.pagesync.store;

public final class UniqueViolationException extends StoreException {
  public UniqueViolationException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
