package io.intellixity.pagesync.store;

public final class ConnectionException extends StoreException {
  public ConnectionException(String message, String sqlState, Throwable cause) {
    super(message, sqlState, cause);
  }
}
