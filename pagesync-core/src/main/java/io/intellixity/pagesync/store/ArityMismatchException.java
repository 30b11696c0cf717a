package io.intellixity.pagesync.store;

public final class ArityMismatchException extends StoreException {
  public ArityMismatchException(int columns, int values) {
    super("Column count " + columns + " does not match value count " + values);
  }
}
