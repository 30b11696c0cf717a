package io.intellixity.pagesync.sync;

/** A missing referenced record could not be fetched from the page source or materialized. */
public final class UnresolvableForeignKeyException extends RuntimeException {
  private final String keyValue;

  public UnresolvableForeignKeyException(String keyValue, String message) {
    super(message);
    this.keyValue = keyValue;
  }

  public UnresolvableForeignKeyException(String keyValue, String message, Throwable cause) {
    super(message, cause);
    this.keyValue = keyValue;
  }

  public String keyValue() { return keyValue; }
}
