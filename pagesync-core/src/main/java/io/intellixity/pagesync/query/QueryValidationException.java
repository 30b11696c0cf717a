package io.intellixity.pagesync.query;

/**
 * Raised when a filter or query description is invalid.
 * <p>
 * Caller input defects: fatal to the single query and never retried.
 */
public class QueryValidationException extends RuntimeException {
  public QueryValidationException(String message) {
    super(message);
  }

  public QueryValidationException(String message, Throwable cause) {
    super(message, cause);
  }
}
