package io.intellixity.pagesync.query;

public final class UnsupportedOperatorException extends QueryValidationException {
  private final String operator;

  public UnsupportedOperatorException(String operator) {
    super("Unsupported operator: " + operator);
    this.operator = operator;
  }

  public String operator() { return operator; }
}
