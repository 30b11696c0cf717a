package io.intellixity.pagesync.query;

/** A rule or group is structurally incomplete (missing property/operator, bad logic, missing value). */
public final class MalformedRuleException extends QueryValidationException {
  public MalformedRuleException(String message) {
    super(message);
  }
}
