package io.intellixity.pagesync.query;

import java.util.Map;
import java.util.Objects;

public final class FilterRule {
  private final String property;
  private final FilterOperator operator;
  private final Object value;

  public FilterRule(String property, FilterOperator operator, Object value) {
    if (property == null || property.isBlank()) throw new MalformedRuleException("Rule property is missing");
    if (operator == null) throw new MalformedRuleException("Rule operator is missing for property '" + property + "'");
    this.property = property;
    this.operator = operator;
    // is_* operators never carry a value, even if the caller sent one.
    this.value = operator.takesValue() ? value : null;
  }

  public String property() { return property; }
  public FilterOperator operator() { return operator; }
  public Object value() { return value; }

  public static FilterRule of(String property, FilterOperator operator, Object value) {
    return new FilterRule(property, operator, value);
  }

  public static FilterRule of(String property, FilterOperator operator) {
    return new FilterRule(property, operator, null);
  }

  /** Parses the wire form {@code {property, operator, value?}}. */
  public static FilterRule fromMap(Map<?, ?> m) {
    Objects.requireNonNull(m, "rule");
    if (!m.containsKey("property") || m.get("property") == null) {
      throw new MalformedRuleException("Each rule must have 'property' and 'operator' keys: " + m.keySet());
    }
    if (!m.containsKey("operator") || m.get("operator") == null) {
      throw new MalformedRuleException("Each rule must have 'property' and 'operator' keys: " + m.keySet());
    }
    String property = String.valueOf(m.get("property"));
    FilterOperator op = FilterOperator.fromWire(String.valueOf(m.get("operator")));
    return new FilterRule(property, op, m.get("value"));
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FilterRule r)) return false;
    return property.equals(r.property) && operator == r.operator && Objects.equals(value, r.value);
  }

  @Override
  public int hashCode() {
    return Objects.hash(property, operator, value);
  }

  @Override
  public String toString() {
    return "FilterRule[" + property + " " + operator.wireName() + (operator.takesValue() ? " <value>" : "") + "]";
  }
}
