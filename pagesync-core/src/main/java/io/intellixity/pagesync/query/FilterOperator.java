package io.intellixity.pagesync.query;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Fixed operator vocabulary of the filter DSL.
 * <p>
 * Each constant carries its wire name (as sent by callers) and whether it takes a value.
 */
public enum FilterOperator {
  EQUALS("equals", true),
  NOT_EQUALS("not_equals", true),
  GREATER_THAN("greater_than", true),
  LESS_THAN("less_than", true),
  GREATER_OR_EQUAL("greater_or_equal", true),
  LESS_OR_EQUAL("less_or_equal", true),

  CONTAINS("contains", true),
  NOT_CONTAINS("not_contains", true),
  STARTS_WITH("starts_with", true),
  ENDS_WITH("ends_with", true),

  IS_NULL("is_null", false),
  IS_NOT_NULL("is_not_null", false),
  IS_EMPTY("is_empty", false),
  IS_NOT_EMPTY("is_not_empty", false);

  private static final Map<String, FilterOperator> BY_WIRE = new HashMap<>();

  static {
    for (FilterOperator op : values()) BY_WIRE.put(op.wireName, op);
    // Older callers send the long-form names.
    BY_WIRE.put("does_not_contain", NOT_CONTAINS);
    BY_WIRE.put("greater_than_or_equal_to", GREATER_OR_EQUAL);
    BY_WIRE.put("less_than_or_equal_to", LESS_OR_EQUAL);
  }

  private final String wireName;
  private final boolean takesValue;

  FilterOperator(String wireName, boolean takesValue) {
    this.wireName = wireName;
    this.takesValue = takesValue;
  }

  public String wireName() { return wireName; }
  public boolean takesValue() { return takesValue; }

  public static FilterOperator fromWire(String raw) {
    if (raw == null || raw.isBlank()) throw new MalformedRuleException("Rule operator is missing");
    String key = raw.trim().toLowerCase(Locale.ROOT);
    FilterOperator op = BY_WIRE.get(key);
    if (op != null) return op;
    try {
      return FilterOperator.valueOf(key.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new UnsupportedOperatorException(raw);
    }
  }
}
