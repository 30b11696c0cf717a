package io.intellixity.pagesync.query;

import java.util.*;

public final class FilterGroups {
  private FilterGroups() {}

  public static FilterRule equalTo(String property, Object value) { return FilterRule.of(property, FilterOperator.EQUALS, value); }
  public static FilterRule notEqualTo(String property, Object value) { return FilterRule.of(property, FilterOperator.NOT_EQUALS, value); }
  public static FilterRule greaterThan(String property, Object value) { return FilterRule.of(property, FilterOperator.GREATER_THAN, value); }
  public static FilterRule lessThan(String property, Object value) { return FilterRule.of(property, FilterOperator.LESS_THAN, value); }
  public static FilterRule greaterOrEqual(String property, Object value) { return FilterRule.of(property, FilterOperator.GREATER_OR_EQUAL, value); }
  public static FilterRule lessOrEqual(String property, Object value) { return FilterRule.of(property, FilterOperator.LESS_OR_EQUAL, value); }

  public static FilterRule contains(String property, String value) { return FilterRule.of(property, FilterOperator.CONTAINS, value); }
  public static FilterRule notContains(String property, String value) { return FilterRule.of(property, FilterOperator.NOT_CONTAINS, value); }
  public static FilterRule startsWith(String property, String value) { return FilterRule.of(property, FilterOperator.STARTS_WITH, value); }
  public static FilterRule endsWith(String property, String value) { return FilterRule.of(property, FilterOperator.ENDS_WITH, value); }

  public static FilterRule isNull(String property) { return FilterRule.of(property, FilterOperator.IS_NULL); }
  public static FilterRule isNotNull(String property) { return FilterRule.of(property, FilterOperator.IS_NOT_NULL); }
  public static FilterRule isEmpty(String property) { return FilterRule.of(property, FilterOperator.IS_EMPTY); }
  public static FilterRule isNotEmpty(String property) { return FilterRule.of(property, FilterOperator.IS_NOT_EMPTY); }

  public static FilterGroup and(FilterRule... rules) {
    return new FilterGroup(Clause.AND, List.of(rules));
  }

  public static FilterGroup or(FilterRule... rules) {
    return new FilterGroup(Clause.OR, List.of(rules));
  }
}
