package io.intellixity.pagesync.query;

import java.util.*;

/**
 * Ordered rules joined by {@link #logic()}.
 * <p>
 * The same logic tag also combines this group with the group before it in a filter list;
 * for the first group of a list it is ignored.
 */
public final class FilterGroup {
  private final Clause logic;
  private final List<FilterRule> rules;

  public FilterGroup(Clause logic, List<FilterRule> rules) {
    this.logic = (logic == null) ? Clause.AND : logic;
    this.rules = List.copyOf(rules == null ? List.of() : rules);
  }

  public Clause logic() { return logic; }
  public List<FilterRule> rules() { return rules; }
  public boolean isEmpty() { return rules.isEmpty(); }

  /** Parses the wire form {@code {logic: AND|OR, rules: [...]}}. */
  public static FilterGroup fromMap(Map<?, ?> m) {
    Objects.requireNonNull(m, "group");
    Clause logic = Clause.parse(m.get("logic"));
    Object raw = m.get("rules");
    if (raw == null) return new FilterGroup(logic, List.of());
    if (!(raw instanceof List<?> list)) {
      throw new MalformedRuleException("Group 'rules' must be a list");
    }
    List<FilterRule> rules = new ArrayList<>();
    for (Object o : list) {
      if (o instanceof FilterRule r) {
        rules.add(r);
      } else if (o instanceof Map<?, ?> rm) {
        rules.add(FilterRule.fromMap(rm));
      } else {
        throw new MalformedRuleException("Unsupported rule element: " + (o == null ? "null" : o.getClass().getName()));
      }
    }
    return new FilterGroup(logic, rules);
  }

  public static List<FilterGroup> fromList(List<?> raw) {
    if (raw == null) return List.of();
    List<FilterGroup> out = new ArrayList<>();
    for (Object o : raw) {
      if (o instanceof FilterGroup g) {
        out.add(g);
      } else if (o instanceof Map<?, ?> m) {
        out.add(fromMap(m));
      } else {
        throw new MalformedRuleException("Unsupported group element: " + (o == null ? "null" : o.getClass().getName()));
      }
    }
    return out;
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) return true;
    if (!(o instanceof FilterGroup g)) return false;
    return logic == g.logic && rules.equals(g.rules);
  }

  @Override
  public int hashCode() {
    return Objects.hash(logic, rules);
  }

  @Override
  public String toString() {
    return "FilterGroup[" + logic + " " + rules + "]";
  }
}
