package io.intellixity.pagesync.query;

import java.util.Locale;

public enum Clause {
  AND,
  OR;

  /** Parses "and"/"or" in any case; {@code null} or blank means {@link #AND}. */
  public static Clause parse(Object raw) {
    if (raw == null) return AND;
    String s = String.valueOf(raw).trim();
    if (s.isEmpty()) return AND;
    try {
      return Clause.valueOf(s.toUpperCase(Locale.ROOT));
    } catch (IllegalArgumentException e) {
      throw new MalformedRuleException("Group logic must be 'AND' or 'OR', got '" + s + "'");
    }
  }

  public String sql() {
    return this == OR ? " OR " : " AND ";
  }
}
