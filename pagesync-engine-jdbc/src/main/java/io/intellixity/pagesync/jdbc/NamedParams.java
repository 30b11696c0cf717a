package io.intellixity.pagesync.jdbc;

/**
 * Rewrites SQL containing named placeholders (e.g. {@code :b1}) into JDBC SQL with '?' binds.
 * <p>
 * Params are ':' followed by [A-Za-z_][A-Za-z0-9_]*. '::' is a cast, not a param.
 * Params inside single-quoted literals or double-quoted identifiers are ignored.
 */
public final class NamedParams {
  private NamedParams() {}

  /** Rewrites {@code :name} placeholders to '?'. Purely lexical. */
  public static String toJdbcSql(String sql) {
    if (sql == null) return "";
    StringBuilder o = new StringBuilder(sql.length());
    char quote = 0;
    for (int i = 0; i < sql.length(); i++) {
      char ch = sql.charAt(i);

      if (quote != 0) {
        if (ch == quote) {
          // Doubled quote is an escape, stay inside.
          if (i + 1 < sql.length() && sql.charAt(i + 1) == quote) {
            o.append(ch).append(ch);
            i++;
            continue;
          }
          quote = 0;
        }
        o.append(ch);
        continue;
      }

      if (ch == '\'' || ch == '"') {
        quote = ch;
        o.append(ch);
        continue;
      }

      if (ch == ':') {
        if (i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
          o.append("::");
          i++;
          continue;
        }
        int start = i + 1;
        if (start < sql.length() && isIdentStart(sql.charAt(start))) {
          int end = start + 1;
          while (end < sql.length() && isIdentPart(sql.charAt(end))) end++;
          o.append('?');
          i = end - 1;
          continue;
        }
      }
      o.append(ch);
    }
    return o.toString();
  }

  private static boolean isIdentStart(char c) {
    return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z') || c == '_';
  }

  private static boolean isIdentPart(char c) {
    return isIdentStart(c) || (c >= '0' && c <= '9');
  }
}
