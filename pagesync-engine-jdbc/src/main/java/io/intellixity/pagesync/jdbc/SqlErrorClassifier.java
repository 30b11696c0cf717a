package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.store.*;

import java.sql.SQLException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Translates driver {@link SQLException}s into the store error taxonomy by SQLState.
 * <p>
 * Subclasses may supply a richer error detail (see {@link #detail(SQLException)}); the
 * foreign-key fields are parsed from it.
 */
public class SqlErrorClassifier {
  private static final Pattern FK_DETAIL =
      Pattern.compile("Key \\(([^)]+)\\)=\\(([^)]*)\\) is not present in table \"([^\"]+)\"");
  private static final Pattern UUID_LIKE =
      Pattern.compile("[0-9a-fA-F]{8}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{4}-?[0-9a-fA-F]{12}");

  public StoreException translate(SQLException e) {
    String state = e.getSQLState();
    String msg = e.getMessage();
    if (state == null) return new StoreException(msg, null, e);
    if (state.startsWith("08")) return new ConnectionException(msg, state, e);
    return switch (state) {
      case "42P01", "3F000" -> new UndefinedTableException(msg, state, e);
      case "42703" -> new UndefinedColumnException(msg, state, e);
      case "23503" -> foreignKey(e);
      case "23505" -> new UniqueViolationException(msg, state, e);
      default -> new StoreException(msg, state, e);
    };
  }

  public ConnectionException connectFailure(SQLException e) {
    return new ConnectionException("Failed to obtain connection: " + e.getMessage(), e.getSQLState(), e);
  }

  protected ForeignKeyViolationException foreignKey(SQLException e) {
    String detail = detail(e);
    String column = null;
    String value = null;
    String table = null;
    if (detail != null) {
      Matcher m = FK_DETAIL.matcher(detail);
      if (m.find()) {
        column = m.group(1);
        value = m.group(2);
        table = m.group(3);
      }
    }
    if (value == null) {
      String text = (detail == null ? "" : detail) + " " + (e.getMessage() == null ? "" : e.getMessage());
      Matcher m = UUID_LIKE.matcher(text);
      if (m.find()) value = m.group();
    }
    return new ForeignKeyViolationException(e.getMessage(), e.getSQLState(), e, column, value, table);
  }

  /** Detail text carrying {@code Key (col)=(value) is not present in table "t".}; the message by default. */
  protected String detail(SQLException e) {
    return e.getMessage();
  }
}
