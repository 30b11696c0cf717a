package io.intellixity.pagesync.jdbc.bind;

import io.intellixity.pagesync.compile.Bind;

import java.sql.Array;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.Types;
import java.util.Collection;
import java.util.Locale;

/**
 * Standard JDBC binding by type id. Lists go out as SQL {@code text[]} arrays, UUIDs and
 * java.time values through {@code setObject}. Nulls without a concrete column type are sent as
 * {@link Types#OTHER} so the server infers the type from the target column.
 */
public class DefaultParameterBinder implements ParameterBinder {
  @Override
  public void bind(PreparedStatement ps, int pos, Bind bind) throws SQLException {
    String type = bind.typeId().toLowerCase(Locale.ROOT);
    Object v = bind.value();
    if (v == null) {
      ps.setNull(pos, sqlType(type));
      return;
    }
    switch (type) {
      case "string" -> ps.setString(pos, String.valueOf(v));
      case "int" -> ps.setInt(pos, ((Number) v).intValue());
      case "long" -> ps.setLong(pos, ((Number) v).longValue());
      case "double" -> ps.setDouble(pos, ((Number) v).doubleValue());
      case "bool" -> ps.setBoolean(pos, (Boolean) v);
      case "text[]" -> ps.setArray(pos, textArray(ps, v));
      case "json" -> bindJson(ps, pos, v);
      default -> ps.setObject(pos, v);
    }
  }

  /** Generic fallback sends JSON as text; Postgres overrides with jsonb. */
  protected void bindJson(PreparedStatement ps, int pos, Object v) throws SQLException {
    ps.setString(pos, String.valueOf(v));
  }

  protected Array textArray(PreparedStatement ps, Object v) throws SQLException {
    Object[] elems = (v instanceof Collection<?> c) ? c.toArray() : (Object[]) v;
    return ps.getConnection().createArrayOf("text", elems);
  }

  protected int sqlType(String type) {
    return switch (type) {
      case "string" -> Types.VARCHAR;
      case "int" -> Types.INTEGER;
      case "long" -> Types.BIGINT;
      case "double" -> Types.DOUBLE;
      case "decimal" -> Types.NUMERIC;
      case "bool" -> Types.BOOLEAN;
      case "timestamp" -> Types.TIMESTAMP;
      case "text[]" -> Types.ARRAY;
      // any, uuid, json
      default -> Types.OTHER;
    };
  }
}
