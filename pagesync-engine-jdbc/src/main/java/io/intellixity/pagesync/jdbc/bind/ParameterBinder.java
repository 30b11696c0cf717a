package io.intellixity.pagesync.jdbc.bind;

import io.intellixity.pagesync.compile.Bind;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Sets one {@link Bind} on a prepared statement; dialects supply their own for vendor types. */
public interface ParameterBinder {
  void bind(PreparedStatement ps, int position1Based, Bind bind) throws SQLException;
}
