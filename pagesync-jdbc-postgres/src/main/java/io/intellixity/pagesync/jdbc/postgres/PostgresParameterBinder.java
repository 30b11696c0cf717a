package io.intellixity.pagesync.jdbc.postgres;

import io.intellixity.pagesync.jdbc.bind.DefaultParameterBinder;
import org.postgresql.util.PGobject;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/** Postgres-specific binding: JSON payloads travel as {@code jsonb}. */
public final class PostgresParameterBinder extends DefaultParameterBinder {
  @Override
  protected void bindJson(PreparedStatement ps, int pos, Object v) throws SQLException {
    PGobject obj = new PGobject();
    obj.setType("jsonb");
    obj.setValue(String.valueOf(v));
    ps.setObject(pos, obj);
  }
}
