package io.intellixity.pagesync.jdbc.postgres;

import io.intellixity.pagesync.jdbc.SqlErrorClassifier;
import org.postgresql.util.PSQLException;
import org.postgresql.util.ServerErrorMessage;

import java.sql.SQLException;

/** Reads the server's DETAIL field, where Postgres reports the offending foreign key. */
public final class PostgresErrorClassifier extends SqlErrorClassifier {
  @Override
  protected String detail(SQLException e) {
    if (e instanceof PSQLException pe) {
      ServerErrorMessage sem = pe.getServerErrorMessage();
      if (sem != null && sem.getDetail() != null) return sem.getDetail();
    }
    return e.getMessage();
  }
}
