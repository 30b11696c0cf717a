package io.intellixity.pagesync.jdbc;

import io.intellixity.pagesync.compile.Bind;
import io.intellixity.pagesync.jdbc.bind.ParameterBinder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.util.*;

/**
 * A live connection plus its row-mapping cursor, exclusive to one unit of work.
 * <p>
 * Not thread-safe. Every method except {@link #isClosed()} and {@link #close()} throws
 * {@link IllegalStateException} once the session is closed.
 */
public final class JdbcSession implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(JdbcSession.class);

  private final Connection conn;
  private final ParameterBinder binder;
  private final SqlErrorClassifier errors;
  private boolean closed;

  public JdbcSession(Connection conn, ParameterBinder binder, SqlErrorClassifier errors) {
    this.conn = Objects.requireNonNull(conn, "conn");
    this.binder = Objects.requireNonNull(binder, "binder");
    this.errors = Objects.requireNonNull(errors, "errors");
  }

  /** Rows as column label to value, in select-list order. SQL arrays come back as lists. */
  public List<Map<String, Object>> query(SqlStatement ss) {
    ensureOpen();
    String jdbcSql = NamedParams.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("QUERY", ss, jdbcSql);
    try (PreparedStatement ps = conn.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      try (ResultSet rs = ps.executeQuery()) {
        List<Map<String, Object>> out = new ArrayList<>();
        ResultSetMetaData md = rs.getMetaData();
        int n = md.getColumnCount();
        while (rs.next()) {
          Map<String, Object> row = new LinkedHashMap<>();
          for (int i = 1; i <= n; i++) row.put(md.getColumnLabel(i), readValue(rs.getObject(i)));
          out.add(row);
        }
        debugDone("QUERY", ss, out.size(), System.nanoTime() - start);
        return out;
      }
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  public int update(SqlStatement ss) {
    ensureOpen();
    String jdbcSql = NamedParams.toJdbcSql(ss.sql());
    long start = System.nanoTime();
    debugSql("UPDATE", ss, jdbcSql);
    try (PreparedStatement ps = conn.prepareStatement(jdbcSql)) {
      bindAll(ps, ss);
      int n = ps.executeUpdate();
      debugDone("UPDATE", ss, n, System.nanoTime() - start);
      return n;
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  public void commit() {
    ensureOpen();
    try {
      conn.commit();
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  public void rollback() {
    ensureOpen();
    try {
      conn.rollback();
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  public boolean isClosed() {
    if (closed) return true;
    try {
      return conn.isClosed();
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  /** Closes (or returns to the pool) the underlying connection. Idempotent. */
  @Override
  public void close() {
    if (closed) return;
    closed = true;
    try {
      conn.close();
    } catch (SQLException e) {
      throw errors.translate(e);
    }
  }

  private void ensureOpen() {
    if (closed) throw new IllegalStateException("JdbcSession is closed");
  }

  private void bindAll(PreparedStatement ps, SqlStatement ss) throws SQLException {
    List<Bind> binds = ss.binds();
    for (int i = 0; i < binds.size(); i++) binder.bind(ps, i + 1, binds.get(i));
  }

  private static Object readValue(Object v) throws SQLException {
    if (v instanceof Array a) {
      Object arr = a.getArray();
      if (arr instanceof Object[] items) return new ArrayList<>(Arrays.asList(items));
      return arr;
    }
    return v;
  }

  private void debugSql(String op, SqlStatement ss, String jdbcSql) {
    if (!log.isDebugEnabled()) return;
    log.debug("pagesync.jdbc op={} execKind={} bindCount={} sql={}", op, ss.execKind(), ss.binds().size(), jdbcSql);

    // TRACE: bind summary only, never raw values
    if (log.isTraceEnabled() && !ss.binds().isEmpty()) {
      int idx = 1;
      for (Bind b : ss.binds()) {
        Object v = b.value();
        String vType = (v == null) ? "null" : v.getClass().getName();
        int vLen = (v instanceof CharSequence cs) ? cs.length() : -1;
        log.trace("pagesync.jdbc bind index={} typeId={} valueType={} valueLen={}", idx++, b.typeId(), vType, vLen);
      }
    }
  }

  private void debugDone(String op, SqlStatement ss, int result, long durationNanos) {
    if (!log.isDebugEnabled()) return;
    log.debug("pagesync.jdbc_done op={} execKind={} durationMs={} result={}",
        op, ss.execKind(), durationNanos / 1_000_000.0, result);
  }
}
