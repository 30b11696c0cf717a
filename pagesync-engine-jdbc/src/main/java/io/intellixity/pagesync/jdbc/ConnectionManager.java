package io.intellixity.pagesync.jdbc;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.pagesync.jdbc.dialect.JdbcDialect;
import io.intellixity.pagesync.jdbc.dialect.JdbcDialects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;

/**
 * Scoped acquisition of {@link JdbcSession}s.
 * <p>
 * {@link #withConnection(SessionWork, JdbcSession)} either reuses a live caller session
 * (no commit, left open) or opens its own, commits on success, rolls back on failure and always
 * closes it. Holds no per-call state, so independent callers may share one instance.
 */
public final class ConnectionManager implements AutoCloseable {
  private static final Logger log = LoggerFactory.getLogger(ConnectionManager.class);

  @FunctionalInterface
  interface ConnectionSource {
    Connection connect() throws SQLException;
  }

  private final ConnectionSource source;
  private final JdbcDialect dialect;
  private final String schema;
  private final HikariDataSource pool;

  /** Pooled (HikariCP) or ad-hoc ({@link DriverManager}) connections as configured. */
  public ConnectionManager(JdbcConfig config) {
    this(config, JdbcDialects.forId(config.getDialect()));
  }

  public ConnectionManager(JdbcConfig config, JdbcDialect dialect) {
    Objects.requireNonNull(config, "config");
    Objects.requireNonNull(config.getJdbcUrl(), "jdbcUrl");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.schema = config.getSchema();
    if (config.isPooled()) {
      HikariConfig hc = new HikariConfig();
      hc.setJdbcUrl(config.getJdbcUrl());
      hc.setUsername(config.getUsername());
      hc.setPassword(config.getPassword());
      hc.setMaximumPoolSize(config.getMaximumPoolSize());
      hc.setConnectionTimeout(config.getConnectionTimeoutMs());
      hc.setAutoCommit(false);
      hc.setPoolName("pagesync");
      this.pool = new HikariDataSource(hc);
      this.source = pool::getConnection;
    } else {
      this.pool = null;
      this.source = () -> DriverManager.getConnection(config.getJdbcUrl(), config.getUsername(), config.getPassword());
    }
    log.info("pagesync.jdbc connection manager ready dialect={} pooled={} schema={}",
        dialect.id(), config.isPooled(), schema);
  }

  /** Wraps an externally managed data source; {@link #close()} leaves it open. */
  public ConnectionManager(DataSource dataSource, JdbcDialect dialect) {
    this(dataSource, dialect, null);
  }

  public ConnectionManager(DataSource dataSource, JdbcDialect dialect, String schema) {
    Objects.requireNonNull(dataSource, "dataSource");
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.source = dataSource::getConnection;
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.pool = null;
  }

  public JdbcDialect dialect() { return dialect; }

  public <T> T withConnection(SessionWork<T> work) {
    return withConnection(work, null);
  }

  public <T> T withConnection(SessionWork<T> work, JdbcSession session) {
    Objects.requireNonNull(work, "work");
    if (session != null && !session.isClosed()) return work.run(session);

    JdbcSession owned = open();
    T out;
    try {
      out = work.run(owned);
      owned.commit();
    } catch (RuntimeException e) {
      try {
        owned.rollback();
      } catch (RuntimeException re) {
        e.addSuppressed(re);
      }
      try {
        owned.close();
      } catch (RuntimeException ce) {
        e.addSuppressed(ce);
      }
      throw e;
    }
    owned.close();
    return out;
  }

  /** Opens a caller-owned session (autoCommit off). The caller commits and closes it. */
  public JdbcSession open() {
    Connection c;
    try {
      c = source.connect();
    } catch (SQLException e) {
      throw dialect.errorClassifier().connectFailure(e);
    }
    try {
      c.setAutoCommit(false);
      if (schema != null) c.setSchema(schema);
    } catch (SQLException e) {
      closeAfterFailure(c, e);
      throw dialect.errorClassifier().connectFailure(e);
    }
    return new JdbcSession(c, dialect.parameterBinder(), dialect.errorClassifier());
  }

  @Override
  public void close() {
    if (pool != null && !pool.isClosed()) pool.close();
  }

  private static void closeAfterFailure(Connection c, SQLException cause) {
    try {
      c.close();
    } catch (SQLException e) {
      cause.addSuppressed(e);
    }
  }
}
