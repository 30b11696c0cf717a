package io.intellixity.pagesync.jdbc;

import java.io.IOException;
import java.io.InputStream;
import java.util.Objects;
import java.util.Properties;

/**
 * Connection settings for {@link ConnectionManager}.
 * <p>
 * Loadable from {@code pagesync.db.*} properties:
 * <pre>
 * pagesync.db.jdbcUrl=jdbc:postgresql://localhost:5432/pages
 * pagesync.db.username=pagesync
 * pagesync.db.password=secret
 * pagesync.db.schema=public
 * pagesync.db.dialect=postgres
 * pagesync.db.pooled=true
 * pagesync.db.maximumPoolSize=10
 * pagesync.db.connectionTimeoutMs=30000
 * </pre>
 */
public final class JdbcConfig {
  public static final String DEFAULT_PREFIX = "pagesync.db.";

  private String jdbcUrl;
  private String username;
  private String password;
  private String schema;
  private String dialect = "postgres";
  private boolean pooled = true;
  private int maximumPoolSize = 10;
  private long connectionTimeoutMs = 30_000;

  public String getJdbcUrl() { return jdbcUrl; }
  public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
  public String getUsername() { return username; }
  public void setUsername(String username) { this.username = username; }
  public String getPassword() { return password; }
  public void setPassword(String password) { this.password = password; }
  /** Default schema applied to every new connection; {@code null} keeps the server default. */
  public String getSchema() { return schema; }
  public void setSchema(String schema) { this.schema = schema; }
  public String getDialect() { return dialect; }
  public void setDialect(String dialect) { this.dialect = dialect; }
  public boolean isPooled() { return pooled; }
  public void setPooled(boolean pooled) { this.pooled = pooled; }
  public int getMaximumPoolSize() { return maximumPoolSize; }
  public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
  public long getConnectionTimeoutMs() { return connectionTimeoutMs; }
  public void setConnectionTimeoutMs(long connectionTimeoutMs) { this.connectionTimeoutMs = connectionTimeoutMs; }

  public static JdbcConfig fromProperties(Properties p, String prefix) {
    Objects.requireNonNull(p, "properties");
    String pre = (prefix == null) ? DEFAULT_PREFIX : prefix;
    JdbcConfig c = new JdbcConfig();
    c.setJdbcUrl(trimToNull(p.getProperty(pre + "jdbcUrl")));
    if (c.getJdbcUrl() == null) throw new IllegalArgumentException("Missing required property " + pre + "jdbcUrl");
    c.setUsername(trimToNull(p.getProperty(pre + "username")));
    c.setPassword(p.getProperty(pre + "password"));
    c.setSchema(trimToNull(p.getProperty(pre + "schema")));
    String dialect = trimToNull(p.getProperty(pre + "dialect"));
    if (dialect != null) c.setDialect(dialect);
    String pooled = trimToNull(p.getProperty(pre + "pooled"));
    if (pooled != null) c.setPooled(Boolean.parseBoolean(pooled));
    String size = trimToNull(p.getProperty(pre + "maximumPoolSize"));
    if (size != null) c.setMaximumPoolSize(parseInt(pre + "maximumPoolSize", size));
    String timeout = trimToNull(p.getProperty(pre + "connectionTimeoutMs"));
    if (timeout != null) c.setConnectionTimeoutMs(parseInt(pre + "connectionTimeoutMs", timeout));
    return c;
  }

  /** Reads a classpath properties resource, e.g. {@code pagesync.properties}. */
  public static JdbcConfig load(String resource) {
    return fromProperties(loadProperties(resource), DEFAULT_PREFIX);
  }

  public static Properties loadProperties(String resource) {
    Objects.requireNonNull(resource, "resource");
    ClassLoader cl = Thread.currentThread().getContextClassLoader();
    if (cl == null) cl = JdbcConfig.class.getClassLoader();
    Properties p = new Properties();
    try (InputStream in = cl.getResourceAsStream(resource)) {
      if (in == null) throw new IllegalArgumentException("Config resource not found: " + resource);
      p.load(in);
    } catch (IOException e) {
      throw new RuntimeException("Failed to load " + resource, e);
    }
    return p;
  }

  private static int parseInt(String key, String v) {
    try {
      return Integer.parseInt(v);
    } catch (NumberFormatException e) {
      throw new IllegalArgumentException("Property " + key + " must be an integer: " + v, e);
    }
  }

  private static String trimToNull(String s) {
    if (s == null) return null;
    String t = s.trim();
    return t.isEmpty() ? null : t;
  }
}
