package io.intellixity.pagesync.jdbc;

import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class JdbcConfigTest {
  @Test
  void loadsClasspathResource() {
    JdbcConfig c = JdbcConfig.load("pagesync-test.properties");
    assertEquals("jdbc:postgresql://localhost:5432/pages", c.getJdbcUrl());
    assertEquals("pagesync", c.getUsername());
    assertEquals("public", c.getSchema());
    assertFalse(c.isPooled());
    assertEquals(4, c.getMaximumPoolSize());
    assertEquals(5000, c.getConnectionTimeoutMs());
    assertEquals("postgres", c.getDialect());
  }

  @Test
  void defaultsApplyAndUrlIsRequired() {
    Properties p = new Properties();
    p.setProperty("x.jdbcUrl", "jdbc:postgresql://db/pages");
    JdbcConfig c = JdbcConfig.fromProperties(p, "x.");
    assertTrue(c.isPooled());
    assertEquals(10, c.getMaximumPoolSize());
    assertNull(c.getSchema());

    assertThrows(IllegalArgumentException.class, () -> JdbcConfig.fromProperties(new Properties(), "x."));
    p.setProperty("x.maximumPoolSize", "many");
    assertThrows(IllegalArgumentException.class, () -> JdbcConfig.fromProperties(p, "x."));
  }

  @Test
  void missingResourceFails() {
    assertThrows(IllegalArgumentException.class, () -> JdbcConfig.load("nope.properties"));
  }
}
