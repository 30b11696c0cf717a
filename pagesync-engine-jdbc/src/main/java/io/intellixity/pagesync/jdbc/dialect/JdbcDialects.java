package io.intellixity.pagesync.jdbc.dialect;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * Looks up dialects registered in {@code META-INF/pagesync.factories} resources on the classpath.
 * Each resource is a Java Properties file of the form:
 *
 * <pre>
 * io.intellixity.pagesync.jdbc.dialect.JdbcDialect=com.acme.MyDialect,com.acme.OtherDialect
 * </pre>
 *
 * {@link StandardDialect} is always available.
 */
public final class JdbcDialects {
  public static final String RESOURCE = "META-INF/pagesync.factories";

  private JdbcDialects() {}

  public static JdbcDialect forId(String id) {
    Objects.requireNonNull(id, "dialect id");
    for (JdbcDialect d : discover(Thread.currentThread().getContextClassLoader())) {
      if (d.id().equalsIgnoreCase(id)) return d;
    }
    throw new IllegalArgumentException("No JDBC dialect registered for id '" + id + "'");
  }

  public static List<JdbcDialect> discover(ClassLoader cl) {
    if (cl == null) cl = JdbcDialects.class.getClassLoader();
    String key = JdbcDialect.class.getName();
    LinkedHashSet<String> implNames = new LinkedHashSet<>();

    Enumeration<URL> resources;
    try {
      resources = cl.getResources(RESOURCE);
    } catch (IOException e) {
      throw new RuntimeException("Failed to enumerate " + RESOURCE, e);
    }
    while (resources.hasMoreElements()) {
      URL url = resources.nextElement();
      Properties p = new Properties();
      try (InputStream in = url.openStream()) {
        p.load(in);
      } catch (IOException e) {
        throw new RuntimeException("Failed to load " + RESOURCE + " from " + url, e);
      }
      String v = p.getProperty(key);
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<JdbcDialect> out = new ArrayList<>();
    for (String implName : implNames) out.add(newInstance(implName, cl));
    out.add(new StandardDialect());
    return out;
  }

  private static JdbcDialect newInstance(String implName, ClassLoader cl) {
    try {
      Class<?> raw = Class.forName(implName, true, cl);
      if (!JdbcDialect.class.isAssignableFrom(raw)) {
        throw new IllegalArgumentException("Class " + implName + " does not implement " + JdbcDialect.class.getName());
      }
      return (JdbcDialect) raw.getDeclaredConstructor().newInstance();
    } catch (ReflectiveOperationException e) {
      throw new IllegalStateException("Failed to instantiate " + implName, e);
    }
  }
}
