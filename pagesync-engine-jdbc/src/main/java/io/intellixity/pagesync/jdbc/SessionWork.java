package io.intellixity.pagesync.jdbc;

@FunctionalInterface
public interface SessionWork<T> {
  T run(JdbcSession session);
}
