package io.intellixity.pagesync.source;

import java.util.Objects;

/**
 * One property of a page-store database.
 *
 * @param relationDatabaseId target database for relation properties, otherwise {@code null}
 */
public record PropertyDef(String name, String type, String relationDatabaseId) {
  public PropertyDef {
    Objects.requireNonNull(name, "name");
    type = (type == null) ? "unsupported" : type;
  }

  public boolean isRelation() { return "relation".equals(type); }

  /** Relations live in join tables and rollups are derived, so neither is stored as a column. */
  public boolean isStored() { return !isRelation() && !"rollup".equals(type); }
}
