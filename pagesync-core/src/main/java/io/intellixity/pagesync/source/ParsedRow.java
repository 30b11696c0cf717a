package io.intellixity.pagesync.source;

import java.util.*;

/** Column values of one page, primary key first. */
public record ParsedRow(String id, Map<String, Object> values) {
  public ParsedRow {
    Objects.requireNonNull(id, "id");
    values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
  }

  public List<String> columns() { return List.copyOf(values.keySet()); }
  public List<Object> valueList() { return new ArrayList<>(values.values()); }
}
