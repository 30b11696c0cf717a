package io.intellixity.pagesync.source;

import java.util.*;

/**
 * @param columns   union of all row columns in first-seen order
 * @param relations relation property name to its edges
 */
public record ParsedRecords(List<String> columns, List<ParsedRow> rows, Map<String, List<RelationEdge>> relations) {
  public ParsedRecords {
    columns = List.copyOf(columns);
    rows = List.copyOf(rows);
    Map<String, List<RelationEdge>> copy = new LinkedHashMap<>();
    relations.forEach((k, v) -> copy.put(k, List.copyOf(v)));
    relations = Collections.unmodifiableMap(copy);
  }
}
