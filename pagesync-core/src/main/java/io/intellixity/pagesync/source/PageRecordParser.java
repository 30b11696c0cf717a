package io.intellixity.pagesync.source;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/** Flattens page-store pages into table rows plus relation edges. */
public final class PageRecordParser {
  private static final Logger log = LoggerFactory.getLogger(PageRecordParser.class);

  public static final String PRIMARY_KEY_COLUMN = "primary_key_id";
  static final int MAX_SHORT_TEXT = 255;
  private static final Set<String> SHORT_TEXT_TYPES = Set.of("title", "select", "status", "email", "phone_number");

  private PageRecordParser() {}

  public static ParsedRecords parse(List<PageRecord> pages) {
    Objects.requireNonNull(pages, "pages");
    LinkedHashSet<String> columns = new LinkedHashSet<>();
    List<ParsedRow> rows = new ArrayList<>();
    Map<String, List<RelationEdge>> relations = new LinkedHashMap<>();

    for (PageRecord page : pages) {
      String recordId = Ids.normalize(page.id());
      Map<String, Object> values = new LinkedHashMap<>();
      values.put(PRIMARY_KEY_COLUMN, Ids.toUuid(recordId));

      for (var e : page.properties().entrySet()) {
        String name = e.getKey();
        PropertyValue pv = e.getValue();
        String type = pv.type();
        if ("rollup".equals(type)) continue;

        if ("relation".equals(type)) {
          List<RelationEdge> edges = relations.computeIfAbsent(name, k -> new ArrayList<>());
          List<String> related = PageValues.relationIds(pv.payload());
          if (related.isEmpty()) {
            edges.add(RelationEdge.purge(recordId));
          } else {
            for (String r : related) edges.add(new RelationEdge(recordId, r));
          }
          continue;
        }

        Object value = PageValues.extract(type, pv.payload());
        if (SHORT_TEXT_TYPES.contains(type) && value instanceof String s && s.length() > MAX_SHORT_TEXT) {
          value = s.substring(0, MAX_SHORT_TEXT);
        }
        values.put(columnName(name), value);
      }

      columns.addAll(values.keySet());
      rows.add(new ParsedRow(recordId, values));
    }

    log.debug("pagesync.parse pages={} columns={} relations={}", rows.size(), columns.size(), relations.size());
    return new ParsedRecords(new ArrayList<>(columns), rows, relations);
  }

  /** Property names that collide with the key column get the same suffix the table derivation uses. */
  static String columnName(String property) {
    return PRIMARY_KEY_COLUMN.equals(property) ? property + "_dup" : property;
  }
}
