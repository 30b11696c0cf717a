package io.intellixity.pagesync.source;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.*;

/**
 * Reads page-store JSON payloads.
 * <p>
 * Page: {@code {"id", "parent": {"database_id"}, "properties": {name: {"type", <type>: payload}}}}.
 * Database: {@code {"id", "title": [{"plain_text"}], "properties": {name: {"type", "relation": {"database_id"}}}}}.
 */
public final class PageJson {
  private static final ObjectMapper JSON = new ObjectMapper();

  private PageJson() {}

  public static PageRecord page(String json) {
    return page(tree(json));
  }

  public static PageRecord page(JsonNode root) {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Page JSON must be an object");
    String id = requiredText(root, "id");
    JsonNode parent = root.get("parent");
    String databaseId = (parent == null) ? null : textOrNull(parent.get("database_id"));

    Map<String, PropertyValue> props = new LinkedHashMap<>();
    JsonNode properties = root.get("properties");
    if (properties != null && properties.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode p = e.getValue();
        String type = textOrNull(p.get("type"));
        if (type == null) continue;
        JsonNode payload = p.get(type);
        Object value = (payload == null || payload.isNull()) ? null : JSON.convertValue(payload, Object.class);
        props.put(e.getKey(), new PropertyValue(type, value));
      }
    }
    return new PageRecord(Ids.normalize(id), databaseId == null ? null : Ids.normalize(databaseId), props);
  }

  /** Accepts a bare array of pages or a query response object with {@code results}. */
  public static List<PageRecord> pages(String json) {
    JsonNode root = tree(json);
    JsonNode arr = root.isObject() ? root.get("results") : root;
    if (arr == null || !arr.isArray()) throw new IllegalArgumentException("Expected an array of pages");
    List<PageRecord> out = new ArrayList<>();
    for (JsonNode n : arr) out.add(page(n));
    return out;
  }

  public static DatabaseSchema database(String json) {
    return database(tree(json));
  }

  public static DatabaseSchema database(JsonNode root) {
    if (root == null || !root.isObject()) throw new IllegalArgumentException("Database JSON must be an object");
    String id = requiredText(root, "id");

    StringBuilder title = new StringBuilder();
    JsonNode t = root.get("title");
    if (t != null && t.isArray()) {
      for (JsonNode run : t) {
        String s = textOrNull(run.get("plain_text"));
        if (s != null) title.append(s);
      }
    }

    List<PropertyDef> defs = new ArrayList<>();
    JsonNode properties = root.get("properties");
    if (properties != null && properties.isObject()) {
      Iterator<Map.Entry<String, JsonNode>> it = properties.fields();
      while (it.hasNext()) {
        Map.Entry<String, JsonNode> e = it.next();
        JsonNode p = e.getValue();
        String type = textOrNull(p.get("type"));
        String target = null;
        if ("relation".equals(type) && p.get("relation") != null) {
          String raw = textOrNull(p.get("relation").get("database_id"));
          target = raw == null ? null : Ids.normalize(raw);
        }
        defs.add(new PropertyDef(e.getKey(), type, target));
      }
    }
    return new DatabaseSchema(Ids.normalize(id), title.toString(), defs);
  }

  private static JsonNode tree(String json) {
    if (json == null || json.isBlank()) throw new IllegalArgumentException("Empty page-store payload");
    try {
      return JSON.readTree(json);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Page-store payload is not valid JSON", e);
    }
  }

  private static String requiredText(JsonNode n, String field) {
    String s = textOrNull(n.get(field));
    if (s == null) throw new IllegalArgumentException("Missing '" + field + "'");
    return s;
  }

  private static String textOrNull(JsonNode n) {
    if (n == null || n.isNull()) return null;
    String s = n.asText();
    return s.isBlank() ? null : s;
  }
}
