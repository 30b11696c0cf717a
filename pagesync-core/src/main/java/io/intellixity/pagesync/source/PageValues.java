package io.intellixity.pagesync.source;

import java.time.LocalDate;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Converts raw typed property payloads into column values.
 * <p>
 * Dates become {@link OffsetDateTime} (or {@link LocalDate} for date-only values), list-like
 * properties become {@code List<String>}, relation payloads become normalized ids.
 */
public final class PageValues {
  private PageValues() {}

  public static Object extract(String type, Object payload) {
    if (type == null) return payload;
    switch (type) {
      case "title":
      case "rich_text":
        return plainText(payload);
      case "select":
      case "status":
        return payload instanceof Map<?, ?> m ? str(m.get("name")) : null;
      case "multi_select":
        return names(payload);
      case "people":
        return people(payload);
      case "created_by":
      case "last_edited_by":
        return person(payload);
      case "date":
        return payload instanceof Map<?, ?> m ? temporal(str(m.get("start"))) : null;
      case "created_time":
      case "last_edited_time":
        return temporal(str(payload));
      case "files":
        return files(payload);
      case "formula":
        return formula(payload);
      case "unique_id":
        return uniqueId(payload);
      case "relation":
        return relationIds(payload);
      case "number":
      case "checkbox":
      case "url":
      case "email":
      case "phone_number":
        return payload;
      default:
        return payload == null ? null : String.valueOf(payload);
    }
  }

  public static List<String> relationIds(Object payload) {
    List<String> out = new ArrayList<>();
    if (!(payload instanceof List<?> list)) return out;
    for (Object o : list) {
      Object id = (o instanceof Map<?, ?> m) ? m.get("id") : o;
      if (id == null || String.valueOf(id).isBlank()) continue;
      out.add(Ids.normalize(String.valueOf(id)));
    }
    return out;
  }

  static Object temporal(String s) {
    if (s == null || s.isBlank()) return null;
    try {
      if (s.indexOf('T') < 0) return LocalDate.parse(s);
      return OffsetDateTime.parse(s);
    } catch (DateTimeParseException e) {
      throw new IllegalArgumentException("Unparseable date value: '" + s + "'", e);
    }
  }

  private static String plainText(Object payload) {
    if (!(payload instanceof List<?> runs)) return payload == null ? "" : String.valueOf(payload);
    StringBuilder sb = new StringBuilder();
    for (Object r : runs) {
      if (!(r instanceof Map<?, ?> m)) continue;
      Object t = m.get("plain_text");
      if (t == null && m.get("text") instanceof Map<?, ?> text) t = text.get("content");
      if (t != null) sb.append(t);
    }
    return sb.toString();
  }

  private static List<String> names(Object payload) {
    List<String> out = new ArrayList<>();
    if (!(payload instanceof List<?> list)) return out;
    for (Object o : list) {
      if (!(o instanceof Map<?, ?> m)) continue;
      Object n = m.get("name") != null ? m.get("name") : m.get("id");
      if (n != null) out.add(String.valueOf(n));
    }
    return out;
  }

  private static List<String> people(Object payload) {
    if (payload instanceof Map<?, ?>) {
      String p = person(payload);
      return p == null ? List.of() : List.of(p);
    }
    return names(payload);
  }

  private static String person(Object payload) {
    if (!(payload instanceof Map<?, ?> m)) return null;
    Object n = m.get("name") != null ? m.get("name") : m.get("id");
    return n == null ? null : String.valueOf(n);
  }

  private static List<String> files(Object payload) {
    List<String> out = new ArrayList<>();
    if (!(payload instanceof List<?> list)) return out;
    for (Object o : list) {
      if (!(o instanceof Map<?, ?> f)) continue;
      Object kind = f.get("type");
      Object holder = kind == null ? null : f.get(String.valueOf(kind));
      if (holder instanceof Map<?, ?> h && h.get("url") != null) out.add(String.valueOf(h.get("url")));
    }
    return out;
  }

  private static Object formula(Object payload) {
    if (!(payload instanceof Map<?, ?> m)) return null;
    String kind = str(m.get("type"));
    if (kind == null) return null;
    Object v = m.get(kind);
    if ("date".equals(kind)) return v instanceof Map<?, ?> d ? temporal(str(d.get("start"))) : null;
    return v;
  }

  private static String uniqueId(Object payload) {
    if (!(payload instanceof Map<?, ?> m)) return null;
    String prefix = str(m.get("prefix"));
    Object number = m.get("number");
    String n = number == null ? "" : String.valueOf(number);
    return (prefix == null || prefix.isEmpty()) ? n : prefix + "_" + n;
  }

  private static String str(Object o) {
    return o == null ? null : String.valueOf(o);
  }
}
