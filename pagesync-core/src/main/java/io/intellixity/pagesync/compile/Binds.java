package io.intellixity.pagesync.compile;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.math.BigDecimal;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.UUID;

public final class Binds {
  private static final ObjectMapper JSON = new ObjectMapper();

  private Binds() {}

  /**
   * Infers the type id from the value. A bare {@code null} is untyped ({@code any}) so the
   * database resolves it against the target column.
   */
  public static Bind of(Object v) {
    if (v instanceof Bind b) return b;
    if (v == null) return new Bind(null, "any");
    if (v instanceof String) return new Bind(v, "string");
    if (v instanceof Integer) return new Bind(v, "int");
    if (v instanceof Long) return new Bind(v, "long");
    if (v instanceof Double || v instanceof Float) return new Bind(((Number) v).doubleValue(), "double");
    if (v instanceof BigDecimal) return new Bind(v, "decimal");
    if (v instanceof Boolean) return new Bind(v, "bool");
    if (v instanceof UUID) return new Bind(v, "uuid");
    if (v instanceof Instant i) return new Bind(i.atOffset(ZoneOffset.UTC), "timestamp");
    if (v instanceof OffsetDateTime || v instanceof LocalDateTime || v instanceof LocalDate) {
      return new Bind(v, "timestamp");
    }
    if (v instanceof Collection<?> c) return new Bind(c.stream().map(Binds::arrayElement).toList(), "text[]");
    if (v instanceof Object[] arr) return new Bind(Arrays.stream(arr).map(Binds::arrayElement).toList(), "text[]");
    if (v instanceof Map<?, ?> m) return new Bind(toJson(m), "json");
    return new Bind(String.valueOf(v), "string");
  }

  // json binds carry encoded text; binders never see the Map itself.
  private static String toJson(Map<?, ?> m) {
    try {
      return JSON.writeValueAsString(m);
    } catch (JsonProcessingException e) {
      throw new IllegalArgumentException("Value is not JSON-serializable: " + e.getOriginalMessage(), e);
    }
  }

  // text[] elements travel as strings; nulls become empty strings.
  private static String arrayElement(Object o) {
    return o == null ? "" : String.valueOf(o);
  }
}
