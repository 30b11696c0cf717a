package io.intellixity.pagesync.compile;

/**
 * One positional bind value plus the type id the JDBC session uses to set it.
 * <p>
 * Known type ids: {@code string, long, int, double, decimal, bool, uuid, timestamp, text[], json, any}.
 * {@code json} values are already-encoded JSON text; {@code any} is an untyped null.
 */
public record Bind(Object value, String typeId) {
  public Bind {
    typeId = (typeId == null || typeId.isBlank()) ? "string" : typeId;
  }
}
