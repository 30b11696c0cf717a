package io.intellixity.pagesync.source;

import java.util.Objects;

/**
 * Raw typed property value as sent by the page store.
 *
 * @param payload the value under the type key, e.g. the text-run list of a {@code title}
 */
public record PropertyValue(String type, Object payload) {
  public PropertyValue {
    Objects.requireNonNull(type, "type");
  }
}
