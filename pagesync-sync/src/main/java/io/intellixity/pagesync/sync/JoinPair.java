package io.intellixity.pagesync.sync;

import java.util.Objects;

/** One join row as normalized ids, in the join table's column order. */
public record JoinPair(String first, String second) {
  public JoinPair {
    Objects.requireNonNull(first, "first");
    Objects.requireNonNull(second, "second");
  }
}
