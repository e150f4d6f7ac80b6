package io.intellixity.arbor.relation;

import java.util.Objects;

/** Equality between a column on the left side of a join and one on the right (logical column names). */
public record JoinKey(String left, String right) {
  public JoinKey {
    Objects.requireNonNull(left, "left");
    Objects.requireNonNull(right, "right");
  }
}
