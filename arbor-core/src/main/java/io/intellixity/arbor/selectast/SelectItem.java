package io.intellixity.arbor.selectast;

import java.util.Objects;

/** Projected expression and the result label it is read back by. */
public record SelectItem(SqlExpr expr, String label) {
  public SelectItem {
    Objects.requireNonNull(expr, "expr");
  }
}
