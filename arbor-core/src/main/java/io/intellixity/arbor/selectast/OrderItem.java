package io.intellixity.arbor.selectast;

import java.util.Objects;

public record OrderItem(SqlExpr expr, boolean descending) {
  public OrderItem {
    Objects.requireNonNull(expr, "expr");
  }
}
