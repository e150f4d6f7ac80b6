package io.intellixity.arbor.query;

import java.util.Objects;

/** Boolean expression supplied verbatim by the caller, usually an {@link Expr.Raw} template. */
public record RawCondition(Expr expr) implements Predicate {
  public RawCondition {
    Objects.requireNonNull(expr, "expr");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
