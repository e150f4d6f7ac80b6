package io.intellixity.arbor.query;

import java.util.Objects;

/** Unary NOT for a filter subtree. */
public record NotElement(Predicate element) implements Predicate {
  public NotElement {
    Objects.requireNonNull(element, "element");
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
