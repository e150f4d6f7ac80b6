package io.intellixity.arbor.query;

import java.util.List;
import java.util.Objects;

public record LogicalGroup(Clause clause, List<Predicate> elements) implements Predicate {
  public LogicalGroup {
    Objects.requireNonNull(clause, "clause");
    elements = List.copyOf(elements == null ? List.of() : elements);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
