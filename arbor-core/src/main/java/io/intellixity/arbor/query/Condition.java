package io.intellixity.arbor.query;

import java.util.Objects;

/**
 * Column comparison. {@code value} may be a literal, a {@link QueryValues.Param}, a list (for IN) or a
 * {@link ColumnSubquery}; range operators use {@code lower}/{@code upper} instead.
 */
public record Condition(String column, Operator operator, Object value, Object lower, Object upper) implements Predicate {
  public Condition {
    Objects.requireNonNull(column, "column");
    Objects.requireNonNull(operator, "operator");
  }

  public static Condition of(String column, Operator operator, Object value) {
    return new Condition(column, operator, value, null, null);
  }

  public static Condition range(String column, Operator operator, Object lower, Object upper) {
    if (!operator.isRange()) throw new IllegalArgumentException("Not a range operator: " + operator);
    return new Condition(column, operator, null, lower, upper);
  }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
