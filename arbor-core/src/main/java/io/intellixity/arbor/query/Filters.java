package io.intellixity.arbor.query;

import java.util.Arrays;
import java.util.Collection;
import java.util.List;

/** Static factories for building filter trees in code. */
public final class Filters {
  private Filters() {}

  public static Condition eq(String column, Object value) { return Condition.of(column, Operator.EQ, value); }
  public static Condition ne(String column, Object value) { return Condition.of(column, Operator.NE, value); }
  public static Condition gt(String column, Object value) { return Condition.of(column, Operator.GT, value); }
  public static Condition gte(String column, Object value) { return Condition.of(column, Operator.GTE, value); }
  public static Condition lt(String column, Object value) { return Condition.of(column, Operator.LT, value); }
  public static Condition lte(String column, Object value) { return Condition.of(column, Operator.LTE, value); }

  public static Condition in(String column, Collection<?> values) { return Condition.of(column, Operator.IN, List.copyOf(values)); }
  public static Condition notIn(String column, Collection<?> values) { return Condition.of(column, Operator.NOT_IN, List.copyOf(values)); }

  public static Condition in(String column, ColumnSubquery subquery) { return Condition.of(column, Operator.IN, subquery); }
  public static Condition notIn(String column, ColumnSubquery subquery) { return Condition.of(column, Operator.NOT_IN, subquery); }

  public static ColumnSubquery select(String table, String column, Predicate where) {
    return new ColumnSubquery(table, column, where);
  }

  /** Patterns are passed through as-is; {@code %} and {@code _} keep their SQL meaning. */
  public static Condition like(String column, Object pattern) { return Condition.of(column, Operator.LIKE, pattern); }
  public static Condition ilike(String column, Object pattern) { return Condition.of(column, Operator.ILIKE, pattern); }
  public static Condition notLike(String column, Object pattern) { return Condition.of(column, Operator.NOT_LIKE, pattern); }
  public static Condition notIlike(String column, Object pattern) { return Condition.of(column, Operator.NOT_ILIKE, pattern); }

  public static Condition isNull(String column) { return Condition.of(column, Operator.IS_NULL, null); }
  public static Condition isNotNull(String column) { return Condition.of(column, Operator.IS_NOT_NULL, null); }

  public static Condition between(String column, Object lower, Object upper) {
    return Condition.range(column, Operator.BETWEEN, lower, upper);
  }

  public static Condition notBetween(String column, Object lower, Object upper) {
    return Condition.range(column, Operator.NOT_BETWEEN, lower, upper);
  }

  public static RelationCondition has(String relation) { return RelationCondition.exists(relation); }
  public static RelationCondition hasNo(String relation) { return RelationCondition.notExists(relation); }
  public static RelationCondition has(String relation, Predicate nested) { return RelationCondition.matching(relation, nested); }

  public static RawCondition raw(String template, Expr... args) { return new RawCondition(Expr.raw(template, args)); }

  public static QueryValues.Param param(String name) { return QueryValues.param(name); }

  public static LogicalGroup and(Predicate... elements) {
    return new LogicalGroup(Clause.AND, Arrays.asList(elements));
  }

  public static LogicalGroup or(Predicate... elements) {
    return new LogicalGroup(Clause.OR, Arrays.asList(elements));
  }

  public static NotElement not(Predicate element) {
    return new NotElement(element);
  }
}
