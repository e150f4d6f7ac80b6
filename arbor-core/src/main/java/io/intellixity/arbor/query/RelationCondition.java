package io.intellixity.arbor.query;

import io.intellixity.arbor.error.PredicateException;

import java.util.Objects;

/**
 * Filter on a relation: either a bare existence check ({@code exists} set) or a nested predicate over the related
 * rows ({@code nested} set), which matches when at least one related row satisfies it.
 */
public record RelationCondition(String relation, Predicate nested, Boolean exists) implements Predicate {
  public RelationCondition {
    Objects.requireNonNull(relation, "relation");
    if (nested != null && exists != null) {
      throw new PredicateException("Relation filter '" + relation + "' mixes the true/false shortcut with a nested filter");
    }
    if (nested == null && exists == null) {
      throw new PredicateException("Relation filter '" + relation + "' needs a nested filter or true/false");
    }
  }

  public static RelationCondition exists(String relation) { return new RelationCondition(relation, null, Boolean.TRUE); }

  public static RelationCondition notExists(String relation) { return new RelationCondition(relation, null, Boolean.FALSE); }

  public static RelationCondition matching(String relation, Predicate nested) {
    return new RelationCondition(relation, Objects.requireNonNull(nested, "nested"), null);
  }

  public boolean isShortcut() { return exists != null; }

  @Override
  public <R> R accept(PredicateVisitor<R> visitor) { return visitor.visit(this); }
}
