package io.intellixity.arbor.query;

/** Node of a filter tree. Instances are immutable and compare by value. */
public interface Predicate {
  <R> R accept(PredicateVisitor<R> visitor);
}
