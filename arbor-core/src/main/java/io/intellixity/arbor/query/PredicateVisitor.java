package io.intellixity.arbor.query;

public interface PredicateVisitor<R> {
  R visit(Condition condition);
  R visit(RelationCondition relation);
  R visit(LogicalGroup group);
  R visit(NotElement not);
  R visit(RawCondition raw);
}
