package io.intellixity.arbor.schema;

public enum RelationKind {
  /** At most one related row; the result holds a nested object or null. */
  ONE,
  /** Any number of related rows joined directly by key columns. */
  MANY,
  /** Any number of related rows reached through a junction table. */
  MANY_THROUGH;

  public boolean toMany() { return this != ONE; }
}
