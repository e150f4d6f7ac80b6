package io.intellixity.arbor.schema;

import io.intellixity.arbor.query.Predicate;

import java.util.List;
import java.util.Objects;

/**
 * Declared relation from the owning table to {@code target}.
 * <p>
 * {@code fromColumns}/{@code toColumns} may be left empty and inferred from the reverse relation on the target
 * table; {@code alias} pairs a relation with its reverse when several relations connect the same tables.
 * {@code optional} only matters for {@link RelationKind#ONE}: a required relation excludes parents without a match.
 * {@code where} is applied every time the relation is traversed.
 */
public record RelationDef(String name,
                          RelationKind kind,
                          String target,
                          List<String> fromColumns,
                          List<String> toColumns,
                          ThroughDef through,
                          boolean optional,
                          String alias,
                          Predicate where) {
  public RelationDef {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(target, "target");
    fromColumns = List.copyOf(fromColumns == null ? List.of() : fromColumns);
    toColumns = List.copyOf(toColumns == null ? List.of() : toColumns);
    if (kind == RelationKind.MANY_THROUGH && through == null) {
      throw new IllegalArgumentException("Relation '" + name + "' is MANY_THROUGH but has no junction");
    }
    if (kind != RelationKind.MANY_THROUGH && through != null) {
      throw new IllegalArgumentException("Relation '" + name + "' declares a junction but is " + kind);
    }
  }

  public static RelationDef one(String name, String target) {
    return new RelationDef(name, RelationKind.ONE, target, null, null, null, true, null, null);
  }

  public static RelationDef many(String name, String target) {
    return new RelationDef(name, RelationKind.MANY, target, null, null, null, true, null, null);
  }

  public static RelationDef manyThrough(String name, String target, ThroughDef through) {
    return new RelationDef(name, RelationKind.MANY_THROUGH, target, null, null, through, true, null, null);
  }

  public RelationDef on(String fromColumn, String toColumn) {
    return on(List.of(fromColumn), List.of(toColumn));
  }

  public RelationDef on(List<String> from, List<String> to) {
    return new RelationDef(name, kind, target, from, to, through, optional, alias, where);
  }

  public RelationDef required() {
    return new RelationDef(name, kind, target, fromColumns, toColumns, through, false, alias, where);
  }

  public RelationDef alias(String alias) {
    return new RelationDef(name, kind, target, fromColumns, toColumns, through, optional, alias, where);
  }

  public RelationDef where(Predicate where) {
    return new RelationDef(name, kind, target, fromColumns, toColumns, through, optional, alias, where);
  }

  public boolean hasDeclaredColumns() { return !fromColumns.isEmpty() && !toColumns.isEmpty(); }
}
