package io.intellixity.arbor.schema;

import java.util.List;
import java.util.Objects;

/**
 * Junction of a {@link RelationKind#MANY_THROUGH} relation.
 * <p>
 * Either list the junction columns explicitly ({@code sourceColumns} pair with the relation's {@code fromColumns},
 * {@code targetColumns} with its {@code toColumns}), or name the junction's two {@link RelationKind#ONE} relations.
 * With neither, the mapping is inferred from the junction's relations.
 */
public record ThroughDef(String table,
                         List<String> sourceColumns,
                         List<String> targetColumns,
                         String sourceRelation,
                         String targetRelation) {
  public ThroughDef {
    Objects.requireNonNull(table, "table");
    sourceColumns = List.copyOf(sourceColumns == null ? List.of() : sourceColumns);
    targetColumns = List.copyOf(targetColumns == null ? List.of() : targetColumns);
  }

  public static ThroughDef of(String table) {
    return new ThroughDef(table, null, null, null, null);
  }

  public ThroughDef columns(List<String> source, List<String> target) {
    return new ThroughDef(table, source, target, sourceRelation, targetRelation);
  }

  public ThroughDef relations(String source, String target) {
    return new ThroughDef(table, sourceColumns, targetColumns, source, target);
  }

  public boolean hasDeclaredColumns() { return !sourceColumns.isEmpty() && !targetColumns.isEmpty(); }

  public boolean hasDeclaredRelations() { return sourceRelation != null && targetRelation != null; }
}
