package io.intellixity.arbor.relation;

import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.schema.RelationKind;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Fully resolved relation. Direct relations carry {@code joinKeys} (source column = target column); many-through
 * relations carry a {@link Junction} and an empty {@code joinKeys}.
 */
public record JoinDescriptor(String sourceTable,
                             String relationName,
                             String targetTable,
                             RelationKind kind,
                             List<JoinKey> joinKeys,
                             Junction through,
                             boolean optional,
                             Predicate relationFilter) {
  public JoinDescriptor {
    Objects.requireNonNull(sourceTable, "sourceTable");
    Objects.requireNonNull(relationName, "relationName");
    Objects.requireNonNull(targetTable, "targetTable");
    Objects.requireNonNull(kind, "kind");
    joinKeys = List.copyOf(joinKeys == null ? List.of() : joinKeys);
  }

  public boolean toMany() { return kind.toMany(); }

  /** Source-table columns whose values select the related rows. */
  public List<String> sourceColumns() {
    List<JoinKey> keys = (through == null) ? joinKeys : through.sourceKeys();
    List<String> out = new ArrayList<>(keys.size());
    for (JoinKey k : keys) out.add(k.left());
    return out;
  }
}
