package io.intellixity.arbor.relation;

import java.util.List;
import java.util.Objects;

/**
 * Resolved junction of a many-through relation. {@code sourceKeys} pair source-table columns (left) with junction
 * columns (right); {@code targetKeys} pair junction columns (left) with target-table columns (right).
 */
public record Junction(String table, List<JoinKey> sourceKeys, List<JoinKey> targetKeys) {
  public Junction {
    Objects.requireNonNull(table, "table");
    sourceKeys = List.copyOf(sourceKeys);
    targetKeys = List.copyOf(targetKeys);
  }
}
