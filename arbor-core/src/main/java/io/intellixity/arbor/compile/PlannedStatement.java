package io.intellixity.arbor.compile;

import io.intellixity.arbor.selectast.SelectAst;

import java.util.List;

/**
 * Statement of a plan and the nodes whose values it returns, in depth-first order; the first node is the head.
 * Child statements (BATCH) also name the parent node and how its rows are matched: {@code keyLabels[i]} in the
 * child rows equals the parent's {@code parentKeyColumns[i]}.
 */
public record PlannedStatement(int index,
                               SelectAst select,
                               List<Integer> nodeIds,
                               int parentNodeId,
                               List<String> keyLabels,
                               List<String> parentKeyColumns,
                               List<String> keyTypes) {
  public PlannedStatement {
    nodeIds = List.copyOf(nodeIds);
    keyLabels = List.copyOf(keyLabels);
    parentKeyColumns = List.copyOf(parentKeyColumns);
    keyTypes = List.copyOf(keyTypes);
  }

  public int headNodeId() { return nodeIds.get(0); }

  public boolean isChild() { return parentNodeId >= 0; }
}
