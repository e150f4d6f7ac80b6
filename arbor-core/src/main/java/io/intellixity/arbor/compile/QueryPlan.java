package io.intellixity.arbor.compile;

import java.util.List;

/** Compiled query: node arena plus the statements to run, parents before children. */
public record QueryPlan(List<PlanNode> nodes, List<PlannedStatement> statements, FetchStrategy strategy) {
  public QueryPlan {
    nodes = List.copyOf(nodes);
    statements = List.copyOf(statements);
  }

  public PlanNode root() { return nodes.get(0); }

  public PlanNode node(int id) { return nodes.get(id); }
}
