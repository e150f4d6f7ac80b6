package io.intellixity.arbor.mapping;

import io.intellixity.arbor.compile.PlanNode;
import io.intellixity.arbor.compile.PlannedStatement;
import io.intellixity.arbor.compile.QueryPlan;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Folds flat statement rows back into nested objects. One instance per execution; not thread-safe.
 * <p>
 * Each row is walked along the nodes of its statement, parents first. A level whose identity is all-NULL (a
 * left-join miss) creates nothing and hides its descendants for that row. Repeated identities under the same parent
 * object are merged, so join fan-out never duplicates objects. Rows of child statements attach to every parent
 * object whose key tuple matches.
 */
public final class RowReconstructor {
  private static final String EXTRA = "$";

  private final QueryPlan plan;
  private final Map<IdentityKey, ResultNode> roots = new LinkedHashMap<>();
  private final List<List<ResultNode>> created = new ArrayList<>();

  public RowReconstructor(QueryPlan plan) {
    this.plan = Objects.requireNonNull(plan, "plan");
    for (int i = 0; i < plan.nodes().size(); i++) created.add(new ArrayList<>());
  }

  public void acceptRoot(PlannedStatement statement, List<RowAdapter> rows) {
    if (statement.isChild()) throw new IllegalArgumentException("Statement " + statement.index() + " is a child statement");
    for (RowAdapter row : rows) walk(statement, row, null);
  }

  /** Distinct non-null parent key tuples a child statement has to be run for, in first-seen order. */
  public List<List<Object>> parentKeys(PlannedStatement statement) {
    Set<IdentityKey> seen = new LinkedHashSet<>();
    List<List<Object>> out = new ArrayList<>();
    for (ResultNode p : created.get(statement.parentNodeId())) {
      IdentityKey k = parentKey(statement, p);
      if (k.anyNull()) continue;
      if (seen.add(k)) out.add(parentKeyValues(statement, p));
    }
    return out;
  }

  public void acceptChildren(PlannedStatement statement, List<RowAdapter> rows) {
    PlanNode head = plan.node(statement.headNodeId());
    Map<IdentityKey, List<ResultNode>> parents = new HashMap<>();
    for (ResultNode p : created.get(statement.parentNodeId())) {
      p.relation(head.relationName());
      parents.computeIfAbsent(parentKey(statement, p), k -> new ArrayList<>()).add(p);
    }
    for (RowAdapter row : rows) {
      List<Object> key = new ArrayList<>(statement.keyLabels().size());
      for (String label : statement.keyLabels()) key.add(row.raw(label));
      for (ResultNode p : parents.getOrDefault(IdentityKey.of(key), List.of())) walk(statement, row, p);
    }
  }

  /** Caller-facing objects: requested columns in table order, then extras, then relations. */
  public List<Map<String, Object>> result() {
    PlanNode root = plan.root();
    List<Map<String, Object>> out = new ArrayList<>(roots.size());
    for (ResultNode n : roots.values()) out.add(toMap(root, n));
    return out;
  }

  private void walk(PlannedStatement statement, RowAdapter row, ResultNode headParent) {
    Map<Integer, ResultNode> inRow = new HashMap<>();
    int headId = statement.headNodeId();
    for (int id : statement.nodeIds()) {
      PlanNode n = plan.node(id);
      ResultNode parent = (id == headId) ? headParent : inRow.get(n.parentId());
      if (id != headId && parent == null) continue;

      IdentityKey key = identity(n, row);
      if (key.allNull()) continue;
      Map<IdentityKey, ResultNode> container = (parent == null) ? roots : parent.relation(n.relationName());
      ResultNode node = container.get(key);
      if (node == null) {
        // a one-relation keeps its first match
        if (!n.isRoot() && !n.toMany() && !container.isEmpty()) continue;
        node = read(n, row);
        container.put(key, node);
        created.get(id).add(node);
      }
      inRow.put(id, node);
    }
  }

  private static IdentityKey identity(PlanNode n, RowAdapter row) {
    List<Object> values = new ArrayList<>(n.identity().size());
    for (String col : n.identity()) values.add(row.raw(n.columnLabel(col)));
    return IdentityKey.of(values);
  }

  private static ResultNode read(PlanNode n, RowAdapter row) {
    Map<String, Object> values = new LinkedHashMap<>();
    for (String col : n.fetchColumns()) values.put(col, row.raw(n.columnLabel(col)));
    for (String name : n.extras()) values.put(EXTRA + name, row.raw(n.extraLabel(name)));
    return new ResultNode(n.id(), values);
  }

  private static IdentityKey parentKey(PlannedStatement statement, ResultNode parent) {
    return IdentityKey.of(parentKeyValues(statement, parent));
  }

  private static List<Object> parentKeyValues(PlannedStatement statement, ResultNode parent) {
    List<Object> values = new ArrayList<>(statement.parentKeyColumns().size());
    for (String col : statement.parentKeyColumns()) values.add(parent.value(col));
    return values;
  }

  private Map<String, Object> toMap(PlanNode n, ResultNode node) {
    Map<String, Object> out = new LinkedHashMap<>();
    for (String col : n.outputColumns()) out.put(col, node.value(col));
    for (String name : n.extras()) out.put(name, node.value(EXTRA + name));
    for (int childId : n.children()) {
      PlanNode c = plan.node(childId);
      Map<IdentityKey, ResultNode> container = node.relationOrNull(c.relationName());
      if (c.toMany()) {
        List<Map<String, Object>> list = new ArrayList<>();
        if (container != null) for (ResultNode child : container.values()) list.add(toMap(c, child));
        out.put(c.relationName(), list);
      } else {
        ResultNode child = (container == null || container.isEmpty()) ? null : container.values().iterator().next();
        out.put(c.relationName(), child == null ? null : toMap(c, child));
      }
    }
    return out;
  }
}
