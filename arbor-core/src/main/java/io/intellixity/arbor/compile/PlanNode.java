package io.intellixity.arbor.compile;

import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.relation.JoinDescriptor;
import io.intellixity.arbor.schema.TableDef;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * One query level of a plan. Nodes live in the plan's arena and refer to each other by id; node 0 is the root.
 * <p>
 * Result labels are derived from the node id so that every level of a statement has its own namespace:
 * columns {@code n<id>.<column>}, extras {@code n<id>$<name>}, batch keys {@code n<id>#k<i>}, row numbers
 * {@code n<id>#rn}.
 */
public final class PlanNode {
  private final int id;
  private final int parentId;
  private final String relationName;
  private final JoinDescriptor join;
  private final TableDef table;
  private final QuerySpec spec;
  private final Predicate where;
  private final boolean derived;
  private final List<String> outputColumns;
  private final List<String> fetchColumns;
  private final List<String> identity;
  private final List<String> extras;
  private final List<Integer> children = new ArrayList<>();

  PlanNode(int id, int parentId, String relationName, JoinDescriptor join, TableDef table, QuerySpec spec,
           Predicate where, boolean derived, List<String> outputColumns, List<String> fetchColumns) {
    this.id = id;
    this.parentId = parentId;
    this.relationName = relationName;
    this.join = join;
    this.table = table;
    this.spec = spec;
    this.where = where;
    this.derived = derived;
    this.outputColumns = List.copyOf(outputColumns);
    this.fetchColumns = List.copyOf(fetchColumns);
    this.identity = table.identityColumns();
    this.extras = List.copyOf(spec.extras().keySet());
  }

  public int id() { return id; }

  /** -1 for the root. */
  public int parentId() { return parentId; }

  public boolean isRoot() { return parentId < 0; }

  /** Relation this level was reached through; null for the root. */
  public String relationName() { return relationName; }

  public JoinDescriptor join() { return join; }

  public TableDef table() { return table; }

  public QuerySpec spec() { return spec; }

  /** Filter of this level including existence checks for required one-relations. */
  public Predicate where() { return where; }

  /** Whether the level is read through a derived table ({@code d<id>}) rather than its table alias. */
  public boolean derived() { return derived; }

  /** Columns returned to the caller, in table order. */
  public List<String> outputColumns() { return outputColumns; }

  /** Columns selected from the database, in table order: output, identity, join and ordering columns. */
  public List<String> fetchColumns() { return fetchColumns; }

  public List<String> identity() { return identity; }

  public List<String> extras() { return extras; }

  public List<Integer> children() { return Collections.unmodifiableList(children); }

  void addChild(int childId) {
    children.add(childId);
  }

  public boolean toMany() { return join != null && join.toMany(); }

  /** To-many level with a limit or offset, paged per parent. */
  public boolean limited() {
    return toMany() && (spec.limit() != null || spec.offset() != null);
  }

  public String tableAlias() { return AliasAllocator.table(id); }

  /** Alias that columns of this level are referenced by outside its own table scope. */
  public String refAlias() { return derived ? AliasAllocator.derived(id) : tableAlias(); }

  public String columnLabel(String column) { return "n" + id + "." + column; }

  public String extraLabel(String name) { return "n" + id + "$" + name; }

  public String keyLabel(int index) { return "n" + id + "#k" + index; }

  public String rowNumberLabel() { return "n" + id + "#rn"; }

  @Override
  public String toString() {
    return "PlanNode[" + id + (relationName == null ? "" : " " + relationName) + " -> " + table.name() + "]";
  }
}
