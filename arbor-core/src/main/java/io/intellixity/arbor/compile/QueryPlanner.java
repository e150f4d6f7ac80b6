package io.intellixity.arbor.compile;

import io.intellixity.arbor.error.PredicateException;
import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.Expr;
import io.intellixity.arbor.query.LogicalGroup;
import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.query.QueryValues;
import io.intellixity.arbor.query.RelationCondition;
import io.intellixity.arbor.query.SortField;
import io.intellixity.arbor.relation.JoinDescriptor;
import io.intellixity.arbor.relation.JoinKey;
import io.intellixity.arbor.relation.RelationResolver;
import io.intellixity.arbor.schema.ColumnDef;
import io.intellixity.arbor.schema.RelationKind;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.selectast.FromItem;
import io.intellixity.arbor.selectast.Join;
import io.intellixity.arbor.selectast.OrderItem;
import io.intellixity.arbor.selectast.SelectAst;
import io.intellixity.arbor.selectast.SelectItem;
import io.intellixity.arbor.selectast.SqlExpr;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Compiles a nested {@link QuerySpec} into a {@link QueryPlan}.
 * <p>
 * JOIN: one statement. One-relations and unlimited many-relations are left-joined directly; limited many-relations
 * and all many-through relations are joined through a derived table, limited ones numbered with
 * {@code ROW_NUMBER() OVER (PARTITION BY <parent key>)} and cut in the join condition, so every parent gets its
 * own page. A limited root with to-many descendants is paged inside a derived table before any fan-out.
 * <p>
 * BATCH: the root statement carries the root and its one-descendants; every to-many level gets its own statement
 * filtered by the parent keys of the current batch, windowed the same way when limited.
 * <p>
 * Planning is pure; a planner can be shared between threads.
 */
public final class QueryPlanner {
  private static final Logger log = LoggerFactory.getLogger(QueryPlanner.class);

  private final SchemaGraph graph;
  private final RelationResolver resolver;

  public QueryPlanner(RelationResolver resolver) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.graph = resolver.graph();
  }

  public QueryPlan plan(QuerySpec spec, FetchStrategy strategy) {
    Objects.requireNonNull(spec, "spec");
    Objects.requireNonNull(strategy, "strategy");
    if (spec.table() == null || spec.table().isBlank()) throw new PredicateException("Query has no table");

    Build b = new Build(strategy);
    b.node(-1, null, null, graph.table(spec.table()), spec);
    if (strategy == FetchStrategy.JOIN) b.joinStatement();
    else b.batchStatements();

    QueryPlan plan = new QueryPlan(b.nodes, b.statements, strategy);
    if (log.isDebugEnabled()) {
      log.debug("arbor.plan table={} strategy={} nodes={} statements={}",
          spec.table(), strategy, plan.nodes().size(), plan.statements().size());
    }
    return plan;
  }

  private final class Build {
    private final FetchStrategy strategy;
    private final List<PlanNode> nodes = new ArrayList<>();
    private final List<PlannedStatement> statements = new ArrayList<>();
    private final PredicateTranslator translator;

    private Build(FetchStrategy strategy) {
      this.strategy = strategy;
      this.translator = new PredicateTranslator(resolver, new AliasAllocator());
    }

    private int node(int parentId, String relation, JoinDescriptor join, TableDef table, QuerySpec spec) {
      String level = (relation == null) ? table.name() : relation;
      if (join != null && spec.table() != null && !spec.table().equals(table.name())) {
        throw new SchemaException("Nested query for '" + relation + "' names table '" + spec.table()
            + "' but the relation targets '" + table.name() + "'");
      }
      List<String> output = outputColumns(table, spec);
      for (SortField s : spec.orderBy()) table.column(s.column());
      if (output.isEmpty() && spec.extras().isEmpty() && spec.with().isEmpty()) {
        throw new PredicateException("No fields selected for '" + level + "'");
      }

      Map<String, QuerySpec> with = spec.with();
      List<JoinDescriptor> childJoins = new ArrayList<>();
      for (String rel : with.keySet()) childJoins.add(resolver.resolve(table.name(), rel));

      Set<String> fetch = new LinkedHashSet<>(output);
      fetch.addAll(table.identityColumns());
      for (JoinDescriptor d : childJoins) fetch.addAll(d.sourceColumns());
      for (SortField s : spec.orderBy()) fetch.add(s.column());
      List<String> fetchColumns = new ArrayList<>();
      for (ColumnDef c : table.columns()) if (fetch.contains(c.name())) fetchColumns.add(c.name());

      int id = nodes.size();
      PlanNode n = new PlanNode(id, parentId, relation, join, table, spec, effectiveWhere(table, spec),
          derived(join, table, spec), output, fetchColumns);
      nodes.add(n);

      int i = 0;
      for (Map.Entry<String, QuerySpec> e : with.entrySet()) {
        JoinDescriptor d = childJoins.get(i++);
        n.addChild(node(id, e.getKey(), d, graph.table(d.targetTable()), e.getValue()));
      }
      return id;
    }

    private boolean derived(JoinDescriptor join, TableDef table, QuerySpec spec) {
      if (strategy != FetchStrategy.JOIN) return false;
      if (join == null) {
        boolean paged = spec.limit() != null || spec.offset() != null || spec.first();
        return paged && hasToManyDescendant(table, spec);
      }
      if (join.kind() == RelationKind.MANY_THROUGH) return true;
      return join.kind() == RelationKind.MANY && (spec.limit() != null || spec.offset() != null);
    }

    private boolean hasToManyDescendant(TableDef table, QuerySpec spec) {
      for (Map.Entry<String, QuerySpec> e : spec.with().entrySet()) {
        JoinDescriptor d = resolver.resolve(table.name(), e.getKey());
        if (d.toMany() || hasToManyDescendant(graph.table(d.targetTable()), e.getValue())) return true;
      }
      return false;
    }

    // ---- JOIN ----

    private void joinStatement() {
      PlanNode root = nodes.get(0);
      Scope rs = scope(root);
      SqlExpr where = translator.translate(root.where(), rs);
      SelectAst.Builder b;
      if (root.derived()) {
        SelectAst inner = SelectAst.from(table(root))
            .select(ownItems(root, rs))
            .where(where)
            .orderBy(levelOrder(root, false))
            .limit(rootLimit(root))
            .offset(paging(root.spec().offset()))
            .build();
        b = SelectAst.from(new FromItem.Derived(inner, root.refAlias())).select(labelRefs(root));
      } else {
        b = SelectAst.from(table(root))
            .select(ownItems(root, rs))
            .where(where)
            .limit(rootLimit(root))
            .offset(paging(root.spec().offset()));
      }
      List<Integer> carried = new ArrayList<>();
      carried.add(0);
      for (int c : root.children()) joinChild(b, root, nodes.get(c), carried);
      b.orderBy(finalOrder(root));
      statements.add(new PlannedStatement(0, b.build(), carried, -1, List.of(), List.of(), List.of()));
    }

    private List<OrderItem> finalOrder(PlanNode n) {
      List<OrderItem> out = new ArrayList<>();
      if (n.isRoot() || n.toMany()) out.addAll(levelOrder(n, true));
      for (int c : n.children()) out.addAll(finalOrder(nodes.get(c)));
      return out;
    }

    private void joinChild(SelectAst.Builder b, PlanNode parent, PlanNode c, List<Integer> carried) {
      if (strategy == FetchStrategy.BATCH && c.toMany()) return;
      carried.add(c.id());
      JoinDescriptor d = c.join();
      Scope cs = scope(c);

      if (!c.derived()) {
        List<SqlExpr> on = new ArrayList<>();
        for (JoinKey k : d.joinKeys()) on.add(SqlExpr.eq(cs.column(k.right()), ref(parent, k.left())));
        on.add(translator.translate(d.relationFilter(), cs));
        on.add(translator.translate(c.where(), cs));
        b.join(new Join(Join.Type.LEFT, table(c), SqlExpr.and(on)));
        b.select(ownItems(c, cs));
      } else {
        SelectAst.Builder inner = SelectAst.from(table(c));
        List<SqlExpr> keys = keyExprs(c, inner);
        inner.select(ownItems(c, cs));
        for (int i = 0; i < keys.size(); i++) inner.select(keys.get(i), c.keyLabel(i));
        inner.where(translator.translate(d.relationFilter(), cs));
        inner.where(translator.translate(c.where(), cs));
        if (c.limited()) inner.select(new SqlExpr.RowNumber(keys, levelOrder(c, false)), c.rowNumberLabel());

        List<SqlExpr> on = new ArrayList<>();
        List<String> source = d.sourceColumns();
        for (int i = 0; i < keys.size(); i++) {
          on.add(SqlExpr.eq(new SqlExpr.Column(c.refAlias(), c.keyLabel(i)), ref(parent, source.get(i))));
        }
        if (c.limited()) on.add(rowBounds(new SqlExpr.Column(c.refAlias(), c.rowNumberLabel()), c.spec()));
        b.join(new Join(Join.Type.LEFT, new FromItem.Derived(inner.build(), c.refAlias()), SqlExpr.and(on)));
        b.select(labelRefs(c));
      }
      for (int gc : c.children()) joinChild(b, c, nodes.get(gc), carried);
    }

    // ---- BATCH ----

    private void batchStatements() {
      PlanNode root = nodes.get(0);
      Scope rs = scope(root);
      SelectAst.Builder b = SelectAst.from(table(root))
          .select(ownItems(root, rs))
          .where(translator.translate(root.where(), rs))
          .limit(rootLimit(root))
          .offset(paging(root.spec().offset()));
      List<Integer> carried = new ArrayList<>();
      carried.add(0);
      for (int c : root.children()) joinChild(b, root, nodes.get(c), carried);
      b.orderBy(levelOrder(root, false));
      statements.add(new PlannedStatement(0, b.build(), carried, -1, List.of(), List.of(), List.of()));

      for (PlanNode n : nodes) if (n.toMany()) childStatement(n);
    }

    private void childStatement(PlanNode c) {
      JoinDescriptor d = c.join();
      PlanNode parent = nodes.get(c.parentId());
      Scope cs = scope(c);

      SelectAst.Builder inner = SelectAst.from(table(c));
      List<SqlExpr> keys = keyExprs(c, inner);
      List<String> keyLabels = new ArrayList<>();
      List<String> keyTypes = new ArrayList<>();
      for (String col : d.sourceColumns()) keyTypes.add(parent.table().column(col).logicalType());

      inner.select(ownItems(c, cs));
      List<Integer> carried = new ArrayList<>();
      carried.add(c.id());
      for (int gc : c.children()) joinChild(inner, c, nodes.get(gc), carried);
      for (int i = 0; i < keys.size(); i++) {
        inner.select(keys.get(i), c.keyLabel(i));
        keyLabels.add(c.keyLabel(i));
      }
      inner.where(new SqlExpr.InBatch(keys, keyTypes));
      inner.where(translator.translate(d.relationFilter(), cs));
      inner.where(translator.translate(c.where(), cs));

      SelectAst select;
      if (c.limited()) {
        inner.select(new SqlExpr.RowNumber(keys, levelOrder(c, false)), c.rowNumberLabel());
        SelectAst in = inner.build();
        String alias = AliasAllocator.derived(c.id());
        SelectAst.Builder outer = SelectAst.from(new FromItem.Derived(in, alias));
        for (SelectItem item : in.items()) {
          if (item.label().equals(c.rowNumberLabel())) continue;
          outer.select(new SqlExpr.Column(alias, item.label()), item.label());
        }
        outer.where(rowBounds(new SqlExpr.Column(alias, c.rowNumberLabel()), c.spec()));
        for (String label : keyLabels) outer.orderBy(new OrderItem(new SqlExpr.Column(alias, label), false));
        for (SortField s : c.spec().orderBy()) {
          outer.orderBy(new OrderItem(new SqlExpr.Column(alias, c.columnLabel(s.column())), desc(s)));
        }
        for (String id : c.identity()) outer.orderBy(new OrderItem(new SqlExpr.Column(alias, c.columnLabel(id)), false));
        select = outer.build();
      } else {
        for (SqlExpr k : keys) inner.orderBy(new OrderItem(k, false));
        inner.orderBy(levelOrder(c, false));
        select = inner.build();
      }
      statements.add(new PlannedStatement(statements.size(), select, carried, parent.id(), keyLabels,
          d.sourceColumns(), keyTypes));
    }

    // ---- shared ----

    /** Child-side key expressions matched against the parent's source columns; joins the junction when needed. */
    private List<SqlExpr> keyExprs(PlanNode c, SelectAst.Builder b) {
      JoinDescriptor d = c.join();
      Scope cs = scope(c);
      List<SqlExpr> keys = new ArrayList<>();
      if (d.through() == null) {
        for (JoinKey k : d.joinKeys()) keys.add(cs.column(k.right()));
        return keys;
      }
      Scope js = new Scope(AliasAllocator.junction(c.id()), graph.table(d.through().table()));
      List<SqlExpr> on = new ArrayList<>();
      for (JoinKey k : d.through().targetKeys()) on.add(SqlExpr.eq(js.column(k.left()), cs.column(k.right())));
      b.join(new Join(Join.Type.INNER, new FromItem.Table(js.table().dbName(), js.alias()), SqlExpr.and(on)));
      for (JoinKey k : d.through().sourceKeys()) keys.add(js.column(k.right()));
      return keys;
    }

    /** Fetched columns and extras of a level, evaluated against its table alias. */
    private List<SelectItem> ownItems(PlanNode n, Scope s) {
      List<SelectItem> out = new ArrayList<>();
      for (String col : n.fetchColumns()) out.add(new SelectItem(s.column(col), n.columnLabel(col)));
      for (Map.Entry<String, Expr> e : n.spec().extras().entrySet()) {
        out.add(new SelectItem(translator.expr(e.getValue(), s), n.extraLabel(e.getKey())));
      }
      return out;
    }

    /** Fetched columns and extras of a derived level, re-exported by label. */
    private List<SelectItem> labelRefs(PlanNode n) {
      List<SelectItem> out = new ArrayList<>();
      for (String col : n.fetchColumns()) {
        out.add(new SelectItem(new SqlExpr.Column(n.refAlias(), n.columnLabel(col)), n.columnLabel(col)));
      }
      for (String name : n.extras()) {
        out.add(new SelectItem(new SqlExpr.Column(n.refAlias(), n.extraLabel(name)), n.extraLabel(name)));
      }
      return out;
    }

    /** Requested order then identity; {@code outside} references derived levels by label. */
    private List<OrderItem> levelOrder(PlanNode n, boolean outside) {
      List<OrderItem> out = new ArrayList<>();
      for (SortField s : n.spec().orderBy()) {
        out.add(new OrderItem(outside ? ref(n, s.column()) : scope(n).column(s.column()), desc(s)));
      }
      for (String id : n.identity()) out.add(new OrderItem(outside ? ref(n, id) : scope(n).column(id), false));
      return out;
    }

    private SqlExpr ref(PlanNode n, String column) {
      if (n.derived()) return new SqlExpr.Column(n.refAlias(), n.columnLabel(column));
      return scope(n).column(column);
    }

    private Scope scope(PlanNode n) {
      return new Scope(n.tableAlias(), n.table());
    }

    private FromItem table(PlanNode n) {
      return new FromItem.Table(n.table().dbName(), n.tableAlias());
    }

    private SqlExpr rootLimit(PlanNode root) {
      if (root.spec().first()) return new SqlExpr.Literal("1");
      return paging(root.spec().limit());
    }

    private SqlExpr rowBounds(SqlExpr rn, QuerySpec spec) {
      Object limit = spec.limit();
      Object offset = spec.offset();
      List<SqlExpr> parts = new ArrayList<>();
      if (offset != null) parts.add(new SqlExpr.Compare(rn, ">", paging(offset)));
      if (limit != null) {
        SqlExpr upper;
        if (offset == null) upper = paging(limit);
        else if (limit instanceof Integer l && offset instanceof Integer o) upper = new SqlExpr.Literal(String.valueOf(l.longValue() + o));
        else upper = new SqlExpr.Plus(paging(offset), paging(limit));
        parts.add(new SqlExpr.Compare(rn, "<=", upper));
      }
      return SqlExpr.and(parts);
    }

    /** Existence checks for required one-relations are part of the level's own filter, ahead of any paging. */
    private Predicate effectiveWhere(TableDef table, QuerySpec spec) {
      List<Predicate> parts = new ArrayList<>();
      if (spec.where() != null) parts.add(spec.where());
      for (Map.Entry<String, QuerySpec> e : spec.with().entrySet()) {
        JoinDescriptor d = resolver.resolve(table.name(), e.getKey());
        if (d.kind() != RelationKind.ONE || d.optional()) continue;
        Predicate nested = effectiveWhere(graph.table(d.targetTable()), e.getValue());
        parts.add(nested == null ? RelationCondition.exists(e.getKey()) : RelationCondition.matching(e.getKey(), nested));
      }
      if (parts.isEmpty()) return null;
      return parts.size() == 1 ? parts.get(0) : new LogicalGroup(Clause.AND, parts);
    }
  }

  private static boolean desc(SortField s) {
    return s.direction() == SortField.Direction.DESC;
  }

  private static SqlExpr paging(Object v) {
    if (v == null) return null;
    if (v instanceof QueryValues.Param p) return new SqlExpr.BindRef(Bind.paging(p.name()));
    return new SqlExpr.Literal(String.valueOf(v));
  }

  /** Columns returned to the caller: all when the selection is empty, include mode when any flag is true. */
  static List<String> outputColumns(TableDef table, QuerySpec spec) {
    Map<String, Boolean> sel = spec.columns();
    for (String c : sel.keySet()) table.column(c);
    boolean include = sel.containsValue(Boolean.TRUE);
    List<String> out = new ArrayList<>();
    for (ColumnDef c : table.columns()) {
      Boolean flag = sel.get(c.name());
      if (sel.isEmpty()) out.add(c.name());
      else if (include && Boolean.TRUE.equals(flag)) out.add(c.name());
      else if (!include && flag == null) out.add(c.name());
    }
    return out;
  }
}
