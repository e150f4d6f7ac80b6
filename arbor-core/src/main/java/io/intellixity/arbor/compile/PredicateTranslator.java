package io.intellixity.arbor.compile;

import io.intellixity.arbor.error.PredicateException;
import io.intellixity.arbor.error.SchemaException;
import io.intellixity.arbor.query.Clause;
import io.intellixity.arbor.query.ColumnSubquery;
import io.intellixity.arbor.query.Condition;
import io.intellixity.arbor.query.Expr;
import io.intellixity.arbor.query.LogicalGroup;
import io.intellixity.arbor.query.NotElement;
import io.intellixity.arbor.query.Operator;
import io.intellixity.arbor.query.Predicate;
import io.intellixity.arbor.query.PredicateVisitor;
import io.intellixity.arbor.query.QueryValues;
import io.intellixity.arbor.query.RawCondition;
import io.intellixity.arbor.query.RelationCondition;
import io.intellixity.arbor.relation.JoinDescriptor;
import io.intellixity.arbor.relation.JoinKey;
import io.intellixity.arbor.relation.RelationResolver;
import io.intellixity.arbor.schema.ColumnDef;
import io.intellixity.arbor.schema.SchemaGraph;
import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.selectast.FromItem;
import io.intellixity.arbor.selectast.Join;
import io.intellixity.arbor.selectast.SelectAst;
import io.intellixity.arbor.selectast.SqlExpr;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Translates filter trees and scalar expressions into {@link SqlExpr} trees scoped to one table occurrence.
 * <p>
 * Values become {@link Bind}s in the order they appear; placeholders stay unresolved and carry the logical type of
 * the column they are compared with. Relation filters become correlated {@code EXISTS} subqueries whose tables get
 * fresh aliases from the plan's {@link AliasAllocator}.
 */
public final class PredicateTranslator {
  private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

  private final SchemaGraph graph;
  private final RelationResolver resolver;
  private final AliasAllocator aliases;

  public PredicateTranslator(RelationResolver resolver, AliasAllocator aliases) {
    this.resolver = Objects.requireNonNull(resolver, "resolver");
    this.graph = resolver.graph();
    this.aliases = Objects.requireNonNull(aliases, "aliases");
  }

  /** Returns null for a null predicate (no constraint). */
  public SqlExpr translate(Predicate predicate, Scope scope) {
    if (predicate == null) return null;
    return predicate.accept(new Visitor(scope));
  }

  /**
   * Correlates {@code relation} of the outer scope: FROM target [JOIN junction] WHERE join keys AND relation filter.
   * The returned builder has no select items yet.
   */
  public Correlated correlate(Scope outer, String relation) {
    JoinDescriptor d = resolver.resolve(outer.table().name(), relation);
    TableDef target = graph.table(d.targetTable());
    Scope inner = new Scope(aliases.filter(), target);
    SelectAst.Builder b = SelectAst.from(new FromItem.Table(target.dbName(), inner.alias()));

    if (d.through() == null) {
      for (JoinKey k : d.joinKeys()) b.where(SqlExpr.eq(inner.column(k.right()), outer.column(k.left())));
    } else {
      TableDef junction = graph.table(d.through().table());
      Scope j = new Scope(aliases.filter(), junction);
      List<SqlExpr> on = new ArrayList<>();
      for (JoinKey k : d.through().targetKeys()) on.add(SqlExpr.eq(j.column(k.left()), inner.column(k.right())));
      b.join(new Join(Join.Type.INNER, new FromItem.Table(junction.dbName(), j.alias()), SqlExpr.and(on)));
      for (JoinKey k : d.through().sourceKeys()) b.where(SqlExpr.eq(j.column(k.right()), outer.column(k.left())));
    }
    b.where(translate(d.relationFilter(), inner));
    return new Correlated(b, inner);
  }

  /** Correlated relation subquery under construction and the scope of its target table. */
  public record Correlated(SelectAst.Builder query, Scope target) {}

  /** {@code [NOT] EXISTS} over related rows matching {@code nested} (null matches any row). */
  public SqlExpr exists(Scope outer, String relation, Predicate nested, boolean negated) {
    Correlated c = correlate(outer, relation);
    c.query().where(translate(nested, c.target()));
    return new SqlExpr.Exists(c.query().select(new SqlExpr.Literal("1"), null).build(), negated);
  }

  /** Scalar expression for extras and raw filter arguments. */
  public SqlExpr expr(Expr expr, Scope scope) {
    if (expr instanceof Expr.Column c) return scope.column(c.name());
    if (expr instanceof Expr.Value v) return new SqlExpr.BindRef(Bind.value(v.value(), null));
    if (expr instanceof Expr.Placeholder p) return new SqlExpr.BindRef(Bind.placeholder(p.name(), null));
    if (expr instanceof Expr.Function f) {
      if (!IDENT.matcher(f.name()).matches()) throw new PredicateException("Invalid function name: " + f.name());
      List<SqlExpr> args = new ArrayList<>();
      for (Expr a : f.args()) args.add(expr(a, scope));
      return new SqlExpr.Function(f.name(), args);
    }
    if (expr instanceof Expr.Raw r) {
      List<SqlExpr> args = new ArrayList<>();
      for (Expr a : r.args()) args.add(expr(a, scope));
      return new SqlExpr.Raw(r.template(), args);
    }
    if (expr instanceof Expr.Count c) {
      Correlated corr = correlate(scope, c.relation());
      corr.query().where(translate(c.where(), corr.target()));
      return new SqlExpr.Scalar(corr.query().select(new SqlExpr.CountAll(), null).build());
    }
    throw new PredicateException("Unsupported expression: " + expr);
  }

  private final class Visitor implements PredicateVisitor<SqlExpr> {
    private final Scope scope;

    private Visitor(Scope scope) {
      this.scope = scope;
    }

    @Override
    public SqlExpr visit(LogicalGroup group) {
      List<SqlExpr> items = new ArrayList<>();
      for (Predicate p : group.elements()) {
        SqlExpr e = p.accept(this);
        if (e != null) items.add(e);
      }
      if (items.isEmpty()) return null;
      if (group.clause() == Clause.AND) return SqlExpr.and(items);
      return items.size() == 1 ? items.get(0) : new SqlExpr.Or(items);
    }

    @Override
    public SqlExpr visit(NotElement not) {
      SqlExpr inner = not.element().accept(this);
      if (inner == null) return null;
      if (inner instanceof SqlExpr.BoolConst b) return new SqlExpr.BoolConst(!b.value());
      return new SqlExpr.Not(inner);
    }

    @Override
    public SqlExpr visit(RawCondition raw) {
      return expr(raw.expr(), scope);
    }

    @Override
    public SqlExpr visit(RelationCondition rc) {
      TableDef table = scope.table();
      if (!table.hasRelation(rc.relation())) {
        throw new SchemaException("Unknown relation '" + rc.relation() + "' on table '" + table.name() + "'");
      }
      if (rc.isShortcut()) return exists(scope, rc.relation(), null, !rc.exists());
      return exists(scope, rc.relation(), rc.nested(), false);
    }

    @Override
    public SqlExpr visit(Condition c) {
      TableDef table = scope.table();
      if (!table.hasColumn(c.column()) && table.hasRelation(c.column())) {
        if (c.operator() == Operator.EQ && c.value() instanceof Boolean b) {
          return exists(scope, c.column(), null, !b);
        }
        throw new PredicateException("Relation '" + c.column() + "' only accepts true/false or a nested filter");
      }
      ColumnDef col = table.column(c.column());
      SqlExpr left = scope.column(c.column());
      String type = col.logicalType();
      Operator op = c.operator();

      return switch (op) {
        case EQ -> c.value() == null ? new SqlExpr.IsNull(left, false) : compare(left, "=", c, type);
        case NE -> c.value() == null ? new SqlExpr.IsNull(left, true) : compare(left, "<>", c, type);
        case GT -> compare(left, ">", c, type);
        case GTE -> compare(left, ">=", c, type);
        case LT -> compare(left, "<", c, type);
        case LTE -> compare(left, "<=", c, type);
        case IN, NOT_IN -> in(left, c, type, op == Operator.NOT_IN);
        case LIKE -> new SqlExpr.Like(left, operand(c, type), false, false);
        case ILIKE -> new SqlExpr.Like(left, operand(c, type), true, false);
        case NOT_LIKE -> new SqlExpr.Like(left, operand(c, type), false, true);
        case NOT_ILIKE -> new SqlExpr.Like(left, operand(c, type), true, true);
        case IS_NULL -> new SqlExpr.IsNull(left, false);
        case IS_NOT_NULL -> new SqlExpr.IsNull(left, true);
        case BETWEEN, NOT_BETWEEN -> {
          if (c.lower() == null || c.upper() == null) {
            throw new PredicateException(op.key() + " on '" + c.column() + "' needs non-null lower and upper bounds");
          }
          yield new SqlExpr.Between(left, bind(c.lower(), type), bind(c.upper(), type), op == Operator.NOT_BETWEEN);
        }
      };
    }

    private SqlExpr compare(SqlExpr left, String op, Condition c, String type) {
      return new SqlExpr.Compare(left, op, operand(c, type));
    }

    private SqlExpr operand(Condition c, String type) {
      if (c.value() == null) {
        throw new PredicateException(c.operator().key() + " on '" + c.column() + "' requires a non-null value");
      }
      if (c.value() instanceof Collection<?> || c.value() instanceof ColumnSubquery) {
        throw new PredicateException(c.operator().key() + " on '" + c.column() + "' expects a scalar value or placeholder");
      }
      return bind(c.value(), type);
    }

    private SqlExpr in(SqlExpr left, Condition c, String type, boolean negated) {
      Object v = c.value();
      if (v instanceof ColumnSubquery sq) {
        TableDef t = graph.table(sq.table());
        Scope s = new Scope(aliases.filter(), t);
        SelectAst q = SelectAst.from(new FromItem.Table(t.dbName(), s.alias()))
            .select(s.column(sq.column()), null)
            .where(translate(sq.where(), s))
            .build();
        return new SqlExpr.InSubquery(left, q, negated);
      }
      if (!(v instanceof Collection<?> values)) {
        throw new PredicateException(c.operator().key() + " on '" + c.column() + "' expects a list, got: " + v);
      }
      if (values.isEmpty()) return new SqlExpr.BoolConst(negated);
      List<SqlExpr> binds = new ArrayList<>(values.size());
      for (Object o : values) {
        if (o == null) throw new PredicateException(c.operator().key() + " on '" + c.column() + "' contains null");
        binds.add(bind(o, type));
      }
      return new SqlExpr.InList(left, binds, negated);
    }
  }

  private static SqlExpr bind(Object value, String type) {
    if (value instanceof QueryValues.Param p) return new SqlExpr.BindRef(Bind.placeholder(p.name(), type));
    return new SqlExpr.BindRef(Bind.value(value, type));
  }
}
