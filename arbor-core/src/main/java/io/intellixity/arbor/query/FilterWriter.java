package io.intellixity.arbor.query;

import io.intellixity.arbor.error.PredicateException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/** Writes filter trees and expressions back to the map form read by {@link FilterParser}. */
public final class FilterWriter {
  private FilterWriter() {}

  public static Map<String, Object> toMap(Predicate p) {
    if (p == null) return Map.of();
    return p.accept(new PredicateVisitor<>() {
      @Override
      public Map<String, Object> visit(Condition c) {
        Object body;
        if (c.operator().isUnary()) {
          body = true;
        } else if (c.operator().isRange()) {
          List<Object> bounds = new ArrayList<>();
          bounds.add(value(c.lower()));
          bounds.add(value(c.upper()));
          body = bounds;
        } else {
          body = value(c.value());
        }
        Map<String, Object> ops = new LinkedHashMap<>();
        ops.put(c.operator().key(), body);
        return single(c.column(), ops);
      }

      @Override
      public Map<String, Object> visit(RelationCondition r) {
        if (r.isShortcut()) return single(r.relation(), single(FilterParser.EXISTS, r.exists()));
        return single(r.relation(), toMap(r.nested()));
      }

      @Override
      public Map<String, Object> visit(LogicalGroup g) {
        List<Object> items = new ArrayList<>();
        for (Predicate e : g.elements()) items.add(toMap(e));
        return single(g.clause().name(), items);
      }

      @Override
      public Map<String, Object> visit(NotElement n) {
        return single("NOT", toMap(n.element()));
      }

      @Override
      public Map<String, Object> visit(RawCondition r) {
        if (r.expr() instanceof Expr.Raw raw && raw.args().isEmpty()) return single("RAW", raw.template());
        throw new PredicateException("Only argument-free RAW filters have a map form");
      }
    });
  }

  public static Map<String, Object> exprToMap(Expr e) {
    if (e instanceof Expr.Column c) return single("column", c.name());
    if (e instanceof Expr.Value v) return single("value", v.value());
    if (e instanceof Expr.Placeholder p) return single("$param", p.name());
    if (e instanceof Expr.Function f) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("fn", f.name());
      m.put("args", exprList(f.args()));
      return m;
    }
    if (e instanceof Expr.Raw r) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("raw", r.template());
      m.put("args", exprList(r.args()));
      return m;
    }
    if (e instanceof Expr.Count c) {
      Map<String, Object> m = new LinkedHashMap<>();
      m.put("count", c.relation());
      if (c.where() != null) m.put("where", toMap(c.where()));
      return m;
    }
    throw new IllegalArgumentException("Unknown expression: " + e);
  }

  private static List<Object> exprList(List<Expr> args) {
    List<Object> out = new ArrayList<>();
    for (Expr a : args) out.add(exprToMap(a));
    return out;
  }

  static Object value(Object v) {
    if (v instanceof QueryValues.Param p) return single("$param", p.name());
    if (v instanceof ColumnSubquery sq) {
      Map<String, Object> body = new LinkedHashMap<>();
      body.put("table", sq.table());
      body.put("column", sq.column());
      if (sq.where() != null) body.put("where", toMap(sq.where()));
      return single(FilterParser.SUBQUERY, body);
    }
    if (v instanceof List<?> list) {
      List<Object> out = new ArrayList<>();
      for (Object o : list) out.add(value(o));
      return out;
    }
    return v;
  }

  private static Map<String, Object> single(String key, Object value) {
    Map<String, Object> m = new LinkedHashMap<>();
    m.put(key, value);
    return m;
  }
}
