package io.intellixity.arbor.query;

import io.intellixity.arbor.error.PredicateException;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Parses the map form of filters (as read from JSON/YAML) into a {@link Predicate} tree.
 *
 * <pre>
 * { "name": "alice",                          // eq
 *   "age": { "gte": 18, "lt": 65 },           // operators on one column combine with AND
 *   "email": null,                            // isNull
 *   "id": { "in": [1, 2, { "$param": "x" }] },
 *   "posts": { "title": { "like": "%db%" } }, // relation: nested filter over related rows
 *   "groups": { "$exists": false },           // relation: existence shortcut
 *   "OR": [ {...}, {...} ], "NOT": {...}, "RAW": "length(name) &gt; 3" }
 * </pre>
 *
 * Sibling keys combine with AND. The parser does not know the schema: {@code "col": true} is read as an equality,
 * and the translator turns it into an existence check when {@code col} names a relation.
 */
public final class FilterParser {
  static final String EXISTS = "$exists";
  static final String SUBQUERY = "$subquery";
  private static final Set<String> LOGICAL = Set.of("AND", "OR", "NOT");

  private FilterParser() {}

  /** Returns null for a null or empty filter. */
  public static Predicate parse(Map<String, ?> filter) {
    if (filter == null || filter.isEmpty()) return null;
    List<Predicate> parts = new ArrayList<>();
    for (Map.Entry<String, ?> e : filter.entrySet()) {
      String key = e.getKey();
      Object v = e.getValue();
      switch (key) {
        case "AND" -> parts.add(group(Clause.AND, v));
        case "OR" -> parts.add(group(Clause.OR, v));
        case "NOT" -> parts.add(new NotElement(requireFilter(v, "NOT")));
        case "RAW" -> {
          if (!(v instanceof String s) || s.isBlank()) throw new PredicateException("RAW must be a non-blank SQL string");
          parts.add(new RawCondition(Expr.raw(s)));
        }
        default -> parts.add(field(key, v));
      }
    }
    return parts.size() == 1 ? parts.get(0) : new LogicalGroup(Clause.AND, parts);
  }

  private static LogicalGroup group(Clause clause, Object v) {
    if (!(v instanceof List<?> list)) throw new PredicateException(clause + " expects a list of filters");
    List<Predicate> out = new ArrayList<>();
    for (Object o : list) {
      Predicate p = requireFilter(o, clause.name());
      out.add(p);
    }
    return new LogicalGroup(clause, out);
  }

  private static Predicate requireFilter(Object v, String where) {
    if (!(v instanceof Map<?, ?> m)) throw new PredicateException(where + " expects a filter object, got: " + v);
    Predicate p = parse(asStringMap(m));
    if (p == null) throw new PredicateException(where + " expects a non-empty filter");
    return p;
  }

  private static Predicate field(String name, Object raw) {
    Object v = QueryValues.maybeParam(raw);
    if (v == null) return Condition.of(name, Operator.IS_NULL, null);
    if (v instanceof List<?>) throw new PredicateException("List value for '" + name + "'; use the 'in' operator");
    if (!(v instanceof Map<?, ?> m0)) return Condition.of(name, Operator.EQ, v);

    Map<String, Object> m = asStringMap(m0);
    if (m.containsKey(EXISTS)) {
      if (m.size() > 1) {
        throw new PredicateException("Relation filter '" + name + "' mixes the " + EXISTS + " shortcut with a nested filter");
      }
      Object flag = m.get(EXISTS);
      if (!(flag instanceof Boolean b)) throw new PredicateException(EXISTS + " on '" + name + "' must be true or false");
      return b ? RelationCondition.exists(name) : RelationCondition.notExists(name);
    }
    if (isColumnFilter(m)) return columnFilter(name, m);

    for (String k : m.keySet()) {
      if (Operator.fromKey(k) != null) {
        throw new PredicateException("Filter on '" + name + "' mixes operators with nested fields: " + m.keySet());
      }
    }
    Predicate nested = parse(m);
    if (nested == null) throw new PredicateException("Empty nested filter for '" + name + "'");
    return RelationCondition.matching(name, nested);
  }

  /** Operator keys, optionally combined through AND/OR/NOT whose bodies are themselves operator maps. */
  private static boolean isColumnFilter(Map<String, Object> m) {
    if (m.isEmpty()) return false;
    boolean anyOp = false;
    for (Map.Entry<String, Object> e : m.entrySet()) {
      String k = e.getKey();
      if (Operator.fromKey(k) != null) {
        anyOp = true;
        continue;
      }
      if (!LOGICAL.contains(k)) return false;
      Object body = e.getValue();
      if (body instanceof Map<?, ?> bm) {
        if (!isColumnFilter(asStringMap(bm))) return false;
      } else if (body instanceof List<?> bl) {
        for (Object o : bl) {
          if (!(o instanceof Map<?, ?> om) || !isColumnFilter(asStringMap(om))) return false;
        }
      } else {
        return false;
      }
      anyOp = true;
    }
    return anyOp;
  }

  private static Predicate columnFilter(String column, Map<String, Object> m) {
    List<Predicate> parts = new ArrayList<>();
    for (Map.Entry<String, Object> e : m.entrySet()) {
      String k = e.getKey();
      Object body = e.getValue();
      switch (k) {
        case "NOT" -> parts.add(new NotElement(columnFilter(column, asStringMap((Map<?, ?>) body))));
        case "AND", "OR" -> {
          List<Predicate> items = new ArrayList<>();
          for (Object o : (List<?>) body) items.add(columnFilter(column, asStringMap((Map<?, ?>) o)));
          parts.add(new LogicalGroup(Clause.valueOf(k), items));
        }
        default -> parts.add(condition(column, Operator.fromKey(k), body));
      }
    }
    return parts.size() == 1 ? parts.get(0) : new LogicalGroup(Clause.AND, parts);
  }

  private static Condition condition(String column, Operator op, Object raw) {
    if (op.isUnary()) return Condition.of(column, op, null);
    if (op.isRange()) {
      if (!(raw instanceof List<?> bounds) || bounds.size() != 2) {
        throw new PredicateException(op.key() + " on '" + column + "' expects [lower, upper]");
      }
      return Condition.range(column, op, QueryValues.maybeParam(bounds.get(0)), QueryValues.maybeParam(bounds.get(1)));
    }
    if (op == Operator.IN || op == Operator.NOT_IN) {
      if (raw instanceof List<?> list) {
        List<Object> values = new ArrayList<>(list.size());
        for (Object o : list) values.add(QueryValues.maybeParam(o));
        return Condition.of(column, op, values);
      }
      if (raw instanceof Map<?, ?> sm && sm.containsKey(SUBQUERY)) {
        return Condition.of(column, op, subquery(column, sm.get(SUBQUERY)));
      }
      throw new PredicateException(op.key() + " on '" + column + "' expects a list or a " + SUBQUERY + " object");
    }
    Object v = QueryValues.maybeParam(raw);
    if (v instanceof Map<?, ?> || v instanceof List<?>) {
      throw new PredicateException(op.key() + " on '" + column + "' expects a scalar value or placeholder");
    }
    return Condition.of(column, op, v);
  }

  private static ColumnSubquery subquery(String column, Object body) {
    if (!(body instanceof Map<?, ?> m)) throw new PredicateException(SUBQUERY + " on '" + column + "' must be an object");
    Object table = m.get("table");
    Object col = m.get("column");
    if (table == null || col == null) throw new PredicateException(SUBQUERY + " on '" + column + "' needs table and column");
    Object where = m.get("where");
    Predicate p = (where instanceof Map<?, ?> wm) ? parse(asStringMap(wm)) : null;
    return new ColumnSubquery(String.valueOf(table), String.valueOf(col), p);
  }

  /**
   * Parses an expression object: {@code {"column": c}}, {@code {"value": v}}, {@code {"$param": p}},
   * {@code {"fn": name, "args": [...]}}, {@code {"raw": sql, "args": [...]}}, {@code {"count": rel, "where": {...}}}.
   */
  public static Expr parseExpr(Object raw) {
    if (!(raw instanceof Map<?, ?> m0)) throw new PredicateException("Expression must be an object, got: " + raw);
    Map<String, Object> m = asStringMap(m0);
    if (m.containsKey("column")) return Expr.column(String.valueOf(m.get("column")));
    if (m.containsKey("value")) return Expr.value(m.get("value"));
    Object p = QueryValues.maybeParam(m);
    if (p instanceof QueryValues.Param param) return Expr.param(param.name());
    if (m.containsKey("fn")) return new Expr.Function(String.valueOf(m.get("fn")), args(m.get("args")));
    if (m.containsKey("raw")) return new Expr.Raw(String.valueOf(m.get("raw")), args(m.get("args")));
    if (m.containsKey("count")) {
      Object where = m.get("where");
      Predicate wp = (where instanceof Map<?, ?> wm) ? parse(asStringMap(wm)) : null;
      return Expr.count(String.valueOf(m.get("count")), wp);
    }
    throw new PredicateException("Unknown expression shape: " + m.keySet());
  }

  private static List<Expr> args(Object raw) {
    if (raw == null) return List.of();
    if (!(raw instanceof List<?> list)) throw new PredicateException("Expression args must be a list");
    List<Expr> out = new ArrayList<>();
    for (Object o : list) out.add(parseExpr(o));
    return out;
  }

  @SuppressWarnings("unchecked")
  private static Map<String, Object> asStringMap(Map<?, ?> m) {
    for (Object k : m.keySet()) {
      if (!(k instanceof String)) throw new PredicateException("Filter keys must be strings, got: " + k);
    }
    return (Map<String, Object>) m;
  }
}
