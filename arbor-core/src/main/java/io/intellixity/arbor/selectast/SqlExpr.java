package io.intellixity.arbor.selectast;

import io.intellixity.arbor.compile.Bind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Dialect-neutral SQL expression. Column and alias names are physical; dialects quote them when rendering.
 */
public interface SqlExpr {
  /** {@code alias.column}. */
  record Column(String alias, String column) implements SqlExpr {
    public Column {
      Objects.requireNonNull(alias, "alias");
      Objects.requireNonNull(column, "column");
    }
  }

  record BindRef(Bind bind) implements SqlExpr {
    public BindRef {
      Objects.requireNonNull(bind, "bind");
    }
  }

  /** Trusted constant SQL text produced by the planner (numbers, {@code 1} in EXISTS selects). */
  record Literal(String sql) implements SqlExpr {}

  record BoolConst(boolean value) implements SqlExpr {}

  /** Binary comparison; {@code op} is one of {@code = <> < <= > >=}. */
  record Compare(SqlExpr left, String op, SqlExpr right) implements SqlExpr {}

  record Like(SqlExpr left, SqlExpr pattern, boolean caseInsensitive, boolean negated) implements SqlExpr {}

  record IsNull(SqlExpr expr, boolean negated) implements SqlExpr {}

  record InList(SqlExpr left, List<SqlExpr> values, boolean negated) implements SqlExpr {
    public InList {
      values = List.copyOf(values);
    }
  }

  record InSubquery(SqlExpr left, SelectAst query, boolean negated) implements SqlExpr {}

  /**
   * Key tuple membership in the current batch of parent keys. The tuple count is only known when the batch is
   * rendered, so dialects expand it with {@link Bind#batch} slots.
   */
  record InBatch(List<SqlExpr> keys, List<String> logicalTypes) implements SqlExpr {
    public InBatch {
      keys = List.copyOf(keys);
      logicalTypes = List.copyOf(logicalTypes);
    }
  }

  record Between(SqlExpr expr, SqlExpr lower, SqlExpr upper, boolean negated) implements SqlExpr {}

  record And(List<SqlExpr> items) implements SqlExpr {
    public And {
      items = List.copyOf(items);
    }
  }

  record Or(List<SqlExpr> items) implements SqlExpr {
    public Or {
      items = List.copyOf(items);
    }
  }

  record Not(SqlExpr item) implements SqlExpr {}

  record Exists(SelectAst query, boolean negated) implements SqlExpr {}

  record Function(String name, List<SqlExpr> args) implements SqlExpr {
    public Function {
      args = List.copyOf(args);
    }
  }

  /** Caller-supplied template; {@code {n}} slots are replaced by the rendered {@code args.get(n)}. */
  record Raw(String template, List<SqlExpr> args) implements SqlExpr {
    public Raw {
      args = List.copyOf(args);
    }
  }

  record Scalar(SelectAst query) implements SqlExpr {}

  record CountAll() implements SqlExpr {}

  record Plus(SqlExpr left, SqlExpr right) implements SqlExpr {}

  record RowNumber(List<SqlExpr> partitionBy, List<OrderItem> orderBy) implements SqlExpr {
    public RowNumber {
      partitionBy = List.copyOf(partitionBy);
      orderBy = List.copyOf(orderBy);
    }
  }

  /** Conjunction that drops null and TRUE items and collapses to a single item where possible. */
  static SqlExpr and(List<SqlExpr> items) {
    List<SqlExpr> out = new ArrayList<>();
    for (SqlExpr e : items) {
      if (e == null) continue;
      if (e instanceof BoolConst b && b.value()) continue;
      if (e instanceof And a) out.addAll(a.items());
      else out.add(e);
    }
    if (out.isEmpty()) return null;
    if (out.size() == 1) return out.get(0);
    return new And(out);
  }

  static SqlExpr and(SqlExpr... items) {
    return and(Arrays.asList(items));
  }

  static SqlExpr eq(SqlExpr left, SqlExpr right) {
    return new Compare(left, "=", right);
  }
}
