package io.intellixity.arbor.query;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;

/**
 * Scalar expression evaluated by the database, used for extras and raw filters.
 * <p>
 * Column references are resolved against the table of the query level the expression belongs to.
 */
public interface Expr {
  record Column(String name) implements Expr {
    public Column {
      Objects.requireNonNull(name, "name");
    }
  }

  record Value(Object value) implements Expr {}

  record Placeholder(String name) implements Expr {
    public Placeholder {
      Objects.requireNonNull(name, "name");
    }
  }

  /** Function call rendered as {@code name(arg, ...)}; the name must be a plain identifier. */
  record Function(String name, List<Expr> args) implements Expr {
    public Function {
      Objects.requireNonNull(name, "name");
      args = List.copyOf(args == null ? List.of() : args);
    }
  }

  /** SQL template with {@code {0}}, {@code {1}}, ... slots filled by the rendered arguments. */
  record Raw(String template, List<Expr> args) implements Expr {
    public Raw {
      Objects.requireNonNull(template, "template");
      args = List.copyOf(args == null ? List.of() : args);
    }
  }

  /** Number of related rows reachable through {@code relation}, optionally filtered. */
  record Count(String relation, Predicate where) implements Expr {
    public Count {
      Objects.requireNonNull(relation, "relation");
    }
  }

  static Expr column(String name) { return new Column(name); }

  static Expr value(Object value) { return new Value(value); }

  static Expr param(String name) { return new Placeholder(name); }

  static Expr fn(String name, Expr... args) { return new Function(name, Arrays.asList(args)); }

  static Expr raw(String template, Expr... args) { return new Raw(template, Arrays.asList(args)); }

  static Expr count(String relation) { return new Count(relation, null); }

  static Expr count(String relation, Predicate where) { return new Count(relation, where); }
}
