package io.intellixity.arbor.query;

import java.util.Map;

public final class QueryValues {
  private QueryValues() {}

  /** Named placeholder, bound when a prepared query executes. */
  public record Param(String name) {
    public Param {
      if (name == null || name.isBlank()) throw new IllegalArgumentException("param name is blank");
    }
  }

  public static Param param(String name) { return new Param(name); }

  /** Accepts {@code {"$param": "x"}} or {@code {"param": "x"}} maps as placeholder references. */
  static Object maybeParam(Object v) {
    if (v == null) return null;
    if (v instanceof Param) return v;
    if (v instanceof Map<?, ?> m && m.size() == 1) {
      Object p = m.get("$param");
      if (p == null) p = m.get("param");
      if (p != null) return new Param(String.valueOf(p));
    }
    return v;
  }
}
