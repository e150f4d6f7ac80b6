package io.intellixity.arbor.query;

import java.util.HashMap;
import java.util.Map;

/** Column comparison operators. {@link #key()} is the name used by the map/JSON filter form. */
public enum Operator {
  EQ("eq"),
  NE("ne"),
  GT("gt"),
  GTE("gte"),
  LT("lt"),
  LTE("lte"),

  IN("in"),
  NOT_IN("notIn"),

  LIKE("like"),
  ILIKE("ilike"),
  NOT_LIKE("notLike"),
  NOT_ILIKE("notIlike"),

  IS_NULL("isNull"),
  IS_NOT_NULL("isNotNull"),

  BETWEEN("between"),
  NOT_BETWEEN("notBetween");

  private static final Map<String, Operator> BY_KEY = new HashMap<>();

  static {
    for (Operator op : values()) BY_KEY.put(op.key, op);
  }

  private final String key;

  Operator(String key) {
    this.key = key;
  }

  public String key() { return key; }

  /** Operators that take no operand; any supplied value is ignored. */
  public boolean isUnary() { return this == IS_NULL || this == IS_NOT_NULL; }

  public boolean isRange() { return this == BETWEEN || this == NOT_BETWEEN; }

  /** Returns the operator for a filter key, or null when the key is not an operator. */
  public static Operator fromKey(String key) {
    return key == null ? null : BY_KEY.get(key);
  }
}
