package io.intellixity.arbor.compile;

import java.util.UUID;

/**
 * One statement parameter: a literal value, a named placeholder resolved at execution, or a batch slot filled with
 * parent key values by the batching executor. {@code logicalType} is the column type the value is compared with,
 * or null when unknown. {@code paging} marks a placeholder used as a LIMIT or OFFSET count.
 */
public record Bind(Object value, String placeholder, int batchSlot, String logicalType, boolean paging) {
  public static Bind value(Object value, String logicalType) {
    return new Bind(coerce(logicalType, value), null, -1, logicalType, false);
  }

  public static Bind placeholder(String name, String logicalType) {
    return new Bind(null, name, -1, logicalType, false);
  }

  /** LIMIT/OFFSET placeholder; its value must be a non-negative integer. */
  public static Bind paging(String name) {
    return new Bind(null, name, -1, "int", true);
  }

  public static Bind batch(int slot, String logicalType) {
    return new Bind(null, null, slot, logicalType, false);
  }

  /** Normalises a value for the column type it is compared with; uuid columns accept their string form. */
  public static Object coerce(String logicalType, Object value) {
    if (value == null || logicalType == null) return value;
    if ("uuid".equalsIgnoreCase(logicalType) && !(value instanceof UUID)) {
      return UUID.fromString(String.valueOf(value).trim());
    }
    return value;
  }

  public boolean isPlaceholder() { return placeholder != null; }

  public boolean isBatchSlot() { return batchSlot >= 0; }
}
