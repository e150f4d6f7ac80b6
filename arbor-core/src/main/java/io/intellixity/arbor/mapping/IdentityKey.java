package io.intellixity.arbor.mapping;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Tuple of identity (or join key) values. Integral numbers are normalised to {@code long} so that a key read as
 * {@code Integer} from one statement equals the same key read as {@code Long} from another.
 */
public final class IdentityKey {
  private final List<Object> values;

  private IdentityKey(List<Object> values) {
    this.values = values;
  }

  public static IdentityKey of(List<?> values) {
    List<Object> out = new ArrayList<>(values.size());
    for (Object v : values) out.add(normalize(v));
    return new IdentityKey(Collections.unmodifiableList(out));
  }

  public static IdentityKey of(Object... values) {
    return of(Arrays.asList(values));
  }

  public List<Object> values() { return values; }

  /** True when every component is null: the row had no match for this level. */
  public boolean allNull() {
    for (Object v : values) if (v != null) return false;
    return true;
  }

  public boolean anyNull() {
    for (Object v : values) if (v == null) return true;
    return false;
  }

  private static Object normalize(Object v) {
    if (v instanceof Integer || v instanceof Long || v instanceof Short || v instanceof Byte) {
      return ((Number) v).longValue();
    }
    if (v instanceof BigInteger bi && bi.bitLength() < 64) return bi.longValue();
    if (v instanceof BigDecimal bd) {
      try {
        return bd.longValueExact();
      } catch (ArithmeticException notIntegral) {
        return bd.stripTrailingZeros();
      }
    }
    return v;
  }

  @Override
  public boolean equals(Object o) {
    return o instanceof IdentityKey k && values.equals(k.values);
  }

  @Override
  public int hashCode() { return values.hashCode(); }

  @Override
  public String toString() { return "IdentityKey" + values; }
}
