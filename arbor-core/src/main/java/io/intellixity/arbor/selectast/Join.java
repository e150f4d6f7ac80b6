package io.intellixity.arbor.selectast;

import java.util.Objects;

public record Join(Type type, FromItem item, SqlExpr on) {
  public enum Type { INNER, LEFT }

  public Join {
    Objects.requireNonNull(type, "type");
    Objects.requireNonNull(item, "item");
    on = (on == null) ? new SqlExpr.BoolConst(true) : on;
  }
}
