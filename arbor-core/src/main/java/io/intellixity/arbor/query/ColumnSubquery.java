package io.intellixity.arbor.query;

import java.util.Objects;

/** Single-column subquery used as the operand of {@code in}/{@code notIn}. */
public record ColumnSubquery(String table, String column, Predicate where) {
  public ColumnSubquery {
    Objects.requireNonNull(table, "table");
    Objects.requireNonNull(column, "column");
  }
}
