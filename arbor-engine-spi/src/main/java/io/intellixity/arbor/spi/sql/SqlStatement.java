package io.intellixity.arbor.spi.sql;

import io.intellixity.arbor.compile.Bind;

import java.util.List;
import java.util.Objects;

/** Rendered statement: SQL text with named binds ({@code :b1}, {@code :b2}, ...) in bind order. */
public record SqlStatement(String sql, List<Bind> binds) {
  public SqlStatement {
    Objects.requireNonNull(sql, "sql");
    binds = (binds == null) ? List.of() : List.copyOf(binds);
  }
}
