package io.intellixity.arbor.compile;

import io.intellixity.arbor.schema.TableDef;
import io.intellixity.arbor.selectast.SqlExpr;

import java.util.Objects;

/** Table occurrence that column names are resolved against. */
public record Scope(String alias, TableDef table) {
  public Scope {
    Objects.requireNonNull(alias, "alias");
    Objects.requireNonNull(table, "table");
  }

  /** Physical reference to a logical column; unknown columns fail with a schema error. */
  public SqlExpr.Column column(String name) {
    return new SqlExpr.Column(alias, table.column(name).dbName());
  }
}
