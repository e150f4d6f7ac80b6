package io.intellixity.arbor.schema;

import java.util.Objects;

/**
 * Column of a {@link TableDef}. {@code name} is the logical name used in queries and results, {@code dbName} the
 * physical column name. Generated columns are read-only.
 */
public record ColumnDef(String name,
                        String dbName,
                        String logicalType,
                        boolean nullable,
                        DefaultPolicy defaultPolicy,
                        boolean generated,
                        boolean primaryKey) {
  public ColumnDef {
    Objects.requireNonNull(name, "name");
    dbName = (dbName == null || dbName.isBlank()) ? name : dbName;
    logicalType = (logicalType == null || logicalType.isBlank()) ? "string" : logicalType;
    defaultPolicy = (defaultPolicy == null) ? DefaultPolicy.NONE : defaultPolicy;
  }

  public static ColumnDef of(String name, String logicalType) {
    return new ColumnDef(name, null, logicalType, false, DefaultPolicy.NONE, false, false);
  }

  public static ColumnDef nullable(String name, String logicalType) {
    return new ColumnDef(name, null, logicalType, true, DefaultPolicy.NONE, false, false);
  }

  /** Primary-key column with a database-generated value. */
  public static ColumnDef id(String name, String logicalType) {
    return new ColumnDef(name, null, logicalType, false, DefaultPolicy.DATABASE, true, true);
  }

  public ColumnDef dbName(String dbName) {
    return new ColumnDef(name, dbName, logicalType, nullable, defaultPolicy, generated, primaryKey);
  }

  public ColumnDef asPrimaryKey() {
    return new ColumnDef(name, dbName, logicalType, nullable, defaultPolicy, generated, true);
  }
}
