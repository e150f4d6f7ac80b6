package io.intellixity.arbor.jdbc.dialect;

import io.intellixity.arbor.spi.sql.SqlDialect;

/** Dialect for JDBC engines; rendered SQL uses named binds that {@link io.intellixity.arbor.jdbc.NamedParamSql} rewrites. */
public interface JdbcDialect extends SqlDialect {
}
