package io.intellixity.arbor.jdbc.postgres;

import io.intellixity.arbor.spi.sql.DialectProvider;
import io.intellixity.arbor.spi.sql.SqlDialect;

public final class PostgresDialectProvider implements DialectProvider {
  @Override public String dialectId() { return PostgresDialect.ID; }

  @Override public SqlDialect create() { return new PostgresDialect(); }
}
