package io.intellixity.arbor.jdbc.dialect;

import io.intellixity.arbor.spi.sql.DialectProvider;
import io.intellixity.arbor.spi.sql.SqlDialect;

public final class AnsiDialectProvider implements DialectProvider {
  @Override public String dialectId() { return AnsiDialect.ID; }

  @Override public SqlDialect create() { return new AnsiDialect(); }
}
