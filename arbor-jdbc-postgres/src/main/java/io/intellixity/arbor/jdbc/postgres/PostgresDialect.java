package io.intellixity.arbor.jdbc.postgres;

import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.jdbc.dialect.AbstractJdbcSqlDialect;

/**
 * Postgres dialect for JDBC.
 * <p>
 * Keeps only Postgres-specific overrides. Generic SQL rendering lives in {@link AbstractJdbcSqlDialect}.
 */
public final class PostgresDialect extends AbstractJdbcSqlDialect {
  public static final String ID = "postgres";

  @Override public String id() { return ID; }

  /** Nested relations are fetched in one statement. */
  @Override
  public FetchStrategy preferredStrategy() { return FetchStrategy.JOIN; }

  @Override
  protected String renderIlike(String left, String pattern, boolean negated) {
    return left + (negated ? " NOT ILIKE " : " ILIKE ") + pattern;
  }
}
