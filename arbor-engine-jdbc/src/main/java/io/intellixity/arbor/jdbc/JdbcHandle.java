package io.intellixity.arbor.jdbc;

import io.intellixity.arbor.exec.handle.EngineHandle;

import javax.sql.DataSource;
import java.util.Objects;

/** JDBC engine handle: data source, optional schema and optional transaction isolation level. */
public final class JdbcHandle implements EngineHandle<DataSource> {
  private final String id;
  private final DataSource client;
  private final String schema;
  private final Integer isolationLevel;

  public JdbcHandle(String id, DataSource client, String schema, Integer isolationLevel) {
    this.id = Objects.requireNonNull(id, "id");
    this.client = Objects.requireNonNull(client, "client");
    this.schema = (schema == null || schema.isBlank()) ? null : schema;
    this.isolationLevel = isolationLevel;
  }

  public JdbcHandle(String id, DataSource client, String schema) {
    this(id, client, schema, null);
  }

  @Override public String id() { return id; }
  @Override public DataSource client() { return client; }
  @Override public String namespace() { return schema; }

  public String schema() { return schema; }

  /** One of the {@code java.sql.Connection.TRANSACTION_*} constants, or null for the driver default. */
  public Integer isolationLevel() { return isolationLevel; }
}
