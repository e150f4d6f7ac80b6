package io.intellixity.arbor.exec.handle;

/**
 * Runtime handle for a backend: the native client an engine talks to and the namespace its tables live in.
 * For JDBC the client is a {@code DataSource} and the namespace a schema.
 */
public interface EngineHandle<TClient> {
  /** Identifier used in logs. */
  String id();

  TClient client();

  /** Schema (or equivalent) that table names are qualified with; null for the backend default. */
  String namespace();
}
