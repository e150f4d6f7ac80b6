package io.intellixity.arbor.spi.sql;

import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.selectast.SelectAst;

/** Renders dialect-neutral select trees to backend SQL. Implementations are stateless and thread-safe. */
public interface SqlDialect {
  String id();

  /** Fetch strategy used when the engine options do not pick one. */
  FetchStrategy preferredStrategy();

  /**
   * Renders {@code select}. Tables are qualified with {@code namespace} when it is non-null. Batch key filters are
   * expanded for {@code batchSize} key tuples; the value is ignored for statements without one.
   */
  SqlStatement render(SelectAst select, String namespace, int batchSize);
}
