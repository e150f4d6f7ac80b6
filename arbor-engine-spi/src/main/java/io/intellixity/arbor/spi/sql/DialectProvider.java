package io.intellixity.arbor.spi.sql;

/** Discovery hook for dialects, registered in {@code META-INF/arbor.factories}. */
public interface DialectProvider {
  String dialectId();

  SqlDialect create();
}
