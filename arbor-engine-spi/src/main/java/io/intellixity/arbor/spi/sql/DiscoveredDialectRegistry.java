package io.intellixity.arbor.spi.sql;

import io.intellixity.arbor.util.ArborFactoriesLoader;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/** Dialects found through {@code META-INF/arbor.factories}; the first provider registered for an id wins. */
public final class DiscoveredDialectRegistry {
  private final Map<String, DialectProvider> providers;

  public DiscoveredDialectRegistry() {
    this(ArborFactoriesLoader.load(DialectProvider.class));
  }

  DiscoveredDialectRegistry(List<DialectProvider> found) {
    LinkedHashMap<String, DialectProvider> m = new LinkedHashMap<>();
    for (DialectProvider p : found) {
      if (p == null || p.dialectId() == null || p.dialectId().isBlank()) continue;
      m.putIfAbsent(p.dialectId(), p);
    }
    this.providers = Collections.unmodifiableMap(m);
  }

  public Set<String> ids() { return providers.keySet(); }

  public SqlDialect get(String dialectId) {
    Objects.requireNonNull(dialectId, "dialectId");
    DialectProvider p = providers.get(dialectId);
    if (p == null) throw new IllegalArgumentException("No dialect registered for id '" + dialectId + "', known: " + ids());
    return p.create();
  }
}
