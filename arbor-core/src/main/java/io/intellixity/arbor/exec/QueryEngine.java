package io.intellixity.arbor.exec;

import io.intellixity.arbor.exec.handle.EngineHandle;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.query.QuerySpecJson;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.function.Supplier;

/**
 * Entry point for nested reads. Results are lists of maps: column values, extras, a {@code List} per to-many
 * relation and a map (or null) per to-one relation.
 */
public interface QueryEngine<H extends EngineHandle<?>> {
  H handle();

  Propagation defaultPropagation();

  <T> T inTx(Propagation propagation, Supplier<T> work);

  default <T> T inTx(Supplier<T> work) {
    return inTx(defaultPropagation(), work);
  }

  /** Fluent request rooted at {@code table}. */
  default FindRequest find(String table) {
    return new FindRequest(this, table);
  }

  PreparedQuery prepare(QuerySpec spec);

  default List<Map<String, Object>> execute(QuerySpec spec) {
    return execute(spec, Map.of());
  }

  default List<Map<String, Object>> execute(QuerySpec spec, Map<String, ?> bindings) {
    return prepare(spec).execute(bindings);
  }

  /** Preparation failures complete the returned future exceptionally as well. */
  default CompletableFuture<List<Map<String, Object>>> executeAsync(QuerySpec spec, Map<String, ?> bindings) {
    PreparedQuery prepared;
    try {
      prepared = prepare(spec);
    } catch (RuntimeException e) {
      return CompletableFuture.failedFuture(e);
    }
    return prepared.executeAsync(bindings);
  }

  /** At most one root object. */
  default Optional<Map<String, Object>> findOne(QuerySpec spec, Map<String, ?> bindings) {
    QuerySpec single = spec.first() ? spec : spec.toBuilder().first().build();
    List<Map<String, Object>> rows = execute(single, bindings);
    return rows.isEmpty() ? Optional.empty() : Optional.of(rows.get(0));
  }

  /** Request in its JSON form, see {@link QuerySpecJson}. */
  default List<Map<String, Object>> executeJson(String json, Map<String, ?> bindings) {
    return execute(QuerySpecJson.read(json), bindings);
  }
}
