package io.intellixity.arbor.exec;

import io.intellixity.arbor.compile.QueryPlan;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;

/**
 * Query compiled and rendered once, executable any number of times with different placeholder bindings.
 * Executions share only immutable state, so one instance may run concurrently.
 */
public interface PreparedQuery {
  QueryPlan plan();

  /** Placeholder names mapped to the logical type they are compared with (null when unknown). */
  Map<String, String> placeholders();

  /** PREPARED once built; a shared instance never reports the state of any one execution. */
  ExecutionState state();

  /**
   * Runs every statement of the plan inside one transaction and returns the nested result.
   *
   * @throws io.intellixity.arbor.error.PlaceholderException when a placeholder is left unbound, or a limit or
   *     offset placeholder is not a non-negative integer
   */
  List<Map<String, Object>> execute(Map<String, ?> bindings);

  default List<Map<String, Object>> execute() {
    return execute(Map.of());
  }

  /** Same as {@link #execute(Map)} on the engine's executor; failures complete the future exceptionally. */
  CompletableFuture<List<Map<String, Object>>> executeAsync(Map<String, ?> bindings);
}
