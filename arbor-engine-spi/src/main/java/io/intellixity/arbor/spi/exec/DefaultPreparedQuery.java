package io.intellixity.arbor.spi.exec;

import io.intellixity.arbor.compile.Bind;
import io.intellixity.arbor.compile.PlannedStatement;
import io.intellixity.arbor.compile.QueryPlan;
import io.intellixity.arbor.error.PlaceholderException;
import io.intellixity.arbor.exec.ExecutionState;
import io.intellixity.arbor.exec.PreparedQuery;
import io.intellixity.arbor.exec.Propagation;
import io.intellixity.arbor.mapping.RowAdapters;
import io.intellixity.arbor.mapping.RowReconstructor;
import io.intellixity.arbor.spi.sql.SqlStatement;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;

/**
 * {@link PreparedQuery} over a compiled plan. Root statements are rendered once at construction; child statements
 * are rendered per batch size and memoised. The placeholder table is built from every rendered bind.
 */
public final class DefaultPreparedQuery implements PreparedQuery {
  private static final Logger log = LoggerFactory.getLogger(DefaultPreparedQuery.class);

  private final AbstractQueryEngine<?> engine;
  private final QueryPlan plan;
  private final SqlStatement[] rendered;
  private final List<Map<Integer, SqlStatement>> batchRenders = new ArrayList<>();
  private final Map<String, String> placeholders;
  private final Set<String> pagingPlaceholders;

  DefaultPreparedQuery(AbstractQueryEngine<?> engine, QueryPlan plan) {
    this.engine = Objects.requireNonNull(engine, "engine");
    this.plan = Objects.requireNonNull(plan, "plan");
    int n = plan.statements().size();
    this.rendered = new SqlStatement[n];
    Map<String, String> table = new LinkedHashMap<>();
    Set<String> paging = new LinkedHashSet<>();
    for (PlannedStatement ps : plan.statements()) {
      Map<Integer, SqlStatement> memo = new ConcurrentHashMap<>();
      batchRenders.add(memo);
      SqlStatement s = engine.render(plan, ps.index(), 1);
      if (ps.isChild()) memo.put(1, s);
      else rendered[ps.index()] = s;
      collectPlaceholders(s, table);
      for (Bind b : s.binds()) if (b.paging()) paging.add(b.placeholder());
    }
    this.placeholders = Collections.unmodifiableMap(table);
    this.pagingPlaceholders = Collections.unmodifiableSet(paging);
    if (log.isDebugEnabled()) {
      log.debug("arbor.prepare statements={} placeholders={}", n, placeholders.keySet());
    }
  }

  private static void collectPlaceholders(SqlStatement s, Map<String, String> table) {
    for (Bind b : s.binds()) {
      if (!b.isPlaceholder()) continue;
      String name = b.placeholder();
      String type = b.logicalType();
      if (!table.containsKey(name)) {
        table.put(name, type);
        continue;
      }
      String known = table.get(name);
      if (known == null) table.put(name, type);
      else if (type != null && !known.equals(type)) {
        throw new PlaceholderException("Placeholder '" + name + "' is used as both " + known + " and " + type, Set.of(name));
      }
    }
  }

  @Override
  public QueryPlan plan() { return plan; }

  @Override
  public Map<String, String> placeholders() { return placeholders; }

  /** Always {@link ExecutionState#PREPARED}: the instance is cached and shared, so execution state is per run. */
  @Override
  public ExecutionState state() { return ExecutionState.PREPARED; }

  @Override
  public List<Map<String, Object>> execute(Map<String, ?> bindings) {
    return run(bindings, () -> false);
  }

  @Override
  public CompletableFuture<List<Map<String, Object>>> executeAsync(Map<String, ?> bindings) {
    CompletableFuture<List<Map<String, Object>>> future = new CompletableFuture<>();
    engine.asyncExecutor().execute(() -> {
      if (future.isCancelled()) return;
      try {
        future.complete(run(bindings, future::isCancelled));
      } catch (RuntimeException | Error e) {
        future.completeExceptionally(e);
      }
    });
    return future;
  }

  private List<Map<String, Object>> run(Map<String, ?> bindings, BooleanSupplier cancelled) {
    Map<String, ?> values = (bindings == null) ? Map.of() : bindings;
    Set<String> missing = new LinkedHashSet<>();
    for (String name : placeholders.keySet()) if (!values.containsKey(name)) missing.add(name);
    if (!missing.isEmpty()) throw new PlaceholderException("Unbound placeholders: " + missing, missing);
    for (String name : pagingPlaceholders) requireCount(name, values.get(name));

    ExecutionState state = ExecutionState.EXECUTING;
    try {
      List<Map<String, Object>> out = engine.inTx(Propagation.REQUIRED, () -> runStatements(values, cancelled));
      state = ExecutionState.COMPLETED;
      return out;
    } catch (RuntimeException | Error e) {
      state = ExecutionState.FAILED;
      throw e;
    } finally {
      if (log.isDebugEnabled()) log.debug("arbor.execute state={} statements={}", state, plan.statements().size());
    }
  }

  private List<Map<String, Object>> runStatements(Map<String, ?> values, BooleanSupplier cancelled) {
    RowReconstructor reconstructor = new RowReconstructor(plan);
    int maxBatch = engine.options().maxBatchSize();
    for (PlannedStatement ps : plan.statements()) {
      checkCancelled(cancelled);
      if (!ps.isChild()) {
        SqlStatement s = rendered[ps.index()];
        reconstructor.acceptRoot(ps, RowAdapters.fromMaps(engine.select(s, params(s, values, null, 0))));
        continue;
      }
      List<List<Object>> keys = reconstructor.parentKeys(ps);
      if (keys.isEmpty()) {
        reconstructor.acceptChildren(ps, List.of());
        continue;
      }
      for (int from = 0; from < keys.size(); from += maxBatch) {
        checkCancelled(cancelled);
        List<List<Object>> chunk = keys.subList(from, Math.min(keys.size(), from + maxBatch));
        SqlStatement s = batchRenders.get(ps.index()).computeIfAbsent(chunk.size(), size -> engine.render(plan, ps.index(), size));
        List<Map<String, Object>> rows = engine.select(s, params(s, values, chunk, ps.keyLabels().size()));
        reconstructor.acceptChildren(ps, RowAdapters.fromMaps(rows));
      }
    }
    checkCancelled(cancelled);
    return reconstructor.result();
  }

  private static List<Object> params(SqlStatement s, Map<String, ?> values, List<List<Object>> chunk, int keyWidth) {
    List<Object> out = new ArrayList<>(s.binds().size());
    for (Bind b : s.binds()) {
      if (b.isPlaceholder()) out.add(Bind.coerce(b.logicalType(), values.get(b.placeholder())));
      else if (b.isBatchSlot()) out.add(chunk.get(b.batchSlot() / keyWidth).get(b.batchSlot() % keyWidth));
      else out.add(b.value());
    }
    return out;
  }

  /** LIMIT and OFFSET placeholders take a non-negative integer that fits an int. */
  private static void requireCount(String name, Object value) {
    boolean integral = value instanceof Integer || value instanceof Long || value instanceof Short
        || value instanceof Byte || value instanceof BigInteger;
    if (integral) {
      BigInteger n = (value instanceof BigInteger big) ? big : BigInteger.valueOf(((Number) value).longValue());
      if (n.signum() >= 0 && n.bitLength() < Integer.SIZE) return;
    }
    throw new PlaceholderException("Placeholder '" + name + "' is a limit or offset and needs a non-negative integer, got "
        + (value == null ? "null" : value + " (" + value.getClass().getSimpleName() + ")"), Set.of(name));
  }

  private static void checkCancelled(BooleanSupplier cancelled) {
    if (cancelled.getAsBoolean()) throw new CancellationException("Query execution cancelled");
  }
}
