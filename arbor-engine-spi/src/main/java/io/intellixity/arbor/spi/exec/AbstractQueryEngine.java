package io.intellixity.arbor.spi.exec;

import io.intellixity.arbor.catalog.SchemaCatalog;
import io.intellixity.arbor.compile.FetchStrategy;
import io.intellixity.arbor.compile.QueryPlan;
import io.intellixity.arbor.exec.PreparedQuery;
import io.intellixity.arbor.exec.Propagation;
import io.intellixity.arbor.exec.QueryEngine;
import io.intellixity.arbor.exec.TxHandle;
import io.intellixity.arbor.exec.handle.EngineHandle;
import io.intellixity.arbor.query.QuerySpec;
import io.intellixity.arbor.spi.internal.LruTtlCache;
import io.intellixity.arbor.spi.sql.SqlDialect;
import io.intellixity.arbor.spi.sql.SqlStatement;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

/**
 * Template for query engines: planning, plan caching, prepared execution and transaction scoping live here;
 * backends implement the transaction and statement hooks.
 * <p>
 * Transactions are bound to the calling thread and to this engine instance, so two engines used from the same
 * thread never share a transaction.
 */
public abstract class AbstractQueryEngine<H extends EngineHandle<?>> implements QueryEngine<H> {
  private final SqlDialect dialect;
  private final H handle;
  private final SchemaCatalog catalog;
  private final EngineOptions options;
  private final Propagation defaultPropagation;
  private final ThreadLocal<TxHandle> currentTx = new ThreadLocal<>();
  private final LruTtlCache<QuerySpec, DefaultPreparedQuery> plans;
  private final AtomicInteger asyncThreads = new AtomicInteger();
  private volatile ExecutorService ownedExecutor;

  protected AbstractQueryEngine(SqlDialect dialect,
                                H handle,
                                SchemaCatalog catalog,
                                EngineOptions options,
                                Propagation defaultPropagation) {
    this.dialect = Objects.requireNonNull(dialect, "dialect");
    this.handle = Objects.requireNonNull(handle, "handle");
    this.catalog = Objects.requireNonNull(catalog, "catalog");
    this.options = (options == null) ? EngineOptions.defaults() : options;
    this.defaultPropagation = (defaultPropagation == null) ? Propagation.REQUIRED : defaultPropagation;
    this.plans = new LruTtlCache<>(this.options.planCacheSize(), this.options.planCacheTtlMillis());
    catalog.addInvalidationListener(plans::clear);
  }

  /** Opens a backend transaction. */
  protected abstract TxHandle begin();

  protected abstract void commit(TxHandle tx);

  protected abstract void rollback(TxHandle tx);

  /**
   * Runs one SELECT and returns its rows as label-to-value maps.
   *
   * @param txOrNull transaction to run in, or null to use a short-lived connection
   * @param params   values for {@code statement.binds()}, in order
   */
  protected abstract List<Map<String, Object>> executeSelect(TxHandle txOrNull, SqlStatement statement, List<Object> params);

  @Override
  public final H handle() { return handle; }

  @Override
  public final Propagation defaultPropagation() { return defaultPropagation; }

  protected final SqlDialect dialect() { return dialect; }

  protected final SchemaCatalog catalog() { return catalog; }

  protected final EngineOptions options() { return options; }

  public final FetchStrategy fetchStrategy() {
    return options.fetchStrategy() != null ? options.fetchStrategy() : dialect.preferredStrategy();
  }

  protected final TxHandle currentTxOrNull() {
    return currentTx.get();
  }

  @Override
  public final PreparedQuery prepare(QuerySpec spec) {
    Objects.requireNonNull(spec, "spec");
    return plans.getOrCompute(spec, () -> {
      QueryPlan plan = catalog.planner().plan(spec, fetchStrategy());
      return new DefaultPreparedQuery(this, plan);
    });
  }

  /** Configured executor, or a cached pool of daemon threads created for this engine on first use. */
  final Executor asyncExecutor() {
    Executor configured = options.asyncExecutor();
    if (configured != null) return configured;
    ExecutorService owned = ownedExecutor;
    if (owned == null) {
      synchronized (this) {
        owned = ownedExecutor;
        if (owned == null) {
          owned = Executors.newCachedThreadPool(r -> {
            Thread t = new Thread(r, "arbor-async-" + asyncThreads.incrementAndGet());
            t.setDaemon(true);
            return t;
          });
          ownedExecutor = owned;
        }
      }
    }
    return owned;
  }

  /** Plans held by the plan cache. */
  public final int cachedPlans() {
    return plans.size();
  }

  final List<Map<String, Object>> select(SqlStatement statement, List<Object> params) {
    return executeSelect(currentTxOrNull(), statement, params);
  }

  final SqlStatement render(QueryPlan plan, int statementIndex, int batchSize) {
    return dialect.render(plan.statements().get(statementIndex).select(), handle.namespace(), batchSize);
  }

  @Override
  public final <T> T inTx(Propagation propagation, Supplier<T> work) {
    Objects.requireNonNull(propagation, "propagation");
    Objects.requireNonNull(work, "work");
    TxHandle existing = currentTxOrNull();
    return switch (propagation) {
      case REQUIRED -> (existing != null) ? work.get() : runInNewTx(work);
      case SUPPORTS -> work.get();
      case MANDATORY -> {
        if (existing == null) throw new IllegalStateException("No existing transaction for propagation=MANDATORY");
        yield work.get();
      }
      case REQUIRES_NEW -> runInNewTx(work);
      case NEVER -> {
        if (existing != null) throw new IllegalStateException("Existing transaction found for propagation=NEVER");
        yield work.get();
      }
    };
  }

  private <T> T runInNewTx(Supplier<T> work) {
    TxHandle outer = currentTx.get();
    TxHandle tx = begin();
    currentTx.set(tx);
    try {
      T result = work.get();
      commit(tx);
      return result;
    } catch (RuntimeException | Error e) {
      try {
        rollback(tx);
      } catch (RuntimeException rollbackFailure) {
        e.addSuppressed(rollbackFailure);
      }
      throw e;
    } finally {
      if (outer == null) currentTx.remove();
      else currentTx.set(outer);
    }
  }
}
