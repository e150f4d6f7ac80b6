package io.intellixity.arbor.spi.exec;

import io.intellixity.arbor.compile.FetchStrategy;

import java.util.Locale;
import java.util.Properties;
import java.util.concurrent.Executor;

/**
 * Engine tuning.
 *
 * @param fetchStrategy      null to use the dialect's preference
 * @param maxBatchSize       parent keys per child statement round trip
 * @param planCacheSize      prepared plans kept per engine
 * @param planCacheTtlMillis plan expiry after creation, 0 for none
 * @param asyncExecutor      executor for {@code executeAsync}, null for a pool owned by the engine
 */
public record EngineOptions(FetchStrategy fetchStrategy,
                            int maxBatchSize,
                            int planCacheSize,
                            long planCacheTtlMillis,
                            Executor asyncExecutor) {
  public static final int DEFAULT_MAX_BATCH_SIZE = 500;
  public static final int DEFAULT_PLAN_CACHE_SIZE = 256;

  public static final String FETCH_STRATEGY = "arbor.fetch-strategy";
  public static final String MAX_BATCH_SIZE = "arbor.max-batch-size";
  public static final String PLAN_CACHE_SIZE = "arbor.plan-cache.size";
  public static final String PLAN_CACHE_TTL_MS = "arbor.plan-cache.ttl-ms";

  public EngineOptions {
    if (maxBatchSize <= 0) throw new IllegalArgumentException("maxBatchSize must be > 0");
    if (planCacheSize <= 0) throw new IllegalArgumentException("planCacheSize must be > 0");
    if (planCacheTtlMillis < 0) throw new IllegalArgumentException("planCacheTtlMillis must be >= 0");
  }

  public static EngineOptions defaults() {
    return new EngineOptions(null, DEFAULT_MAX_BATCH_SIZE, DEFAULT_PLAN_CACHE_SIZE, 0, null);
  }

  /** Reads the {@code arbor.*} keys; absent keys keep their defaults. */
  public static EngineOptions fromProperties(Properties p) {
    String strategy = p.getProperty(FETCH_STRATEGY);
    FetchStrategy fs = (strategy == null || strategy.isBlank())
        ? null
        : FetchStrategy.valueOf(strategy.trim().toUpperCase(Locale.ROOT));
    return new EngineOptions(fs,
        intProp(p, MAX_BATCH_SIZE, DEFAULT_MAX_BATCH_SIZE),
        intProp(p, PLAN_CACHE_SIZE, DEFAULT_PLAN_CACHE_SIZE),
        Long.parseLong(p.getProperty(PLAN_CACHE_TTL_MS, "0").trim()),
        null);
  }

  public EngineOptions withFetchStrategy(FetchStrategy strategy) {
    return new EngineOptions(strategy, maxBatchSize, planCacheSize, planCacheTtlMillis, asyncExecutor);
  }

  public EngineOptions withMaxBatchSize(int size) {
    return new EngineOptions(fetchStrategy, size, planCacheSize, planCacheTtlMillis, asyncExecutor);
  }

  public EngineOptions withAsyncExecutor(Executor executor) {
    return new EngineOptions(fetchStrategy, maxBatchSize, planCacheSize, planCacheTtlMillis, executor);
  }

  private static int intProp(Properties p, String key, int def) {
    String v = p.getProperty(key);
    return (v == null || v.isBlank()) ? def : Integer.parseInt(v.trim());
  }
}
