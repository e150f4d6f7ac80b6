package io.intellixity.arbor.spi.exec;

import io.intellixity.arbor.compile.FetchStrategy;
import org.junit.jupiter.api.Test;

import java.util.Properties;

import static org.junit.jupiter.api.Assertions.*;

final class EngineOptionsTest {
  @Test
  void defaults() {
    EngineOptions o = EngineOptions.defaults();
    assertNull(o.fetchStrategy());
    assertEquals(EngineOptions.DEFAULT_MAX_BATCH_SIZE, o.maxBatchSize());
    assertEquals(EngineOptions.DEFAULT_PLAN_CACHE_SIZE, o.planCacheSize());
    assertEquals(0, o.planCacheTtlMillis());
    assertNull(o.asyncExecutor());
  }

  @Test
  void readsProperties() {
    Properties p = new Properties();
    p.setProperty(EngineOptions.FETCH_STRATEGY, " batch ");
    p.setProperty(EngineOptions.MAX_BATCH_SIZE, "50");
    p.setProperty(EngineOptions.PLAN_CACHE_TTL_MS, "60000");

    EngineOptions o = EngineOptions.fromProperties(p);
    assertEquals(FetchStrategy.BATCH, o.fetchStrategy());
    assertEquals(50, o.maxBatchSize());
    assertEquals(EngineOptions.DEFAULT_PLAN_CACHE_SIZE, o.planCacheSize());
    assertEquals(60_000, o.planCacheTtlMillis());
  }

  @Test
  void rejectsInvalidValues() {
    Properties p = new Properties();
    p.setProperty(EngineOptions.MAX_BATCH_SIZE, "0");
    assertThrows(IllegalArgumentException.class, () -> EngineOptions.fromProperties(p));

    Properties bad = new Properties();
    bad.setProperty(EngineOptions.FETCH_STRATEGY, "sideways");
    assertThrows(IllegalArgumentException.class, () -> EngineOptions.fromProperties(bad));
  }

  @Test
  void withersKeepOtherFields() {
    EngineOptions o = EngineOptions.defaults().withFetchStrategy(FetchStrategy.JOIN).withMaxBatchSize(3);
    assertEquals(FetchStrategy.JOIN, o.fetchStrategy());
    assertEquals(3, o.maxBatchSize());
    assertEquals(EngineOptions.DEFAULT_PLAN_CACHE_SIZE, o.planCacheSize());
  }
}
