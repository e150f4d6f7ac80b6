package io.intellixity.arbor.spi.internal;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.LongSupplier;
import java.util.function.Supplier;

/**
 * Thread-safe LRU cache with optional expire-after-write. A {@code ttlMillis} of 0 disables expiry.
 */
public final class LruTtlCache<K, V> {
  private final long ttlMillis;
  private final LongSupplier nowMillis;
  private final LinkedHashMap<K, Slot<V>> map;
  private long generation;

  private record Slot<V>(V value, long writtenAt) {}

  public LruTtlCache(int maxEntries, long ttlMillis) {
    this(maxEntries, ttlMillis, System::currentTimeMillis);
  }

  public LruTtlCache(int maxEntries, long ttlMillis, LongSupplier nowMillis) {
    if (maxEntries <= 0) throw new IllegalArgumentException("maxEntries must be > 0");
    if (ttlMillis < 0) throw new IllegalArgumentException("ttlMillis must be >= 0");
    this.ttlMillis = ttlMillis;
    this.nowMillis = Objects.requireNonNull(nowMillis, "nowMillis");
    this.map = new LinkedHashMap<>(16, 0.75f, true) {
      @Override
      protected boolean removeEldestEntry(Map.Entry<K, Slot<V>> eldest) {
        return size() > maxEntries;
      }
    };
  }

  public synchronized V get(K key) {
    Objects.requireNonNull(key, "key");
    Slot<V> e = map.get(key);
    if (e == null) return null;
    if (expired(e)) {
      map.remove(key);
      return null;
    }
    return e.value();
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    Objects.requireNonNull(value, "value");
    map.put(key, new Slot<>(value, nowMillis.getAsLong()));
  }

  /**
   * Cached value, or the supplier's result stored under {@code key}. The supplier runs outside the cache lock, so
   * two callers may compute the same key; the first value stored wins and is returned to both. A value computed
   * across a {@link #clear()} is returned but not stored.
   */
  public V getOrCompute(K key, Supplier<V> supplier) {
    long seen;
    synchronized (this) {
      V existing = get(key);
      if (existing != null) return existing;
      seen = generation;
    }
    V created = Objects.requireNonNull(supplier.get(), "supplier returned null");
    synchronized (this) {
      V existing = get(key);
      if (existing != null) return existing;
      if (seen == generation) put(key, created);
      return created;
    }
  }

  public synchronized void clear() {
    generation++;
    map.clear();
  }

  public synchronized int size() {
    map.values().removeIf(this::expired);
    return map.size();
  }

  private boolean expired(Slot<V> e) {
    return ttlMillis > 0 && nowMillis.getAsLong() - e.writtenAt() >= ttlMillis;
  }
}
