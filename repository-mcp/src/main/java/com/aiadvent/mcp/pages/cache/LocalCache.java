package com.aiadvent.mcp.pages.cache;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import java.time.Clock;
import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.TimeUnit;
import java.util.function.UnaryOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.Nullable;

/**
 * Bounded, time-limited cache of remote values on top of Caffeine. Values are copied on the way
 * in and on the way out, so callers never share mutable state with the cache.
 *
 * <p>Entries expire {@code ttl} after they were written, measured on the supplied {@link Clock}.
 * When an insertion of a new key would exceed the capacity the oldest-written fifth of the
 * entries (at least one) is evicted first.
 */
public class LocalCache<K, V> {

  private static final Logger log = LoggerFactory.getLogger(LocalCache.class);

  public static final Duration DEFAULT_TTL = Duration.ofMinutes(5);
  public static final int DEFAULT_CAPACITY = 50;

  private final Cache<K, V> entries;
  private final Duration ttl;
  private final int capacity;
  private final UnaryOperator<V> copier;
  private final Counter hitCounter;
  private final Counter missCounter;
  private final Counter evictionCounter;

  public LocalCache(
      Duration ttl,
      int capacity,
      UnaryOperator<V> copier,
      Clock clock,
      @Nullable MeterRegistry meterRegistry) {
    if (capacity <= 0) {
      throw new IllegalArgumentException("capacity must be positive");
    }
    Objects.requireNonNull(clock, "clock");
    this.ttl = ttl == null || ttl.isNegative() || ttl.isZero() ? DEFAULT_TTL : ttl;
    this.capacity = capacity;
    this.copier = Objects.requireNonNull(copier, "copier");
    this.entries =
        Caffeine.newBuilder()
            .expireAfterWrite(this.ttl)
            .ticker(() -> TimeUnit.MILLISECONDS.toNanos(clock.millis()))
            .executor(Runnable::run)
            .build();
    MeterRegistry registry = meterRegistry;
    if (registry == null) {
      registry = new SimpleMeterRegistry();
    }
    this.hitCounter = registry.counter("repository_cache_hit_total");
    this.missCounter = registry.counter("repository_cache_miss_total");
    this.evictionCounter = registry.counter("repository_cache_eviction_total");
  }

  public Optional<V> get(K key) {
    V value = entries.getIfPresent(key);
    if (value == null) {
      missCounter.increment();
      return Optional.empty();
    }
    hitCounter.increment();
    return Optional.of(copier.apply(value));
  }

  public synchronized void put(K key, V value) {
    Objects.requireNonNull(key, "key");
    V copy = copier.apply(Objects.requireNonNull(value, "value"));
    if (entries.getIfPresent(key) == null) {
      entries.cleanUp();
      if (entries.estimatedSize() >= capacity) {
        evictOldest();
      }
    }
    entries.put(key, copy);
  }

  public void invalidate(K key) {
    entries.invalidate(key);
  }

  public void clear() {
    entries.invalidateAll();
  }

  public int size() {
    entries.cleanUp();
    return (int) entries.estimatedSize();
  }

  public boolean containsKey(K key) {
    return entries.getIfPresent(key) != null;
  }

  public int capacity() {
    return capacity;
  }

  public Duration ttl() {
    return ttl;
  }

  private void evictOldest() {
    int toEvict = Math.max(1, capacity / 5);
    Set<K> victims =
        entries.policy().expireAfterWrite().orElseThrow().oldest(toEvict).keySet();
    entries.invalidateAll(victims);
    evictionCounter.increment(victims.size());
    log.debug("repository.cache evicted={} remaining={}", victims.size(), entries.estimatedSize());
  }
}
