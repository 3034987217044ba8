/*
 * Copyright 2025 AxonOps
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.axonops.rextract.cache;

import com.axonops.rextract.api.Pattern;
import com.axonops.rextract.metrics.MetricNames;
import com.axonops.rextract.metrics.RextractMetricsRegistry;
import com.axonops.rextract.util.PatternHasher;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Thread-safe read-through cache of compiled patterns with dual eviction.
 *
 * <p>Eviction strategies: 1. LRU (soft limit): when the cache exceeds max size, least recently used
 * entries are evicted asynchronously. 2. Idle time: a background thread evicts entries idle beyond
 * the timeout.
 *
 * <p>Cached {@link Pattern}s are immutable, so a hit returns exactly what a fresh compile would.
 * Failed compilations propagate to the caller and are never cached.
 *
 * <p>Each instance reports its size under its own gauge, {@link MetricNames#cachePatternsCurrent},
 * so caches sharing one metrics registry do not overwrite or remove each other's gauge. After
 * {@link #shutdown()} lookups still succeed but compile without caching.
 *
 * @since 1.0.0
 */
public final class PatternCache {
  private static final Logger logger = LoggerFactory.getLogger(PatternCache.class);

  private static final AtomicInteger CACHE_IDS = new AtomicInteger(0);

  private final RextractConfig config;
  private final String cacheId;
  private final String sizeGaugeName;
  private final AtomicBoolean shutdown = new AtomicBoolean(false);

  // null when caching is disabled
  private final ConcurrentHashMap<CacheKey, CachedPattern> cache;
  private final IdleEvictionTask evictionTask;
  private final ExecutorService lruEvictionExecutor;

  private final AtomicLong hits = new AtomicLong(0);
  private final AtomicLong misses = new AtomicLong(0);
  private final AtomicLong evictionsLRU = new AtomicLong(0);
  private final AtomicLong evictionsIdle = new AtomicLong(0);

  /**
   * Creates a new pattern cache. Starts the idle eviction thread when caching is enabled.
   *
   * @param config the cache configuration
   */
  public PatternCache(RextractConfig config) {
    this.config = config;
    this.cacheId = String.valueOf(CACHE_IDS.incrementAndGet());
    this.sizeGaugeName = MetricNames.cachePatternsCurrent(cacheId);

    if (config.cacheEnabled()) {
      this.cache = new ConcurrentHashMap<>(Math.min(config.maxCacheSize(), 1024));

      this.lruEvictionExecutor =
          Executors.newSingleThreadExecutor(
              r -> {
                Thread t = new Thread(r, "Rextract-LRU-Eviction");
                t.setDaemon(true);
                t.setPriority(Thread.MIN_PRIORITY);
                return t;
              });

      this.evictionTask = new IdleEvictionTask(this, config);
      this.evictionTask.start();

      logger.debug(
          "Rextract: Pattern cache {} initialized - maxSize: {}, idleTimeout: {}s, scanInterval: {}s",
          cacheId,
          config.maxCacheSize(),
          config.idleTimeoutSeconds(),
          config.evictionScanIntervalSeconds());

      config
          .metricsRegistry()
          .registerGauge(sizeGaugeName, () -> cache.size());
    } else {
      this.cache = null;
      this.evictionTask = null;
      this.lruEvictionExecutor = null;
      logger.info("Rextract: Pattern caching disabled");
    }
  }

  public RextractConfig getConfig() {
    return config;
  }

  /** Identifier of this cache, unique within the JVM; names its size gauge. */
  public String getCacheId() {
    return cacheId;
  }

  /**
   * Gets or compiles a pattern.
   *
   * <p>Lock-free for cache hits. On a miss, {@code computeIfAbsent} guarantees a single compilation
   * per key even under contention.
   *
   * @param patternString regex pattern
   * @param caseSensitive case sensitivity flag
   * @param compiler compiles the pattern on a miss; may throw
   * @return cached or newly compiled pattern
   */
  public Pattern getOrCompile(
      String patternString, boolean caseSensitive, Supplier<Pattern> compiler) {
    RextractMetricsRegistry metrics = config.metricsRegistry();

    if (!config.cacheEnabled() || shutdown.get()) {
      misses.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
      return compiler.get();
    }

    CacheKey key = new CacheKey(patternString, caseSensitive);

    CachedPattern cached = cache.get(key);
    if (cached != null) {
      cached.touch();
      hits.incrementAndGet();
      metrics.incrementCounter(MetricNames.PATTERNS_CACHE_HITS);
      logger.trace("Rextract: Cache hit - hash: {}", PatternHasher.hash(patternString));
      return cached.pattern();
    }

    misses.incrementAndGet();
    metrics.incrementCounter(MetricNames.PATTERNS_CACHE_MISSES);
    logger.trace("Rextract: Cache miss - hash: {}, compiling", PatternHasher.hash(patternString));

    CachedPattern created = cache.computeIfAbsent(key, k -> new CachedPattern(compiler.get()));
    created.touch();

    int currentSize = cache.size();
    if (currentSize > config.maxCacheSize()) {
      triggerAsyncLRUEviction(currentSize - config.maxCacheSize());
    }

    return created.pattern();
  }

  /** Schedules LRU eviction without blocking the caller. */
  private void triggerAsyncLRUEviction(int toEvict) {
    if (toEvict <= 0 || lruEvictionExecutor.isShutdown()) {
      return;
    }

    lruEvictionExecutor.submit(
        () -> {
          try {
            evictLRUBatch(toEvict);
          } catch (Exception e) {
            logger.warn("Rextract: Error during async LRU eviction", e);
          }
        });
  }

  /**
   * Evicts least-recently-used patterns.
   *
   * <p>Sample-based: looks at up to 500 entries older than the protection window and evicts the
   * oldest of them.
   *
   * @return number of patterns evicted
   */
  int evictLRUBatch(int toEvict) {
    int actualToEvict = Math.min(toEvict, cache.size() - config.maxCacheSize());
    if (actualToEvict <= 0) {
      return 0;
    }

    int sampleSize = Math.min(500, cache.size());
    long cutoffTime = System.nanoTime() - config.evictionProtectionMs() * 1_000_000L;

    List<Map.Entry<CacheKey, CachedPattern>> candidates =
        cache.entrySet().stream()
            .filter(e -> e.getValue().lastAccessTimeNanos() <= cutoffTime)
            .limit(sampleSize)
            .sorted(Comparator.comparingLong(e -> e.getValue().lastAccessTimeNanos()))
            .limit(actualToEvict)
            .collect(Collectors.toList());

    int evicted = 0;
    for (Map.Entry<CacheKey, CachedPattern> entry : candidates) {
      if (cache.remove(entry.getKey(), entry.getValue())) {
        evictionsLRU.incrementAndGet();
        config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_LRU);
        logger.trace("Rextract: LRU evicting pattern: {}", entry.getKey());
        evicted++;
      }
    }

    if (evicted > 0) {
      logger.debug(
          "Rextract: LRU eviction completed - evicted: {}, cacheSize: {}/{}",
          evicted,
          cache.size(),
          config.maxCacheSize());
    }
    return evicted;
  }

  /**
   * Evicts idle patterns (called by the background thread).
   *
   * @return number of patterns evicted
   */
  int evictIdlePatterns() {
    if (!config.cacheEnabled()) {
      return 0;
    }

    long cutoffNanos = System.nanoTime() - config.idleTimeoutSeconds() * 1_000_000_000L;
    AtomicLong evictedCount = new AtomicLong(0);

    cache
        .entrySet()
        .removeIf(
            entry -> {
              if (entry.getValue().lastAccessTimeNanos() < cutoffNanos) {
                logger.trace("Rextract: Idle evicting pattern: {}", entry.getKey());
                evictionsIdle.incrementAndGet();
                config.metricsRegistry().incrementCounter(MetricNames.CACHE_EVICTIONS_IDLE);
                evictedCount.incrementAndGet();
                return true;
              }
              return false;
            });

    int evicted = (int) evictedCount.get();
    if (evicted > 0) {
      logger.debug(
          "Rextract: Idle eviction completed - evicted: {}, cacheSize: {}", evicted, cache.size());
    }
    return evicted;
  }

  /** Gets cache statistics snapshot. */
  public CacheStatistics getStatistics() {
    int currentSize = config.cacheEnabled() ? cache.size() : 0;
    return new CacheStatistics(
        hits.get(),
        misses.get(),
        evictionsLRU.get(),
        evictionsIdle.get(),
        currentSize,
        config.maxCacheSize());
  }

  /** Removes all cached patterns. */
  public void clear() {
    if (!config.cacheEnabled()) {
      return;
    }
    logger.debug("Rextract: Clearing cache - {} cached patterns", cache.size());
    cache.clear();
  }

  /** Resets cache statistics. */
  public void resetStatistics() {
    hits.set(0);
    misses.set(0);
    evictionsLRU.set(0);
    evictionsIdle.set(0);
    logger.trace("Rextract: Cache statistics reset");
  }

  /**
   * Shuts down the cache: stops the eviction threads, clears entries and removes this cache's
   * gauge. Idempotent.
   */
  public void shutdown() {
    if (!config.cacheEnabled() || !shutdown.compareAndSet(false, true)) {
      return;
    }
    logger.info("Rextract: Shutting down pattern cache {}", cacheId);

    evictionTask.stop();
    lruEvictionExecutor.shutdown();
    clear();
    config.metricsRegistry().removeGauge(sizeGaugeName);
  }

  /** Whether the idle eviction thread is alive (false when caching is disabled). */
  boolean isEvictionRunning() {
    return evictionTask != null && evictionTask.isRunning();
  }

  /** Cache key combining pattern string and case-sensitivity. */
  private record CacheKey(String pattern, boolean caseSensitive) {
    @Override
    public String toString() {
      return PatternHasher.hashWithCase(pattern, caseSensitive);
    }
  }

  /** Cached pattern with atomic access time tracking. */
  private static final class CachedPattern {
    private final Pattern pattern;
    private final AtomicLong lastAccessTimeNanos;

    CachedPattern(Pattern pattern) {
      this.pattern = pattern;
      this.lastAccessTimeNanos = new AtomicLong(System.nanoTime());
    }

    Pattern pattern() {
      return pattern;
    }

    long lastAccessTimeNanos() {
      return lastAccessTimeNanos.get();
    }

    void touch() {
      lastAccessTimeNanos.set(System.nanoTime());
    }
  }
}
