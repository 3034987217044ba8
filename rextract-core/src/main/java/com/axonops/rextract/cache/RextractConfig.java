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

import com.axonops.rextract.metrics.NoOpMetricsRegistry;
import com.axonops.rextract.metrics.RextractMetricsRegistry;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration for pattern caching and metrics.
 *
 * <p>Each {@link com.axonops.rextract.function.RegexpExtractFunction} owns one {@link PatternCache}
 * built from this configuration, so invocations that share a pattern compile it once.
 *
 * <h2>Eviction</h2>
 *
 * <ol>
 *   <li><b>LRU</b> - When the cache exceeds {@code maxCacheSize}, least-recently-used patterns are
 *       evicted asynchronously (soft limit)
 *   <li><b>Idle</b> - A background thread evicts patterns unused for {@code idleTimeoutSeconds}
 * </ol>
 *
 * <p>{@code evictionProtectionMs} keeps a freshly used pattern out of LRU eviction for a short
 * window.
 *
 * <h2>Examples</h2>
 *
 * <pre>{@code
 * // Defaults: 1000 patterns, 5 min idle timeout, metrics disabled
 * RextractConfig config = RextractConfig.DEFAULT;
 *
 * // Metrics enabled, larger cache
 * RextractConfig config = RextractConfig.builder()
 *     .maxCacheSize(10_000)
 *     .metricsRegistry(new DropwizardMetricsAdapter(registry, "myapp.regexp"))
 *     .build();
 *
 * // Compile on every invocation
 * RextractConfig config = RextractConfig.NO_CACHE;
 * }</pre>
 *
 * @param cacheEnabled Enable pattern caching
 * @param maxCacheSize Maximum patterns in cache before LRU eviction (must be > 0 if cache enabled)
 * @param idleTimeoutSeconds Evict patterns unused for this duration (must be > 0 if cache enabled)
 * @param evictionScanIntervalSeconds How often idle eviction runs (must be > 0 if cache enabled)
 * @param evictionProtectionMs Recently used patterns are not LRU-evicted for this long
 * @param metricsRegistry Metrics implementation
 * @since 1.0.0
 * @see PatternCache
 */
public record RextractConfig(
    boolean cacheEnabled,
    int maxCacheSize,
    long idleTimeoutSeconds,
    long evictionScanIntervalSeconds,
    long evictionProtectionMs,
    RextractMetricsRegistry metricsRegistry) {

  private static final Logger logger = LoggerFactory.getLogger(RextractConfig.class);

  /** Default configuration: cache of 1000 patterns, 5 minute idle timeout, no metrics. */
  public static final RextractConfig DEFAULT =
      new RextractConfig(
          true, // Cache enabled
          1000, // Max 1000 cached patterns
          300, // 5 minute idle timeout
          60, // Scan every 60 seconds
          1000, // 1 second eviction protection
          NoOpMetricsRegistry.INSTANCE);

  /** Configuration with caching disabled: every invocation compiles its pattern. */
  public static final RextractConfig NO_CACHE =
      new RextractConfig(
          false, // Cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          0, // Ignored when cache disabled
          NoOpMetricsRegistry.INSTANCE);

  /** Compact constructor with validation. */
  public RextractConfig {
    Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");

    if (cacheEnabled) {
      if (maxCacheSize <= 0) {
        throw new IllegalArgumentException("maxCacheSize must be positive when cache enabled");
      }
      if (idleTimeoutSeconds <= 0) {
        throw new IllegalArgumentException(
            "idleTimeoutSeconds must be positive when cache enabled");
      }
      if (evictionScanIntervalSeconds <= 0) {
        throw new IllegalArgumentException(
            "evictionScanIntervalSeconds must be positive when cache enabled");
      }
      if (evictionProtectionMs < 0) {
        throw new IllegalArgumentException(
            "evictionProtectionMs must be non-negative when cache enabled");
      }

      // Valid, but idle patterns will outlive their timeout
      if (evictionScanIntervalSeconds > idleTimeoutSeconds) {
        logger.warn(
            "Rextract: evictionScanIntervalSeconds ({}s) exceeds idleTimeoutSeconds ({}s) - idle patterns may not be evicted promptly",
            evictionScanIntervalSeconds,
            idleTimeoutSeconds);
      }
    }
  }

  /**
   * Creates a builder starting from {@link #DEFAULT}.
   *
   * <pre>{@code
   * RextractConfig config = RextractConfig.builder()
   *     .maxCacheSize(5_000)
   *     .idleTimeoutSeconds(600)
   *     .build();
   * }</pre>
   *
   * @return new builder with default values
   */
  public static Builder builder() {
    return new Builder();
  }

  /** Builder for custom configuration. */
  public static class Builder {
    private boolean cacheEnabled = DEFAULT.cacheEnabled();
    private int maxCacheSize = DEFAULT.maxCacheSize();
    private long idleTimeoutSeconds = DEFAULT.idleTimeoutSeconds();
    private long evictionScanIntervalSeconds = DEFAULT.evictionScanIntervalSeconds();
    private long evictionProtectionMs = DEFAULT.evictionProtectionMs();
    private RextractMetricsRegistry metricsRegistry = NoOpMetricsRegistry.INSTANCE;

    /**
     * Enable or disable pattern caching.
     *
     * @param enabled true to enable caching (default), false to compile on every call
     * @return this builder
     */
    public Builder cacheEnabled(boolean enabled) {
      this.cacheEnabled = enabled;
      return this;
    }

    /**
     * Set maximum number of cached patterns before LRU eviction.
     *
     * <p><b>Default: 1000</b>
     *
     * @param size maximum cached patterns (must be > 0)
     * @return this builder
     */
    public Builder maxCacheSize(int size) {
      this.maxCacheSize = size;
      return this;
    }

    /**
     * Set idle timeout for pattern eviction.
     *
     * <p><b>Default: 300 seconds</b>
     *
     * @param seconds idle timeout in seconds (must be > 0)
     * @return this builder
     */
    public Builder idleTimeoutSeconds(long seconds) {
      this.idleTimeoutSeconds = seconds;
      return this;
    }

    /**
     * Set how often the idle eviction task runs.
     *
     * <p><b>Default: 60 seconds</b>. Should be at most {@code idleTimeoutSeconds}.
     *
     * @param seconds scan interval in seconds (must be > 0)
     * @return this builder
     */
    public Builder evictionScanIntervalSeconds(long seconds) {
      this.evictionScanIntervalSeconds = seconds;
      return this;
    }

    /**
     * Set LRU eviction protection for recently used patterns.
     *
     * <p><b>Default: 1000ms</b>. 0 disables protection.
     *
     * @param ms protection period in milliseconds (must be >= 0)
     * @return this builder
     */
    public Builder evictionProtectionMs(long ms) {
      this.evictionProtectionMs = ms;
      return this;
    }

    /**
     * Set metrics registry for instrumentation.
     *
     * @param metricsRegistry metrics implementation (must not be null)
     * @return this builder
     * @throws NullPointerException if metricsRegistry is null
     */
    public Builder metricsRegistry(RextractMetricsRegistry metricsRegistry) {
      this.metricsRegistry =
          Objects.requireNonNull(metricsRegistry, "metricsRegistry cannot be null");
      return this;
    }

    /**
     * Build immutable configuration.
     *
     * @return validated configuration
     * @throws IllegalArgumentException if configuration is invalid
     */
    public RextractConfig build() {
      return new RextractConfig(
          cacheEnabled,
          maxCacheSize,
          idleTimeoutSeconds,
          evictionScanIntervalSeconds,
          evictionProtectionMs,
          metricsRegistry);
    }
  }
}
