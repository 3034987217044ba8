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

package com.axonops.rextract.metrics;

/**
 * Metric name constants for rextract instrumentation.
 *
 * <h2>Metric Types</h2>
 *
 * <ul>
 *   <li><b>Counter</b> - Monotonically increasing count (suffix: {@code .total.count})
 *   <li><b>Timer</b> - Latency histogram with percentiles (suffix: {@code .latency})
 *   <li><b>Gauge</b> - Current value (suffix: {@code .current.count})
 * </ul>
 *
 * <h2>Categories</h2>
 *
 * <ul>
 *   <li><b>Pattern compilation</b> - compilations, latency, cache hits and misses
 *   <li><b>Cache</b> - size and evictions (LRU and idle)
 *   <li><b>Extraction</b> - rows processed, null rows, rows without a match, per-row latency
 *   <li><b>Function</b> - columnar invocations and their latency
 *   <li><b>Errors</b> - compilation failures and rejected arguments
 * </ul>
 *
 * <p>Names are relative; {@link DropwizardMetricsAdapter} adds its prefix.
 *
 * @since 1.0.0
 */
public final class MetricNames {

  private MetricNames() {}

  // ========== Pattern Compilation ==========

  /** Patterns compiled successfully (cache misses that compiled, plus uncached compiles). */
  public static final String PATTERNS_COMPILED = "patterns.compiled.total.count";

  /** Time spent compiling a pattern. */
  public static final String PATTERNS_COMPILATION_LATENCY = "patterns.compilation.latency";

  /** Lookups served from the pattern cache. */
  public static final String PATTERNS_CACHE_HITS = "patterns.cache.hits.total.count";

  /** Lookups that had to compile. Counted even when the cache is disabled. */
  public static final String PATTERNS_CACHE_MISSES = "patterns.cache.misses.total.count";

  // ========== Cache ==========

  /**
   * Gauge: patterns currently held by one cache, e.g. {@code cache.3.patterns.current.count}.
   *
   * @param cacheId the cache's {@link com.axonops.rextract.cache.PatternCache#getCacheId() id}
   */
  public static String cachePatternsCurrent(String cacheId) {
    return "cache." + cacheId + ".patterns.current.count";
  }

  /** Patterns evicted because the cache exceeded its maximum size. */
  public static final String CACHE_EVICTIONS_LRU = "cache.evictions.lru.total.count";

  /** Patterns evicted because they were unused for the idle timeout. */
  public static final String CACHE_EVICTIONS_IDLE = "cache.evictions.idle.total.count";

  // ========== Extraction ==========

  /** Rows passed through extraction, null rows included. */
  public static final String EXTRACT_ROWS = "extract.rows.total.count";

  /** Null input rows (propagated as null output). */
  public static final String EXTRACT_NULL_ROWS = "extract.rows.null.total.count";

  /** Non-null rows the pattern did not match (output ""). */
  public static final String EXTRACT_NO_MATCH_ROWS = "extract.rows.no_match.total.count";

  /** Per-row extraction latency (bulk calls record the per-row average). */
  public static final String EXTRACT_LATENCY = "extract.latency";

  /** Bulk extraction calls (array, collection or column). */
  public static final String EXTRACT_BULK_OPERATIONS = "extract.bulk.total.count";

  // ========== Function ==========

  /** Columnar function invocations that produced an output column. */
  public static final String FUNCTION_INVOCATIONS = "function.invocations.total.count";

  /** Latency of a whole columnar invocation. */
  public static final String FUNCTION_INVOCATION_LATENCY = "function.invocation.latency";

  // ========== Errors ==========

  /** Patterns rejected by the regex compiler. */
  public static final String ERRORS_COMPILATION_FAILED = "errors.compilation.failed.total.count";

  /** Invocations rejected for wrong argument count or kind. */
  public static final String ERRORS_ARGUMENT_INVALID = "errors.argument.invalid.total.count";
}
