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

import java.util.function.Supplier;

/**
 * Sink for the metrics rextract emits while compiling patterns and extracting rows.
 *
 * <p>rextract-core reports through this interface only; whether anything is recorded is decided by
 * the {@link com.axonops.rextract.cache.RextractConfig#metricsRegistry() configured} implementation.
 * {@link NoOpMetricsRegistry} discards everything, {@link DropwizardMetricsAdapter} forwards to a
 * Dropwizard {@code MetricRegistry}.
 *
 * <p>What is reported, by call site:
 * <ul>
 *   <li>{@code Pattern.compile} - {@link MetricNames#PATTERNS_COMPILED} and
 *       {@link MetricNames#PATTERNS_COMPILATION_LATENCY}, or
 *       {@link MetricNames#ERRORS_COMPILATION_FAILED}
 *   <li>{@code Pattern.extract} and {@code extractAll} - row counters and
 *       {@link MetricNames#EXTRACT_LATENCY} (per row)
 *   <li>{@code PatternCache} - hits, misses, evictions, and one size gauge per cache
 *   <li>{@code RegexpExtractFunction} - invocations, latency, rejected arguments
 * </ul>
 *
 * <p>Called from query worker threads, so implementations must be thread-safe and cheap.
 *
 * @since 1.0.0
 */
public interface RextractMetricsRegistry {

    /**
     * Adds one to a counter, e.g. {@link MetricNames#FUNCTION_INVOCATIONS}.
     */
    void incrementCounter(String name);

    /**
     * Adds {@code delta} to a counter. Bulk extraction reports its row counts this way, once per
     * call rather than once per row.
     *
     * @param delta non-negative amount
     */
    void incrementCounter(String name, long delta);

    /**
     * Records one duration, e.g. a pattern compilation or a function invocation.
     *
     * @param durationNanos elapsed time in nanoseconds
     */
    void recordTimer(String name, long durationNanos);

    /**
     * Registers a gauge read on demand. {@code PatternCache} uses this for its current size under
     * {@link MetricNames#cachePatternsCurrent(String)}. Re-registering a name replaces the gauge.
     *
     * @param valueSupplier read on every poll; must not block
     */
    void registerGauge(String name, Supplier<Number> valueSupplier);

    /**
     * Removes a gauge registered with {@link #registerGauge}. Does nothing if it is not registered.
     */
    void removeGauge(String name);
}
