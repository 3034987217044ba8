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

package com.axonops.rextract.dropwizard;

import com.axonops.rextract.cache.RextractConfig;
import com.axonops.rextract.metrics.DropwizardMetricsAdapter;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;
import java.util.Objects;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Convenience factory for {@link RextractConfig} with Dropwizard Metrics integration.
 *
 * <p>Sets up the Dropwizard adapter and, unless told otherwise, a {@link JmxReporter} for the
 * registry, so every rextract metric is visible over JMX.
 *
 * <pre>{@code
 * MetricRegistry registry = new MetricRegistry();
 * RextractConfig config = RextractMetricsConfig.withMetrics(registry, "com.myapp.sql.regexp");
 * RegexpExtractFunction fn = ScalarFunctions.regexpExtract(config);
 * }</pre>
 *
 * @since 1.0.0
 */
public final class RextractMetricsConfig {
    private static final Logger logger = LoggerFactory.getLogger(RextractMetricsConfig.class);

    // One reporter per registry
    private static final Map<MetricRegistry, JmxReporter> jmxReporters = new ConcurrentHashMap<>();

    private RextractMetricsConfig() {
        // Utility class
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}, exposed via JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @return config with metrics enabled and default cache settings
     */
    public static RextractConfig withMetrics(MetricRegistry registry, String metricPrefix) {
        return withMetrics(registry, metricPrefix, true);
    }

    /**
     * Creates a config reporting to {@code registry} under {@code metricPrefix}.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @param metricPrefix the metric namespace prefix
     * @param enableJmx whether to start a JmxReporter for the registry
     * @return config with metrics enabled and default cache settings
     */
    public static RextractConfig withMetrics(MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        return builderWithMetrics(registry, metricPrefix, enableJmx).build();
    }

    /**
     * Creates a config reporting to {@code registry} under the default prefix
     * {@value DropwizardMetricsAdapter#DEFAULT_PREFIX}, exposed via JMX.
     *
     * @param registry the Dropwizard MetricRegistry to use
     * @return config with metrics enabled and default cache settings
     */
    public static RextractConfig withMetrics(MetricRegistry registry) {
        return withMetrics(registry, DropwizardMetricsAdapter.DEFAULT_PREFIX, true);
    }

    /**
     * Like {@link #withMetrics(MetricRegistry, String, boolean)}, but returns the builder so cache
     * settings can still be changed.
     */
    public static RextractConfig.Builder builderWithMetrics(
        MetricRegistry registry, String metricPrefix, boolean enableJmx) {
        Objects.requireNonNull(registry, "registry cannot be null");
        Objects.requireNonNull(metricPrefix, "metricPrefix cannot be null");

        if (enableJmx) {
            ensureJmxReporter(registry);
        }

        return RextractConfig.builder()
            .metricsRegistry(new DropwizardMetricsAdapter(registry, metricPrefix));
    }

    /**
     * Whether a JmxReporter started by this class is running for {@code registry}.
     */
    public static boolean isJmxEnabled(MetricRegistry registry) {
        return jmxReporters.containsKey(registry);
    }

    /**
     * Stops every JmxReporter started by this class.
     */
    public static synchronized void shutdown() {
        jmxReporters.forEach((registry, reporter) -> {
            logger.info("Rextract: Stopping JmxReporter");
            reporter.stop();
        });
        jmxReporters.clear();
    }

    private static synchronized void ensureJmxReporter(MetricRegistry registry) {
        if (jmxReporters.containsKey(registry)) {
            return;
        }
        try {
            JmxReporter reporter = JmxReporter.forRegistry(registry).build();
            reporter.start();
            jmxReporters.put(registry, reporter);
            logger.info("Rextract: JmxReporter started - metrics available via JMX");
        } catch (RuntimeException e) {
            // Not fatal: the host may already expose this registry over JMX
            logger.warn("Rextract: Failed to start JmxReporter (may already be configured)", e);
        }
    }
}
