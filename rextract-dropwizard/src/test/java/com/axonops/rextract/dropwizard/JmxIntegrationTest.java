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
import com.axonops.rextract.function.RegexpExtractFunction;
import com.axonops.rextract.function.ScalarFunctions;
import com.axonops.rextract.metrics.MetricNames;
import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.jmx.JmxReporter;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.memory.RootAllocator;
import org.apache.arrow.vector.VarCharVector;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import javax.management.MBeanServer;
import javax.management.ObjectName;
import java.lang.management.ManagementFactory;
import java.nio.charset.StandardCharsets;
import java.util.Set;

import static org.assertj.core.api.Assertions.*;

/**
 * JMX integration tests.
 *
 * Verifies that metrics are actually exposed via JMX and accessible
 * through the platform MBean server.
 */
class JmxIntegrationTest {

    private JmxReporter jmxReporter;
    private MetricRegistry registry;
    private BufferAllocator allocator;

    @BeforeEach
    void setup() {
        registry = new MetricRegistry();
        allocator = new RootAllocator();

        jmxReporter = JmxReporter.forRegistry(registry).build();
        jmxReporter.start();
    }

    @AfterEach
    void cleanup() {
        if (jmxReporter != null) {
            jmxReporter.stop();
        }
        allocator.close();
    }

    private void extract(RegexpExtractFunction fn, String pattern, String... inputs) {
        try (VarCharVector input = new VarCharVector("input", allocator)) {
            input.allocateNew();
            for (int i = 0; i < inputs.length; i++) {
                input.setSafe(i, inputs[i].getBytes(StandardCharsets.UTF_8));
            }
            input.setValueCount(inputs.length);
            fn.extract(input, pattern, 1, allocator).close();
        }
    }

    @Test
    void testMetricsExposedViaJmx() throws Exception {
        RextractConfig config = RextractMetricsConfig.withMetrics(registry, "com.test.jmx", false);

        try (RegexpExtractFunction fn = ScalarFunctions.regexpExtract(config)) {
            extract(fn, "([a-z]+)(\\d+)", "hello123", "none");

            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();

            // Dropwizard registers under the "metrics" domain with a type classification
            Set<ObjectName> mbeans = mBeanServer.queryNames(
                new ObjectName("metrics:name=com.test.jmx.*,type=*"), null
            );

            assertThat(mbeans)
                .as("JMX MBeans should be registered for rextract metrics")
                .hasSizeGreaterThan(5);

            assertThat(mbeans.stream()
                .anyMatch(name -> name.toString().contains(MetricNames.cachePatternsCurrent(fn.getCacheId())) && name.toString().contains("type=gauges")))
                .as("cache size gauge should be in JMX")
                .isTrue();

            assertThat(mbeans.stream()
                .anyMatch(name -> name.toString().contains("function.invocations.total.count") && name.toString().contains("type=counters")))
                .as("function.invocations.total.count counter should be in JMX")
                .isTrue();

            assertThat(mbeans.stream()
                .anyMatch(name -> name.toString().contains("extract.latency") && name.toString().contains("type=timers")))
                .as("extract.latency timer should be in JMX")
                .isTrue();
        }
    }

    @Test
    void testJmxGaugeReadable() throws Exception {
        RextractConfig config = RextractMetricsConfig.withMetrics(registry, "jmx.readable.test", false);

        try (RegexpExtractFunction fn = ScalarFunctions.regexpExtract(config)) {
            extract(fn, "(p1)", "p1");
            extract(fn, "(p2)", "p2");
            extract(fn, "(p3)", "p3");

            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            ObjectName cacheSizeName = new ObjectName("metrics:name=jmx.readable.test."
                + MetricNames.cachePatternsCurrent(fn.getCacheId()) + ",type=gauges");

            assertThat(mBeanServer.isRegistered(cacheSizeName))
                .as("cache size gauge should be registered in JMX")
                .isTrue();

            Object value = mBeanServer.getAttribute(cacheSizeName, "Value");
            assertThat(((Number) value).intValue()).isEqualTo(3);
        }
    }

    @Test
    void testJmxCounterReadable() throws Exception {
        RextractConfig config = RextractMetricsConfig.withMetrics(registry, "jmx.counter.test", false);

        try (RegexpExtractFunction fn = ScalarFunctions.regexpExtract(config)) {
            extract(fn, "(\\d+)", "a1", "b2", "c3");

            MBeanServer mBeanServer = ManagementFactory.getPlatformMBeanServer();
            ObjectName rowsName =
                new ObjectName("metrics:name=jmx.counter.test.extract.rows.total.count,type=counters");

            assertThat(mBeanServer.getAttribute(rowsName, "Count")).isEqualTo(3L);
        }
    }
}
