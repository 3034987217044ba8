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
import com.axonops.rextract.api.PatternCompilationException;
import com.axonops.rextract.test.TestUtils;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Supplier;

import static org.assertj.core.api.Assertions.*;

@DisplayName("PatternCache")
class PatternCacheTest {

    private PatternCache cache;

    @AfterEach
    void cleanup() {
        if (cache != null) {
            cache.shutdown();
        }
    }

    private static Supplier<Pattern> counting(String pattern, AtomicInteger compilations) {
        return () -> {
            compilations.incrementAndGet();
            return Pattern.compile(pattern);
        };
    }

    private Pattern get(String pattern) {
        return cache.getOrCompile(pattern, true, () -> Pattern.compile(pattern));
    }

    @Test
    @DisplayName("second lookup should return the cached pattern")
    void hitReturnsSameInstance() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());
        AtomicInteger compilations = new AtomicInteger();

        Pattern first = cache.getOrCompile("(\\d+)", true, counting("(\\d+)", compilations));
        Pattern second = cache.getOrCompile("(\\d+)", true, counting("(\\d+)", compilations));

        assertThat(second).isSameAs(first);
        assertThat(compilations).hasValue(1);

        CacheStatistics stats = cache.getStatistics();
        assertThat(stats.hits()).isEqualTo(1);
        assertThat(stats.misses()).isEqualTo(1);
        assertThat(stats.currentSize()).isEqualTo(1);
        assertThat(stats.hitRate()).isEqualTo(0.5);
    }

    @Test
    @DisplayName("case sensitivity should be part of the key")
    void caseSensitivityInKey() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());

        Pattern sensitive = cache.getOrCompile("abc", true, () -> Pattern.compile("abc", true));
        Pattern insensitive = cache.getOrCompile("abc", false, () -> Pattern.compile("abc", false));

        assertThat(insensitive).isNotSameAs(sensitive);
        assertThat(cache.getStatistics().currentSize()).isEqualTo(2);
    }

    @Test
    @DisplayName("failed compilation should propagate and not be cached")
    void failuresNotCached() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());
        AtomicInteger compilations = new AtomicInteger();

        for (int i = 0; i < 2; i++) {
            assertThatThrownBy(() -> cache.getOrCompile("(", true, counting("(", compilations)))
                .isInstanceOf(PatternCompilationException.class);
        }

        assertThat(compilations).hasValue(2);
        assertThat(cache.getStatistics().currentSize()).isZero();
    }

    @Test
    @DisplayName("disabled cache should compile every time")
    void disabledCache() {
        cache = new PatternCache(RextractConfig.NO_CACHE);
        AtomicInteger compilations = new AtomicInteger();

        cache.getOrCompile("a", true, counting("a", compilations));
        cache.getOrCompile("a", true, counting("a", compilations));

        assertThat(compilations).hasValue(2);
        assertThat(cache.getStatistics().misses()).isEqualTo(2);
        assertThat(cache.getStatistics().currentSize()).isZero();
        assertThat(cache.isEvictionRunning()).isFalse();
        assertThat(cache.evictIdlePatterns()).isZero();
    }

    @Test
    @Timeout(10)
    @DisplayName("growing past the limit should evict least recently used patterns")
    void lruEviction() throws InterruptedException {
        cache = new PatternCache(TestUtils.testConfigBuilder()
            .maxCacheSize(3)
            .evictionProtectionMs(0)
            .build());

        for (int i = 0; i < 5; i++) {
            get("p" + i);
            Thread.sleep(2);
        }

        // Eviction runs asynchronously
        while (cache.getStatistics().currentSize() > 3) {
            Thread.sleep(10);
        }
        while (cache.getStatistics().evictionsLRU() < 2) {
            Thread.sleep(10);
        }

        CacheStatistics stats = cache.getStatistics();
        assertThat(stats.currentSize()).isEqualTo(3);
        assertThat(stats.evictionsLRU()).isEqualTo(2);
        assertThat(stats.utilization()).isEqualTo(1.0);

        long hitsBefore = stats.hits();
        get("p4");
        assertThat(cache.getStatistics().hits()).isEqualTo(hitsBefore + 1);
    }

    @Test
    @DisplayName("recently used patterns should be protected from LRU eviction")
    void lruProtectionWindow() {
        cache = new PatternCache(TestUtils.testConfigBuilder()
            .maxCacheSize(3)
            .evictionProtectionMs(60_000)
            .build());

        for (int i = 0; i < 4; i++) {
            get("p" + i);
        }

        assertThat(cache.evictLRUBatch(1)).isZero();
        assertThat(cache.getStatistics().currentSize()).isEqualTo(4);
    }

    @Test
    @DisplayName("LRU eviction within the limit should do nothing")
    void lruWithinLimit() {
        cache = new PatternCache(TestUtils.testConfigBuilder().evictionProtectionMs(0).build());
        get("a");

        assertThat(cache.evictLRUBatch(5)).isZero();
        assertThat(cache.getStatistics().currentSize()).isEqualTo(1);
    }

    @Test
    @DisplayName("patterns unused past the idle timeout should be evicted")
    void idleEviction() throws InterruptedException {
        cache = new PatternCache(TestUtils.testConfigBuilder()
            .idleTimeoutSeconds(1)
            .evictionScanIntervalSeconds(60)
            .build());

        get("stale");
        assertThat(cache.evictIdlePatterns()).isZero();

        Thread.sleep(1_100);
        get("fresh");

        assertThat(cache.evictIdlePatterns()).isEqualTo(1);
        assertThat(cache.getStatistics().currentSize()).isEqualTo(1);
        assertThat(cache.getStatistics().evictionsIdle()).isEqualTo(1);
    }

    @Test
    @DisplayName("clear and resetStatistics should empty the cache and counters")
    void clearAndReset() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());
        get("a");
        get("a");

        cache.clear();
        cache.resetStatistics();

        CacheStatistics stats = cache.getStatistics();
        assertThat(stats.currentSize()).isZero();
        assertThat(stats.totalRequests()).isZero();
        assertThat(stats.hitRate()).isZero();
    }

    @Test
    @DisplayName("shutdown should stop the idle eviction thread and clear entries")
    void shutdownStopsEviction() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());
        get("a");
        assertThat(cache.isEvictionRunning()).isTrue();

        cache.shutdown();

        assertThat(cache.isEvictionRunning()).isFalse();
        assertThat(cache.getStatistics().currentSize()).isZero();

        // Lookups after shutdown still work but are no longer cached
        for (int i = 0; i < 20; i++) {
            assertThat(get("b" + i).pattern()).isEqualTo("b" + i);
        }
        assertThat(cache.getStatistics().currentSize()).isZero();
    }

    @Test
    @DisplayName("each cache should have its own id")
    void distinctCacheIds() {
        cache = new PatternCache(TestUtils.testConfigBuilder().build());
        PatternCache other = new PatternCache(TestUtils.testConfigBuilder().build());
        try {
            assertThat(other.getCacheId()).isNotEqualTo(cache.getCacheId());
        } finally {
            other.shutdown();
        }
    }
}
