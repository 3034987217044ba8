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

package com.axonops.rextract.api;

import com.axonops.rextract.metrics.MetricNames;
import com.axonops.rextract.metrics.NoOpMetricsRegistry;
import com.axonops.rextract.metrics.RextractMetricsRegistry;
import com.axonops.rextract.util.PatternHasher;
import com.google.re2j.Matcher;
import com.google.re2j.PatternSyntaxException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Objects;

/**
 * A compiled regular expression pattern (RE2 syntax, linear-time matching).
 *
 * <p>Thread-safe and immutable: a Pattern can be shared between threads and cached. Every search
 * uses its own matcher.
 *
 * <h2>Extraction</h2>
 *
 * <p>{@link #extract(String, int)} searches the input (leftmost-first, unanchored unless the pattern
 * anchors itself) and returns one capture group:
 *
 * <ul>
 *   <li>null input gives null, without matching
 *   <li>no match gives {@code ""}
 *   <li>group 0 gives the whole match
 *   <li>a group past {@link #groupCount()}, or one that did not take part in the match, gives
 *       {@code ""}
 * </ul>
 *
 * <pre>{@code
 * Pattern pattern = Pattern.compile("([a-z]+)(\\d+)");
 * pattern.extract("hello123", 1);   // "hello"
 * pattern.extract("hello123", 2);   // "123"
 * pattern.extract("nothing", 1);    // ""
 * pattern.extract(null, 1);         // null
 * }</pre>
 *
 * @since 1.0.0
 */
public final class Pattern {
    private static final Logger logger = LoggerFactory.getLogger(Pattern.class);

    private final com.google.re2j.Pattern compiled;
    private final boolean caseSensitive;
    private final RextractMetricsRegistry metrics;

    private Pattern(com.google.re2j.Pattern compiled, boolean caseSensitive, RextractMetricsRegistry metrics) {
        this.compiled = compiled;
        this.caseSensitive = caseSensitive;
        this.metrics = metrics;
    }

    public static Pattern compile(String pattern) {
        return compile(pattern, true);
    }

    public static Pattern compile(String pattern, boolean caseSensitive) {
        return compile(pattern, caseSensitive, NoOpMetricsRegistry.INSTANCE);
    }

    /**
     * Compiles a pattern, reporting compilation and later extraction metrics to {@code metrics}.
     *
     * @param pattern regex source (RE2 syntax); the empty pattern is valid and matches everywhere
     * @param caseSensitive false to match case-insensitively
     * @param metrics metrics sink
     * @return compiled pattern
     * @throws PatternCompilationException if the pattern is not a valid regular expression
     * @throws NullPointerException if pattern or metrics is null
     */
    public static Pattern compile(String pattern, boolean caseSensitive, RextractMetricsRegistry metrics) {
        Objects.requireNonNull(pattern, "pattern cannot be null");
        Objects.requireNonNull(metrics, "metrics cannot be null");

        String hash = PatternHasher.hash(pattern);
        long startNanos = System.nanoTime();

        com.google.re2j.Pattern compiled;
        try {
            compiled = caseSensitive
                ? com.google.re2j.Pattern.compile(pattern)
                : com.google.re2j.Pattern.compile(pattern, com.google.re2j.Pattern.CASE_INSENSITIVE);
        } catch (PatternSyntaxException e) {
            metrics.incrementCounter(MetricNames.ERRORS_COMPILATION_FAILED);
            logger.debug("Rextract: Pattern compilation failed - hash: {}, error: {}", hash, e.getMessage());
            throw new PatternCompilationException(pattern, e.getDescription(), e);
        }

        long durationNanos = System.nanoTime() - startNanos;
        metrics.recordTimer(MetricNames.PATTERNS_COMPILATION_LATENCY, durationNanos);
        metrics.incrementCounter(MetricNames.PATTERNS_COMPILED);

        Pattern result = new Pattern(compiled, caseSensitive, metrics);
        logger.trace("Rextract: Pattern compiled - hash: {}, length: {}, caseSensitive: {}, groups: {}, timeNs: {}",
            PatternHasher.hashWithCase(pattern, caseSensitive), pattern.length(), caseSensitive,
            result.groupCount(), durationNanos);
        return result;
    }

    // ========== Extraction ==========

    /**
     * Extracts one capture group from the first match in {@code input}.
     *
     * @param input text to search, may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return null if input is null, otherwise the group text or {@code ""}
     * @throws IllegalArgumentException if groupIndex is negative
     */
    public String extract(String input, int groupIndex) {
        checkGroupIndex(groupIndex);

        long startNanos = System.nanoTime();
        String result = extractOne(input, groupIndex);
        long durationNanos = System.nanoTime() - startNanos;

        metrics.incrementCounter(MetricNames.EXTRACT_ROWS);
        metrics.recordTimer(MetricNames.EXTRACT_LATENCY, durationNanos);
        return result;
    }

    /**
     * Extracts one capture group from each input (bulk operation).
     *
     * <p>The result is parallel to {@code inputs}: same length, null exactly where the input is null.
     *
     * <pre>{@code
     * Pattern pattern = Pattern.compile("([a-z]+)?(\\d+)?");
     * pattern.extractAll(new String[] {"abc123", "def", "456", null}, 2);
     * // {"123", "", "456", null}
     * }</pre>
     *
     * @param inputs array of strings, elements may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return extracted values, parallel to inputs
     * @throws NullPointerException if inputs is null
     * @throws IllegalArgumentException if groupIndex is negative
     */
    public String[] extractAll(String[] inputs, int groupIndex) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        checkGroupIndex(groupIndex);

        String[] results = new String[inputs.length];
        if (inputs.length == 0) {
            return results;
        }

        RowCounts counts = new RowCounts();
        long startNanos = System.nanoTime();
        for (int i = 0; i < inputs.length; i++) {
            results[i] = extractRow(inputs[i], groupIndex, counts);
        }
        recordBulk(inputs.length, counts, System.nanoTime() - startNanos);

        return results;
    }

    /**
     * Extracts one capture group from each input (bulk operation, collection variant).
     *
     * @param inputs collection of strings, elements may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return extracted values in iteration order of inputs
     * @throws NullPointerException if inputs is null
     * @throws IllegalArgumentException if groupIndex is negative
     */
    public List<String> extractAll(Collection<String> inputs, int groupIndex) {
        Objects.requireNonNull(inputs, "inputs cannot be null");
        String[] results = extractAll(inputs.toArray(new String[0]), groupIndex);
        return new ArrayList<>(Arrays.asList(results));
    }

    // Never throws for a non-negative group index
    private String extractRow(String input, int groupIndex, RowCounts counts) {
        if (input == null) {
            counts.nulls++;
            return null;
        }
        // An index past the last group is "" whether or not the pattern matches
        if (groupIndex > compiled.groupCount()) {
            return "";
        }
        Matcher matcher = compiled.matcher(input);
        if (!matcher.find()) {
            counts.noMatch++;
            return "";
        }
        String group = matcher.group(groupIndex);
        return group != null ? group : "";
    }

    private String extractOne(String input, int groupIndex) {
        RowCounts counts = new RowCounts();
        String result = extractRow(input, groupIndex, counts);
        if (counts.nulls > 0) {
            metrics.incrementCounter(MetricNames.EXTRACT_NULL_ROWS);
        }
        if (counts.noMatch > 0) {
            metrics.incrementCounter(MetricNames.EXTRACT_NO_MATCH_ROWS);
        }
        return result;
    }

    private void recordBulk(int rows, RowCounts counts, long durationNanos) {
        metrics.incrementCounter(MetricNames.EXTRACT_BULK_OPERATIONS);
        metrics.incrementCounter(MetricNames.EXTRACT_ROWS, rows);
        if (counts.nulls > 0) {
            metrics.incrementCounter(MetricNames.EXTRACT_NULL_ROWS, counts.nulls);
        }
        if (counts.noMatch > 0) {
            metrics.incrementCounter(MetricNames.EXTRACT_NO_MATCH_ROWS, counts.noMatch);
        }
        if (rows > 0) {
            metrics.recordTimer(MetricNames.EXTRACT_LATENCY, durationNanos / rows);
        }
    }

    // ========== Matching ==========

    /**
     * Finds the first match in {@code input} and captures every group.
     *
     * <pre>{@code
     * Pattern pattern = Pattern.compile("(a+)(b)?(c)");
     * MatchResult result = pattern.find("xxaaaac");
     * result.group(0);  // "aaaac"
     * result.group(2);  // null (did not participate)
     * }</pre>
     *
     * @param input text to search
     * @return match result, {@code matched() == false} if nothing matched
     * @throws NullPointerException if input is null
     */
    public MatchResult find(String input) {
        Objects.requireNonNull(input, "input cannot be null");

        Matcher matcher = compiled.matcher(input);
        if (!matcher.find()) {
            return new MatchResult(input);
        }
        String[] groups = new String[matcher.groupCount() + 1];
        for (int i = 0; i < groups.length; i++) {
            groups[i] = matcher.group(i);
        }
        return new MatchResult(input, groups);
    }

    // ========== Accessors ==========

    public String pattern() {
        return compiled.pattern();
    }

    public boolean isCaseSensitive() {
        return caseSensitive;
    }

    /**
     * Number of capturing groups, not counting group 0.
     */
    public int groupCount() {
        return compiled.groupCount();
    }

    private static void checkGroupIndex(int groupIndex) {
        if (groupIndex < 0) {
            throw new IllegalArgumentException("groupIndex must be non-negative: " + groupIndex);
        }
    }

    @Override
    public String toString() {
        return "Pattern{hash=" + PatternHasher.hashWithCase(pattern(), caseSensitive)
            + ", groups=" + groupCount() + "}";
    }

    /** Per-call tallies of null and unmatched rows. */
    private static final class RowCounts {
        long nulls;
        long noMatch;
    }
}
