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

import java.util.Collection;
import java.util.List;

/**
 * Static entry points for one-off extraction.
 *
 * <p>Each call compiles its pattern without caching. To extract with the same pattern repeatedly,
 * compile it once with {@link Pattern#compile(String)} and reuse it.
 *
 * Thread-safe: All methods can be called concurrently from multiple threads.
 *
 * @since 1.0.0
 */
public final class RegexpExtract {

    private RegexpExtract() {
        // Utility class
    }

    /**
     * Extracts one capture group from the first match of {@code pattern} in {@code input}.
     *
     * @param pattern regex pattern
     * @param input input string, may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return null if input is null, otherwise the group text or {@code ""}
     * @throws PatternCompilationException if the pattern is invalid
     */
    public static String extract(String pattern, String input, int groupIndex) {
        return Pattern.compile(pattern).extract(input, groupIndex);
    }

    /**
     * Extracts one capture group from each input (bulk operation).
     *
     * @param pattern regex pattern
     * @param inputs array of input strings, elements may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return extracted values, parallel to inputs
     * @throws PatternCompilationException if the pattern is invalid
     */
    public static String[] extractAll(String pattern, String[] inputs, int groupIndex) {
        return Pattern.compile(pattern).extractAll(inputs, groupIndex);
    }

    /**
     * Extracts one capture group from each input (bulk operation, collection variant).
     *
     * @param pattern regex pattern
     * @param inputs collection of input strings, elements may be null
     * @param groupIndex 0 for the whole match, 1+ for capturing groups
     * @return extracted values in iteration order of inputs
     * @throws PatternCompilationException if the pattern is invalid
     */
    public static List<String> extractAll(String pattern, Collection<String> inputs, int groupIndex) {
        return Pattern.compile(pattern).extractAll(inputs, groupIndex);
    }

    /**
     * Finds the first match with all capture groups.
     *
     * @param pattern regex pattern
     * @param input input string
     * @return match result
     * @throws PatternCompilationException if the pattern is invalid
     */
    public static MatchResult find(String pattern, String input) {
        return Pattern.compile(pattern).find(input);
    }
}
