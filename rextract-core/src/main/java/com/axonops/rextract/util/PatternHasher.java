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

package com.axonops.rextract.util;

/**
 * Utility for hashing pattern strings for logging purposes.
 *
 * <p>Patterns are user supplied and can be long or sensitive, so logs carry a short deterministic
 * hash instead. Same pattern, same hash.
 *
 * @since 1.0.0
 */
public final class PatternHasher {

    private PatternHasher() {
        // Utility class
    }

    /**
     * Creates a compact hex hash of a pattern string for logging.
     *
     * @param pattern the regex pattern string
     * @return hex string (e.g., "7a3f2b1c"), or "null"
     */
    public static String hash(String pattern) {
        if (pattern == null) {
            return "null";
        }
        return Integer.toHexString(pattern.hashCode());
    }

    /**
     * Creates a hash with a case sensitivity marker.
     *
     * @param pattern the regex pattern string
     * @param caseSensitive whether the pattern is case-sensitive
     * @return hash with indicator (e.g., "7a3f2b1c[CS]" or "7a3f2b1c[CI]")
     */
    public static String hashWithCase(String pattern, boolean caseSensitive) {
        return hash(pattern) + (caseSensitive ? "[CS]" : "[CI]");
    }
}
