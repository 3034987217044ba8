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

import java.util.Arrays;
import java.util.Objects;

/**
 * Result of a regex search with capture group access.
 *
 * <p>Immutable and thread-safe.
 *
 * <pre>{@code
 * Pattern pattern = Pattern.compile("([a-z]+)@([a-z]+)\\.([a-z]+)");
 * MatchResult result = pattern.find("mail user@example.com now");
 * if (result.matched()) {
 *     String user = result.group(1);     // "user"
 *     String domain = result.group(2);   // "example"
 * }
 * }</pre>
 *
 * <p>Unlike {@link Pattern#extract(String, int)}, a group that did not participate in the match is
 * reported as {@code null} here, so callers can tell it apart from a group that matched the empty
 * string.
 *
 * @since 1.0.0
 */
public final class MatchResult {

  private final boolean matched;
  private final String input;
  private final String[] groups;

  /**
   * Creates a MatchResult for a successful match.
   *
   * @param input the original input string
   * @param groups group[0] is the full match, group[1+] the capturing groups
   */
  MatchResult(String input, String[] groups) {
    this.matched = true;
    this.input = Objects.requireNonNull(input, "input cannot be null");
    this.groups = Objects.requireNonNull(groups, "groups cannot be null");
  }

  /**
   * Creates a MatchResult for a failed match.
   *
   * @param input the original input string
   */
  MatchResult(String input) {
    this.matched = false;
    this.input = Objects.requireNonNull(input, "input cannot be null");
    this.groups = new String[0];
  }

  public boolean matched() {
    return matched;
  }

  /**
   * Gets the full matched text (same as {@code group(0)}).
   *
   * @throws IllegalStateException if match failed
   */
  public String group() {
    return group(0);
  }

  /**
   * Gets a captured group by index.
   *
   * @param index the group index (0 = full match, 1+ = capturing groups)
   * @return the captured text, or null if the group didn't participate in the match
   * @throws IllegalStateException if match failed
   * @throws IndexOutOfBoundsException if index is negative or greater than groupCount()
   */
  public String group(int index) {
    if (!matched) {
      throw new IllegalStateException("No match found");
    }
    if (index < 0 || index >= groups.length) {
      throw new IndexOutOfBoundsException(
          "Group index " + index + " out of bounds (0 to " + (groups.length - 1) + ")");
    }
    return groups[index];
  }

  /**
   * Number of capturing groups, excluding group 0. Zero when the match failed.
   */
  public int groupCount() {
    return matched ? groups.length - 1 : 0;
  }

  public String input() {
    return input;
  }

  /**
   * All captured groups: [0] = full match, [1+] = capturing groups. Empty if no match.
   */
  public String[] groups() {
    return groups.clone();
  }

  @Override
  public String toString() {
    if (!matched) {
      return "MatchResult{matched=false, input=\"" + input + "\"}";
    }
    return "MatchResult{matched=true, input=\"" + input + "\", groups=" + groups.length + "}";
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj) {
      return true;
    }
    if (!(obj instanceof MatchResult other)) {
      return false;
    }
    return matched == other.matched
        && input.equals(other.input)
        && Arrays.equals(groups, other.groups);
  }

  @Override
  public int hashCode() {
    return Objects.hash(matched, input, Arrays.hashCode(groups));
  }
}
