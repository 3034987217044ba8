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

package com.axonops.rextract.function;

import com.axonops.rextract.api.ArgumentTypeException;
import com.axonops.rextract.api.Pattern;
import com.axonops.rextract.api.PatternCompilationException;
import com.axonops.rextract.cache.CacheStatistics;
import com.axonops.rextract.cache.PatternCache;
import com.axonops.rextract.cache.RextractConfig;
import com.axonops.rextract.metrics.MetricNames;
import com.axonops.rextract.metrics.RextractMetricsRegistry;
import com.axonops.rextract.util.PatternHasher;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import org.apache.arrow.memory.BufferAllocator;
import org.apache.arrow.vector.FieldVector;
import org.apache.arrow.vector.VarCharVector;
import org.apache.arrow.vector.types.pojo.ArrowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code regexp_extract(input, pattern, group_index)}: extracts one capture group from every row of a
 * text column.
 *
 * <ul>
 *   <li>{@code input} - Utf8 column ({@link VarCharVector})
 *   <li>{@code pattern} - non-null Utf8 scalar, RE2 syntax
 *   <li>{@code group_index} - non-null UInt32 scalar, 0 for the whole match
 * </ul>
 *
 * <p>Returns a Utf8 column of the same length. A row is null exactly when the input row is null; a
 * row that does not match, or whose group did not participate or does not exist, is {@code ""}.
 * This is the behaviour of Spark's {@code regexp_extract}.
 *
 * <pre>{@code
 * try (RegexpExtractFunction fn = ScalarFunctions.regexpExtract();
 *      VarCharVector out = fn.extract(input, "([a-z]+)(\\d+)", 1, allocator)) {
 *   // ["hello123", "world456", null] -> ["hello", "world", null]
 * }
 * }</pre>
 *
 * <p>Patterns use RE2 syntax as implemented by RE2/J: no backreferences or lookaround, and the
 * Perl classes {@code \d}, {@code \w} and {@code \s} are ASCII-only, as in
 * {@code java.util.regex} by default. {@code (\w+)} on {@code "café"} extracts {@code "caf"}; use
 * Unicode classes such as {@code \pL} or {@code \p{N}} to match beyond ASCII.
 *
 * <p>Argument and pattern errors are raised before any row is read; there are no partial results.
 * Compiled patterns are kept in a {@link PatternCache} owned by this instance, so {@link #close()}
 * it when the host unregisters the function. A closed function rejects further calls.
 *
 * <p>Thread-safe.
 *
 * @since 1.0.0
 */
public final class RegexpExtractFunction implements ScalarFunction, AutoCloseable {
  private static final Logger logger = LoggerFactory.getLogger(RegexpExtractFunction.class);

  public static final String NAME = "regexp_extract";

  /** Name of the result vector. */
  public static final String OUTPUT_NAME = NAME;

  public static final Signature SIGNATURE =
      new Signature(
          List.of(ArrowType.Utf8.INSTANCE, ArrowType.Utf8.INSTANCE, new ArrowType.Int(32, false)),
          ArrowType.Utf8.INSTANCE,
          Volatility.IMMUTABLE);

  private static final int INPUT = 0;
  private static final int PATTERN = 1;
  private static final int GROUP_INDEX = 2;

  private final PatternCache cache;
  private final RextractMetricsRegistry metrics;
  private final AtomicBoolean closed = new AtomicBoolean(false);

  public RegexpExtractFunction(RextractConfig config) {
    Objects.requireNonNull(config, "config cannot be null");
    this.cache = new PatternCache(config);
    this.metrics = config.metricsRegistry();
  }

  @Override
  public String name() {
    return NAME;
  }

  @Override
  public Signature signature() {
    return SIGNATURE;
  }

  /**
   * Validates the three arguments and extracts.
   *
   * @return {@link ColumnarValue.Array} holding a new {@link VarCharVector}
   * @throws ArgumentTypeException on wrong arity, or wrong variant or type at any position
   * @throws PatternCompilationException if the pattern is invalid
   * @throws IllegalStateException if this function is closed
   */
  @Override
  public ColumnarValue invoke(List<ColumnarValue> args, BufferAllocator allocator) {
    Objects.requireNonNull(args, "args cannot be null");
    Objects.requireNonNull(allocator, "allocator cannot be null");
    checkNotClosed();

    if (args.size() != SIGNATURE.arity()) {
      throw rejected(
          ArgumentTypeException.NO_POSITION,
          "expected " + SIGNATURE.arity() + " arguments, got " + args.size());
    }

    VarCharVector input = inputColumn(args.get(INPUT));
    String pattern = patternText(args.get(PATTERN));
    long unsignedIndex = groupIndex(args.get(GROUP_INDEX));

    // Indexes past Integer.MAX_VALUE can never name a group
    int groupIndex = (int) Math.min(unsignedIndex, Integer.MAX_VALUE);

    return ColumnarValue.of(extract(input, pattern, groupIndex, allocator));
  }

  /**
   * Extracts group {@code groupIndex} of {@code pattern} from every row of {@code input}.
   *
   * @param input text column; not modified
   * @param pattern regex pattern (RE2 syntax)
   * @param groupIndex 0 for the whole match, 1+ for capturing groups
   * @param allocator allocator for the result
   * @return new column of {@code input.getValueCount()} rows, owned by the caller
   * @throws PatternCompilationException if the pattern is invalid
   * @throws IllegalArgumentException if groupIndex is negative
   * @throws IllegalStateException if this function is closed
   */
  public VarCharVector extract(
      VarCharVector input, String pattern, int groupIndex, BufferAllocator allocator) {
    Objects.requireNonNull(input, "input cannot be null");
    Objects.requireNonNull(pattern, "pattern cannot be null");
    Objects.requireNonNull(allocator, "allocator cannot be null");
    checkNotClosed();
    if (groupIndex < 0) {
      throw new IllegalArgumentException("groupIndex must be non-negative: " + groupIndex);
    }

    long startNanos = System.nanoTime();
    Pattern compiled = cache.getOrCompile(pattern, true, () -> compile(pattern));

    int rowCount = input.getValueCount();
    String[] values = new String[rowCount];
    for (int i = 0; i < rowCount; i++) {
      if (!input.isNull(i)) {
        values[i] = new String(input.get(i), StandardCharsets.UTF_8);
      }
    }

    String[] extracted = compiled.extractAll(values, groupIndex);

    VarCharVector output = new VarCharVector(OUTPUT_NAME, allocator);
    try {
      output.allocateNew();
      for (int i = 0; i < rowCount; i++) {
        if (extracted[i] == null) {
          output.setNull(i);
        } else {
          output.setSafe(i, extracted[i].getBytes(StandardCharsets.UTF_8));
        }
      }
      output.setValueCount(rowCount);
    } catch (RuntimeException e) {
      output.close();
      throw e;
    }

    long durationNanos = System.nanoTime() - startNanos;
    metrics.incrementCounter(MetricNames.FUNCTION_INVOCATIONS);
    metrics.recordTimer(MetricNames.FUNCTION_INVOCATION_LATENCY, durationNanos);
    logger.trace(
        "Rextract: {} - pattern: {}, group: {}, rows: {}, timeNs: {}",
        NAME,
        PatternHasher.hash(pattern),
        groupIndex,
        rowCount,
        durationNanos);

    return output;
  }

  /** Statistics of this function's pattern cache. */
  public CacheStatistics getCacheStatistics() {
    return cache.getStatistics();
  }

  /** Identifier of this function's pattern cache, which names its size gauge. */
  public String getCacheId() {
    return cache.getCacheId();
  }

  /** Stops the pattern cache's background eviction. Idempotent. */
  @Override
  public void close() {
    if (closed.compareAndSet(false, true)) {
      cache.shutdown();
    }
  }

  /** Whether {@link #close()} has been called. */
  public boolean isClosed() {
    return closed.get();
  }

  private void checkNotClosed() {
    if (closed.get()) {
      throw new IllegalStateException("Rextract: " + NAME + " function is closed");
    }
  }

  private Pattern compile(String pattern) {
    return Pattern.compile(pattern, true, metrics);
  }

  private VarCharVector inputColumn(ColumnarValue arg) {
    if (arg instanceof ColumnarValue.Array array) {
      FieldVector vector = array.vector();
      if (vector instanceof VarCharVector varChar) {
        return varChar;
      }
    }
    throw rejected(INPUT, "expected a Utf8 column, got " + describe(arg));
  }

  private String patternText(ColumnarValue arg) {
    if (arg instanceof ColumnarValue.Scalar scalar
        && scalar.value() instanceof ScalarValue.Utf8 utf8
        && !utf8.isNull()) {
      return utf8.value();
    }
    throw rejected(PATTERN, "expected a non-null Utf8 scalar pattern, got " + describe(arg));
  }

  private long groupIndex(ColumnarValue arg) {
    if (arg instanceof ColumnarValue.Scalar scalar
        && scalar.value() instanceof ScalarValue.UInt32 uint32
        && !uint32.isNull()) {
      return uint32.asLong();
    }
    throw rejected(GROUP_INDEX, "expected a non-null UInt32 scalar group index, got " + describe(arg));
  }

  private static String describe(ColumnarValue arg) {
    return arg == null ? "null" : arg.describe();
  }

  private ArgumentTypeException rejected(int position, String message) {
    metrics.incrementCounter(MetricNames.ERRORS_ARGUMENT_INVALID);
    logger.debug("Rextract: {} rejected arguments - position: {}, {}", NAME, position, message);
    return new ArgumentTypeException(NAME, position, message);
  }
}
