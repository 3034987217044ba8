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

import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * A single typed value passed to a scalar function in place of a column.
 *
 * <p>A null payload is a typed SQL NULL (for example {@code new Utf8(null)}).
 *
 * @since 1.0.0
 */
public sealed interface ScalarValue {

  /** Largest value an unsigned 32-bit integer can hold. */
  long UINT32_MAX = 0xFFFF_FFFFL;

  /** Arrow type of this value. */
  ArrowType type();

  /** True if this is a typed SQL NULL. */
  boolean isNull();

  static Utf8 utf8(String value) {
    return new Utf8(value);
  }

  /**
   * Creates an unsigned 32-bit scalar.
   *
   * @param value 0 to {@link #UINT32_MAX}
   * @throws IllegalArgumentException if value is out of range
   */
  static UInt32 uint32(long value) {
    if (value < 0 || value > UINT32_MAX) {
      throw new IllegalArgumentException("value out of UInt32 range: " + value);
    }
    return new UInt32((int) value);
  }

  static Int64 int64(long value) {
    return new Int64(value);
  }

  /** UTF-8 text. */
  record Utf8(String value) implements ScalarValue {
    @Override
    public ArrowType type() {
      return ArrowType.Utf8.INSTANCE;
    }

    @Override
    public boolean isNull() {
      return value == null;
    }
  }

  /**
   * Unsigned 32-bit integer. {@code bits} holds the value's two's complement bit pattern, as Arrow's
   * {@code UInt4Vector} does; read it with {@link #asLong()}.
   */
  record UInt32(Integer bits) implements ScalarValue {
    @Override
    public ArrowType type() {
      return new ArrowType.Int(32, false);
    }

    @Override
    public boolean isNull() {
      return bits == null;
    }

    /**
     * The unsigned value.
     *
     * @throws IllegalStateException if this is NULL
     */
    public long asLong() {
      if (bits == null) {
        throw new IllegalStateException("UInt32 scalar is NULL");
      }
      return Integer.toUnsignedLong(bits);
    }
  }

  /** Signed 64-bit integer. */
  record Int64(Long value) implements ScalarValue {
    @Override
    public ArrowType type() {
      return new ArrowType.Int(64, true);
    }

    @Override
    public boolean isNull() {
      return value == null;
    }
  }
}
