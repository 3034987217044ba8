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

import java.util.Objects;
import org.apache.arrow.vector.FieldVector;

/**
 * An argument or result of a scalar function: either a whole column or a single scalar.
 *
 * <p>Functions check the variant and payload type of every argument up front instead of casting.
 *
 * @since 1.0.0
 */
public sealed interface ColumnarValue {

  static Array of(FieldVector vector) {
    return new Array(vector);
  }

  static Scalar of(ScalarValue value) {
    return new Scalar(value);
  }

  /** Short description for error messages, e.g. {@code "array<VARCHAR>"} or {@code "scalar<Utf8>"}. */
  String describe();

  /** A column. The vector stays owned by whoever created it. */
  record Array(FieldVector vector) implements ColumnarValue {
    public Array {
      Objects.requireNonNull(vector, "vector cannot be null");
    }

    @Override
    public String describe() {
      return "array<" + vector.getMinorType() + ">";
    }
  }

  /** A single value. */
  record Scalar(ScalarValue value) implements ColumnarValue {
    public Scalar {
      Objects.requireNonNull(value, "value cannot be null");
    }

    @Override
    public String describe() {
      return "scalar<" + value.type() + (value.isNull() ? ", NULL" : "") + ">";
    }
  }
}
