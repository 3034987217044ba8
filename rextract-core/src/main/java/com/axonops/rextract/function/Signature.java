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

import java.util.List;
import java.util.Objects;
import org.apache.arrow.vector.types.pojo.ArrowType;

/**
 * Declared argument types, return type and volatility of a scalar function.
 *
 * @since 1.0.0
 */
public record Signature(List<ArrowType> argumentTypes, ArrowType returnType, Volatility volatility) {

  public Signature {
    argumentTypes = List.copyOf(argumentTypes);
    Objects.requireNonNull(returnType, "returnType cannot be null");
    Objects.requireNonNull(volatility, "volatility cannot be null");
  }

  public int arity() {
    return argumentTypes.size();
  }
}
