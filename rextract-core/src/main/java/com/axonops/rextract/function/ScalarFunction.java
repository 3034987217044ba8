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
import org.apache.arrow.memory.BufferAllocator;

/**
 * A row-wise function a columnar query engine can bind by name and call once per batch.
 *
 * <p>Implementations must be thread-safe: the host may invoke one instance from many worker threads
 * at once.
 *
 * @since 1.0.0
 */
public interface ScalarFunction {

  /** Name the host registers this function under. */
  String name();

  Signature signature();

  /**
   * Invokes the function on one batch.
   *
   * @param args positional arguments
   * @param allocator allocator for the result; the caller owns and closes the returned vector
   * @return the result
   * @throws com.axonops.rextract.api.ArgumentTypeException if the arguments do not fit the signature
   */
  ColumnarValue invoke(List<ColumnarValue> args, BufferAllocator allocator);
}
