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

import com.axonops.rextract.cache.RextractConfig;

/**
 * Factories for the scalar functions this library provides.
 *
 * @since 1.0.0
 */
public final class ScalarFunctions {

  private ScalarFunctions() {
    // Utility class
  }

  /** {@code regexp_extract} with {@link RextractConfig#DEFAULT}. */
  public static RegexpExtractFunction regexpExtract() {
    return regexpExtract(RextractConfig.DEFAULT);
  }

  /** {@code regexp_extract} with a custom cache and metrics configuration. */
  public static RegexpExtractFunction regexpExtract(RextractConfig config) {
    return new RegexpExtractFunction(config);
  }
}
