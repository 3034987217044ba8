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

/**
 * How a function's result depends on things other than its arguments.
 *
 * @since 1.0.0
 */
public enum Volatility {
  /** Same arguments always give the same result; the host may constant-fold or cache. */
  IMMUTABLE,
  /** Same result within one query execution. */
  STABLE,
  /** May differ on every call. */
  VOLATILE
}
