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

/**
 * Thrown when a function receives the wrong number of arguments, or an argument of the wrong kind
 * at some position.
 *
 * @since 1.0.0
 */
public final class ArgumentTypeException extends RextractException {

    /** Position reported for arity errors, which are not tied to one argument. */
    public static final int NO_POSITION = -1;

    private final String functionName;
    private final int position;

    public ArgumentTypeException(String functionName, int position, String message) {
        super("Rextract: " + functionName + ": " + describe(position) + message);
        this.functionName = functionName;
        this.position = position;
    }

    public String getFunctionName() {
        return functionName;
    }

    /**
     * Zero-based argument position, or {@link #NO_POSITION} for an arity error.
     */
    public int getPosition() {
        return position;
    }

    private static String describe(int position) {
        return position == NO_POSITION ? "" : "argument " + position + ": ";
    }
}
