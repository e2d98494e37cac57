/* Copyright (C) 2024 DetLib contributors
 * This file is part of DetLib.
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
package de.detlib.api.automaton;

import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Constants and helpers for input symbols. Symbols are single characters.
 */
public final class Symbols {

    /**
     * The reserved symbol labeling spontaneous (non-consuming) transitions. It must never be part of a declared
     * alphabet.
     */
    public static final char EPSILON = 'ε';

    private Symbols() {
        // prevent instantiation
    }

    public static boolean isEpsilon(@Nullable Character symbol) {
        return symbol != null && symbol == EPSILON;
    }
}
