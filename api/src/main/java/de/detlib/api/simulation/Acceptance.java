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
package de.detlib.api.simulation;

/**
 * The outcome of simulating a DFA on an input word.
 * <p>
 * Besides the definite verdicts, the outcome distinguishes malformed input ({@link #INVALID_ALPHABET}) from an
 * automaton that is not defined for the input ({@link #NO_TRANSITION}).
 */
public enum Acceptance {
    /**
     * The whole word was read and the walk ended in a final state.
     */
    ACCEPTED,
    /**
     * The whole word was read and the walk ended in a non-final state.
     */
    REJECTED,
    /**
     * The word contains a symbol outside the alphabet of the automaton. The walk stopped at the first such symbol.
     */
    INVALID_ALPHABET,
    /**
     * The walk reached a state without a transition for the next symbol.
     */
    NO_TRANSITION;

    public boolean isAccepted() {
        return this == ACCEPTED;
    }
}
