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
package de.detlib.api.algorithm;

import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;

/**
 * Converts nondeterministic automata into deterministic ones accepting the same language.
 */
@FunctionalInterface
public interface Determinizer {

    /**
     * Constructs a DFA equivalent to the given NFA. The NFA is only read.
     *
     * @param nfa
     *         the automaton to determinize
     *
     * @return a new, immutable DFA
     */
    DFA determinize(NFA nfa);
}
