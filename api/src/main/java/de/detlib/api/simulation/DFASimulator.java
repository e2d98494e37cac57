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

import de.detlib.api.automaton.DFA;
import net.automatalib.words.Word;

/**
 * Decides membership of words in the language of a {@link DFA}.
 * <p>
 * Implementations must not modify the automaton, so a single DFA may be queried by several simulators concurrently.
 */
public interface DFASimulator {

    /**
     * Walks the given automaton over the given input, starting in its start state.
     *
     * @param dfa
     *         the automaton
     * @param input
     *         the input word
     *
     * @return the outcome of the walk
     */
    Acceptance simulate(DFA dfa, Word<Character> input);

    default Acceptance simulate(DFA dfa, CharSequence input) {
        return simulate(dfa, Word.fromCharSequence(input));
    }
}
