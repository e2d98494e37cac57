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
package de.detlib.examples;

import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;

/**
 * A deterministic automaton over {@code {0, 1}} accepting the words that contain a {@code 1} and end with an even
 * number of {@code 0}s.
 */
public class ExampleTrailingZerosDFA extends DefaultAutomatonExample {

    public ExampleTrailingZerosDFA() {
        super(constructMachine());
    }

    /**
     * @return the automaton, as a (deterministic) {@link NFA}
     */
    public static NFA constructMachine() {
        // @formatter:off
        return NFA.builder()
                  .withStates("q1", "q2", "q3")
                  .withAlphabet('0', '1')
                  .withStartState("q1")
                  .withFinalStates("q2")
                  .withTransition("q1", '0', "q1")
                  .withTransition("q1", '1', "q2")
                  .withTransition("q2", '0', "q3")
                  .withTransition("q2", '1', "q2")
                  .withTransition("q3", '0', "q2")
                  .withTransition("q3", '1', "q2")
                  .build();
        // @formatter:on
    }

    /**
     * @return the same automaton, assembled directly as a {@link DFA}
     */
    public static DFA constructDFA() {
        // @formatter:off
        return DFA.builder()
                  .withStates("q1", "q2", "q3")
                  .withAlphabet('0', '1')
                  .withStartState("q1")
                  .withFinalStates("q2")
                  .withTransition("q1", '0', "q1")
                  .withTransition("q1", '1', "q2")
                  .withTransition("q2", '0', "q3")
                  .withTransition("q2", '1', "q2")
                  .withTransition("q3", '0', "q2")
                  .withTransition("q3", '1', "q2")
                  .build();
        // @formatter:on
    }

    public static ExampleTrailingZerosDFA createExample() {
        return new ExampleTrailingZerosDFA();
    }
}
