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

import de.detlib.api.automaton.NFA;

/**
 * A nondeterministic automaton over {@code {a, b}} with an epsilon transition from its (final) start state and
 * several multi-target transitions.
 */
public class ExampleEpsilonNFA extends DefaultAutomatonExample {

    public ExampleEpsilonNFA() {
        super(constructMachine());
    }

    public static NFA constructMachine() {
        // @formatter:off
        return NFA.builder()
                  .withStates("q0", "q1", "q2", "q3")
                  .withAlphabet('a', 'b')
                  .withStartState("q0")
                  .withFinalStates("q0")
                  .withEpsilonTransition("q0", "q1")
                  .withTransition("q1", 'a', "q1", "q2")
                  .withTransition("q1", 'b', "q2")
                  .withTransition("q2", 'a', "q0", "q2")
                  .withTransition("q2", 'b', "q3")
                  .withTransition("q3", 'b', "q1")
                  .build();
        // @formatter:on
    }

    public static ExampleEpsilonNFA createExample() {
        return new ExampleEpsilonNFA();
    }
}
