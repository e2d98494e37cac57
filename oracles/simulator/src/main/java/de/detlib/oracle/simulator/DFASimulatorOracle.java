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
package de.detlib.oracle.simulator;

import java.util.Objects;

import de.detlib.api.automaton.DFA;
import de.detlib.api.simulation.Acceptance;
import de.detlib.api.simulation.DFASimulator;
import net.automatalib.words.Word;

/**
 * Answers membership queries against a fixed {@link DFA}.
 * <p>
 * Queries are split into a prefix and a suffix; the outcome is the one of their concatenation. Since the automaton is
 * immutable, this oracle is thread-safe as long as its simulator is.
 */
public class DFASimulatorOracle {

    private final DFA dfa;
    private final DFASimulator simulator;

    public DFASimulatorOracle(DFA dfa) {
        this(dfa, DFAWalkSimulator.getInstance());
    }

    public DFASimulatorOracle(DFA dfa, DFASimulator simulator) {
        this.dfa = Objects.requireNonNull(dfa, "dfa");
        this.simulator = Objects.requireNonNull(simulator, "simulator");
    }

    public Acceptance answerQuery(Word<Character> input) {
        return simulator.simulate(dfa, input);
    }

    public Acceptance answerQuery(Word<Character> prefix, Word<Character> suffix) {
        return answerQuery(prefix.concat(suffix));
    }

    public Acceptance answerQuery(CharSequence input) {
        return simulator.simulate(dfa, input);
    }

    /**
     * @return {@code true} iff the word is {@link Acceptance#ACCEPTED accepted}
     */
    public boolean accepts(CharSequence input) {
        return answerQuery(input).isAccepted();
    }

    public DFA getAutomaton() {
        return dfa;
    }
}
