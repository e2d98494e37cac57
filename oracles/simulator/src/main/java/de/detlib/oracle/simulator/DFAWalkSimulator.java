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
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Simulates a {@link DFA} by walking it symbol by symbol from its start state.
 * <p>
 * The walk stops at the first symbol outside the alphabet ({@link Acceptance#INVALID_ALPHABET}, also for {@code null}
 * symbols) or at the first undefined transition ({@link Acceptance#NO_TRANSITION}). Otherwise the verdict depends on whether the state reached
 * after the last symbol is final. The empty word is accepted iff the start state is final.
 * <p>
 * The simulator is stateless; a single instance may be shared.
 */
public class DFAWalkSimulator implements DFASimulator {

    private static final DFAWalkSimulator INSTANCE = new DFAWalkSimulator();

    public static DFAWalkSimulator getInstance() {
        return INSTANCE;
    }

    @Override
    public Acceptance simulate(DFA dfa, Word<Character> input) {
        Objects.requireNonNull(dfa, "dfa");
        Objects.requireNonNull(input, "input");

        String current = dfa.getStartState();

        for (@Nullable Character symbol : input) {
            if (symbol == null || !dfa.containsSymbol(symbol)) {
                return Acceptance.INVALID_ALPHABET;
            }
            final @Nullable String succ = dfa.getSuccessor(current, symbol);
            if (succ == null) {
                return Acceptance.NO_TRANSITION;
            }
            current = succ;
        }

        return dfa.isFinal(current) ? Acceptance.ACCEPTED : Acceptance.REJECTED;
    }
}
