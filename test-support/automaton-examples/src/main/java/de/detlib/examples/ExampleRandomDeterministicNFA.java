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

import java.util.Random;

import de.detlib.api.automaton.NFA;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.util.automata.random.RandomAutomata;
import net.automatalib.words.Alphabet;

/**
 * Generates a random, complete DFA via AutomataLib and exposes it as a deterministic {@link NFA}. State {@code i} of the
 * generated automaton is named {@code "d" + i}.
 */
public class ExampleRandomDeterministicNFA extends DefaultAutomatonExample {

    public ExampleRandomDeterministicNFA(Random rand, Alphabet<Character> alphabet, int size) {
        super(constructMachine(rand, alphabet, size));
    }

    public static NFA constructMachine(Random rand, Alphabet<Character> alphabet, int size) {
        final CompactDFA<Character> dfa = RandomAutomata.randomDFA(rand, size, alphabet, false);
        final NFA.Builder builder = NFA.builder().withAlphabet(alphabet);

        for (Integer state : dfa.getStates()) {
            final String label = "d" + state;
            builder.withStates(label).withTransitionEntry(label);
            if (dfa.isAccepting(state)) {
                builder.withFinalStates(label);
            }
            for (Character symbol : alphabet) {
                final Integer succ = dfa.getSuccessor(state, symbol);
                if (succ != null) {
                    builder.withTransition(label, symbol, "d" + succ);
                }
            }
        }

        return builder.withStartState("d" + dfa.getInitialState()).build();
    }
}
