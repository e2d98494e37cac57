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

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Random;

import de.detlib.api.automaton.NFA;
import de.detlib.api.automaton.Symbols;

/**
 * Generates a random NFA with states {@code s0, ..., s(n-1)} and start state {@code s0}.
 * <p>
 * Every state gets an entry in the transition table. For each state and symbol, each state becomes a target with
 * probability {@code transitionProb}; epsilon transitions are drawn the same way with probability
 * {@code epsilonProb}.
 */
public class ExampleRandomNFA extends DefaultAutomatonExample {

    public ExampleRandomNFA(Random rand,
                            Collection<Character> alphabet,
                            int size,
                            double transitionProb,
                            double epsilonProb,
                            double acceptanceProb) {
        super(constructMachine(rand, alphabet, size, transitionProb, epsilonProb, acceptanceProb));
    }

    public static NFA constructMachine(Random rand,
                                       Collection<Character> alphabet,
                                       int size,
                                       double transitionProb,
                                       double epsilonProb,
                                       double acceptanceProb) {
        final List<String> states = new ArrayList<>(size);
        for (int i = 0; i < size; i++) {
            states.add("s" + i);
        }

        final NFA.Builder builder = NFA.builder().withStates(states).withAlphabet(alphabet).withStartState("s0");

        for (String source : states) {
            builder.withTransitionEntry(source);
            if (rand.nextDouble() < acceptanceProb) {
                builder.withFinalStates(source);
            }
            for (Character symbol : alphabet) {
                final List<String> targets = pick(rand, states, transitionProb);
                if (!targets.isEmpty()) {
                    builder.withTransition(source, symbol, targets);
                }
            }
            final List<String> epsilonTargets = pick(rand, states, epsilonProb);
            if (!epsilonTargets.isEmpty()) {
                builder.withTransition(source, Symbols.EPSILON, epsilonTargets);
            }
        }

        return builder.build();
    }

    private static List<String> pick(Random rand, List<String> states, double prob) {
        final List<String> result = new ArrayList<>();
        for (String s : states) {
            if (rand.nextDouble() < prob) {
                result.add(s);
            }
        }
        return result;
    }
}
