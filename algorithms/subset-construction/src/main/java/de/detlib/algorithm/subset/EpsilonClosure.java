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
package de.detlib.algorithm.subset;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.Set;

import de.detlib.api.automaton.NFA;
import de.detlib.api.automaton.StateSet;

/**
 * Computes epsilon-closures: the smallest set of states containing the given states and closed under
 * {@link de.detlib.api.automaton.Symbols#EPSILON epsilon} transitions.
 * <p>
 * A state is expanded only when it is newly added to the closure, so every state is expanded at most once per
 * computation and epsilon cycles terminate. States without an entry in the transition table, or without epsilon
 * transitions, contribute nothing but themselves.
 */
public final class EpsilonClosure {

    private EpsilonClosure() {
        // prevent instantiation
    }

    public static StateSet of(NFA nfa, String state) {
        return of(nfa, Collections.singleton(state));
    }

    /**
     * Computes the epsilon-closure of a (possibly not yet closed) set of states.
     *
     * @param nfa
     *         the automaton providing the epsilon transitions
     * @param states
     *         the initial states
     *
     * @return the epsilon-closure of {@code states}
     */
    public static StateSet of(NFA nfa, Iterable<String> states) {
        final Set<String> closure = new HashSet<>();
        final Deque<String> worklist = new ArrayDeque<>();

        for (String s : states) {
            if (closure.add(s)) {
                worklist.push(s);
            }
        }

        while (!worklist.isEmpty()) {
            final String current = worklist.pop();
            for (String target : nfa.getEpsilonSuccessors(current)) {
                if (closure.add(target)) {
                    worklist.push(target);
                }
            }
        }

        return StateSet.of(closure);
    }
}
