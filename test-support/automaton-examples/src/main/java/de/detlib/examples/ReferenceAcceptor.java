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

import java.util.Collections;
import java.util.HashSet;
import java.util.Set;

import de.detlib.api.automaton.NFA;

/**
 * A straightforward acceptance check working directly on an {@link NFA}, used as an independent reference when testing
 * determinization.
 * <p>
 * The check follows the textbook definition: a word is accepted iff some run, interleaving epsilon transitions with
 * the symbols of the word, leads from the start state to a final state. Unlike the subset construction, states without
 * a transition entry simply contribute no successors.
 */
public final class ReferenceAcceptor {

    private ReferenceAcceptor() {
        // prevent instantiation
    }

    public static boolean accepts(NFA nfa, Iterable<Character> word) {
        Set<String> current = close(nfa, Collections.singleton(nfa.getStartState()));

        for (Character symbol : word) {
            if (!nfa.getSymbols().contains(symbol)) {
                return false;
            }
            final Set<String> next = new HashSet<>();
            for (String state : current) {
                next.addAll(nfa.getSuccessors(state, symbol));
            }
            current = close(nfa, next);
        }

        for (String state : current) {
            if (nfa.isFinal(state)) {
                return true;
            }
        }
        return false;
    }

    private static Set<String> close(NFA nfa, Set<String> states) {
        final Set<String> result = new HashSet<>();
        for (String s : states) {
            visit(nfa, s, result);
        }
        return result;
    }

    private static void visit(NFA nfa, String state, Set<String> visited) {
        if (visited.add(state)) {
            for (String target : nfa.getEpsilonSuccessors(state)) {
                visit(nfa, target, visited);
            }
        }
    }
}
