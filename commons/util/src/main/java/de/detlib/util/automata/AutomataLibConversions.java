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
package de.detlib.util.automata;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import de.detlib.api.automaton.Symbols;
import net.automatalib.automata.fsa.impl.compact.CompactDFA;
import net.automatalib.automata.fsa.impl.compact.CompactNFA;
import net.automatalib.commons.util.Pair;

/**
 * Conversions from DetLib automata into AutomataLib's compact automata, e.g. for use with AutomataLib's analysis
 * utilities or LearnLib oracles.
 * <p>
 * The compact automata identify states by integers; the conversions return the mapping from state labels to these
 * integers alongside the automaton. Transition targets that are not declared states become additional, non-accepting
 * states.
 */
public final class AutomataLibConversions {

    private AutomataLibConversions() {
        // prevent instantiation
    }

    public static Pair<CompactDFA<Character>, Map<String, Integer>> toCompactDFA(DFA dfa) {
        final CompactDFA<Character> result = new CompactDFA<>(dfa.getAlphabet());
        final Map<String, Integer> ids = new LinkedHashMap<>();

        ids.put(dfa.getStartState(), result.addInitialState(dfa.isFinal(dfa.getStartState())));
        for (String state : dfa.getStates()) {
            ids.computeIfAbsent(state, s -> result.addState(dfa.isFinal(s)));
        }

        for (Map.Entry<String, ImmutableMap<Character, String>> row : dfa.getTransitions().entrySet()) {
            final Integer source = ids.get(row.getKey());
            for (Map.Entry<Character, String> t : row.getValue().entrySet()) {
                final Integer target = ids.computeIfAbsent(t.getValue(), s -> result.addState(false));
                result.setTransition(source, t.getKey(), target);
            }
        }

        return Pair.of(result, Collections.unmodifiableMap(ids));
    }

    /**
     * Converts an epsilon-free NFA.
     *
     * @param nfa
     *         the automaton to convert
     *
     * @return the compact NFA and the mapping from state labels to compact state ids
     *
     * @throws IllegalArgumentException
     *         if {@code nfa} has epsilon transitions, which AutomataLib's NFAs cannot express
     */
    public static Pair<CompactNFA<Character>, Map<String, Integer>> toCompactNFA(NFA nfa) {
        final CompactNFA<Character> result = new CompactNFA<>(nfa.getAlphabet());
        final Map<String, Integer> ids = new LinkedHashMap<>();

        ids.put(nfa.getStartState(), result.addInitialState(nfa.isFinal(nfa.getStartState())));
        for (String state : nfa.getStates()) {
            ids.computeIfAbsent(state, s -> result.addState(nfa.isFinal(s)));
        }

        for (Map.Entry<String, ImmutableMap<Character, ImmutableSet<String>>> row : nfa.getTransitions().entrySet()) {
            final Integer source = ids.get(row.getKey());
            for (Map.Entry<Character, ImmutableSet<String>> t : row.getValue().entrySet()) {
                if (Symbols.isEpsilon(t.getKey())) {
                    throw new IllegalArgumentException("State '" + row.getKey() + "' has epsilon transitions");
                }
                for (String targetLabel : t.getValue()) {
                    final Integer target = ids.computeIfAbsent(targetLabel, s -> result.addState(false));
                    result.addTransition(source, t.getKey(), target);
                }
            }
        }

        return Pair.of(result, Collections.unmodifiableMap(ids));
    }
}
