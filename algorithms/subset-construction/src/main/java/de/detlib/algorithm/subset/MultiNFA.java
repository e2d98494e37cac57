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
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Queue;
import java.util.Set;
import java.util.TreeMap;

import com.google.common.collect.ImmutableSet;
import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import de.detlib.api.automaton.StateSet;
import de.detlib.api.automaton.Symbols;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The reachable part of the powerset automaton of an {@link NFA}: its states are epsilon-closed {@link StateSet}s.
 * <p>
 * A multi-NFA only lives during a {@link SubsetConstruction} and is relabeled into a {@link DFA} by
 * {@link #toDFA()}.
 */
final class MultiNFA {

    private static final Logger LOGGER = LoggerFactory.getLogger(MultiNFA.class);

    private final NFA nfa;
    private final StateSet startState;
    // insertion order = discovery order
    private final Map<StateSet, Map<Character, StateSet>> transitions;

    private MultiNFA(NFA nfa, StateSet startState, Map<StateSet, Map<Character, StateSet>> transitions) {
        this.nfa = nfa;
        this.startState = startState;
        this.transitions = transitions;
    }

    /**
     * Explores all state sets reachable from the epsilon-closure of the start state of the given NFA.
     *
     * @param nfa
     *         the automaton to explore
     *
     * @return the explored multi-NFA
     */
    static MultiNFA fromNFA(NFA nfa) {
        final StateSet start = EpsilonClosure.of(nfa, nfa.getStartState());
        final Map<StateSet, Map<Character, StateSet>> table = new LinkedHashMap<>();
        final Queue<StateSet> worklist = new ArrayDeque<>();

        // the start set is checked for missing entries before its closure, i.e. only the start state itself
        final Map<Character, StateSet> startRow =
                aggregateTransitions(nfa, start, StateSet.of(nfa.getStartState()));
        table.put(start, startRow);
        worklist.addAll(startRow.values());

        while (!worklist.isEmpty()) {
            final StateSet current = EpsilonClosure.of(nfa, worklist.poll());

            if (table.containsKey(current)) {
                continue;
            }

            final Map<Character, StateSet> row = aggregateTransitions(nfa, current, current);
            table.put(current, row);

            for (StateSet target : row.values()) {
                if (!table.containsKey(target)) {
                    worklist.add(target);
                }
            }
        }

        return new MultiNFA(nfa, start, table);
    }

    /**
     * Aggregates the transitions of all members of {@code current}. If a member of {@code checked} has no entry in
     * the transition table, the row is empty. Members of {@code current} without an entry contribute nothing.
     */
    private static Map<Character, StateSet> aggregateTransitions(NFA nfa, StateSet current, StateSet checked) {
        for (String member : checked) {
            if (!nfa.hasTransitions(member)) {
                LOGGER.trace("State '{}' has no transition entry, {} gets no transitions", member, current);
                return Collections.emptyMap();
            }
        }

        final Map<Character, Set<String>> targets = new TreeMap<>();
        for (String member : current) {
            for (Map.Entry<Character, ImmutableSet<String>> e : nfa.getTransitions(member).entrySet()) {
                if (Symbols.isEpsilon(e.getKey()) || e.getValue().isEmpty()) {
                    continue;
                }
                targets.computeIfAbsent(e.getKey(), k -> new HashSet<>()).addAll(e.getValue());
            }
        }

        final Map<Character, StateSet> row = new LinkedHashMap<>();
        for (Map.Entry<Character, Set<String>> e : targets.entrySet()) {
            row.put(e.getKey(), EpsilonClosure.of(nfa, e.getValue()));
        }
        return row;
    }

    StateSet getStartState() {
        return startState;
    }

    Set<StateSet> getStates() {
        return Collections.unmodifiableSet(transitions.keySet());
    }

    Map<Character, StateSet> getTransitions(StateSet state) {
        final Map<Character, StateSet> row = transitions.get(state);
        return row == null ? Collections.emptyMap() : Collections.unmodifiableMap(row);
    }

    boolean isFinal(StateSet state) {
        return state.containsAny(nfa.getFinalStates());
    }

    int size() {
        return transitions.size();
    }

    /**
     * Relabels this multi-NFA into a DFA: every state set becomes the state named by its canonical label.
     *
     * @return the DFA
     */
    DFA toDFA() {
        final DFA.Builder builder = DFA.builder().withAlphabet(nfa.getSymbols()).withStartState(startState.toLabel());

        for (Map.Entry<StateSet, Map<Character, StateSet>> e : transitions.entrySet()) {
            final StateSet state = e.getKey();
            final String label = state.toLabel();

            builder.withStates(label).withTransitionEntry(label);
            if (isFinal(state)) {
                builder.withFinalStates(label);
            }
            for (Map.Entry<Character, StateSet> t : e.getValue().entrySet()) {
                builder.withTransition(label, t.getKey(), t.getValue().toLabel());
            }
        }

        return builder.build();
    }
}
