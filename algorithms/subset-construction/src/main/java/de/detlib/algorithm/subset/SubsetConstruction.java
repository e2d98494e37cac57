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

import java.util.Map;
import java.util.Objects;

import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import de.detlib.api.algorithm.Determinizer;
import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The classical subset (powerset) construction.
 * <p>
 * Starting with the epsilon-closure of the start state, the construction explores every reachable set of NFA states
 * with a work list. The successor of a state set on a symbol is the epsilon-closure of the union of the successors of
 * its members; each distinct state set is processed at most once, so at most {@code 2^n} state sets are explored for an
 * NFA with {@code n} states. A state set is final iff it contains a final state of the NFA. Transitions are only created
 * where at least one member has one, so the resulting DFA may be partial.
 * <p>
 * If a member of a state set has no entry in the transition table at all, the whole state set gets no transitions.
 * Declare an (empty) entry for such states to let the other members contribute their transitions. For the start set,
 * only the start state itself needs an entry; states reached from it by epsilon transitions do not.
 * <p>
 * Unless disabled, automata that are {@link NFA#isDeterministic() deterministic} already are relabeled directly
 * instead: single-target sets become plain targets, and states, start state and final states are taken over as they
 * are.
 */
public class SubsetConstruction implements Determinizer {

    private static final Logger LOGGER = LoggerFactory.getLogger(SubsetConstruction.class);

    private final boolean deterministicShortcut;

    public SubsetConstruction() {
        this(true);
    }

    /**
     * Constructor.
     *
     * @param deterministicShortcut
     *         whether deterministic input should be relabeled directly instead of running the full construction
     */
    public SubsetConstruction(boolean deterministicShortcut) {
        this.deterministicShortcut = deterministicShortcut;
    }

    @Override
    public DFA determinize(NFA nfa) {
        Objects.requireNonNull(nfa, "nfa");

        if (deterministicShortcut && nfa.isDeterministic()) {
            LOGGER.debug("Automaton with {} states is deterministic, relabeling it", nfa.getStates().size());
            return relabel(nfa);
        }

        final MultiNFA multiNFA = MultiNFA.fromNFA(nfa);
        LOGGER.debug("Explored {} state sets for an automaton with {} states",
                     multiNFA.size(),
                     nfa.getStates().size());
        return multiNFA.toDFA();
    }

    static DFA relabel(NFA nfa) {
        final DFA.Builder builder = DFA.builder()
                                       .withStates(nfa.getStates())
                                       .withAlphabet(nfa.getSymbols())
                                       .withStartState(nfa.getStartState())
                                       .withFinalStates(nfa.getFinalStates());

        for (Map.Entry<String, ImmutableMap<Character, ImmutableSet<String>>> row : nfa.getTransitions().entrySet()) {
            final String source = row.getKey();
            builder.withTransitionEntry(source);
            for (Map.Entry<Character, ImmutableSet<String>> e : row.getValue().entrySet()) {
                for (String target : e.getValue()) {
                    builder.withTransition(source, e.getKey(), target);
                }
            }
        }

        return builder.build();
    }

    public boolean isDeterministicShortcut() {
        return deterministicShortcut;
    }
}
