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
package de.detlib.api.automaton;

import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.ImmutableSet;
import com.google.common.collect.ImmutableSortedSet;
import de.detlib.exception.InvalidAutomatonException;
import net.automatalib.words.Alphabet;
import net.automatalib.words.impl.ListAlphabet;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * A deterministic finite automaton over single-character symbols.
 * <p>
 * Each state has at most one successor per symbol; the transition function may be partial. Instances are immutable
 * (all tables are immutable copies) and may therefore be shared between threads without synchronization.
 */
public final class DFA {

    private final ImmutableSet<String> states;
    private final ImmutableSortedSet<Character> symbols;
    private final Alphabet<Character> alphabet;
    private final ImmutableMap<String, ImmutableMap<Character, String>> transitions;
    private final String startState;
    private final ImmutableSet<String> finalStates;

    private DFA(ImmutableSet<String> states,
                ImmutableSortedSet<Character> symbols,
                ImmutableMap<String, ImmutableMap<Character, String>> transitions,
                String startState,
                ImmutableSet<String> finalStates) {
        this.states = states;
        this.symbols = symbols;
        this.alphabet = new ListAlphabet<>(ImmutableList.copyOf(symbols));
        this.transitions = transitions;
        this.startState = startState;
        this.finalStates = finalStates;
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImmutableSet<String> getStates() {
        return states;
    }

    public int size() {
        return states.size();
    }

    public Alphabet<Character> getAlphabet() {
        return alphabet;
    }

    public ImmutableSortedSet<Character> getSymbols() {
        return symbols;
    }

    public boolean containsSymbol(char symbol) {
        return symbols.contains(symbol);
    }

    public String getStartState() {
        return startState;
    }

    public ImmutableSet<String> getFinalStates() {
        return finalStates;
    }

    public boolean isFinal(String state) {
        return finalStates.contains(state);
    }

    public ImmutableMap<String, ImmutableMap<Character, String>> getTransitions() {
        return transitions;
    }

    public ImmutableMap<Character, String> getTransitions(String state) {
        final ImmutableMap<Character, String> row = transitions.get(state);
        return row == null ? ImmutableMap.of() : row;
    }

    /**
     * @param state
     *         the source state
     * @param symbol
     *         the input symbol
     *
     * @return the successor of {@code state} on {@code symbol}, or {@code null} if the transition is undefined
     */
    public @Nullable String getSuccessor(String state, char symbol) {
        return getTransitions(state).get(symbol);
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof DFA)) {
            return false;
        }
        final DFA that = (DFA) o;
        return states.equals(that.states) && symbols.equals(that.symbols) && transitions.equals(that.transitions) &&
               startState.equals(that.startState) && finalStates.equals(that.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, symbols, transitions, startState, finalStates);
    }

    @Override
    public String toString() {
        return "DFA{states=" + states + ", alphabet=" + symbols + ", start=" + startState + ", final=" + finalStates +
               ", transitions=" + transitions + '}';
    }

    /**
     * Assembles {@link DFA}s. Besides the checks of {@link NFA.Builder}, the builder rejects epsilon transitions and
     * a second, different target for the same state and symbol.
     */
    public static final class Builder {

        private final Set<String> states = new LinkedHashSet<>();
        private final Set<Character> symbols = new LinkedHashSet<>();
        private final Map<String, Map<Character, String>> transitions = new LinkedHashMap<>();
        private final Set<String> finalStates = new LinkedHashSet<>();
        private @Nullable String startState;

        private Builder() {}

        public Builder withStates(String... states) {
            return withStates(Arrays.asList(states));
        }

        public Builder withStates(Collection<String> states) {
            this.states.addAll(states);
            return this;
        }

        public Builder withAlphabet(Character... symbols) {
            return withAlphabet(Arrays.asList(symbols));
        }

        public Builder withAlphabet(Collection<Character> symbols) {
            this.symbols.addAll(symbols);
            return this;
        }

        public Builder withStartState(String startState) {
            this.startState = Objects.requireNonNull(startState, "startState");
            return this;
        }

        public Builder withFinalStates(String... finalStates) {
            return withFinalStates(Arrays.asList(finalStates));
        }

        public Builder withFinalStates(Collection<String> finalStates) {
            this.finalStates.addAll(finalStates);
            return this;
        }

        public Builder withTransitionEntry(String state) {
            transitions.computeIfAbsent(state, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder withTransition(String from, char symbol, String to) {
            if (Symbols.isEpsilon(symbol)) {
                throw InvalidAutomatonException.of("Deterministic automata cannot have epsilon transitions (from '%s')",
                                                   from);
            }
            final String previous = transitions.computeIfAbsent(from, k -> new LinkedHashMap<>()).putIfAbsent(symbol, to);
            if (previous != null && !previous.equals(to)) {
                throw InvalidAutomatonException.of("State '%s' has two successors on '%s': '%s' and '%s'",
                                                   from,
                                                   symbol,
                                                   previous,
                                                   to);
            }
            return this;
        }

        public DFA build() {
            if (startState == null) {
                throw new InvalidAutomatonException("No start state given");
            }
            if (!states.contains(startState)) {
                throw InvalidAutomatonException.of("Start state '%s' is not a declared state", startState);
            }
            if (symbols.contains(Symbols.EPSILON)) {
                throw InvalidAutomatonException.of("The epsilon symbol '%s' must not be part of the alphabet",
                                                   Symbols.EPSILON);
            }
            for (String f : finalStates) {
                if (!states.contains(f)) {
                    throw InvalidAutomatonException.of("Final state '%s' is not a declared state", f);
                }
            }

            final ImmutableMap.Builder<String, ImmutableMap<Character, String>> table = ImmutableMap.builder();
            for (Map.Entry<String, Map<Character, String>> row : transitions.entrySet()) {
                final String source = row.getKey();
                if (!states.contains(source)) {
                    throw InvalidAutomatonException.of("Transition source '%s' is not a declared state", source);
                }
                for (Character symbol : row.getValue().keySet()) {
                    if (!symbols.contains(symbol)) {
                        throw InvalidAutomatonException.of("Transition symbol '%s' of state '%s' is not in the alphabet",
                                                           symbol,
                                                           source);
                    }
                }
                table.put(source, ImmutableMap.copyOf(row.getValue()));
            }

            return new DFA(ImmutableSet.copyOf(states),
                           ImmutableSortedSet.copyOf(symbols),
                           table.build(),
                           startState,
                           ImmutableSet.copyOf(finalStates));
        }
    }
}
