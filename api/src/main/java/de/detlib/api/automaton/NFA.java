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
 * A nondeterministic finite automaton over single-character symbols.
 * <p>
 * The transition table maps a state to its outgoing transitions, which in turn map a symbol (an alphabet symbol or
 * {@link Symbols#EPSILON}) to a set of target states. A state may be missing from the table altogether, which is
 * distinguishable from a state whose entry holds no transitions (see {@link #hasTransitions(String)}).
 * <p>
 * Instances are immutable and are created through a {@link Builder}.
 */
public final class NFA {

    private final ImmutableSet<String> states;
    private final ImmutableSortedSet<Character> symbols;
    private final Alphabet<Character> alphabet;
    private final ImmutableMap<String, ImmutableMap<Character, ImmutableSet<String>>> transitions;
    private final String startState;
    private final ImmutableSet<String> finalStates;
    private final boolean deterministic;

    private NFA(ImmutableSet<String> states,
                ImmutableSortedSet<Character> symbols,
                ImmutableMap<String, ImmutableMap<Character, ImmutableSet<String>>> transitions,
                String startState,
                ImmutableSet<String> finalStates) {
        this.states = states;
        this.symbols = symbols;
        this.alphabet = new ListAlphabet<>(ImmutableList.copyOf(symbols));
        this.transitions = transitions;
        this.startState = startState;
        this.finalStates = finalStates;
        this.deterministic = computeDeterministic(transitions);
    }

    public static Builder builder() {
        return new Builder();
    }

    public ImmutableSet<String> getStates() {
        return states;
    }

    public Alphabet<Character> getAlphabet() {
        return alphabet;
    }

    public ImmutableSortedSet<Character> getSymbols() {
        return symbols;
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

    /**
     * @return the complete transition table, in declaration order
     */
    public ImmutableMap<String, ImmutableMap<Character, ImmutableSet<String>>> getTransitions() {
        return transitions;
    }

    /**
     * Checks whether the transition table has an entry for the given state, regardless of whether that entry holds
     * any transitions.
     *
     * @param state
     *         the state
     *
     * @return {@code true} if the table has an entry for {@code state}
     */
    public boolean hasTransitions(String state) {
        return transitions.containsKey(state);
    }

    /**
     * @param state
     *         the source state
     *
     * @return the outgoing transitions of {@code state}, empty if the table has no entry for it
     */
    public ImmutableMap<Character, ImmutableSet<String>> getTransitions(String state) {
        final ImmutableMap<Character, ImmutableSet<String>> row = transitions.get(state);
        return row == null ? ImmutableMap.of() : row;
    }

    public ImmutableSet<String> getSuccessors(String state, char symbol) {
        final ImmutableSet<String> succs = getTransitions(state).get(symbol);
        return succs == null ? ImmutableSet.of() : succs;
    }

    public ImmutableSet<String> getEpsilonSuccessors(String state) {
        return getSuccessors(state, Symbols.EPSILON);
    }

    /**
     * Checks whether this automaton is deterministic in its transition structure: no transition is labeled with
     * {@link Symbols#EPSILON} and no state has more than one target for the same symbol.
     *
     * @return {@code true} if the automaton is deterministic
     */
    public boolean isDeterministic() {
        return deterministic;
    }

    private static boolean computeDeterministic(Map<String, ImmutableMap<Character, ImmutableSet<String>>> table) {
        for (Map<Character, ImmutableSet<String>> row : table.values()) {
            for (Map.Entry<Character, ImmutableSet<String>> e : row.entrySet()) {
                if (Symbols.isEpsilon(e.getKey()) || e.getValue().size() > 1) {
                    return false;
                }
            }
        }
        return true;
    }

    @Override
    public boolean equals(@Nullable Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof NFA)) {
            return false;
        }
        final NFA that = (NFA) o;
        return states.equals(that.states) && symbols.equals(that.symbols) && transitions.equals(that.transitions) &&
               startState.equals(that.startState) && finalStates.equals(that.finalStates);
    }

    @Override
    public int hashCode() {
        return Objects.hash(states, symbols, transitions, startState, finalStates);
    }

    @Override
    public String toString() {
        return "NFA{states=" + states + ", alphabet=" + symbols + ", start=" + startState + ", final=" + finalStates +
               ", transitions=" + transitions + '}';
    }

    /**
     * Assembles {@link NFA}s. The builder validates the description in {@link #build()}:
     * <ul>
     * <li>the start state must be set and declared,</li>
     * <li>no declared state may contain {@link StateSet#SEPARATOR},</li>
     * <li>all final states and all transition sources must be declared,</li>
     * <li>{@link Symbols#EPSILON} must not be part of the alphabet,</li>
     * <li>every transition symbol is either an alphabet symbol or {@link Symbols#EPSILON}.</li>
     * </ul>
     * Transition targets are not checked against the declared states.
     */
    public static final class Builder {

        private final Set<String> states = new LinkedHashSet<>();
        private final Set<Character> symbols = new LinkedHashSet<>();
        private final Map<String, Map<Character, Set<String>>> transitions = new LinkedHashMap<>();
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

        /**
         * Makes sure the transition table has an entry for the given state, even if no transition leaves it.
         *
         * @param state
         *         the state
         *
         * @return this builder
         */
        public Builder withTransitionEntry(String state) {
            transitions.computeIfAbsent(state, k -> new LinkedHashMap<>());
            return this;
        }

        public Builder withTransition(String from, char symbol, String... targets) {
            return withTransition(from, symbol, Arrays.asList(targets));
        }

        /**
         * Adds transitions from {@code from} to each of the {@code targets} on {@code symbol}. Adding transitions for
         * an existing {@code (from, symbol)} pair extends its target set. An empty {@code targets} collection still
         * creates the table entries for {@code from} and {@code symbol}.
         *
         * @return this builder
         */
        public Builder withTransition(String from, char symbol, Collection<String> targets) {
            transitions.computeIfAbsent(from, k -> new LinkedHashMap<>())
                       .computeIfAbsent(symbol, k -> new LinkedHashSet<>())
                       .addAll(targets);
            return this;
        }

        public Builder withEpsilonTransition(String from, String... targets) {
            return withTransition(from, Symbols.EPSILON, targets);
        }

        public NFA build() {
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
            for (String s : states) {
                // state set labels would no longer be unique
                if (s.contains(StateSet.SEPARATOR)) {
                    throw InvalidAutomatonException.of("State '%s' contains the reserved separator '%s'",
                                                       s,
                                                       StateSet.SEPARATOR);
                }
            }
            for (String f : finalStates) {
                if (!states.contains(f)) {
                    throw InvalidAutomatonException.of("Final state '%s' is not a declared state", f);
                }
            }

            final ImmutableMap.Builder<String, ImmutableMap<Character, ImmutableSet<String>>> table =
                    ImmutableMap.builder();
            for (Map.Entry<String, Map<Character, Set<String>>> row : transitions.entrySet()) {
                final String source = row.getKey();
                if (!states.contains(source)) {
                    throw InvalidAutomatonException.of("Transition source '%s' is not a declared state", source);
                }
                final ImmutableMap.Builder<Character, ImmutableSet<String>> rowBuilder = ImmutableMap.builder();
                for (Map.Entry<Character, Set<String>> e : row.getValue().entrySet()) {
                    final Character symbol = e.getKey();
                    if (!Symbols.isEpsilon(symbol) && !symbols.contains(symbol)) {
                        throw InvalidAutomatonException.of("Transition symbol '%s' of state '%s' is not in the alphabet",
                                                           symbol,
                                                           source);
                    }
                    rowBuilder.put(symbol, ImmutableSet.copyOf(e.getValue()));
                }
                table.put(source, rowBuilder.build());
            }

            return new NFA(ImmutableSet.copyOf(states),
                           ImmutableSortedSet.copyOf(symbols),
                           table.build(),
                           startState,
                           ImmutableSet.copyOf(finalStates));
        }
    }
}
