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
package de.detlib.serialization.json;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.google.common.collect.ImmutableMap;
import de.detlib.algorithm.subset.SubsetConstruction;
import de.detlib.api.algorithm.Determinizer;
import de.detlib.api.automaton.DFA;
import de.detlib.api.automaton.NFA;
import de.detlib.api.automaton.Symbols;
import de.detlib.exception.InvalidAutomatonException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads automaton descriptions of the form
 * <pre>
 * {
 *   "states": ["q0", "q1"],
 *   "alphabet": ["a", "b"],
 *   "start_state": "q0",
 *   "final_states": ["q1"],
 *   "state_transitions": { "q0": { "a": ["q0", "q1"], "ε": ["q1"] } }
 * }
 * </pre>
 * and writes DFAs in the same format. A transition symbol may map to a list of targets or to a single target label.
 * Alphabet entries and transition symbols must be exactly one character long; the configured epsilon token (by
 * default {@code "ε"}) denotes epsilon transitions.
 * <p>
 * Unknown properties are rejected. Instances are thread-safe.
 */
public class JsonAutomatonParser {

    public static final String DEFAULT_EPSILON_TOKEN = String.valueOf(Symbols.EPSILON);

    private static final Logger LOGGER = LoggerFactory.getLogger(JsonAutomatonParser.class);

    private final ObjectMapper mapper;
    private final String epsilonToken;
    private final Determinizer determinizer;

    public JsonAutomatonParser() {
        this(DEFAULT_EPSILON_TOKEN);
    }

    public JsonAutomatonParser(String epsilonToken) {
        this(epsilonToken, new SubsetConstruction());
    }

    public JsonAutomatonParser(String epsilonToken, Determinizer determinizer) {
        this.epsilonToken = Objects.requireNonNull(epsilonToken, "epsilonToken");
        this.determinizer = Objects.requireNonNull(determinizer, "determinizer");
        this.mapper = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT)
                                        .disable(JsonParser.Feature.AUTO_CLOSE_SOURCE)
                                        .disable(JsonGenerator.Feature.AUTO_CLOSE_TARGET);
    }

    public NFA readNFA(String json) throws AutomatonFormatException {
        try {
            return toNFA(mapper.readValue(json, AutomatonDescription.class));
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Malformed automaton description: " + e.getOriginalMessage(), e);
        }
    }

    /**
     * Reads a description from the given stream, which is consumed but not closed.
     *
     * @throws IOException
     *         if reading from {@code in} fails
     * @throws AutomatonFormatException
     *         if the content is not a valid automaton description
     */
    public NFA readNFA(InputStream in) throws IOException, AutomatonFormatException {
        try {
            return toNFA(mapper.readValue(in, AutomatonDescription.class));
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Malformed automaton description: " + e.getOriginalMessage(), e);
        }
    }

    public NFA readNFA(File file) throws IOException, AutomatonFormatException {
        LOGGER.debug("Reading automaton description from {}", file);
        try {
            return toNFA(mapper.readValue(file, AutomatonDescription.class));
        } catch (JsonProcessingException e) {
            throw new AutomatonFormatException("Malformed automaton description in " + file + ": " +
                                               e.getOriginalMessage(), e);
        }
    }

    public DFA readDFA(String json) throws AutomatonFormatException {
        return determinizer.determinize(readNFA(json));
    }

    public DFA readDFA(InputStream in) throws IOException, AutomatonFormatException {
        return determinizer.determinize(readNFA(in));
    }

    public DFA readDFA(File file) throws IOException, AutomatonFormatException {
        return determinizer.determinize(readNFA(file));
    }

    /**
     * Encodes a DFA. Each transition is written in the single-target form, {@code "symbol": "target"}.
     */
    public String writeDFA(DFA dfa) {
        try {
            return mapper.writeValueAsString(toTree(dfa));
        } catch (JsonProcessingException e) {
            // a tree of strings always serializes
            throw new IllegalStateException(e);
        }
    }

    /**
     * Writes the encoded DFA to the given stream, which is not closed.
     */
    public void writeDFA(DFA dfa, OutputStream out) throws IOException {
        mapper.writeValue(out, toTree(dfa));
    }

    private ObjectNode toTree(DFA dfa) {
        final ObjectNode root = mapper.createObjectNode();

        final ArrayNode states = root.putArray("states");
        dfa.getStates().forEach(states::add);
        final ArrayNode alphabet = root.putArray("alphabet");
        dfa.getSymbols().forEach(s -> alphabet.add(String.valueOf(s)));
        root.put("start_state", dfa.getStartState());
        final ArrayNode finals = root.putArray("final_states");
        dfa.getFinalStates().forEach(finals::add);

        final ObjectNode table = root.putObject("state_transitions");
        for (Map.Entry<String, ImmutableMap<Character, String>> row : dfa.getTransitions().entrySet()) {
            final ObjectNode node = table.putObject(row.getKey());
            row.getValue().forEach((symbol, target) -> node.put(String.valueOf(symbol), target));
        }
        return root;
    }

    private NFA toNFA(AutomatonDescription description) throws AutomatonFormatException {
        final List<String> states = require(description.getStates(), "states");
        final List<String> alphabet = require(description.getAlphabet(), "alphabet");
        final String startState = require(description.getStartState(), "start_state");

        if (states.contains(null) || description.getFinalStates().contains(null)) {
            throw new AutomatonFormatException("State labels must be strings");
        }

        final List<Character> symbols = new ArrayList<>(alphabet.size());
        for (String symbol : alphabet) {
            if (symbol == null || symbol.length() != 1) {
                throw new AutomatonFormatException("Alphabet entry '" + symbol + "' is not a single character");
            }
            if (epsilonToken.equals(symbol)) {
                throw new AutomatonFormatException("Alphabet entry '" + symbol + "' is the epsilon token");
            }
            symbols.add(symbol.charAt(0));
        }

        final NFA.Builder builder = NFA.builder()
                                       .withStates(states)
                                       .withAlphabet(symbols)
                                       .withStartState(startState)
                                       .withFinalStates(description.getFinalStates());

        for (Map.Entry<String, Map<String, List<String>>> row : description.getStateTransitions().entrySet()) {
            builder.withTransitionEntry(row.getKey());
            for (Map.Entry<String, List<String>> t : row.getValue().entrySet()) {
                builder.withTransition(row.getKey(), toSymbol(row.getKey(), t.getKey()), t.getValue());
            }
        }

        try {
            final NFA nfa = builder.build();
            LOGGER.debug("Decoded automaton with {} states over {} symbols", nfa.getStates().size(),
                         nfa.getSymbols().size());
            return nfa;
        } catch (InvalidAutomatonException e) {
            throw new AutomatonFormatException("Invalid automaton: " + e.getMessage(), e);
        }
    }

    private char toSymbol(String state, String token) throws AutomatonFormatException {
        if (epsilonToken.equals(token)) {
            return Symbols.EPSILON;
        }
        if (token.length() != 1) {
            throw new AutomatonFormatException("Transition symbol '" + token + "' of state '" + state +
                                               "' is not a single character");
        }
        final char symbol = token.charAt(0);
        if (Symbols.isEpsilon(symbol)) {
            // reserved, only reachable through the configured token
            throw new AutomatonFormatException("Transition symbol '" + token + "' of state '" + state +
                                               "' is reserved, epsilon transitions use '" + epsilonToken + "'");
        }
        return symbol;
    }

    private static <T> T require(T value, String property) throws AutomatonFormatException {
        if (value == null) {
            throw new AutomatonFormatException("Property '" + property + "' must exist");
        }
        return value;
    }
}
