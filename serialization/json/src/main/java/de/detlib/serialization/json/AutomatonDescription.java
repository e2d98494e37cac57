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

import java.util.Collections;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * The raw, undecoded shape of an automaton description. Symbols are kept as strings here; their validation happens in
 * {@link JsonAutomatonParser}.
 */
class AutomatonDescription {

    @JsonProperty("states")
    private @Nullable List<String> states;

    @JsonProperty("alphabet")
    private @Nullable List<String> alphabet;

    @JsonProperty("start_state")
    private @Nullable String startState;

    @JsonProperty("final_states")
    private @Nullable List<String> finalStates;

    @JsonProperty("state_transitions")
    @JsonDeserialize(using = TransitionTableDeserializer.class)
    private @Nullable Map<String, Map<String, List<String>>> stateTransitions;

    AutomatonDescription() {}

    @Nullable List<String> getStates() {
        return states;
    }

    @Nullable List<String> getAlphabet() {
        return alphabet;
    }

    @Nullable String getStartState() {
        return startState;
    }

    List<String> getFinalStates() {
        return finalStates == null ? Collections.emptyList() : finalStates;
    }

    Map<String, Map<String, List<String>>> getStateTransitions() {
        return stateTransitions == null ? Collections.emptyMap() : stateTransitions;
    }
}
