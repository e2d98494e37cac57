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

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.fasterxml.jackson.core.JsonParseException;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.deser.std.StdDeserializer;

/**
 * Reads the {@code state_transitions} table. A symbol may map to a list of target labels or, in the legacy form, to a
 * single target label; both are normalized into a list. Declaration order is preserved.
 */
class TransitionTableDeserializer extends StdDeserializer<Map<String, Map<String, List<String>>>> {

    private static final long serialVersionUID = 1L;

    TransitionTableDeserializer() {
        super(Map.class);
    }

    @Override
    public Map<String, Map<String, List<String>>> deserialize(JsonParser jp, DeserializationContext ctxt)
            throws IOException {
        final JsonNode table = jp.getCodec().readTree(jp);
        if (!table.isObject()) {
            throw new JsonParseException(jp, "Property 'state_transitions' must be an object");
        }

        final Map<String, Map<String, List<String>>> result = new LinkedHashMap<>();
        final Iterator<Map.Entry<String, JsonNode>> rows = table.fields();
        while (rows.hasNext()) {
            final Map.Entry<String, JsonNode> row = rows.next();
            if (!row.getValue().isObject()) {
                throw new JsonParseException(jp, "Transitions of state '" + row.getKey() + "' must be an object");
            }

            final Map<String, List<String>> transitions = new LinkedHashMap<>();
            final Iterator<Map.Entry<String, JsonNode>> entries = row.getValue().fields();
            while (entries.hasNext()) {
                final Map.Entry<String, JsonNode> entry = entries.next();
                transitions.put(entry.getKey(), readTargets(jp, row.getKey(), entry.getKey(), entry.getValue()));
            }
            result.put(row.getKey(), transitions);
        }
        return result;
    }

    private static List<String> readTargets(JsonParser jp, String state, String symbol, JsonNode node)
            throws JsonParseException {
        if (node.isTextual()) {
            return Collections.singletonList(node.asText());
        }
        if (node.isArray()) {
            final List<String> targets = new ArrayList<>(node.size());
            for (JsonNode target : node) {
                if (!target.isTextual()) {
                    throw new JsonParseException(jp, targetError(state, symbol));
                }
                targets.add(target.asText());
            }
            return targets;
        }
        throw new JsonParseException(jp, targetError(state, symbol));
    }

    private static String targetError(String state, String symbol) {
        return "Targets of state '" + state + "' on '" + symbol + "' must be a state label or a list of state labels";
    }
}
