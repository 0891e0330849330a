package me.golemcore.transcript.domain.model;

/*
 * Copyright 2026 Aleksei Kuleshov
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
 *
 * Contact: alex@kuleshov.tech
 */

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Shape of the raw final output reported by the execution engine at the end of
 * a run. Engines report plain strings, lists of content segments, or objects
 * with a conventionally named text field.
 */
public sealed interface FinalOutput permits FinalOutput.Text, FinalOutput.Segments, FinalOutput.Fields,
        FinalOutput.Unknown {

    /**
     * Classifies a raw payload. A missing payload is treated as empty text.
     */
    static FinalOutput of(Object raw) {
        if (raw == null) {
            return new Text("");
        }
        if (raw instanceof CharSequence text) {
            return new Text(text.toString());
        }
        if (raw instanceof Collection<?> collection) {
            return new Segments(new ArrayList<>(collection));
        }
        if (raw instanceof Object[] array) {
            return new Segments(Arrays.asList(array));
        }
        if (raw instanceof Map<?, ?> map) {
            return new Fields(map);
        }
        return new Unknown(raw);
    }

    /**
     * Classifies a raw payload, also reading JSON trees and bean-like objects
     * (records, POJOs) through the given mapper. Beans become {@link Fields}
     * keyed by property name; values the mapper cannot read as an object stay
     * {@link Unknown}.
     */
    static FinalOutput of(Object raw, ObjectMapper objectMapper) {
        if (raw instanceof JsonNode node) {
            return ofTree(node, objectMapper);
        }
        FinalOutput output = of(raw);
        if (!(output instanceof Unknown) || isScalar(raw)) {
            return output;
        }
        try {
            return new Fields(objectMapper.convertValue(raw, new TypeReference<Map<String, Object>>() {
            }));
        } catch (IllegalArgumentException e) {
            // not readable as an object, rendered as-is by the caller
            return output;
        }
    }

    private static FinalOutput ofTree(JsonNode node, ObjectMapper objectMapper) {
        if (node.isNull() || node.isMissingNode()) {
            return new Text("");
        }
        if (node.isTextual()) {
            return new Text(node.asText());
        }
        if (node.isObject()) {
            return new Fields(objectMapper.convertValue(node, new TypeReference<Map<String, Object>>() {
            }));
        }
        if (node.isArray()) {
            return new Segments(objectMapper.convertValue(node, new TypeReference<List<Object>>() {
            }));
        }
        return new Unknown(node);
    }

    private static boolean isScalar(Object raw) {
        return raw instanceof Number || raw instanceof Boolean || raw instanceof Character || raw instanceof Enum<?>;
    }

    record Text(String value) implements FinalOutput {
    }

    record Segments(List<?> segments) implements FinalOutput {
    }

    record Fields(Map<?, ?> fields) implements FinalOutput {
    }

    record Unknown(Object raw) implements FinalOutput {
    }
}
