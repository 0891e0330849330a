package me.golemcore.transcript.domain.service;

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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Renders arbitrary engine payloads as JSON text.
 *
 * <p>
 * Payloads can be cyclic or expose failing accessors. {@link #render} and
 * {@link #coerce} never throw; {@link #renderPretty} reports the failure so
 * callers can log it and fall back.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StructuredTextRenderer {

    static final String SERIALIZATION_FAILED = "Serialization failed";

    private final ObjectMapper objectMapper;

    /**
     * Compact JSON rendering, or a string coercion when the value cannot be
     * serialized.
     */
    public String render(Object value) {
        try {
            return objectMapper.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException | StackOverflowError e) {
            log.debug("[Render] JSON rendering failed, coercing to string: {}", e.getMessage());
            return coerce(value);
        }
    }

    /**
     * Indented JSON rendering.
     *
     * @throws JsonProcessingException
     *             if the value cannot be serialized
     */
    public String renderPretty(Object value) throws JsonProcessingException {
        try {
            return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(value);
        } catch (StackOverflowError e) {
            throw new JsonProcessingException("Object graph too deep to serialize") {
                private static final long serialVersionUID = 1L;
            };
        }
    }

    /**
     * Best-effort textual coercion of any value.
     */
    public static String coerce(Object value) {
        try {
            String text = String.valueOf(value);
            return text != null ? text : SERIALIZATION_FAILED;
        } catch (RuntimeException | StackOverflowError e) {
            return SERIALIZATION_FAILED;
        }
    }
}
