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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.FinalOutput;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;

/**
 * Extracts the canonical answer text from the final output of a run.
 *
 * <p>
 * Checked in order, first match wins:
 * <ol>
 * <li>plain text - returned verbatim</li>
 * <li>list of segments - concatenation of each segment's text</li>
 * <li>object (map, JSON object or bean) - first non-empty field among {@code output}, {@code answer},
 * {@code text}, {@code content}</li>
 * <li>anything else - JSON rendering, logged as unexpected</li>
 * </ol>
 * Never throws.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class FinalOutputNormalizer {

    static final List<String> ANSWER_FIELDS = List.of("output", "answer", "text", "content");
    static final List<String> SEGMENT_TEXT_FIELDS = List.of("text", "content");

    private final StructuredTextRenderer renderer;
    private final ObjectMapper objectMapper;

    public String normalize(Object rawOutput) {
        try {
            return normalize(FinalOutput.of(rawOutput, objectMapper));
        } catch (RuntimeException e) {
            log.warn("[Output] Failed to normalize final output: {}", e.getMessage());
            return StructuredTextRenderer.coerce(rawOutput);
        }
    }

    String normalize(FinalOutput output) {
        if (output instanceof FinalOutput.Text text) {
            return text.value();
        }
        if (output instanceof FinalOutput.Segments segments) {
            return joinSegments(segments.segments());
        }
        if (output instanceof FinalOutput.Fields fields) {
            Object answer = firstPresent(fields.fields(), ANSWER_FIELDS);
            if (answer != null) {
                return asText(answer);
            }
            log.warn("[Output] Unexpected output format: object without answer field {}",
                    fields.fields().keySet());
            return renderer.render(fields.fields());
        }

        Object raw = ((FinalOutput.Unknown) output).raw();
        log.warn("[Output] Unexpected output format: {}", raw.getClass().getName());
        return renderer.render(raw);
    }

    private String joinSegments(List<?> segments) {
        StringBuilder sb = new StringBuilder();
        for (Object segment : segments) {
            if (segment == null) {
                continue;
            }
            if (segment instanceof CharSequence text) {
                sb.append(text);
                continue;
            }
            FinalOutput shape = FinalOutput.of(segment, objectMapper);
            Object segmentText = shape instanceof FinalOutput.Fields fields
                    ? firstPresent(fields.fields(), SEGMENT_TEXT_FIELDS)
                    : null;
            sb.append(segmentText != null ? asText(segmentText) : renderer.render(segment));
        }
        return sb.toString();
    }

    private Object firstPresent(Map<?, ?> fields, List<String> names) {
        for (String name : names) {
            Object value = fields.get(name);
            if (value == null) {
                continue;
            }
            if (value instanceof CharSequence text && text.length() == 0) {
                continue;
            }
            return value;
        }
        return null;
    }

    private String asText(Object value) {
        if (value instanceof CharSequence text) {
            return text.toString();
        }
        return renderer.render(value);
    }
}
