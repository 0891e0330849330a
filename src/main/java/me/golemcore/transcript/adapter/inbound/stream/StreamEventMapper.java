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

package me.golemcore.transcript.adapter.inbound.stream;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.domain.model.StreamEventKind;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

import java.util.Map;

/**
 * Translates LangChain-style stream event documents into {@link StreamEvent}s.
 *
 * <p>
 * Document shape:
 *
 * <pre>
 * {"event": "on_tool_start", "run_id": "...", "name": "search",
 *  "data": {"input": {...}, "output": ..., "toolCallId": "...", "chunk": {"content": "..."}}}
 * </pre>
 *
 * Documents that cannot be read are mapped to an event without a kind, which
 * the validator rejects.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StreamEventMapper {

    static final String EVENT_TOOL_START = "on_tool_start";
    static final String EVENT_TOOL_END = "on_tool_end";
    static final String EVENT_TOOL_ERROR = "on_tool_error";
    static final String EVENT_CHAT_MODEL_STREAM = "on_chat_model_stream";
    static final String EVENT_CHAIN_END = "on_chain_end";

    private static final String FIELD_EVENT = "event";
    private static final String FIELD_RUN_ID = "run_id";
    private static final String FIELD_NAME = "name";
    private static final String FIELD_DATA = "data";
    private static final String FIELD_INPUT = "input";
    private static final String FIELD_OUTPUT = "output";
    private static final String FIELD_ERROR = "error";
    private static final String FIELD_TOOL_CALL_ID = "toolCallId";
    private static final String FIELD_CHUNK = "chunk";
    private static final String FIELD_CONTENT = "content";

    private final ObjectMapper objectMapper;

    /**
     * Maps newline-delimited JSON documents, skipping blank lines.
     */
    public Flux<StreamEvent> mapLines(Flux<String> lines) {
        return lines.filter(line -> !line.isBlank()).map(this::map);
    }

    public StreamEvent map(String json) {
        try {
            return map(objectMapper.readTree(json));
        } catch (JsonProcessingException e) {
            log.warn("[Stream] Unreadable event document: {}", e.getOriginalMessage());
            return unrecognized();
        }
    }

    public StreamEvent map(Map<String, ?> document) {
        JsonNode tree = document != null ? objectMapper.valueToTree(document) : null;
        return map(tree);
    }

    public StreamEvent map(JsonNode document) {
        if (document == null || !document.isObject()) {
            return unrecognized();
        }
        String eventName = text(document.get(FIELD_EVENT));
        StreamEventKind kind = resolveKind(eventName);
        if (kind == null) {
            return unrecognized();
        }

        JsonNode data = document.path(FIELD_DATA);
        StreamEvent.StreamEventBuilder builder = StreamEvent.builder()
                .kind(kind)
                .runId(text(document.get(FIELD_RUN_ID)))
                .name(text(document.get(FIELD_NAME)))
                .toolCallId(text(data.get(FIELD_TOOL_CALL_ID)));

        switch (kind) {
        case TOOL_START -> builder.payload(toValue(data.get(FIELD_INPUT)));
        case TOOL_END -> {
            if (EVENT_TOOL_ERROR.equals(eventName)) {
                builder.error(true).payload(toValue(data.get(FIELD_ERROR)));
            } else {
                builder.payload(toValue(data.get(FIELD_OUTPUT)));
            }
        }
        case MODEL_CHUNK -> builder.payload(chunkText(data.path(FIELD_CHUNK)));
        case RUN_END -> builder.payload(toValue(data.get(FIELD_OUTPUT)));
        default -> builder.payload(toValue(data.isMissingNode() ? null : data));
        }
        return builder.build();
    }

    private static StreamEventKind resolveKind(String eventName) {
        if (eventName == null || eventName.isBlank()) {
            return null;
        }
        return switch (eventName) {
        case EVENT_TOOL_START -> StreamEventKind.TOOL_START;
        case EVENT_TOOL_END, EVENT_TOOL_ERROR -> StreamEventKind.TOOL_END;
        case EVENT_CHAT_MODEL_STREAM -> StreamEventKind.MODEL_CHUNK;
        case EVENT_CHAIN_END -> StreamEventKind.RUN_END;
        default -> {
            StreamEventKind direct = StreamEventKind.fromWireName(eventName);
            yield direct != null ? direct : StreamEventKind.OTHER;
        }
        };
    }

    private String chunkText(JsonNode chunk) {
        JsonNode content = chunk.get(FIELD_CONTENT);
        if (content == null || content.isNull()) {
            return null;
        }
        if (content.isTextual()) {
            return content.asText();
        }
        // multi-part content: concatenate text parts
        StringBuilder sb = new StringBuilder();
        if (content.isArray()) {
            for (JsonNode part : content) {
                if (part.isTextual()) {
                    sb.append(part.asText());
                } else if (part.hasNonNull("text")) {
                    sb.append(part.get("text").asText());
                }
            }
        }
        return sb.toString();
    }

    private Object toValue(JsonNode node) {
        if (node == null || node.isNull() || node.isMissingNode()) {
            return null;
        }
        if (node.isTextual()) {
            return node.asText();
        }
        return objectMapper.convertValue(node, Object.class);
    }

    private static String text(JsonNode node) {
        return node != null && node.isValueNode() && !node.isNull() ? node.asText() : null;
    }

    private static StreamEvent unrecognized() {
        return StreamEvent.builder().build();
    }
}
