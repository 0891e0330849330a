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

import java.util.Locale;

/**
 * Kinds of events emitted by the agent execution engine during a run.
 */
public enum StreamEventKind {

    /**
     * A tool invocation started. Payload holds the tool arguments.
     */
    TOOL_START("tool_start"),

    /**
     * A tool invocation finished. Payload holds the raw tool output.
     */
    TOOL_END("tool_end"),

    /**
     * A streamed chunk of model text. Only its length is tracked.
     */
    MODEL_CHUNK("model_chunk"),

    /**
     * The run finished. Payload holds the raw final output.
     */
    RUN_END("run_end"),

    /**
     * Any other engine event. Relayed to the caller, ignored by the transcript.
     */
    OTHER("other");

    private final String wireName;

    StreamEventKind(String wireName) {
        this.wireName = wireName;
    }

    public String getWireName() {
        return wireName;
    }

    public boolean isToolEvent() {
        return this == TOOL_START || this == TOOL_END;
    }

    /**
     * Resolves a kind by its wire name ({@code tool_start}, {@code run_end}, ...).
     *
     * @return the matching kind, or {@code null} when the name is not recognized
     */
    public static StreamEventKind fromWireName(String name) {
        if (name == null || name.isBlank()) {
            return null;
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        for (StreamEventKind kind : values()) {
            if (kind.wireName.equals(normalized)) {
                return kind;
            }
        }
        return null;
    }
}
