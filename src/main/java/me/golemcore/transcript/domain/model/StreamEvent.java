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

import lombok.Builder;
import lombok.Value;

/**
 * Single event produced by the agent execution engine. Events are immutable and
 * consumed exactly once by the run that receives them.
 *
 * <p>
 * The meaning of {@link #payload} depends on {@link #kind}: tool arguments for
 * {@code TOOL_START}, raw tool output for {@code TOOL_END}, the final output for
 * {@code RUN_END} and the text chunk for {@code MODEL_CHUNK}.
 */
@Value
@Builder
public class StreamEvent {

    StreamEventKind kind;
    String runId;
    String name;
    Object payload;
    String toolCallId; // caller-assigned id, when the engine supplies one
    boolean error;

    public static StreamEvent toolStart(String runId, String name, Object args) {
        return StreamEvent.builder()
                .kind(StreamEventKind.TOOL_START)
                .runId(runId)
                .name(name)
                .payload(args)
                .build();
    }

    public static StreamEvent toolEnd(String runId, String name, Object output) {
        return StreamEvent.builder()
                .kind(StreamEventKind.TOOL_END)
                .runId(runId)
                .name(name)
                .payload(output)
                .build();
    }

    public static StreamEvent modelChunk(String text) {
        return StreamEvent.builder()
                .kind(StreamEventKind.MODEL_CHUNK)
                .payload(text)
                .build();
    }

    public static StreamEvent runEnd(Object finalOutput) {
        return StreamEvent.builder()
                .kind(StreamEventKind.RUN_END)
                .payload(finalOutput)
                .build();
    }
}
