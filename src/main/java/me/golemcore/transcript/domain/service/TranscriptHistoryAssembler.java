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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.Message;
import me.golemcore.transcript.domain.model.RunState;
import me.golemcore.transcript.domain.model.ToolCallRecord;
import me.golemcore.transcript.domain.model.ToolResultRecord;
import me.golemcore.transcript.domain.service.truncation.ContentTruncationService;
import me.golemcore.transcript.infrastructure.config.TranscriptProperties;
import me.golemcore.transcript.port.outbound.HistoryStorePort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Single point of mutation for the conversation history of a run.
 *
 * <p>
 * Appends, in order: the user query, the assistant answer carrying every
 * resolved tool call, and one tool message per result in result order. Each
 * append is isolated: a failed write is logged and the remaining messages are
 * still written.
 */
@Service
@Slf4j
public class TranscriptHistoryAssembler {

    private final HistoryStorePort historyStore;
    private final ContentTruncationService truncationService;
    private final TranscriptProperties properties;
    private final Clock clock;

    public TranscriptHistoryAssembler(HistoryStorePort historyStore, ContentTruncationService truncationService,
            TranscriptProperties properties, Clock clock) {
        this.historyStore = historyStore;
        this.truncationService = truncationService;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Writes the transcript of a finished run.
     *
     * @param state
     *            the run state holding resolved tool calls and results
     * @param finalOutput
     *            the normalized final answer
     * @return number of messages that failed to be written
     */
    public int assemble(RunState state, String finalOutput) {
        if (!properties.isMemoryEnabled()) {
            log.debug("[History] Memory disabled, skipping transcript for run {}", state.getRunKey());
            return 0;
        }

        int failures = 0;
        if (!append("user", () -> buildUserMessage(state))) {
            failures++;
        }

        List<ToolCallRecord> toolCalls = state.getToolCalls();
        if (!append("assistant", () -> buildAssistantMessage(finalOutput, toolCalls))) {
            failures++;
        }

        List<ToolResultRecord> results = state.getToolResults();
        for (ToolResultRecord result : results) {
            if (!append("tool", () -> buildToolMessage(result))) {
                failures++;
            }
        }

        log.debug("[History] Run {}: wrote {} messages ({} failed)", state.getRunKey(),
                results.size() + 2 - failures, failures);
        return failures;
    }

    private boolean append(String kind, Supplier<Message> messageSupplier) {
        try {
            historyStore.append(messageSupplier.get());
            return true;
        } catch (RuntimeException e) {
            log.error("[History] Failed to append {} message: {}", kind, e.getMessage(), e);
            return false;
        }
    }

    private Message buildUserMessage(RunState state) {
        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_USER)
                .content(state.getQuery())
                .timestamp(now())
                .build();
    }

    private Message buildAssistantMessage(String finalOutput, List<ToolCallRecord> toolCalls) {
        String content = finalOutput != null ? finalOutput : "";
        if (content.isEmpty() && !toolCalls.isEmpty()) {
            content = properties.getPlaceholder().getNoFinalResponse();
        }

        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_ASSISTANT)
                .content(content)
                .toolCalls(toolCalls.isEmpty() ? null : toolCalls)
                .timestamp(now())
                .build();
    }

    private Message buildToolMessage(ToolResultRecord result) {
        String content;
        if (result.error() && result.output() == null) {
            content = properties.getPlaceholder().getToolExecutionError();
        } else {
            content = truncationService.render(result.output(),
                    properties.getEffectiveTruncationSettings(result.toolName()));
        }

        return Message.builder()
                .id(UUID.randomUUID().toString())
                .role(Message.ROLE_TOOL)
                .toolCallId(result.toolCallId())
                .toolName(result.toolName())
                .content(content)
                .timestamp(now())
                .build();
    }

    private Instant now() {
        return clock != null ? clock.instant() : Instant.now();
    }
}
