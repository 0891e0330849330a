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

package me.golemcore.transcript.adapter.outbound.history;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.exception.HistoryWriteException;
import me.golemcore.transcript.domain.model.Message;
import me.golemcore.transcript.infrastructure.config.TranscriptProperties;
import me.golemcore.transcript.port.outbound.HistoryStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.List;

/**
 * File-backed conversation history. Each message is one JSON line in
 * {@code <base-path>/<conversation-id>.jsonl}.
 *
 * <p>
 * Base path configured via {@code transcript.history.base-path}, defaults to
 * {@code ${user.home}/.golemcore/transcripts}.
 */
@Component
@ConditionalOnProperty(prefix = "transcript.history", name = "store", havingValue = "jsonl")
@Slf4j
public class JsonlHistoryStoreAdapter implements HistoryStorePort {

    private static final String JSONL_EXTENSION = ".jsonl";
    private static final String NEWLINE = "\n";

    private final TranscriptProperties properties;
    private final ObjectMapper objectMapper;

    private Path historyFile;

    public JsonlHistoryStoreAdapter(TranscriptProperties properties, ObjectMapper objectMapper) {
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    @PostConstruct
    public void init() {
        TranscriptProperties.HistoryProperties history = properties.getHistory();
        Path basePath = Paths.get(history.getBasePath().replace("${user.home}", System.getProperty("user.home")))
                .toAbsolutePath().normalize();
        try {
            Files.createDirectories(basePath);
        } catch (IOException e) {
            throw new IllegalStateException("Cannot create transcript directory " + basePath, e);
        }
        this.historyFile = basePath.resolve(history.getConversationId() + JSONL_EXTENSION);
        log.info("[History] Writing transcripts to {}", historyFile);
    }

    @Override
    public synchronized void append(Message message) {
        try {
            String line = objectMapper.writeValueAsString(message) + NEWLINE;
            Files.writeString(historyFile, line, StandardCharsets.UTF_8,
                    StandardOpenOption.CREATE, StandardOpenOption.APPEND);
        } catch (IOException e) {
            throw new HistoryWriteException("Failed to append message to " + historyFile, e);
        }
    }

    @Override
    public synchronized List<Message> getMessages() {
        if (!Files.exists(historyFile)) {
            return List.of();
        }
        List<Message> messages = new ArrayList<>();
        try {
            for (String line : Files.readAllLines(historyFile, StandardCharsets.UTF_8)) {
                if (line.isBlank()) {
                    continue;
                }
                try {
                    messages.add(objectMapper.readValue(line, Message.class));
                } catch (JsonProcessingException e) {
                    log.warn("[History] Skipping unreadable line in {}: {}", historyFile, e.getOriginalMessage());
                }
            }
        } catch (IOException e) {
            throw new HistoryWriteException("Failed to read " + historyFile, e);
        }
        return messages;
    }

    @Override
    public synchronized void clear() {
        try {
            Files.deleteIfExists(historyFile);
        } catch (IOException e) {
            throw new HistoryWriteException("Failed to clear " + historyFile, e);
        }
    }
}
