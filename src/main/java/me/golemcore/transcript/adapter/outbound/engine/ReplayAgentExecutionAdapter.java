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

package me.golemcore.transcript.adapter.outbound.engine;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.adapter.inbound.stream.StreamEventMapper;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.infrastructure.config.TranscriptProperties;
import me.golemcore.transcript.port.outbound.AgentExecutionPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;
import reactor.core.scheduler.Schedulers;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.stream.Stream;

/**
 * Replays a recorded engine run from a JSONL file of LangChain-style event
 * documents, one per line. The query is not sent anywhere: every run replays
 * the same recording.
 *
 * <p>
 * Engine mode: {@code "replay"}, file set via
 * {@code transcript.engine.replay-file}.
 */
@Component
@ConditionalOnProperty(prefix = "transcript.engine", name = "mode", havingValue = "replay")
@Slf4j
public class ReplayAgentExecutionAdapter implements AgentExecutionPort {

    private final TranscriptProperties properties;
    private final StreamEventMapper mapper;

    public ReplayAgentExecutionAdapter(TranscriptProperties properties, StreamEventMapper mapper) {
        this.properties = properties;
        this.mapper = mapper;
    }

    @Override
    public Flux<StreamEvent> streamEvents(String query) {
        Path replayFile = resolveReplayFile();
        if (replayFile == null) {
            return Flux.error(new IllegalStateException("transcript.engine.replay-file is not set"));
        }
        log.debug("[Replay] Replaying {} for query", replayFile);
        Flux<String> lines = Flux.using(() -> Files.lines(replayFile, StandardCharsets.UTF_8),
                stream -> Flux.fromStream(stream),
                Stream::close);
        return mapper.mapLines(lines)
                .subscribeOn(Schedulers.boundedElastic());
    }

    @Override
    public boolean isAvailable() {
        Path replayFile = resolveReplayFile();
        return replayFile != null && Files.isReadable(replayFile);
    }

    private Path resolveReplayFile() {
        String configured = properties.getEngine().getReplayFile();
        if (configured == null || configured.isBlank()) {
            return null;
        }
        return Paths.get(configured.replace("${user.home}", System.getProperty("user.home")));
    }
}
