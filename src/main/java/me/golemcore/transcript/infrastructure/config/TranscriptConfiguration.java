package me.golemcore.transcript.infrastructure.config;

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

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.TruncationSettings;
import me.golemcore.transcript.port.outbound.AgentExecutionPort;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;

/**
 * Shared beans for transcript recording and a startup summary of the active
 * configuration.
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class TranscriptConfiguration {

    private final TranscriptProperties properties;
    private final AgentExecutionPort executionPort;

    @Bean
    public static Clock clock() {
        return Clock.systemDefaultZone();
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @PostConstruct
    public void init() {
        TruncationSettings truncation = properties.getDefaultTruncationSettings();
        log.info("Transcript recording: memory={}, history store={}, telemetry={}",
                properties.isMemoryEnabled(), properties.getHistory().getStore(),
                properties.getTelemetry().isEnabled());
        log.info("Truncation: method={}, limit={} chars, {} per-tool overrides",
                truncation.getMethod(), truncation.effectiveLimit(), properties.getPerToolTruncation().size());
        log.info("Execution engine: {} (available: {})", properties.getEngine().getMode(),
                executionPort.isAvailable());
    }
}
