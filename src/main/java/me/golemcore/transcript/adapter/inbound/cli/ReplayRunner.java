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


package me.golemcore.transcript.adapter.inbound.cli;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.RunReport;
import me.golemcore.transcript.domain.service.EventStreamRunService;
import me.golemcore.transcript.infrastructure.config.TranscriptProperties;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Runs one query against the replay engine at startup and logs the run report.
 *
 * <p>
 * The query is taken from the non-option command line arguments, joined by
 * spaces, or from {@code transcript.engine.replay-query} when none are given.
 */
@Component
@ConditionalOnProperty(prefix = "transcript.engine", name = "mode", havingValue = "replay")
@RequiredArgsConstructor
@Slf4j
public class ReplayRunner implements ApplicationRunner {

    private final EventStreamRunService runService;
    private final TranscriptProperties properties;

    @Override
    public void run(ApplicationArguments args) {
        String query = resolveQuery(args.getNonOptionArgs());
        log.info("[Replay] Replaying run for query '{}'", query);

        RunReport report = runService.run(query).block();
        if (report == null) {
            log.warn("[Replay] Run finished without a report");
            return;
        }
        log.info("[Replay] Run {} {}: {} events, {} tool calls, {} orphaned, {} chars of answer",
                report.getRunKey(), report.getOutcome(), report.getEventCount(), report.getToolCallCount(),
                report.getOrphanedStartCount() + report.getOrphanedEndCount(), report.getTotalResponseLength());
    }

    String resolveQuery(List<String> arguments) {
        String joined = String.join(" ", arguments).trim();
        if (!joined.isEmpty()) {
            return joined;
        }
        return properties.getEngine().getReplayQuery();
    }
}
