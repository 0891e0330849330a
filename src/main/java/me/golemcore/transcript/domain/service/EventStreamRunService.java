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
import me.golemcore.transcript.domain.exception.EventValidationException;
import me.golemcore.transcript.domain.exception.FatalStreamException;
import me.golemcore.transcript.domain.model.CorrelationAnomaly;
import me.golemcore.transcript.domain.model.RunReport;
import me.golemcore.transcript.domain.model.RunState;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.infrastructure.config.TranscriptProperties;
import me.golemcore.transcript.port.outbound.AgentExecutionPort;
import me.golemcore.transcript.port.outbound.TelemetryPort;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Clock;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Consumer;

/**
 * Drives one pass over an execution engine event stream and records its
 * transcript.
 *
 * <p>
 * Every subscription gets its own {@link RunState}; concurrent runs never share
 * correlation state. Events are processed one at a time in arrival order. At
 * the end of the stream the final output is normalized, the transcript is
 * written and a {@link RunReport} is sent to telemetry:
 * <ul>
 * <li>completion - full transcript</li>
 * <li>cancellation - tool calls resolved so far are flushed</li>
 * <li>source failure - no transcript, the error reaches the caller as
 * {@link FatalStreamException}</li>
 * </ul>
 * Malformed events, unpaired tool events and history write failures are logged
 * and never end the run.
 */
@Service
@Slf4j
public class EventStreamRunService {

    private static final int QUERY_PREVIEW_LENGTH = 50;

    private final AgentExecutionPort executionPort;
    private final StreamEventValidator validator;
    private final ToolInvocationCorrelator correlator;
    private final FinalOutputNormalizer normalizer;
    private final TranscriptHistoryAssembler historyAssembler;
    private final TelemetryPort telemetryPort;
    private final TranscriptProperties properties;
    private final Clock clock;

    public EventStreamRunService(AgentExecutionPort executionPort, StreamEventValidator validator,
            ToolInvocationCorrelator correlator, FinalOutputNormalizer normalizer,
            TranscriptHistoryAssembler historyAssembler, TelemetryPort telemetryPort,
            TranscriptProperties properties, Clock clock) {
        this.executionPort = executionPort;
        this.validator = validator;
        this.correlator = correlator;
        this.normalizer = normalizer;
        this.historyAssembler = historyAssembler;
        this.telemetryPort = telemetryPort;
        this.properties = properties;
        this.clock = clock;
    }

    /**
     * Runs the query on the execution engine and records the transcript.
     */
    public Mono<RunReport> run(String query) {
        if (!executionPort.isAvailable()) {
            log.warn("[Run] Execution engine is not available, running anyway");
        }
        return run(query, Flux.defer(() -> executionPort.streamEvents(query)));
    }

    /**
     * Consumes the whole event stream and records the transcript.
     *
     * @return the run report, emitted after the transcript has been written
     */
    public Mono<RunReport> run(String query, Flux<StreamEvent> source) {
        return Mono.defer(() -> {
            AtomicReference<RunReport> report = new AtomicReference<>();
            return record(new RunState(query, clock.instant()), source, report::set)
                    .then(Mono.fromSupplier(report::get));
        });
    }

    /**
     * Relays accepted events to the subscriber while recording the transcript.
     * Malformed events are dropped from the relayed stream.
     */
    public Flux<StreamEvent> streamEvents(String query, Flux<StreamEvent> source) {
        return Flux.defer(() -> record(new RunState(query, clock.instant()), source, report -> {
        }));
    }

    private Flux<StreamEvent> record(RunState state, Flux<StreamEvent> source, Consumer<RunReport> onReport) {
        if (source == null) {
            return Flux.error(new FatalStreamException("No event source for run " + state.getRunKey(), null));
        }
        log.info("[Run] Received query: '{}'", preview(state.getQuery()));

        return source
                .onErrorMap(e -> !(e instanceof FatalStreamException),
                        e -> new FatalStreamException("Event stream failed: " + e.getMessage(), e))
                .filter(event -> accept(state, event))
                .doOnComplete(() -> complete(state, RunReport.Outcome.COMPLETED, onReport))
                .doOnCancel(() -> complete(state, RunReport.Outcome.CANCELLED, onReport))
                .doOnError(e -> fail(state, e, onReport));
    }

    /**
     * Processes one event.
     *
     * @return whether the event is relayed downstream
     */
    boolean accept(RunState state, StreamEvent event) {
        // cancellation may arrive on another thread while an event is in flight
        synchronized (state) {
            if (state.isFinished()) {
                return false;
            }
            state.countEvent();
            try {
                validator.validate(event);
            } catch (EventValidationException e) {
                state.countRejectedEvent();
                log.warn("[Run] Invalid event skipped: {}", e.getMessage());
                return false;
            }

            try {
                dispatch(state, event);
            } catch (RuntimeException e) {
                log.error("[Run] Error processing {} event: {}", event.getKind(), e.getMessage(), e);
            }
            return true;
        }
    }

    private void dispatch(RunState state, StreamEvent event) {
        switch (event.getKind()) {
        case TOOL_START -> correlator.onToolStart(state, event);
        case TOOL_END -> correlator.onToolEnd(state, event);
        case MODEL_CHUNK -> {
            if (event.getPayload() instanceof CharSequence chunk) {
                state.addResponseLength(chunk.length());
            }
        }
        case RUN_END -> {
            if (event.getPayload() != null) {
                state.setFinalOutput(event.getPayload());
            }
        }
        default -> log.trace("[Run] Relaying {} event", event.getKind());
        }
    }

    private void complete(RunState state, RunReport.Outcome outcome, Consumer<RunReport> onReport) {
        RunReport report;
        synchronized (state) {
            if (!state.markFinished()) {
                return;
            }

            int historyFailures = 0;
            try {
                correlator.finish(state);
                String finalText = normalizer.normalize(state.getFinalOutput());
                historyFailures = historyAssembler.assemble(state, finalText);
            } catch (RuntimeException e) {
                log.error("[Run] Failed to record transcript for run {}", state.getRunKey(), e);
            }

            if (outcome == RunReport.Outcome.CANCELLED) {
                log.info("[Run] Run {} cancelled after {} events, flushed {} resolved tool calls",
                        state.getRunKey(), state.getEventCount(), state.getToolCalls().size());
            } else {
                log.info("[Run] Event stream complete - {} events, {} tool calls",
                        state.getEventCount(), state.getToolCalls().size());
            }
            report = buildReport(state, outcome, historyFailures, null);
        }
        publish(report, onReport);
    }

    private void fail(RunState state, Throwable error, Consumer<RunReport> onReport) {
        RunReport report;
        synchronized (state) {
            if (!state.markFinished()) {
                return;
            }
            log.error("[Run] Error during event stream for run {}: {}", state.getRunKey(), error.getMessage());
            report = buildReport(state, RunReport.Outcome.FAILED, 0, error.getClass().getSimpleName());
        }
        publish(report, onReport);
    }

    private RunReport buildReport(RunState state, RunReport.Outcome outcome, int historyFailures,
            String errorType) {
        return RunReport.builder()
                .runKey(state.getRunKey())
                .outcome(outcome)
                .eventCount(state.getEventCount())
                .totalResponseLength(state.getTotalResponseLength())
                .rejectedEventCount(state.getRejectedEventCount())
                .toolCallCount(state.getToolCalls().size())
                .toolResultCount(state.getToolResults().size())
                .orphanedStartCount((int) state.countAnomalies(CorrelationAnomaly.Kind.ORPHANED_START)
                        + state.getPendingCount())
                .orphanedEndCount((int) state.countAnomalies(CorrelationAnomaly.Kind.ORPHANED_END))
                .historyWriteFailures(historyFailures)
                .memoryEnabled(properties.isMemoryEnabled())
                .executionTimeMs(Duration.between(state.getStartedAt(), clock.instant()).toMillis())
                .errorType(errorType)
                .completedAt(clock.instant())
                .build();
    }

    private void publish(RunReport report, Consumer<RunReport> onReport) {
        onReport.accept(report);
        if (!properties.getTelemetry().isEnabled()) {
            return;
        }
        try {
            telemetryPort.recordRun(report);
        } catch (RuntimeException e) {
            log.debug("[Run] Telemetry write failed: {}", e.getMessage());
        }
    }

    private static String preview(String query) {
        if (query == null) {
            return "";
        }
        String flat = query.replace('\n', ' ');
        return flat.length() > QUERY_PREVIEW_LENGTH ? flat.substring(0, QUERY_PREVIEW_LENGTH) + "..." : flat;
    }
}
