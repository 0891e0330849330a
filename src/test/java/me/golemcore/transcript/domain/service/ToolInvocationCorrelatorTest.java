package me.golemcore.transcript.domain.service;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import me.golemcore.transcript.domain.model.CorrelationAnomaly;
import me.golemcore.transcript.domain.model.RunState;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.domain.model.StreamEventKind;
import me.golemcore.transcript.domain.model.ToolCallRecord;
import me.golemcore.transcript.domain.model.ToolResultRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ToolInvocationCorrelatorTest {

    private static final Instant STARTED_AT = Instant.parse("2026-02-14T00:00:00Z");

    private ToolInvocationCorrelator correlator;
    private RunState state;
    private AtomicInteger generated;
    private Logger correlatorLogger;
    private ListAppender<ILoggingEvent> logAppender;

    @BeforeEach
    void setUp() {
        generated = new AtomicInteger();
        correlator = new ToolInvocationCorrelator(
                new ToolCallIdResolver(() -> "gen-" + generated.incrementAndGet()));
        state = new RunState("run-key", "query", STARTED_AT);

        correlatorLogger = (Logger) LoggerFactory.getLogger(ToolInvocationCorrelator.class);
        logAppender = new ListAppender<>();
        logAppender.start();
        correlatorLogger.addAppender(logAppender);
    }

    @AfterEach
    void tearDown() {
        correlatorLogger.detachAppender(logAppender);
        logAppender.stop();
    }

    private List<ILoggingEvent> warnings() {
        return logAppender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .toList();
    }

    // ==================== pairing ====================

    @Test
    void shouldPairStartAndEndWithGeneratedId() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", Map.of("query", "x")));
        boolean resolved = correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "search", "result text"));

        assertTrue(resolved);
        ToolCallRecord call = state.getToolCalls().get(0);
        ToolResultRecord result = state.getToolResults().get(0);
        assertEquals("gen-1", call.id());
        assertEquals(call.id(), result.toolCallId());
        assertEquals("search", call.name());
        assertEquals(Map.of("query", "x"), call.args());
        assertEquals("result text", result.output());
        assertEquals(1, generated.get());
    }

    @Test
    void shouldPreferIdSuppliedOnStart() {
        correlator.onToolStart(state, StreamEvent.builder()
                .kind(StreamEventKind.TOOL_START)
                .runId("r1").name("search").toolCallId("call_start").build());
        correlator.onToolEnd(state, StreamEvent.builder()
                .kind(StreamEventKind.TOOL_END)
                .runId("r1").name("search").toolCallId("call_end").payload("ok").build());

        assertEquals("call_start", state.getToolCalls().get(0).id());
        assertEquals("call_start", state.getToolResults().get(0).toolCallId());
        assertEquals(0, generated.get());
    }

    @Test
    void shouldFallBackToIdSuppliedOnEnd() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", null));
        correlator.onToolEnd(state, StreamEvent.builder()
                .kind(StreamEventKind.TOOL_END)
                .runId("r1").name("search").toolCallId("call_end").payload("ok").build());

        assertEquals("call_end", state.getToolCalls().get(0).id());
        assertEquals("call_end", state.getToolResults().get(0).toolCallId());
    }

    @Test
    void shouldCarryErrorFlagToResult() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "shell", null));
        correlator.onToolEnd(state, StreamEvent.builder()
                .kind(StreamEventKind.TOOL_END)
                .runId("r1").name("shell").error(true).build());

        assertTrue(state.getToolResults().get(0).error());
    }

    @Test
    void shouldOrderCallsByStartAndResultsByEnd() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "first", null));
        correlator.onToolStart(state, StreamEvent.toolStart("r2", "second", null));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r2", "second", "b"));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "first", "a"));

        List<ToolCallRecord> calls = state.getToolCalls();
        List<ToolResultRecord> results = state.getToolResults();
        assertEquals(List.of("first", "second"), calls.stream().map(ToolCallRecord::name).toList());
        assertEquals(List.of("second", "first"), results.stream().map(ToolResultRecord::toolName).toList());
    }

    @Test
    void shouldKeepEveryResultReferencingExactlyOneCall() {
        for (int i = 0; i < 5; i++) {
            correlator.onToolStart(state, StreamEvent.toolStart("r" + i, "tool" + i, null));
        }
        for (int i = 4; i >= 0; i--) {
            correlator.onToolEnd(state, StreamEvent.toolEnd("r" + i, "tool" + i, "out" + i));
        }

        List<String> callIds = state.getToolCalls().stream().map(ToolCallRecord::id).toList();
        assertEquals(5, callIds.stream().distinct().count());
        for (ToolResultRecord result : state.getToolResults()) {
            assertEquals(1, callIds.stream().filter(result.toolCallId()::equals).count());
        }
    }

    // ==================== anomalies ====================

    @Test
    void shouldReplaceDuplicateStartWithMostRecent() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", Map.of("query", "old")));
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", Map.of("query", "new")));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "search", "ok"));

        assertEquals(1, state.getToolCalls().size());
        assertEquals(Map.of("query", "new"), state.getToolCalls().get(0).args());
        assertEquals(0, state.getPendingCount());
    }

    @Test
    void shouldDropOrphanedEnd() {
        boolean resolved = correlator.onToolEnd(state, StreamEvent.toolEnd("ghost", "search", "ok"));

        assertFalse(resolved);
        assertTrue(state.getToolCalls().isEmpty());
        assertTrue(state.getToolResults().isEmpty());
        assertEquals(1, state.countAnomalies(CorrelationAnomaly.Kind.ORPHANED_END));
        List<ILoggingEvent> warnings = warnings();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("Tool end without matching start: run 'ghost'"));
    }

    @Test
    void shouldTreatSecondEndForSameRunAsOrphan() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", null));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "search", "first"));
        boolean resolved = correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "search", "second"));

        assertFalse(resolved);
        assertEquals(1, state.getToolResults().size());
        assertEquals("first", state.getToolResults().get(0).output());
    }

    @Test
    void shouldReportOrphanedStartsOnFinish() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", null));
        correlator.onToolStart(state, StreamEvent.toolStart("r2", "fetch", null));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r2", "fetch", "ok"));

        int orphans = correlator.finish(state);

        assertEquals(1, orphans);
        assertEquals(0, state.getPendingCount());
        assertEquals(1, state.getToolCalls().size());
        assertEquals("fetch", state.getToolCalls().get(0).name());
        CorrelationAnomaly anomaly = state.getAnomalies().get(0);
        assertEquals(CorrelationAnomaly.Kind.ORPHANED_START, anomaly.kind());
        assertEquals("r1", anomaly.runId());
        assertEquals("search", anomaly.toolName());
        List<ILoggingEvent> warnings = warnings();
        assertEquals(1, warnings.size());
        assertTrue(warnings.get(0).getFormattedMessage().contains("Tool start without matching end: run 'r1'"));
    }

    @Test
    void shouldNotWarnForPairedInvocations() {
        correlator.onToolStart(state, StreamEvent.toolStart("r1", "search", null));
        correlator.onToolEnd(state, StreamEvent.toolEnd("r1", "search", "ok"));
        correlator.finish(state);

        assertTrue(warnings().isEmpty());
    }
}
