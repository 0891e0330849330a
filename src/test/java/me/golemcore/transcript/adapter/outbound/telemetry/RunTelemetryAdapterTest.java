package me.golemcore.transcript.adapter.outbound.telemetry;

import me.golemcore.transcript.domain.model.RunReport;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertDoesNotThrow;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;

class RunTelemetryAdapterTest {

    private RunTelemetryAdapter telemetry;

    @BeforeEach
    void setUp() {
        telemetry = new RunTelemetryAdapter();
    }

    private static RunReport report(RunReport.Outcome outcome, int events, int toolCalls, long executionTimeMs) {
        return RunReport.builder()
                .runKey("run-" + events)
                .outcome(outcome)
                .eventCount(events)
                .toolCallCount(toolCalls)
                .orphanedStartCount(1)
                .executionTimeMs(executionTimeMs)
                .build();
    }

    @Test
    void shouldAggregateReports() {
        telemetry.recordRun(report(RunReport.Outcome.COMPLETED, 10, 2, 100));
        telemetry.recordRun(report(RunReport.Outcome.COMPLETED, 5, 1, 300));
        RunReport failed = RunReport.builder()
                .runKey("run-failed")
                .outcome(RunReport.Outcome.FAILED)
                .errorType("FatalStreamException")
                .executionTimeMs(200)
                .build();
        telemetry.recordRun(failed);

        assertEquals(3, telemetry.getRunCount());
        assertEquals(2, telemetry.getRunCount(RunReport.Outcome.COMPLETED));
        assertEquals(1, telemetry.getRunCount(RunReport.Outcome.FAILED));
        assertEquals(0, telemetry.getRunCount(RunReport.Outcome.CANCELLED));
        assertEquals(15, telemetry.getTotalEvents());
        assertEquals(3, telemetry.getTotalToolCalls());
        assertEquals(2, telemetry.getTotalOrphans());
        assertEquals(200, telemetry.getAverageExecutionTimeMs());
        assertSame(failed, telemetry.getLastReport());
    }

    @Test
    void shouldIgnoreNullReport() {
        assertDoesNotThrow(() -> telemetry.recordRun(null));

        assertEquals(0, telemetry.getRunCount());
        assertEquals(0, telemetry.getAverageExecutionTimeMs());
        assertNull(telemetry.getLastReport());
    }
}
