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

package me.golemcore.transcript.adapter.outbound.telemetry;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.RunReport;
import me.golemcore.transcript.port.outbound.TelemetryPort;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Logs run reports and keeps process-wide aggregates in memory.
 *
 * <p>
 * Counters are reset on restart; the last report is kept for inspection.
 */
@Component
@Slf4j
public class RunTelemetryAdapter implements TelemetryPort {

    private static final String LOG_PREFIX = "[Telemetry]";

    private final Map<RunReport.Outcome, AtomicLong> runsByOutcome = new ConcurrentHashMap<>();
    private final AtomicLong totalEvents = new AtomicLong();
    private final AtomicLong totalToolCalls = new AtomicLong();
    private final AtomicLong totalOrphans = new AtomicLong();
    private final AtomicLong totalExecutionTimeMs = new AtomicLong();
    private final AtomicReference<RunReport> lastReport = new AtomicReference<>();

    @Override
    public void recordRun(RunReport report) {
        if (report == null) {
            return;
        }
        runsByOutcome.computeIfAbsent(report.getOutcome(), outcome -> new AtomicLong()).incrementAndGet();
        totalEvents.addAndGet(report.getEventCount());
        totalToolCalls.addAndGet(report.getToolCallCount());
        totalOrphans.addAndGet((long) report.getOrphanedStartCount() + report.getOrphanedEndCount());
        totalExecutionTimeMs.addAndGet(report.getExecutionTimeMs());
        lastReport.set(report);

        log.info("{} run={} outcome={} method={} events={} responseLength={} toolCalls={} orphans={}/{} "
                + "historyFailures={} in {}ms",
                LOG_PREFIX, report.getRunKey(), report.getOutcome(), report.getMethod(), report.getEventCount(),
                report.getTotalResponseLength(), report.getToolCallCount(), report.getOrphanedStartCount(),
                report.getOrphanedEndCount(), report.getHistoryWriteFailures(), report.getExecutionTimeMs());
        if (report.getErrorType() != null) {
            log.warn("{} run={} failed with {}", LOG_PREFIX, report.getRunKey(), report.getErrorType());
        }
    }

    public long getRunCount() {
        return runsByOutcome.values().stream().mapToLong(AtomicLong::get).sum();
    }

    public long getRunCount(RunReport.Outcome outcome) {
        AtomicLong count = runsByOutcome.get(outcome);
        return count != null ? count.get() : 0L;
    }

    public long getTotalEvents() {
        return totalEvents.get();
    }

    public long getTotalToolCalls() {
        return totalToolCalls.get();
    }

    public long getTotalOrphans() {
        return totalOrphans.get();
    }

    public long getAverageExecutionTimeMs() {
        long runs = getRunCount();
        return runs == 0 ? 0L : totalExecutionTimeMs.get() / runs;
    }

    public RunReport getLastReport() {
        return lastReport.get();
    }
}
