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

import lombok.Getter;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Mutable state of a single pass over one event stream.
 *
 * <p>
 * A run state is created when the stream is subscribed and discarded once the
 * transcript has been written. It is never shared between runs, so the pending
 * invocation map needs no synchronization: events of one run are processed
 * sequentially.
 *
 * <p>
 * Resolved tool calls are kept in start arrival order, results in end arrival
 * order. The two orders can differ when the engine interleaves invocations.
 */
public class RunState {

    @Getter
    private final String runKey;
    @Getter
    private final String query;
    @Getter
    private final Instant startedAt;

    private final Map<String, PendingInvocation> pending = new LinkedHashMap<>();
    private final TreeMap<Long, ToolCallRecord> toolCallsByStartSequence = new TreeMap<>();
    private final List<ToolResultRecord> toolResults = new ArrayList<>();
    private final List<CorrelationAnomaly> anomalies = new ArrayList<>();
    private final AtomicBoolean finished = new AtomicBoolean(false);

    private long startSequence;

    @Getter
    private Object finalOutput;
    @Getter
    private int eventCount;
    @Getter
    private int rejectedEventCount;
    @Getter
    private int totalResponseLength;

    public RunState(String query, Instant startedAt) {
        this(UUID.randomUUID().toString(), query, startedAt);
    }

    public RunState(String runKey, String query, Instant startedAt) {
        this.runKey = runKey;
        this.query = query;
        this.startedAt = startedAt;
    }

    // ==================== Pending invocations ====================

    public long nextStartSequence() {
        return startSequence++;
    }

    /**
     * Registers a pending invocation.
     *
     * @return the invocation previously registered for the same run id, or null
     */
    public PendingInvocation putPending(PendingInvocation invocation) {
        return pending.put(invocation.runId(), invocation);
    }

    public PendingInvocation removePending(String runId) {
        return pending.remove(runId);
    }

    public int getPendingCount() {
        return pending.size();
    }

    /**
     * Removes and returns every invocation still pending.
     */
    public List<PendingInvocation> drainPending() {
        List<PendingInvocation> drained = new ArrayList<>(pending.values());
        pending.clear();
        return drained;
    }

    // ==================== Resolved pairs ====================

    public void addResolvedPair(long startSequence, ToolCallRecord call, ToolResultRecord result) {
        toolCallsByStartSequence.put(startSequence, call);
        toolResults.add(result);
    }

    public List<ToolCallRecord> getToolCalls() {
        return List.copyOf(toolCallsByStartSequence.values());
    }

    public List<ToolResultRecord> getToolResults() {
        return Collections.unmodifiableList(new ArrayList<>(toolResults));
    }

    public boolean hasToolCalls() {
        return !toolCallsByStartSequence.isEmpty();
    }

    // ==================== Anomalies ====================

    public void recordAnomaly(CorrelationAnomaly anomaly) {
        anomalies.add(anomaly);
    }

    public List<CorrelationAnomaly> getAnomalies() {
        return Collections.unmodifiableList(new ArrayList<>(anomalies));
    }

    public long countAnomalies(CorrelationAnomaly.Kind kind) {
        return anomalies.stream().filter(a -> a.kind() == kind).count();
    }

    // ==================== Counters and final output ====================

    public void countEvent() {
        eventCount++;
    }

    public void countRejectedEvent() {
        rejectedEventCount++;
    }

    public void addResponseLength(int length) {
        totalResponseLength += length;
    }

    public void setFinalOutput(Object finalOutput) {
        this.finalOutput = finalOutput;
    }

    /**
     * Marks the run as finished.
     *
     * @return true only for the first caller
     */
    public boolean markFinished() {
        return finished.compareAndSet(false, true);
    }

    public boolean isFinished() {
        return finished.get();
    }
}
