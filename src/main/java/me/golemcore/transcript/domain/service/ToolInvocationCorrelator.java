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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.CorrelationAnomaly;
import me.golemcore.transcript.domain.model.PendingInvocation;
import me.golemcore.transcript.domain.model.RunState;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.domain.model.ToolCallRecord;
import me.golemcore.transcript.domain.model.ToolResultRecord;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Pairs tool start and end events by engine run id.
 *
 * <p>
 * Holds no state of its own: pending invocations and resolved pairs live in the
 * {@link RunState} of the run being processed. Edge cases are handled by
 * policy, never by throwing:
 * <ul>
 * <li>duplicate start for a run id - the most recent start wins</li>
 * <li>end without a pending start - logged and dropped</li>
 * <li>start without an end by run completion - logged and dropped</li>
 * </ul>
 * No synthetic record is ever produced for an unpaired event.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ToolInvocationCorrelator {

    private final ToolCallIdResolver idResolver;

    public void onToolStart(RunState state, StreamEvent event) {
        PendingInvocation invocation = new PendingInvocation(
                event.getRunId(),
                event.getName(),
                event.getPayload(),
                event.getToolCallId(),
                state.nextStartSequence());

        PendingInvocation previous = state.putPending(invocation);
        if (previous != null) {
            log.warn("[Correlator] Duplicate tool start for run '{}' ({}), keeping the most recent",
                    event.getRunId(), event.getName());
        }
    }

    /**
     * Resolves the pending invocation matching the end event.
     *
     * @return true when a call/result pair was recorded
     */
    public boolean onToolEnd(RunState state, StreamEvent event) {
        PendingInvocation pending = state.removePending(event.getRunId());
        if (pending == null) {
            log.warn("[Correlator] Tool end without matching start: run '{}' ({})",
                    event.getRunId(), event.getName());
            state.recordAnomaly(new CorrelationAnomaly(
                    CorrelationAnomaly.Kind.ORPHANED_END, event.getRunId(), event.getName()));
            return false;
        }

        String suppliedId = pending.suppliedId() != null && !pending.suppliedId().isBlank()
                ? pending.suppliedId()
                : event.getToolCallId();
        String toolCallId = idResolver.resolve(suppliedId);

        ToolCallRecord call = new ToolCallRecord(toolCallId, pending.toolName(), pending.args());
        ToolResultRecord result = new ToolResultRecord(toolCallId, pending.toolName(), event.getPayload(),
                event.isError());
        state.addResolvedPair(pending.sequence(), call, result);

        log.debug("[Correlator] Resolved tool call '{}' ({}) for run '{}'",
                toolCallId, pending.toolName(), event.getRunId());
        return true;
    }

    /**
     * Discards every invocation still pending at run completion.
     *
     * @return the number of orphaned starts
     */
    public int finish(RunState state) {
        List<PendingInvocation> orphans = state.drainPending();
        for (PendingInvocation orphan : orphans) {
            log.warn("[Correlator] Tool start without matching end: run '{}' ({})",
                    orphan.runId(), orphan.toolName());
            state.recordAnomaly(new CorrelationAnomaly(
                    CorrelationAnomaly.Kind.ORPHANED_START, orphan.runId(), orphan.toolName()));
        }
        return orphans.size();
    }
}
