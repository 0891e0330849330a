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

import lombok.Builder;
import lombok.Data;

import java.time.Instant;

/**
 * Run-level metrics emitted to the telemetry sink when a run completes.
 */
@Data
@Builder
public class RunReport {

    public static final String METHOD_EVENT_STREAM = "event-stream";

    private String runKey;
    private Outcome outcome;

    @Builder.Default
    private String method = METHOD_EVENT_STREAM;

    private int eventCount;
    private int totalResponseLength;
    private int rejectedEventCount;
    private int toolCallCount;
    private int toolResultCount;
    private int orphanedStartCount;
    private int orphanedEndCount;
    private int historyWriteFailures;
    private boolean memoryEnabled;
    private long executionTimeMs;
    private String errorType;
    private Instant completedAt;

    public boolean isSuccess() {
        return outcome == Outcome.COMPLETED;
    }

    /**
     * How the run ended.
     */
    public enum Outcome {
        COMPLETED, CANCELLED, FAILED
    }
}
