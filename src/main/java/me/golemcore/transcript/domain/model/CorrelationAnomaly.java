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

/**
 * Tool event that could not be paired. Anomalies are logged and counted, never
 * turned into synthetic records.
 */
public record CorrelationAnomaly(Kind kind, String runId, String toolName) {

    public enum Kind {

        /**
         * A tool start that never received a matching end before the run finished.
         */
        ORPHANED_START,

        /**
         * A tool end without a pending start for its run id.
         */
        ORPHANED_END
    }
}
