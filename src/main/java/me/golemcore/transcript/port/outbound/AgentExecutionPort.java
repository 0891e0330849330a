package me.golemcore.transcript.port.outbound;

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

import me.golemcore.transcript.domain.model.StreamEvent;
import reactor.core.publisher.Flux;

/**
 * Port for the agent execution engine that plans and invokes tools. The engine
 * is opaque: the transcript only sees the ordered events of a run.
 */
public interface AgentExecutionPort {

    /**
     * Start a run for the query and stream its events. The stream ends with a
     * {@code RUN_END} event carrying the final output.
     */
    Flux<StreamEvent> streamEvents(String query);

    boolean isAvailable();
}
