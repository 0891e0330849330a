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

package me.golemcore.transcript.adapter.outbound.engine;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.StreamEvent;
import me.golemcore.transcript.port.outbound.AgentExecutionPort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;
import reactor.core.publisher.Flux;

/**
 * Execution engine used when no real engine is configured.
 *
 * <p>
 * Every run ends immediately with a placeholder answer and no tool activity.
 * Engine mode: {@code "none"}
 */
@Component
@ConditionalOnProperty(prefix = "transcript.engine", name = "mode", havingValue = "none", matchIfMissing = true)
@Slf4j
public class NoOpAgentExecutionAdapter implements AgentExecutionPort {

    static final String NO_ENGINE_ANSWER = "[No execution engine configured]";

    @Override
    public Flux<StreamEvent> streamEvents(String query) {
        log.warn("NoOpAgentExecutionAdapter: streamEvents() called - no engine configured");
        return Flux.just(StreamEvent.runEnd(NO_ENGINE_ANSWER));
    }

    @Override
    public boolean isAvailable() {
        return false;
    }
}
