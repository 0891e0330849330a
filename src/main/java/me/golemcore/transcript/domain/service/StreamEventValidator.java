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

import me.golemcore.transcript.domain.exception.EventValidationException;
import me.golemcore.transcript.domain.model.StreamEvent;
import org.springframework.stereotype.Component;

/**
 * Structural validation of engine events. Keeps partially formed events away
 * from correlation and history assembly.
 */
@Component
public class StreamEventValidator {

    /**
     * Returns the event unchanged when it is well formed.
     *
     * @throws EventValidationException
     *             if the event has no kind, or is a tool event without a run id
     *             or tool name
     */
    public StreamEvent validate(StreamEvent event) {
        if (event == null) {
            throw new EventValidationException("Event is null");
        }
        if (event.getKind() == null) {
            throw new EventValidationException("Event has no recognized kind");
        }
        if (event.getKind().isToolEvent()) {
            if (isBlank(event.getRunId())) {
                throw new EventValidationException(event.getKind().getWireName() + " event is missing run id");
            }
            if (isBlank(event.getName())) {
                throw new EventValidationException(event.getKind().getWireName() + " event '"
                        + event.getRunId() + "' is missing tool name");
            }
        }
        return event;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
