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

package me.golemcore.transcript.adapter.outbound.history;

import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.Message;
import me.golemcore.transcript.port.outbound.HistoryStorePort;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-process conversation history. Default store; contents are lost on
 * restart.
 */
@Component
@ConditionalOnProperty(prefix = "transcript.history", name = "store", havingValue = "memory", matchIfMissing = true)
@Slf4j
public class InMemoryHistoryStoreAdapter implements HistoryStorePort {

    private final List<Message> messages = new CopyOnWriteArrayList<>();

    @Override
    public void append(Message message) {
        if (message == null) {
            throw new IllegalArgumentException("message must not be null");
        }
        messages.add(message);
        log.trace("[History] Appended {} message ({} total)", message.getRole(), messages.size());
    }

    @Override
    public List<Message> getMessages() {
        return List.copyOf(messages);
    }

    @Override
    public void clear() {
        messages.clear();
    }
}
