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

import me.golemcore.transcript.domain.model.Message;

import java.util.List;

/**
 * Port for the append-only conversation history. Messages are appended one at a
 * time with no transactional grouping.
 */
public interface HistoryStorePort {

    /**
     * Append a message to the history.
     *
     * @throws me.golemcore.transcript.domain.exception.HistoryWriteException
     *             if the message could not be stored
     */
    void append(Message message);

    /**
     * Messages stored so far, in append order.
     */
    List<Message> getMessages();

    void clear();
}
