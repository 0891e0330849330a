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

import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.util.UUID;
import java.util.function.Supplier;

/**
 * Resolves the correlation id of a tool call. Ids assigned by the execution
 * engine are preserved so they keep matching the engine's own protocol; missing
 * ids are generated.
 */
@Component
public class ToolCallIdResolver {

    private final Supplier<String> idGenerator;

    @Autowired
    public ToolCallIdResolver() {
        this(() -> UUID.randomUUID().toString());
    }

    // Visible for testing
    public ToolCallIdResolver(Supplier<String> idGenerator) {
        this.idGenerator = idGenerator;
    }

    public String resolve(String suppliedId) {
        if (suppliedId != null && !suppliedId.isBlank()) {
            return suppliedId;
        }
        return idGenerator.get();
    }
}
