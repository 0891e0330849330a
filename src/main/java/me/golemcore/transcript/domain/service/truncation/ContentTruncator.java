package me.golemcore.transcript.domain.service.truncation;

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

import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;

/**
 * Size-bounding strategy for stored text. Implementations are discovered by
 * {@link ContentTruncationService} and selected by {@link #method()}.
 *
 * <p>
 * Content within the effective limit must be returned unchanged. Strategies
 * must not throw for any input.
 */
public interface ContentTruncator {

    TruncationMethod method();

    String truncate(String content, TruncationSettings settings);
}
