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

import lombok.RequiredArgsConstructor;
import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.springframework.stereotype.Component;

/**
 * Picks a strategy from the content shape: JSON goes through structured
 * truncation, XML keeps head and tail, everything else is cut by lines.
 */
@Component
@RequiredArgsConstructor
public class SmartContentTruncator implements ContentTruncator {

    private final StructuredContentTruncator structuredTruncator;
    private final MiddleContentTruncator middleTruncator;
    private final LineAwareContentTruncator lineTruncator;

    @Override
    public TruncationMethod method() {
        return TruncationMethod.SMART;
    }

    @Override
    public String truncate(String content, TruncationSettings settings) {
        if (content.length() <= settings.effectiveLimit()) {
            return content;
        }
        if (TruncationText.isJsonLike(content)) {
            return structuredTruncator.truncate(content, settings);
        }
        if (TruncationText.isXmlLike(content)) {
            return middleTruncator.truncate(content, settings);
        }
        return lineTruncator.truncate(content, settings);
    }
}
