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
import org.springframework.stereotype.Component;

/**
 * Keeps the first {@code limit} characters and appends the truncation marker,
 * followed by {@code " (100,000 → 1,000 chars)"} when size info is enabled.
 */
@Component
public class EndContentTruncator implements ContentTruncator {

    @Override
    public TruncationMethod method() {
        return TruncationMethod.END;
    }

    @Override
    public String truncate(String content, TruncationSettings settings) {
        int limit = settings.effectiveLimit();
        if (content.length() <= limit) {
            return content;
        }

        String sizeInfo = settings.isIncludeSizeInfo()
                ? " (" + TruncationText.formatCount(content.length()) + " → "
                        + TruncationText.formatCount(limit) + " chars)"
                : "";
        return TruncationText.head(content, limit) + settings.marker() + sizeInfo;
    }
}
