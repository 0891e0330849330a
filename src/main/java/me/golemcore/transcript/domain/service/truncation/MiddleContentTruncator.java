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
 * Keeps 40% of the budget from the head and 40% from the tail; the remaining
 * fifth is left for the marker and size info.
 */
@Component
public class MiddleContentTruncator implements ContentTruncator {

    private static final double KEEP_RATIO = 0.4;

    @Override
    public TruncationMethod method() {
        return TruncationMethod.MIDDLE;
    }

    @Override
    public String truncate(String content, TruncationSettings settings) {
        int limit = settings.effectiveLimit();
        if (content.length() <= limit) {
            return content;
        }

        int keep = (int) Math.floor(limit * KEEP_RATIO);
        String sizeInfo = settings.isIncludeSizeInfo()
                ? " (" + TruncationText.formatCount(content.length()) + " chars total)"
                : "";
        return TruncationText.head(content, keep) + settings.marker() + sizeInfo
                + TruncationText.tail(content, keep);
    }
}
