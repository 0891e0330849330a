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
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.springframework.stereotype.Component;

import java.util.Arrays;

/**
 * Keeps the first and last {@code preserveLines} lines of line-oriented text
 * such as logs. Used by {@link SmartContentTruncator}; falls back to end
 * truncation for short inputs or when the kept lines are still too long.
 */
@Component
@RequiredArgsConstructor
public class LineAwareContentTruncator {

    private final EndContentTruncator endTruncator;

    public String truncate(String content, TruncationSettings settings) {
        int limit = settings.effectiveLimit();
        if (content.length() <= limit) {
            return content;
        }

        String[] lines = content.split("\n", -1);
        int preserve = Math.max(0, settings.getPreserveLines());
        if (lines.length <= preserve * 2) {
            return endTruncator.truncate(content, settings);
        }

        String head = String.join("\n", Arrays.copyOfRange(lines, 0, preserve));
        String tail = String.join("\n", Arrays.copyOfRange(lines, lines.length - preserve, lines.length));
        String sizeInfo = settings.isIncludeSizeInfo()
                ? " (" + lines.length + " lines, " + TruncationText.formatCount(content.length()) + " chars total)"
                : "";

        String result = head + settings.marker() + sizeInfo + tail;
        return result.length() > limit ? endTruncator.truncate(result, settings) : result;
    }
}
