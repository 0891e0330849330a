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

import java.text.NumberFormat;
import java.util.Locale;

/**
 * Shared text helpers for truncation strategies.
 */
final class TruncationText {

    private TruncationText() {
    }

    /**
     * Formats a count with digit grouping, e.g. {@code 100000 -> "100,000"}.
     */
    static String formatCount(long count) {
        return NumberFormat.getIntegerInstance(Locale.US).format(count);
    }

    /**
     * First {@code length} chars, without splitting a surrogate pair.
     */
    static String head(String content, int length) {
        int end = Math.max(0, Math.min(length, content.length()));
        if (end > 0 && end < content.length() && Character.isHighSurrogate(content.charAt(end - 1))) {
            end--;
        }
        return content.substring(0, end);
    }

    /**
     * Last {@code length} chars, without splitting a surrogate pair.
     */
    static String tail(String content, int length) {
        int start = Math.max(0, content.length() - Math.max(0, length));
        if (start > 0 && start < content.length() && Character.isLowSurrogate(content.charAt(start))) {
            start++;
        }
        return content.substring(start);
    }

    static boolean isJsonLike(String content) {
        String trimmed = content.trim();
        return (trimmed.startsWith("{") && trimmed.endsWith("}"))
                || (trimmed.startsWith("[") && trimmed.endsWith("]"));
    }

    static boolean isXmlLike(String content) {
        String trimmed = content.trim();
        return trimmed.startsWith("<") && trimmed.endsWith(">");
    }
}
