package me.golemcore.transcript.domain.model;

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

import lombok.Builder;
import lombok.Value;

/**
 * Immutable size budget for stored content.
 *
 * <p>
 * Non-positive {@code maxCharacters} or {@code maxBytes} leave that dimension
 * unbounded. The effective limit is the smaller of the two.
 */
@Value
@Builder(toBuilder = true)
public class TruncationSettings {

    public static final int DEFAULT_MAX_CHARACTERS = 50_000;
    public static final int DEFAULT_MAX_BYTES = 1_024_000;
    public static final int DEFAULT_WARN_THRESHOLD = 10_000;
    public static final int DEFAULT_PRESERVE_LINES = 5;
    public static final String DEFAULT_MARKER = "\n\n[... CONTENT TRUNCATED ...]\n\n";

    @Builder.Default
    int maxCharacters = DEFAULT_MAX_CHARACTERS;

    @Builder.Default
    int maxBytes = DEFAULT_MAX_BYTES;

    @Builder.Default
    int warnThreshold = DEFAULT_WARN_THRESHOLD;

    @Builder.Default
    TruncationMethod method = TruncationMethod.SMART;

    @Builder.Default
    int preserveLines = DEFAULT_PRESERVE_LINES;

    @Builder.Default
    String truncationMarker = DEFAULT_MARKER;

    @Builder.Default
    boolean includeSizeInfo = true;

    public static TruncationSettings defaults() {
        return TruncationSettings.builder().build();
    }

    /**
     * Maximum number of characters the content may have before it is truncated.
     */
    public int effectiveLimit() {
        int chars = maxCharacters > 0 ? maxCharacters : Integer.MAX_VALUE;
        int bytes = maxBytes > 0 ? maxBytes : Integer.MAX_VALUE;
        return Math.min(chars, bytes);
    }

    public boolean fits(String content) {
        return content == null || content.length() <= effectiveLimit();
    }

    public String marker() {
        return truncationMarker != null ? truncationMarker : "";
    }
}
