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

import com.fasterxml.jackson.core.JsonProcessingException;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import me.golemcore.transcript.domain.service.StructuredTextRenderer;
import org.springframework.stereotype.Service;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Bounds the size of stored tool output.
 *
 * <p>
 * Serializes arbitrary output to text, then applies the configured
 * {@link ContentTruncator}. Content within the limit is returned unchanged.
 * Serialization failures (cyclic graphs, failing accessors) are replaced by a
 * best-effort string coercion that is still bounded. Nothing here throws to the
 * caller.
 */
@Service
@Slf4j
public class ContentTruncationService {

    static final String NO_OUTPUT = "No output";

    private final Map<TruncationMethod, ContentTruncator> truncators = new EnumMap<>(TruncationMethod.class);
    private final StructuredTextRenderer renderer;

    public ContentTruncationService(List<ContentTruncator> truncators, StructuredTextRenderer renderer) {
        this.renderer = renderer;
        if (truncators != null) {
            for (ContentTruncator truncator : truncators) {
                this.truncators.put(truncator.method(), truncator);
            }
        }
    }

    /**
     * Serializes tool output and bounds the result.
     */
    public String render(Object output, TruncationSettings settings) {
        String content;
        if (output == null) {
            content = NO_OUTPUT;
        } else if (output instanceof CharSequence text) {
            content = text.toString();
        } else {
            try {
                content = renderer.renderPretty(output);
            } catch (JsonProcessingException | RuntimeException e) {
                log.warn("[Truncation] Failed to serialize tool output ({}): {}",
                        output.getClass().getSimpleName(), e.getMessage());
                content = StructuredTextRenderer.coerce(output);
            }
        }
        return truncate(content, settings);
    }

    public String truncate(String content, TruncationSettings settings) {
        if (content == null) {
            return null;
        }
        TruncationSettings effective = settings != null ? settings : TruncationSettings.defaults();
        if (effective.fits(content)) {
            return content;
        }

        int limit = effective.effectiveLimit();
        if (content.length() > effective.getWarnThreshold()) {
            log.info("[Truncation] Content size: {} chars, truncating (limit: {}, method: {})",
                    TruncationText.formatCount(content.length()), TruncationText.formatCount(limit),
                    effective.getMethod());
        }

        ContentTruncator truncator = resolve(effective.getMethod());
        try {
            return truncator != null ? truncator.truncate(content, effective) : hardCut(content, effective);
        } catch (RuntimeException e) {
            log.warn("[Truncation] {} truncation failed, cutting content: {}", effective.getMethod(), e.getMessage());
            return hardCut(content, effective);
        }
    }

    private ContentTruncator resolve(TruncationMethod method) {
        ContentTruncator truncator = method != null ? truncators.get(method) : null;
        return truncator != null ? truncator : truncators.get(TruncationMethod.END);
    }

    private static String hardCut(String content, TruncationSettings settings) {
        return TruncationText.head(content, settings.effectiveLimit()) + settings.marker();
    }
}
