package me.golemcore.transcript.infrastructure.config;

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

import lombok.Data;
import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.HashMap;
import java.util.Map;

/**
 * Centralized configuration properties for transcript recording, bound from
 * application.yml.
 *
 * <p>
 * All configuration is organized under the {@code transcript.*} prefix:
 * <ul>
 * <li>{@code memory-enabled} - whether runs are written to history at all</li>
 * <li>{@link TruncationProperties} - default size budget for tool output</li>
 * <li>{@code per-tool-truncation.<tool>} - partial overrides per tool name</li>
 * <li>{@link PlaceholderProperties} - substitute texts for missing output</li>
 * <li>{@link HistoryProperties} - history store selection</li>
 * <li>{@link TelemetryProperties} - run telemetry</li>
 * <li>{@link EngineProperties} - execution engine selection</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "transcript")
@Data
public class TranscriptProperties {

    private boolean memoryEnabled = true;
    private TruncationProperties truncation = new TruncationProperties();
    private Map<String, TruncationProperties> perToolTruncation = new HashMap<>();
    private PlaceholderProperties placeholder = new PlaceholderProperties();
    private HistoryProperties history = new HistoryProperties();
    private TelemetryProperties telemetry = new TelemetryProperties();
    private EngineProperties engine = new EngineProperties();

    /**
     * Run-wide truncation settings: configured values over the built-in defaults.
     */
    public TruncationSettings getDefaultTruncationSettings() {
        TruncationSettings defaults = TruncationSettings.defaults();
        return truncation != null ? truncation.applyTo(defaults) : defaults;
    }

    /**
     * Truncation settings for a tool: its override, if any, over the run-wide
     * settings.
     */
    public TruncationSettings getEffectiveTruncationSettings(String toolName) {
        TruncationSettings base = getDefaultTruncationSettings();
        if (toolName == null || perToolTruncation == null) {
            return base;
        }
        TruncationProperties override = perToolTruncation.get(toolName);
        return override != null ? override.applyTo(base) : base;
    }

    /**
     * Truncation options. Unset fields inherit from the settings they are applied
     * to, which lets per-tool entries override a single value.
     */
    @Data
    public static class TruncationProperties {
        private Integer maxCharacters;
        private Integer maxBytes;
        private Integer warnThreshold;
        private TruncationMethod method;
        private Integer preserveLines;
        private String truncationMarker;
        private Boolean includeSizeInfo;

        public TruncationSettings applyTo(TruncationSettings base) {
            TruncationSettings.TruncationSettingsBuilder builder = base.toBuilder();
            if (maxCharacters != null) {
                builder.maxCharacters(maxCharacters);
            }
            if (maxBytes != null) {
                builder.maxBytes(maxBytes);
            }
            if (warnThreshold != null) {
                builder.warnThreshold(warnThreshold);
            }
            if (method != null) {
                builder.method(method);
            }
            if (preserveLines != null) {
                builder.preserveLines(preserveLines);
            }
            if (truncationMarker != null) {
                builder.truncationMarker(truncationMarker);
            }
            if (includeSizeInfo != null) {
                builder.includeSizeInfo(includeSizeInfo);
            }
            return builder.build();
        }
    }

    @Data
    public static class PlaceholderProperties {
        private String noFinalResponse = "[Tool execution completed - no final response]";
        private String toolExecutionError = "[Tool execution failed]";
    }

    @Data
    public static class HistoryProperties {
        private String store = "memory"; // memory, jsonl
        private String basePath = "${user.home}/.golemcore/transcripts";
        private String conversationId = "default";
    }

    @Data
    public static class TelemetryProperties {
        private boolean enabled = true;
    }

    @Data
    public static class EngineProperties {
        private String mode = "none"; // none, replay
        private String replayFile;
        private String replayQuery = "replay";
    }
}
