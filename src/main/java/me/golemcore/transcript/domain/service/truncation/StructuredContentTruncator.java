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
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.springframework.stereotype.Component;

import java.util.Iterator;
import java.util.Map;

/**
 * JSON-preserving truncation.
 *
 * <p>
 * Arrays keep a prefix of elements whose cumulative compact size stays within
 * 80% of the limit, followed by one marker element:
 *
 * <pre>
 * {"_truncated": true, "_originalLength": 1000, "_showingFirst": 160, "_message": "..."}
 * </pre>
 *
 * Objects keep a prefix of fields and gain {@code _truncated},
 * {@code _originalKeys}, {@code _showingKeys} and {@code _message}. The result
 * is always valid JSON. When nothing had to be dropped the value is
 * re-serialized compactly instead, without a marker. Content that is not a JSON
 * array or object falls back to end truncation.
 */
@Component
@Slf4j
public class StructuredContentTruncator implements ContentTruncator {

    static final String TRUNCATED_FIELD = "_truncated";
    static final String ORIGINAL_LENGTH_FIELD = "_originalLength";
    static final String SHOWING_FIRST_FIELD = "_showingFirst";
    static final String ORIGINAL_KEYS_FIELD = "_originalKeys";
    static final String SHOWING_KEYS_FIELD = "_showingKeys";
    static final String MESSAGE_FIELD = "_message";

    private static final double BUDGET_RATIO = 0.8;

    private final ObjectMapper objectMapper;
    private final EndContentTruncator endTruncator;

    public StructuredContentTruncator(ObjectMapper objectMapper, EndContentTruncator endTruncator) {
        this.objectMapper = objectMapper;
        this.endTruncator = endTruncator;
    }

    @Override
    public TruncationMethod method() {
        return TruncationMethod.STRUCTURED;
    }

    @Override
    public String truncate(String content, TruncationSettings settings) {
        int limit = settings.effectiveLimit();
        if (content.length() <= limit) {
            return content;
        }
        if (!TruncationText.isJsonLike(content)) {
            return endTruncator.truncate(content, settings);
        }

        try {
            JsonNode root = objectMapper.reader()
                    .with(DeserializationFeature.FAIL_ON_TRAILING_TOKENS)
                    .readTree(content);
            if (root != null && root.isArray()) {
                return truncateArray((ArrayNode) root, limit);
            }
            if (root != null && root.isObject()) {
                return truncateObject((ObjectNode) root, limit);
            }
        } catch (JsonProcessingException e) {
            log.debug("[Truncation] Content is not valid JSON, using end truncation: {}", e.getOriginalMessage());
        }
        return endTruncator.truncate(content, settings);
    }

    private String truncateArray(ArrayNode array, int limit) throws JsonProcessingException {
        double budget = limit * BUDGET_RATIO;
        ArrayNode result = objectMapper.createArrayNode();
        int currentSize = 2; // []

        for (JsonNode item : array) {
            int itemSize = objectMapper.writeValueAsString(item).length() + 1; // +1 for comma
            if (currentSize + itemSize > budget) {
                ObjectNode marker = result.addObject();
                marker.put(TRUNCATED_FIELD, true);
                marker.put(ORIGINAL_LENGTH_FIELD, array.size());
                marker.put(SHOWING_FIRST_FIELD, result.size() - 1);
                marker.put(MESSAGE_FIELD, "Array truncated: showing " + (result.size() - 1) + " of "
                        + array.size() + " items");
                return pretty(result);
            }
            result.add(item);
            currentSize += itemSize;
        }
        return objectMapper.writeValueAsString(result);
    }

    private String truncateObject(ObjectNode object, int limit) throws JsonProcessingException {
        double budget = limit * BUDGET_RATIO;
        ObjectNode result = objectMapper.createObjectNode();
        int currentSize = 2; // {}

        Iterator<Map.Entry<String, JsonNode>> fields = object.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            ObjectNode single = objectMapper.createObjectNode();
            single.set(field.getKey(), field.getValue());
            int entrySize = objectMapper.writeValueAsString(single).length();

            if (currentSize + entrySize > budget) {
                int shown = result.size();
                result.put(TRUNCATED_FIELD, true);
                result.put(ORIGINAL_KEYS_FIELD, object.size());
                result.put(SHOWING_KEYS_FIELD, shown);
                result.put(MESSAGE_FIELD, "Object truncated: showing " + shown + " of " + object.size() + " keys");
                return pretty(result);
            }
            result.set(field.getKey(), field.getValue());
            currentSize += entrySize;
        }
        return objectMapper.writeValueAsString(result);
    }

    private String pretty(JsonNode node) throws JsonProcessingException {
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(node);
    }
}
