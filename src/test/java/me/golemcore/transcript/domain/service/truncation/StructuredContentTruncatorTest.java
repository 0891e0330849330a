package me.golemcore.transcript.domain.service.truncation;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StructuredContentTruncatorTest {

    private ObjectMapper objectMapper;
    private StructuredContentTruncator truncator;

    @BeforeEach
    void setUp() {
        objectMapper = new ObjectMapper();
        truncator = new StructuredContentTruncator(objectMapper, new EndContentTruncator());
    }

    private static TruncationSettings limit(int maxCharacters) {
        return TruncationSettings.builder()
                .maxCharacters(maxCharacters)
                .method(TruncationMethod.STRUCTURED)
                .build();
    }

    // ==================== arrays ====================

    @Test
    void shouldTruncateArrayAndAppendSingleMarker() throws Exception {
        List<Map<String, Object>> items = IntStream.range(0, 1000)
                .mapToObj(i -> Map.<String, Object>of("id", i, "name", "item-" + i))
                .toList();
        String content = objectMapper.writeValueAsString(items);

        String result = truncator.truncate(content, limit(5000));

        JsonNode parsed = objectMapper.readTree(result);
        assertTrue(parsed.isArray());
        long markers = 0;
        for (JsonNode element : parsed) {
            if (element.has("_truncated")) {
                markers++;
            }
        }
        assertEquals(1, markers);

        JsonNode marker = parsed.get(parsed.size() - 1);
        assertTrue(marker.get("_truncated").asBoolean());
        assertEquals(1000, marker.get("_originalLength").asInt());
        assertEquals(parsed.size() - 1, marker.get("_showingFirst").asInt());
        assertEquals("Array truncated: showing " + (parsed.size() - 1) + " of 1000 items",
                marker.get("_message").asText());
        assertTrue(parsed.size() - 1 > 0);
    }

    @Test
    void shouldKeepElementsWithinBudget() throws Exception {
        ArrayNode array = objectMapper.createArrayNode();
        for (int i = 0; i < 100; i++) {
            array.add("x".repeat(18));
        }
        String content = objectMapper.writeValueAsString(array);

        String result = truncator.truncate(content, limit(1000));

        ArrayNode parsed = (ArrayNode) objectMapper.readTree(result);
        int kept = parsed.size() - 1;
        String keptJson = objectMapper.writeValueAsString(parsed.get(0));
        assertTrue(2 + kept * (keptJson.length() + 1) <= 800);
    }

    @Test
    void shouldCompactArrayThatFitsOnceParsed() throws Exception {
        String content = "[\n" + "    1,\n".repeat(30) + "    2\n]";

        String result = truncator.truncate(content, limit(100));

        assertFalse(result.contains("_truncated"));
        assertEquals(31, objectMapper.readTree(result).size());
    }

    // ==================== objects ====================

    @Test
    void shouldTruncateObjectKeys() throws Exception {
        Map<String, String> fields = new LinkedHashMap<>();
        for (int i = 0; i < 200; i++) {
            fields.put("key" + i, "v".repeat(50));
        }
        String content = objectMapper.writeValueAsString(fields);

        String result = truncator.truncate(content, limit(2000));

        ObjectNode parsed = (ObjectNode) objectMapper.readTree(result);
        assertTrue(parsed.get("_truncated").asBoolean());
        assertEquals(200, parsed.get("_originalKeys").asInt());
        int shown = parsed.get("_showingKeys").asInt();
        assertTrue(shown > 0 && shown < 200);
        assertTrue(parsed.has("key0"));
        assertFalse(parsed.has("key199"));
    }

    // ==================== fallbacks ====================

    @Test
    void shouldFallBackToEndForUnparseableJson() {
        String content = "[" + "not json ".repeat(200) + "]";

        String result = truncator.truncate(content, limit(100));

        assertTrue(result.startsWith(content.substring(0, 100)));
        assertTrue(result.contains("[... CONTENT TRUNCATED ...]"));
    }

    @Test
    void shouldFallBackToEndForPlainText() {
        String result = truncator.truncate("z".repeat(300), limit(100));

        assertTrue(result.endsWith("(300 → 100 chars)"));
    }

    @Test
    void shouldReturnSmallContentUnchanged() {
        String content = "[1,2,3]";

        assertEquals(content, truncator.truncate(content, limit(100)));
    }
}
