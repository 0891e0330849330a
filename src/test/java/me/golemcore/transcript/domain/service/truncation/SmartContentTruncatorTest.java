package me.golemcore.transcript.domain.service.truncation;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.stream.Collectors;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertTrue;

class SmartContentTruncatorTest {

    private SmartContentTruncator truncator;
    private final TruncationSettings settings = TruncationSettings.builder().maxCharacters(300).build();

    @BeforeEach
    void setUp() {
        EndContentTruncator end = new EndContentTruncator();
        truncator = new SmartContentTruncator(
                new StructuredContentTruncator(new ObjectMapper(), end),
                new MiddleContentTruncator(),
                new LineAwareContentTruncator(end));
    }

    @Test
    void shouldUseStructuredTruncationForJson() {
        String content = IntStream.range(0, 200).mapToObj(String::valueOf)
                .collect(Collectors.joining(",", "[", "]"));

        String result = truncator.truncate(content, settings);

        assertTrue(result.contains("\"_truncated\" : true"));
    }

    @Test
    void shouldUseMiddleTruncationForXml() {
        String content = "<root>" + "<item>value</item>".repeat(100) + "</root>";

        String result = truncator.truncate(content, settings);

        assertTrue(result.startsWith("<root><item>"));
        assertTrue(result.endsWith("</item></root>"));
        assertTrue(result.contains("chars total)"));
    }

    @Test
    void shouldUseLineTruncationForText() {
        String content = IntStream.range(0, 200).mapToObj(i -> "2026-02-14 INFO entry " + i)
                .collect(Collectors.joining("\n"));

        String result = truncator.truncate(content, TruncationSettings.builder().maxCharacters(400).build());

        assertTrue(result.startsWith("2026-02-14 INFO entry 0\n"));
        assertTrue(result.contains("(200 lines, "));
        assertTrue(result.endsWith("2026-02-14 INFO entry 199"));
    }
}
