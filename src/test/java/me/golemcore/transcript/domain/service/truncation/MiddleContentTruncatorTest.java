package me.golemcore.transcript.domain.service.truncation;

import me.golemcore.transcript.domain.model.TruncationSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MiddleContentTruncatorTest {

    private final MiddleContentTruncator truncator = new MiddleContentTruncator();

    @Test
    void shouldKeepHeadAndTail() {
        String content = "H".repeat(500) + "T".repeat(500);
        TruncationSettings settings = TruncationSettings.builder().maxCharacters(100).build();

        String result = truncator.truncate(content, settings);

        assertTrue(result.startsWith("H".repeat(40) + "\n\n"));
        assertTrue(result.endsWith(" (1,000 chars total)" + "T".repeat(40)));
        assertTrue(result.contains("(1,000 chars total)"));
    }

    @Test
    void shouldOmitSizeInfoWhenDisabled() {
        TruncationSettings settings = TruncationSettings.builder()
                .maxCharacters(10)
                .includeSizeInfo(false)
                .truncationMarker("...")
                .build();

        assertEquals("abcd...wxyz", truncator.truncate("abcdefghijklmnopqrstuvwxyz", settings));
    }
}
