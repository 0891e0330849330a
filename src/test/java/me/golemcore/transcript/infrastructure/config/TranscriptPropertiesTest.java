package me.golemcore.transcript.infrastructure.config;

import me.golemcore.transcript.domain.model.TruncationMethod;
import me.golemcore.transcript.domain.model.TruncationSettings;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TranscriptPropertiesTest {

    @Test
    void shouldHaveDefaults() {
        TranscriptProperties properties = new TranscriptProperties();

        assertTrue(properties.isMemoryEnabled());
        assertEquals("memory", properties.getHistory().getStore());
        assertEquals("default", properties.getHistory().getConversationId());
        assertTrue(properties.getTelemetry().isEnabled());
        assertEquals("none", properties.getEngine().getMode());
        assertEquals("replay", properties.getEngine().getReplayQuery());
        assertEquals("[Tool execution completed - no final response]",
                properties.getPlaceholder().getNoFinalResponse());
        assertEquals("[Tool execution failed]", properties.getPlaceholder().getToolExecutionError());
        assertEquals(TruncationSettings.defaults(), properties.getDefaultTruncationSettings());
    }

    @Test
    void shouldApplyConfiguredTruncationOverDefaults() {
        TranscriptProperties properties = new TranscriptProperties();
        properties.getTruncation().setMaxCharacters(2000);
        properties.getTruncation().setMethod(TruncationMethod.MIDDLE);

        TruncationSettings settings = properties.getDefaultTruncationSettings();

        assertEquals(2000, settings.getMaxCharacters());
        assertEquals(TruncationMethod.MIDDLE, settings.getMethod());
        assertEquals(TruncationSettings.DEFAULT_MAX_BYTES, settings.getMaxBytes());
        assertTrue(settings.isIncludeSizeInfo());
    }

    @Test
    void shouldMergePerToolOverrideOverRunDefaults() {
        TranscriptProperties properties = new TranscriptProperties();
        properties.getTruncation().setMethod(TruncationMethod.END);
        properties.getTruncation().setMaxCharacters(2000);
        TranscriptProperties.TruncationProperties override = new TranscriptProperties.TruncationProperties();
        override.setMaxCharacters(500);
        override.setIncludeSizeInfo(false);
        properties.getPerToolTruncation().put("browse", override);

        TruncationSettings browse = properties.getEffectiveTruncationSettings("browse");
        TruncationSettings other = properties.getEffectiveTruncationSettings("search");

        assertEquals(500, browse.getMaxCharacters());
        assertFalse(browse.isIncludeSizeInfo());
        assertEquals(TruncationMethod.END, browse.getMethod());
        assertEquals(2000, other.getMaxCharacters());
        assertTrue(other.isIncludeSizeInfo());
    }

    @Test
    void shouldUseRunDefaultsForUnnamedTool() {
        TranscriptProperties properties = new TranscriptProperties();

        assertEquals(properties.getDefaultTruncationSettings(), properties.getEffectiveTruncationSettings(null));
    }
}
