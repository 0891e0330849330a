package me.golemcore.transcript.domain.model;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TruncationSettingsTest {

    @Test
    void shouldUseBuiltInDefaults() {
        TruncationSettings settings = TruncationSettings.defaults();

        assertEquals(50_000, settings.getMaxCharacters());
        assertEquals(1_024_000, settings.getMaxBytes());
        assertEquals(10_000, settings.getWarnThreshold());
        assertEquals(TruncationMethod.SMART, settings.getMethod());
        assertEquals(5, settings.getPreserveLines());
        assertEquals("\n\n[... CONTENT TRUNCATED ...]\n\n", settings.getTruncationMarker());
        assertTrue(settings.isIncludeSizeInfo());
    }

    @Test
    void shouldUseSmallerOfTheTwoLimits() {
        TruncationSettings settings = TruncationSettings.builder().maxCharacters(500).maxBytes(200).build();

        assertEquals(200, settings.effectiveLimit());
    }

    @Test
    void shouldTreatNonPositiveLimitsAsUnbounded() {
        TruncationSettings settings = TruncationSettings.builder().maxCharacters(0).maxBytes(-1).build();

        assertEquals(Integer.MAX_VALUE, settings.effectiveLimit());
        assertTrue(settings.fits("x".repeat(100_000)));
    }

    @Test
    void shouldCheckFit() {
        TruncationSettings settings = TruncationSettings.builder().maxCharacters(3).build();

        assertTrue(settings.fits("abc"));
        assertFalse(settings.fits("abcd"));
        assertTrue(settings.fits(null));
    }

    @Test
    void shouldTreatNullMarkerAsEmpty() {
        TruncationSettings settings = TruncationSettings.builder().truncationMarker(null).build();

        assertEquals("", settings.marker());
    }
}
