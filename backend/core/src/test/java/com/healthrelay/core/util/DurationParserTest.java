package com.healthrelay.core.util;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DurationParserTest {
    @Test
    void parsesUnitStrings() {
        assertEquals(Duration.ofMillis(500), DurationParser.parse("500ms"));
        assertEquals(Duration.ofSeconds(10), DurationParser.parse("10s"));
        assertEquals(Duration.ofSeconds(90), DurationParser.parse("1m30s"));
        assertEquals(Duration.ofHours(2), DurationParser.parse("2h"));
        assertEquals(Duration.ofMillis(1500), DurationParser.parse("1.5s"));
        assertEquals(Duration.ofNanos(250), DurationParser.parse("250ns"));
        assertEquals(Duration.ofNanos(1), DurationParser.parse("1.5ns"));
    }

    @Test
    void parsesIsoAndWholeSeconds() {
        assertEquals(Duration.ofSeconds(10), DurationParser.parse("PT10S"));
        assertEquals(Duration.ofMinutes(2), DurationParser.parse("pt2m"));
        assertEquals(Duration.ofSeconds(30), DurationParser.parse(" 30 "));
    }

    @Test
    void rejectsMalformedText() {
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse(""));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("ten seconds"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("10s garbage"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("10d"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("PTX"));
    }

    @Test
    void rejectsDurationsBeyondNanosecondRange() {
        IllegalArgumentException single = assertThrows(
                IllegalArgumentException.class, () -> DurationParser.parse("3000000h"));
        assertTrue(single.getMessage().contains("3000000h"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("2000000h2000000h"));
        assertThrows(IllegalArgumentException.class, () -> DurationParser.parse("99999999999999999999"));
        assertEquals(Duration.ofHours(2_000_000), DurationParser.parse("2000000h"));
    }
}
