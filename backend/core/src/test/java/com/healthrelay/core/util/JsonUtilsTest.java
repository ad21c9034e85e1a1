package com.healthrelay.core.util;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class JsonUtilsTest {
    @Test
    void objectMapperIsSingletonAndConfigured() throws Exception {
        ObjectMapper first = JsonUtils.objectMapper();
        ObjectMapper second = JsonUtils.objectMapper();

        assertSame(first, second);
        assertFalse(first.isEnabled(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES));
        assertTrue(first.writeValueAsString(new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), null))
                .contains("\"name\":\"ok\""));
    }

    @Test
    void instantsAreWrittenAsIsoTextAndNullsAreOmitted() throws Exception {
        ObjectMapper mapper = JsonUtils.objectMapper();
        Payload payload = new Payload("ok", null, Instant.parse("2026-02-01T00:00:00Z"), null);

        var tree = mapper.readTree(mapper.writeValueAsString(payload));
        assertEquals("ok", tree.get("name").asText());
        assertEquals("2026-02-01T00:00:00Z", tree.get("createdAt").asText());
        assertFalse(tree.has("optional"));

        Payload parsed = mapper.readValue(
                "{\"name\":\"ok\",\"createdAt\":\"2026-02-01T00:00:00Z\",\"unknown\":1}",
                Payload.class
        );
        assertEquals(payload.name(), parsed.name());
        assertEquals(payload.createdAt(), parsed.createdAt());
    }

    @Test
    void yamlMapperAcceptsUnitDurations() throws Exception {
        Payload parsed = JsonUtils.yamlMapper().readValue("""
                name: timed
                timeout: 1m30s
                """, Payload.class);
        assertEquals(Duration.ofSeconds(90), parsed.timeout());

        Payload iso = JsonUtils.yamlMapper().readValue("name: iso\ntimeout: PT5S\n", Payload.class);
        assertEquals(Duration.ofSeconds(5), iso.timeout());

        Payload seconds = JsonUtils.yamlMapper().readValue("name: plain\ntimeout: 7\n", Payload.class);
        assertEquals(Duration.ofSeconds(7), seconds.timeout());
    }

    @Test
    void invalidDurationTextFailsDeserialization() {
        Exception ex = assertThrows(Exception.class,
                () -> JsonUtils.yamlMapper().readValue("name: bad\ntimeout: soon\n", Payload.class));
        assertTrue(ex.getMessage().contains("soon"));
    }

    private record Payload(String name, String optional, Instant createdAt, Duration timeout) {
    }
}
