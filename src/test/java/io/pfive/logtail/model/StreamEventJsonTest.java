// Copyright 2023-2025 Phase Five LLC.  For license terms, see LICENSE.txt in the repository root.

package io.pfive.logtail.model;

import com.fasterxml.jackson.databind.JsonNode;
import io.pfive.logtail.util.JettyUtil;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StreamEventJsonTest {

    private static final Instant NOW = Instant.parse("2025-03-01T12:34:56.789Z");

    private static JsonNode json (StreamEvent event) throws Exception {
        return JettyUtil.objectMapper.readTree(JettyUtil.toJson(event));
    }

    @Test
    void plainLineOmitsFalseFlags () throws Exception {
        JsonNode node = json(LineEvent.line("app-1", 7, NOW, "GET /index.html 200", false));
        assertEquals("app-1", node.get("sourceId").asText());
        assertEquals(7, node.get("seq").asLong());
        assertEquals("2025-03-01T12:34:56.789Z", node.get("timestamp").asText());
        assertEquals("GET /index.html 200", node.get("content").asText());
        assertFalse(node.has("truncated"));
        assertFalse(node.has("gap"));
        assertFalse(node.has("rotated"));
        assertFalse(node.has("marker"));
    }

    @Test
    void markersCarryTheirFlag () throws Exception {
        assertTrue(json(LineEvent.rotationMarker("app-1", 8, NOW)).get("rotated").asBoolean());
        JsonNode gap = json(LineEvent.gapMarker("app-1", 20, NOW));
        assertTrue(gap.get("gap").asBoolean());
        assertEquals(20, gap.get("seq").asLong());
        assertTrue(json(LineEvent.line("app-1", 9, NOW, "xxxx", true)).get("truncated").asBoolean());
    }

    @Test
    void errorKindUsesItsWireName () throws Exception {
        JsonNode node = json(new ErrorEvent("app-1", ErrorKind.POOL_EXHAUSTED, "All 10 sessions in use."));
        assertEquals("PoolExhausted", node.get("errorKind").asText());
        assertEquals("All 10 sessions in use.", node.get("message").asText());
        assertEquals("error", new ErrorEvent("app-1", ErrorKind.SOURCE_UNAVAILABLE, "").eventType());
    }
}
