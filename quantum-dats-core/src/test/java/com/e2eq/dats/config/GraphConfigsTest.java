package com.e2eq.dats.config;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class GraphConfigsTest {

    @Test
    void testDefaults() {
        GraphConfig config = GraphConfigs.defaults();
        assertTrue(config.allowBackLinks());
        assertEquals("characteristics", config.backLinkSlot());
        assertEquals("Dimension", config.backLinkType());
        assertEquals("@id", config.identifierProperty());
        assertTrue(config.prettyPrint());
    }

    @Test
    void testOverridesTakePrecedence() {
        GraphConfig config = GraphConfigs.load(Map.of(
                "quantum.dats.graph.allow-back-links", "false",
                "quantum.dats.graph.identifier-property", "identifier"));
        assertFalse(config.allowBackLinks());
        assertEquals("identifier", config.identifierProperty());
        assertEquals("characteristics", config.backLinkSlot());
    }

    @Test
    void testWithBackLinks() {
        assertFalse(GraphConfigs.withBackLinks(false).allowBackLinks());
        assertTrue(GraphConfigs.withBackLinks(true).allowBackLinks());
    }
}
