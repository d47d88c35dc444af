package com.grantharvest.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HarvesterPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("grant-harvester/0.1"));
    }

    @Test
    void pageLimitAndTimeoutAreClamped() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setMaxPages(0);
        properties.setRequestTimeoutSeconds(-5);
        properties.setMaxErrorSamples(-1);
        assertEquals(1, properties.getMaxPages());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(0, properties.getMaxErrorSamples());
    }

    @Test
    void baseOriginDropsTrailingSlashes() {
        HarvesterProperties properties = new HarvesterProperties();
        properties.setBaseOrigin(" https://example.org// ");
        assertEquals("https://example.org", properties.getBaseOrigin());

        properties.setBaseOrigin("");
        assertEquals("https://www.pw.org", properties.getBaseOrigin());
    }
}
