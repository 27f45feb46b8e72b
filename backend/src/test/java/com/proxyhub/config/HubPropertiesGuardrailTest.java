package com.proxyhub.config;

import com.proxyhub.aggregator.model.MergeStrategy;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class HubPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        HubProperties properties = new HubProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("proxy-hub/0.1"));
    }

    @Test
    void concurrencyAndTimeoutsAreClamped() {
        HubProperties properties = new HubProperties();
        properties.setGlobalConcurrency(0);
        properties.setRequestTimeoutSeconds(-5);
        properties.getProbe().setMaxWorkers(0);
        properties.getProbe().setTierTimeoutSeconds(0);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getRequestTimeoutSeconds());
        assertEquals(1, properties.getProbe().getMaxWorkers());
        assertEquals(1, properties.getProbe().getTierTimeoutSeconds());
    }

    @Test
    void defaultsMatchDocumentedValues() {
        HubProperties properties = new HubProperties();
        assertEquals(86400, properties.getSubscription().getDefaultUpdateIntervalSeconds());
        assertEquals(60, properties.getSubscription().getRefreshMaxSleepSeconds());
        assertEquals(MergeStrategy.EXACT_DESCRIPTOR, properties.getSubscription().getMergeStrategy());
        assertEquals(10, properties.getProbe().getMaxWorkers());
    }
}
