package com.delta.signaltracker.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class IngestionPropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        IngestionProperties properties = new IngestionProperties();
        properties.setUserAgent("   ");
        assertTrue(properties.getUserAgent().startsWith("delta-signal-tracker/0.1"));
    }

    @Test
    void concurrencyAndTimeoutsAreClamped() {
        IngestionProperties properties = new IngestionProperties();
        properties.setGlobalConcurrency(0);
        properties.setFetchTimeoutSeconds(-5);
        properties.setFetchMaxAttempts(0);
        properties.setAcquireTimeoutMs(-1);
        assertEquals(1, properties.getGlobalConcurrency());
        assertEquals(1, properties.getFetchTimeoutSeconds());
        assertEquals(1, properties.getFetchMaxAttempts());
        assertEquals(0, properties.acquireTimeout().toMillis());
    }

    @Test
    void filterThresholdStaysWithinUnitInterval() {
        IngestionProperties properties = new IngestionProperties();
        properties.getFilter().setThreshold(1.7);
        assertEquals(1.0, properties.getFilter().getThreshold());
        properties.getFilter().setThreshold(-0.2);
        assertEquals(0.0, properties.getFilter().getThreshold());
    }

    @Test
    void linkedInQuotasNeverDropBelowOneCall() {
        IngestionProperties.LinkedIn linkedIn = new IngestionProperties.LinkedIn();
        linkedIn.setMaxCallsPerHour(0);
        linkedIn.setPollAttempts(-3);
        assertEquals(1, linkedIn.getMaxCallsPerHour());
        assertEquals(1, linkedIn.getPollAttempts());
    }

    @Test
    void linkedInCallSlotsAndRandomPauseAreClamped() {
        IngestionProperties.LinkedIn linkedIn = new IngestionProperties.LinkedIn();
        assertEquals(1, linkedIn.getMaxConcurrentCalls());
        assertEquals(10_000, linkedIn.getRandomDelayMinMs());
        assertEquals(30_000, linkedIn.getRandomDelayMaxMs());
        linkedIn.setMaxConcurrentCalls(0);
        linkedIn.setRandomDelayMinMs(20_000);
        linkedIn.setRandomDelayMaxMs(5_000);
        assertEquals(1, linkedIn.getMaxConcurrentCalls());
        assertEquals(20_000, linkedIn.getRandomDelayMaxMs());
    }
}
