package com.market.intel.config;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PipelinePropertiesGuardrailTest {

    @Test
    void userAgentFallsBackToSafeDefault() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFetch().setUserAgent("   ");
        assertTrue(properties.getFetch().getUserAgent().startsWith("market-intel/0.1"));
    }

    @Test
    void concurrencyAndDelayAreClamped() {
        PipelineProperties properties = new PipelineProperties();
        properties.getFetch().setGlobalConcurrency(0);
        properties.getFetch().setPerHostDelayMs(-10);
        properties.getFetch().setRequestMaxRetries(-3);
        assertEquals(1, properties.getFetch().getGlobalConcurrency());
        assertEquals(1, properties.getFetch().getPerHostDelayMs());
        assertEquals(0, properties.getFetch().getRequestMaxRetries());
    }

    @Test
    void similarityThresholdsStayWithinUnitInterval() {
        PipelineProperties properties = new PipelineProperties();
        properties.getAnalysis().setClusterSimilarityThreshold(1.7);
        properties.getAggregation().setNameSimilarityThreshold(-0.2);
        assertEquals(1.0, properties.getAnalysis().getClusterSimilarityThreshold());
        assertEquals(0.0, properties.getAggregation().getNameSimilarityThreshold());
    }

    @Test
    void generativeSummariesAndCliAreOffUntilConfigured() {
        PipelineProperties properties = new PipelineProperties();
        assertFalse(properties.getAnalysis().getGenerative().isEnabled());
        assertFalse(properties.getCli().isRun());

        properties.getAnalysis().getGenerative().setBaseUrl("http://localhost:11434/v1");
        properties.getCli().setCommand("run");
        assertTrue(properties.getAnalysis().getGenerative().isEnabled());
        assertTrue(properties.getCli().isRun());
    }
}
