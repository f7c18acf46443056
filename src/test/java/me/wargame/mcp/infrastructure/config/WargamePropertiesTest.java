package me.wargame.mcp.infrastructure.config;

import me.wargame.mcp.domain.model.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class WargamePropertiesTest {

    @Test
    void defaultsAreValid() {
        WargameProperties properties = new WargameProperties();

        assertDoesNotThrow(properties::validate);
        assertEquals(800, properties.getChunking().getMaxTokens());
        assertEquals(200, properties.getChunking().getOverlapTokens());
        assertEquals(0.9, properties.getMemory().getDedupThreshold());
        assertEquals(8, properties.getOrchestrator().getMaxToolIterations());
        assertEquals(3, properties.getOrchestrator().getMaxConsecutiveFailedTools());
        assertEquals(2, properties.getOrchestrator().getRetry().getMaxRetries());
        assertEquals(5, properties.getIndex().getCollectionDescriptions().size());
    }

    @Test
    void overlapMustBeSmallerThanWindow() {
        WargameProperties properties = new WargameProperties();
        properties.getChunking().setOverlapTokens(800);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void dedupThresholdMustBeInUnitInterval() {
        WargameProperties properties = new WargameProperties();
        properties.getMemory().setDedupThreshold(0.0);
        assertThrows(ConfigurationException.class, properties::validate);

        properties.getMemory().setDedupThreshold(1.0);
        assertDoesNotThrow(properties::validate);
    }

    @Test
    void retryDelaysMustBeConsistent() {
        WargameProperties properties = new WargameProperties();
        properties.getOrchestrator().getRetry().setMaxDelayMs(500);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void jitterMustBeAFraction() {
        WargameProperties properties = new WargameProperties();
        properties.getOrchestrator().getRetry().setJitter(1.5);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void workerPoolMustBePositive() {
        WargameProperties properties = new WargameProperties();
        properties.getIngestion().setWorkers(0);

        assertThrows(ConfigurationException.class, properties::validate);
    }

    @Test
    void iterationCapMustBePositive() {
        WargameProperties properties = new WargameProperties();
        properties.getOrchestrator().setMaxToolIterations(0);

        assertThrows(ConfigurationException.class, properties::validate);
    }
}
