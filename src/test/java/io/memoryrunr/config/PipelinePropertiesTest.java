package io.memoryrunr.config;

import io.memoryrunr.error.ConfigurationException;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class PipelinePropertiesTest {

    @Test
    void shouldFallBackToDefaults() {
        PipelineProperties properties = PipelineProperties.defaults();

        assertEquals(7, properties.attention().baseCapacity());
        assertEquals(2, properties.attention().capacityVariance());
        assertEquals(1800L, properties.attention().shortTermWindowSeconds());
        assertEquals(0.5, properties.consolidation().consolidationThreshold());
        assertEquals(0.1, properties.consolidation().learningRate());
        assertEquals(1000, properties.semantic().clusterCount());
        assertEquals(1000, properties.writeback().batchSize());
        assertEquals(50, properties.writeback().minBatchSize());
        assertTrue(properties.schedule().enabled());
    }

    @Test
    void shouldRejectCapacityOutsideMillerRange() {
        PipelineProperties.Attention attention = new PipelineProperties.Attention(8, 2, null, null, null, null, null, null);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new PipelineProperties(attention, null, null, null, null, null, null));

        assertEquals(1, e.violations().size());
        assertTrue(e.violations().get(0).contains("8+/-2"));
    }

    @Test
    void shouldRejectLearningRateOutsideBounds() {
        PipelineProperties.Consolidation consolidation =
                new PipelineProperties.Consolidation(null, 0.5, null, null, null, null, null, null, null);

        assertThrows(ConfigurationException.class,
                () -> new PipelineProperties(null, null, consolidation, null, null, null, null));
    }

    @Test
    void shouldCollectEveryViolation() {
        PipelineProperties.Semantic semantic =
                new PipelineProperties.Semantic(null, 0.5, null, null, null, null, 1.5, null, null, null, null, null);
        PipelineProperties.Writeback writeback = new PipelineProperties.Writeback(10, 20, null, null, null, null, null);

        ConfigurationException e = assertThrows(ConfigurationException.class,
                () -> new PipelineProperties(null, null, null, semantic, writeback, null, null));

        assertEquals(3, e.violations().size());
    }

    @Test
    void shouldAcceptAlternativeThresholds() {
        PipelineProperties.Attention attention = new PipelineProperties.Attention(null, null, null, 30L, null, null, null, null);
        PipelineProperties.Consolidation consolidation =
                new PipelineProperties.Consolidation(null, null, null, null, 0.6, null, null, null, null);

        PipelineProperties properties = new PipelineProperties(attention, null, consolidation, null, null, null, null);

        assertEquals(30L, properties.attention().shortTermWindow().toSeconds());
        assertEquals(0.6, properties.consolidation().consolidationThreshold());
    }
}
