package io.memoryrunr.semantic;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.ConsolidationState;
import io.memoryrunr.model.SemanticNode;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HomeostaticRescalerTest {

    private static final Instant NOW = Instant.parse("2025-06-01T03:00:00Z");
    private static final PipelineProperties.Semantic PROPERTIES = PipelineProperties.defaults().semantic();

    private final HomeostaticRescaler rescaler = new HomeostaticRescaler(PROPERTIES);

    @Test
    void shouldDivideScaleByClusterMean() {
        SemanticNode a = node("a", 1, 0.6, 1, 0.4, NOW.minus(Duration.ofDays(2)));
        SemanticNode b = node("b", 1, 0.3, 2, 0.2, NOW.minus(Duration.ofDays(2)));

        HomeostaticRescaler.Result result = rescaler.rescale(List.of(a, b), NOW);

        assertTrue(result.pruned().isEmpty());
        for (SemanticNode node : result.kept()) {
            assertEquals(1.0 / 0.3, node.homeostaticScale(), 1e-9);
            assertEquals(RetrievalStrength.of(node, PROPERTIES), node.retrievalStrength(), 1e-12);
            assertEquals(NOW, node.evaluatedAt());
            assertEquals(AgeCategory.WEEK_OLD, node.ageCategory());
        }
    }

    @Test
    void shouldRescaleEachClusterIndependently() {
        SemanticNode a = node("a", 1, 0.6, 1, 0.5, NOW);
        SemanticNode b = node("b", 2, 0.6, 1, 0.25, NOW);

        HomeostaticRescaler.Result result = rescaler.rescale(List.of(a, b), NOW);

        assertEquals(2.0, result.kept().get(0).homeostaticScale(), 1e-9);
        assertEquals(4.0, result.kept().get(1).homeostaticScale(), 1e-9);
    }

    @Test
    void shouldPruneWeakRemoteNodes() {
        Instant longAgo = NOW.minus(Duration.ofDays(100));
        SemanticNode strong = node("strong", 3, 1.0, 1, 1.0, longAgo);
        SemanticNode weak = node("weak", 3, 0.0, 1000, 0.001, longAgo);

        HomeostaticRescaler.Result result = rescaler.rescale(List.of(strong, weak), NOW);

        assertEquals(List.of("weak"), result.pruned().stream().map(SemanticNode::id).toList());
        assertEquals(List.of("strong"), result.kept().stream().map(SemanticNode::id).toList());
    }

    @Test
    void shouldNotPruneWeakRecentNodes() {
        SemanticNode strong = node("strong", 3, 1.0, 1, 1.0, NOW.minus(Duration.ofHours(1)));
        SemanticNode weak = node("weak", 3, 0.0, 1000, 0.001, NOW.minus(Duration.ofHours(1)));

        HomeostaticRescaler.Result result = rescaler.rescale(List.of(strong, weak), NOW);

        assertTrue(result.pruned().isEmpty());
    }

    @Test
    void shouldLeaveClusterWithZeroMeanUntouched() {
        SemanticNode zero = node("zero", 5, 0.0, 1, 0.0, NOW.minus(Duration.ofDays(1)));

        HomeostaticRescaler.Result result = rescaler.rescale(List.of(zero), NOW);

        assertEquals(List.of(zero), result.kept());
    }

    private static SemanticNode node(String id, int cluster, double strength, int rank, double retrieval, Instant createdAt) {
        long age = Duration.between(createdAt, NOW).toSeconds();
        return new SemanticNode(id, "general_cognition", cluster, strength, rank, 0, 1.0, retrieval,
                AgeCategory.of(age), ConsolidationState.EPISODIC, createdAt, NOW.minus(Duration.ofDays(7)));
    }
}
