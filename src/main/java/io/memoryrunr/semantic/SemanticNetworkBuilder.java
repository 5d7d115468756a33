package io.memoryrunr.semantic;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.ClusterCentroid;
import io.memoryrunr.model.ConsolidatedMemory;
import io.memoryrunr.model.ConsolidationState;
import io.memoryrunr.model.SemanticNode;
import io.memoryrunr.support.UnitInterval;

import java.time.Instant;
import java.util.*;

/**
 * Places consolidated memories into clusters and derives the ranked, scored semantic nodes.
 */
public class SemanticNetworkBuilder {

    private final ClusterAssigner assigner;
    private final EmbeddingProvider embeddings;
    private final PipelineProperties.Semantic properties;

    public SemanticNetworkBuilder(ClusterAssigner assigner, EmbeddingProvider embeddings,
                                  PipelineProperties.Semantic properties) {
        this.assigner = assigner;
        this.embeddings = embeddings;
        this.properties = properties;
    }

    /**
     * Creates a node for each memory. Derived fields are left for {@link #evaluate}.
     *
     * @param centroids current centroids by cluster id, updated in place
     */
    public Placement place(List<ConsolidatedMemory> memories, Map<Integer, ClusterCentroid> centroids, Instant now) {
        List<SemanticNode> nodes = new ArrayList<>();
        Map<Integer, ClusterCentroid> moved = new TreeMap<>();
        for (ConsolidatedMemory memory : memories) {
            ClusterAssigner.Assignment assignment = assigner.assign(
                    memory.semanticCategory(), embeddings.embed(memory.profile()), centroids);
            assignment.centroid().ifPresent(c -> moved.put(c.clusterId(), c));
            nodes.add(newNode(memory, assignment.clusterId(), now));
        }
        return new Placement(nodes, new ArrayList<>(moved.values()));
    }

    /**
     * Reassigns every node from scratch, ignoring the current centroids.
     */
    public Placement recluster(List<SemanticNode> nodes, Map<String, ConsolidatedMemory> memories, Instant now) {
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();
        List<SemanticNode> reassigned = new ArrayList<>();
        List<SemanticNode> ordered = new ArrayList<>(nodes);
        ordered.sort(Comparator.comparing(SemanticNode::createdAt).thenComparing(SemanticNode::id));
        for (SemanticNode node : ordered) {
            ConsolidatedMemory memory = memories.get(node.id());
            Optional<float[]> embedding = memory == null ? Optional.empty() : embeddings.embed(memory.profile());
            reassigned.add(node.withCluster(assigner.assign(node.semanticCategory(), embedding, centroids).clusterId()));
        }
        return new Placement(reassigned, new ArrayList<>(centroids.values()));
    }

    /**
     * Recomputes rank, access frequency, retrieval strength, age and consolidation state of every member
     * of the given clusters.
     *
     * @param members      all nodes of the clusters being evaluated
     * @param accessCounts accesses per node id within the rolling window
     */
    public List<SemanticNode> evaluate(Collection<SemanticNode> members, Map<String, Integer> accessCounts, Instant now) {
        Map<Integer, List<SemanticNode>> clusters = new TreeMap<>();
        for (SemanticNode node : members) {
            clusters.computeIfAbsent(node.clusterId(), k -> new ArrayList<>()).add(node);
        }
        List<SemanticNode> evaluated = new ArrayList<>();
        for (List<SemanticNode> cluster : clusters.values()) {
            Map<String, Integer> ranks = CompetitionRanker.rank(cluster);
            for (SemanticNode node : cluster) {
                evaluated.add(evaluateNode(node, ranks.get(node.id()), accessCounts.getOrDefault(node.id(), 0), now));
            }
        }
        return evaluated;
    }

    private SemanticNode evaluateNode(SemanticNode node, int rank, int accesses, Instant now) {
        long ageSeconds = Math.max(0, now.getEpochSecond() - node.createdAt().getEpochSecond());
        double retrieval = RetrievalStrength.compute(node.consolidatedStrength(), rank, accesses, ageSeconds,
                node.homeostaticScale(), properties);
        return new SemanticNode(node.id(), node.semanticCategory(), node.clusterId(), node.consolidatedStrength(),
                rank, accesses, node.homeostaticScale(), retrieval, AgeCategory.of(ageSeconds),
                ConsolidationState.of(accesses, properties.consolidatingAccesses(), properties.schematizedAccesses()),
                node.createdAt(), now);
    }

    private static SemanticNode newNode(ConsolidatedMemory memory, int clusterId, Instant now) {
        double strength = UnitInterval.enforce(memory.consolidatedStrength(), "consolidated_strength", memory.id());
        return new SemanticNode(memory.id(), memory.semanticCategory(), clusterId, strength, 1, 0, 1.0, 0.0,
                AgeCategory.RECENT, ConsolidationState.EPISODIC, memory.createdAt(), now);
    }

    public record Placement(List<SemanticNode> nodes, List<ClusterCentroid> centroids) {
    }
}
