package io.memoryrunr.semantic;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.model.AgeCategory;
import io.memoryrunr.model.SemanticNode;

import java.time.Instant;
import java.util.*;

/**
 * Weekly synaptic homeostasis. Within each cluster every node's scale is divided by the cluster's
 * mean retrieval strength, which normalizes the cluster mean towards 1 before clamping. Remote nodes
 * left below the prune threshold are removed.
 */
public class HomeostaticRescaler {

    private final PipelineProperties.Semantic properties;

    public HomeostaticRescaler(PipelineProperties.Semantic properties) {
        this.properties = properties;
    }

    public Result rescale(Collection<SemanticNode> nodes, Instant now) {
        Map<Integer, List<SemanticNode>> clusters = new TreeMap<>();
        for (SemanticNode node : nodes) {
            clusters.computeIfAbsent(node.clusterId(), k -> new ArrayList<>()).add(node);
        }

        List<SemanticNode> kept = new ArrayList<>();
        List<SemanticNode> pruned = new ArrayList<>();
        for (List<SemanticNode> members : clusters.values()) {
            double mean = members.stream().mapToDouble(SemanticNode::retrievalStrength).average().orElse(0.0);
            for (SemanticNode node : members) {
                SemanticNode rescaled = mean > 0 ? rescaled(node, node.homeostaticScale() / mean, now) : node;
                if (rescaled.retrievalStrength() < properties.pruneThreshold()
                        && rescaled.ageCategory() == AgeCategory.REMOTE) {
                    pruned.add(rescaled);
                } else {
                    kept.add(rescaled);
                }
            }
        }
        return new Result(kept, pruned);
    }

    private SemanticNode rescaled(SemanticNode node, double scale, Instant now) {
        SemanticNode scaled = new SemanticNode(node.id(), node.semanticCategory(), node.clusterId(),
                node.consolidatedStrength(), node.competitionRank(), node.accessFrequency(), scale, 0.0,
                node.ageCategory(), node.consolidationState(), node.createdAt(), now);
        double retrieval = RetrievalStrength.of(scaled, properties);
        return new SemanticNode(scaled.id(), scaled.semanticCategory(), scaled.clusterId(),
                scaled.consolidatedStrength(), scaled.competitionRank(), scaled.accessFrequency(), scale, retrieval,
                AgeCategory.of(scaled.ageSeconds()), scaled.consolidationState(), scaled.createdAt(), now);
    }

    public record Result(List<SemanticNode> kept, List<SemanticNode> pruned) {
    }
}
