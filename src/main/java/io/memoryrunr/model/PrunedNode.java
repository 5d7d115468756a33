package io.memoryrunr.model;

import java.time.Instant;

/**
 * Tombstone of a semantic node removed by homeostatic pruning.
 */
public record PrunedNode(String id, int clusterId, double retrievalStrength, Instant prunedAt) {

    public static PrunedNode of(SemanticNode node, Instant at) {
        return new PrunedNode(node.id(), node.clusterId(), node.retrievalStrength(), at);
    }
}
