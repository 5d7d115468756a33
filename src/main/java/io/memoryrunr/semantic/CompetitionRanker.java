package io.memoryrunr.semantic;

import io.memoryrunr.model.SemanticNode;

import java.util.*;

/**
 * 1-based rank of each member of a cluster by consolidated strength, strongest first, ties broken by id.
 */
public final class CompetitionRanker {

    private CompetitionRanker() {
    }

    public static Map<String, Integer> rank(Collection<SemanticNode> members) {
        List<SemanticNode> ordered = new ArrayList<>(members);
        ordered.sort(Comparator.comparingDouble(SemanticNode::consolidatedStrength).reversed()
                .thenComparing(SemanticNode::id));
        Map<String, Integer> ranks = new LinkedHashMap<>();
        for (int i = 0; i < ordered.size(); i++) {
            ranks.put(ordered.get(i).id(), i + 1);
        }
        return ranks;
    }
}
