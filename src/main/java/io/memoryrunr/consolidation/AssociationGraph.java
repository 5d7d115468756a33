package io.memoryrunr.consolidation;

import io.memoryrunr.model.Association;

import java.util.*;

/**
 * Owns the association edges loaded for one consolidation run and tracks which of them changed.
 * Episodes refer to each other only through edge keys.
 */
public class AssociationGraph {

    private final Map<String, Association> edges = new LinkedHashMap<>();
    private final Set<String> changed = new LinkedHashSet<>();

    public static AssociationGraph of(Collection<Association> associations) {
        AssociationGraph graph = new AssociationGraph();
        for (Association association : associations) {
            graph.edges.put(association.key(), association);
        }
        return graph;
    }

    public Optional<Association> edge(String sourceId, String targetId) {
        return Optional.ofNullable(edges.get(sourceId + "->" + targetId));
    }

    public boolean connected(String a, String b) {
        return edges.containsKey(a + "->" + b) || edges.containsKey(b + "->" + a);
    }

    public void put(Association association) {
        Association previous = edges.put(association.key(), association);
        if (!association.equals(previous)) {
            changed.add(association.key());
        }
    }

    public List<Association> outgoing(String sourceId) {
        return edges.values().stream().filter(a -> a.sourceId().equals(sourceId)).toList();
    }

    /** Edges added or re-weighted since the graph was loaded, in the order they were touched. */
    public List<Association> changed() {
        return changed.stream().map(edges::get).toList();
    }

    public int size() {
        return edges.size();
    }
}
