package io.memoryrunr.model;

/**
 * A directed weighted edge between two episodes. Edges are owned by the association collection;
 * neither endpoint holds a reference to the other.
 *
 * @param sourceId source episode id
 * @param targetId target episode id
 * @param weight   association weight in [0,1]
 * @param kind     how the edge was discovered
 */
public record Association(String sourceId, String targetId, double weight, AssociationKind kind) {

    public String key() {
        return sourceId + "->" + targetId;
    }

    public Association withWeight(double weight) {
        return new Association(sourceId, targetId, weight, kind);
    }
}
