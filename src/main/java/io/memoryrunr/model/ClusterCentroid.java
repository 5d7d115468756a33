package io.memoryrunr.model;

/**
 * Running-mean centroid of an embedding cluster.
 *
 * @param clusterId   cluster id
 * @param category    semantic category the cluster was opened for
 * @param vector      centroid vector
 * @param memberCount number of members folded into the mean
 */
public record ClusterCentroid(int clusterId, String category, float[] vector, int memberCount) {

    /** Folds {@code point} into the running mean. */
    public ClusterCentroid absorb(float[] point) {
        float[] next = new float[vector.length];
        int n = memberCount + 1;
        for (int i = 0; i < vector.length; i++) {
            next[i] = vector[i] + (point[i] - vector[i]) / n;
        }
        return new ClusterCentroid(clusterId, category, next, n);
    }
}
