package io.memoryrunr.semantic;

import io.memoryrunr.model.ClusterCentroid;

import java.util.Map;
import java.util.Optional;

/**
 * Online clustering into a fixed number of clusters.
 *
 * <p>With an embedding the nearest centroid (cosine) wins; when none is similar enough and a cluster
 * id is still free, a new cluster is opened at the category's hashed id, probing forward on collision.
 * Without an embedding the point follows the same probe sequence and lands on the first id that is
 * free or whose centroid has the same category, so it never joins a cluster opened for another
 * category. Only when every id holds a foreign centroid does it share its hashed id.</p>
 */
public class ClusterAssigner {

    private final int clusterCount;
    private final double newClusterSimilarity;

    public ClusterAssigner(int clusterCount, double newClusterSimilarity) {
        this.clusterCount = clusterCount;
        this.newClusterSimilarity = newClusterSimilarity;
    }

    /**
     * Assigns one point. {@code centroids} is updated in place so later points of the same batch see
     * the new means.
     *
     * @return the cluster id and, when a centroid moved or was created, the centroid to persist
     */
    public Assignment assign(String category, Optional<float[]> embedding, Map<Integer, ClusterCentroid> centroids) {
        if (embedding.isEmpty()) {
            return new Assignment(probe(category, centroids, true), Optional.empty());
        }
        float[] point = FeatureVectors.of(category, embedding.get());

        ClusterCentroid nearest = null;
        double best = Double.NEGATIVE_INFINITY;
        for (ClusterCentroid centroid : centroids.values()) {
            double similarity = FeatureVectors.cosine(point, centroid.vector());
            if (similarity > best || (similarity == best && nearest != null && centroid.clusterId() < nearest.clusterId())) {
                best = similarity;
                nearest = centroid;
            }
        }

        if ((nearest == null || best < newClusterSimilarity) && centroids.size() < clusterCount) {
            int id = probe(category, centroids, false);
            ClusterCentroid opened = new ClusterCentroid(id, category, point, 1);
            centroids.put(id, opened);
            return new Assignment(id, Optional.of(opened));
        }

        ClusterCentroid moved = nearest.absorb(point);
        centroids.put(moved.clusterId(), moved);
        return new Assignment(moved.clusterId(), Optional.of(moved));
    }

    /** Home id of a category before probing. */
    public int categoryCluster(String category) {
        return Math.floorMod(FeatureVectors.stableHash(category), clusterCount);
    }

    private int probe(String category, Map<Integer, ClusterCentroid> centroids, boolean joinSameCategory) {
        int home = categoryCluster(category);
        int id = home;
        for (int probes = 0; probes < clusterCount; probes++) {
            ClusterCentroid held = centroids.get(id);
            if (held == null || (joinSameCategory && held.category().equals(category))) {
                return id;
            }
            id = (id + 1) % clusterCount;
        }
        return home;
    }

    public record Assignment(int clusterId, Optional<ClusterCentroid> centroid) {
    }
}
