package io.memoryrunr.semantic;

import io.memoryrunr.model.ClusterCentroid;
import org.junit.jupiter.api.Test;

import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

import static org.junit.jupiter.api.Assertions.*;

class ClusterAssignerTest {

    @Test
    void shouldUseCategoryHashWithoutEmbedding() {
        ClusterAssigner assigner = new ClusterAssigner(1000, 0.75);

        ClusterAssigner.Assignment assignment = assigner.assign("social_cognition", Optional.empty(), new TreeMap<>());

        assertEquals(assigner.categoryCluster("social_cognition"), assignment.clusterId());
        assertTrue(assignment.clusterId() >= 0 && assignment.clusterId() < 1000);
        assertTrue(assignment.centroid().isEmpty());
    }

    @Test
    void shouldSkipClusterOpenedForAnotherCategoryWithoutEmbedding() {
        ClusterAssigner assigner = new ClusterAssigner(1000, 0.75);
        int home = assigner.categoryCluster("social_cognition");
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();
        centroids.put(home, new ClusterCentroid(home, "technical_procedures", new float[]{1, 0}, 3));

        ClusterAssigner.Assignment assignment = assigner.assign("social_cognition", Optional.empty(), centroids);

        assertEquals((home + 1) % 1000, assignment.clusterId());
        assertTrue(assignment.centroid().isEmpty());
        assertEquals(1, centroids.size());
    }

    @Test
    void shouldJoinProbedClusterOfSameCategoryWithoutEmbedding() {
        ClusterAssigner assigner = new ClusterAssigner(1000, 0.75);
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();
        int first = assigner.assign("social_cognition", Optional.of(new float[]{1, 0, 0}), centroids).clusterId();
        int second = assigner.assign("social_cognition", Optional.of(new float[]{0, 1, 0}), centroids).clusterId();
        centroids.put(first, new ClusterCentroid(first, "technical_procedures", new float[]{1, 0}, 3));

        assertEquals(second, assigner.assign("social_cognition", Optional.empty(), centroids).clusterId());
    }

    @Test
    void shouldShareHomeClusterWhenEveryIdIsTaken() {
        ClusterAssigner assigner = new ClusterAssigner(2, 0.75);
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();
        centroids.put(0, new ClusterCentroid(0, "a", new float[]{1, 0}, 1));
        centroids.put(1, new ClusterCentroid(1, "b", new float[]{0, 1}, 1));

        assertEquals(assigner.categoryCluster("c"), assigner.assign("c", Optional.empty(), centroids).clusterId());
    }

    @Test
    void shouldAbsorbSimilarPointIntoExistingCluster() {
        ClusterAssigner assigner = new ClusterAssigner(1000, 0.75);
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();

        int first = assigner.assign("social_cognition", Optional.of(new float[]{1, 0, 0}), centroids).clusterId();
        ClusterAssigner.Assignment second = assigner.assign("social_cognition", Optional.of(new float[]{2, 0.1f, 0}), centroids);

        assertEquals(first, second.clusterId());
        assertEquals(2, centroids.get(first).memberCount());
        assertEquals(2, second.centroid().orElseThrow().memberCount());
    }

    @Test
    void shouldOpenNextFreeClusterForDissimilarPoint() {
        ClusterAssigner assigner = new ClusterAssigner(1000, 0.75);
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();

        int first = assigner.assign("social_cognition", Optional.of(new float[]{1, 0, 0}), centroids).clusterId();
        int second = assigner.assign("social_cognition", Optional.of(new float[]{0, 1, 0}), centroids).clusterId();

        assertEquals(assigner.categoryCluster("social_cognition"), first);
        assertEquals((first + 1) % 1000, second);
        assertEquals(2, centroids.size());
    }

    @Test
    void shouldAbsorbIntoNearestWhenAllClustersAreTaken() {
        ClusterAssigner assigner = new ClusterAssigner(2, 0.99);
        Map<Integer, ClusterCentroid> centroids = new TreeMap<>();
        assigner.assign("a", Optional.of(new float[]{1, 0, 0}), centroids);
        assigner.assign("a", Optional.of(new float[]{0, 1, 0}), centroids);

        ClusterAssigner.Assignment third = assigner.assign("a", Optional.of(new float[]{0, 0.9f, 0.1f}), centroids);

        assertEquals(2, centroids.size());
        assertEquals(2, centroids.get(third.clusterId()).memberCount());
        assertEquals(1.0f, centroids.get(third.clusterId()).vector()[FeatureVectors.CATEGORY_DIMENSIONS + 1], 0.1f);
    }

    @Test
    void shouldTreatVectorsOfDifferentLengthAsUnrelated() {
        assertEquals(0.0, FeatureVectors.cosine(new float[]{1, 0}, new float[]{1, 0, 0}));
        assertEquals(1.0, FeatureVectors.cosine(new float[]{1, 1}, new float[]{2, 2}), 1e-9);
    }
}
