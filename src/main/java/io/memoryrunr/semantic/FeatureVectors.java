package io.memoryrunr.semantic;

import org.apache.commons.codec.digest.DigestUtils;

import java.nio.ByteBuffer;

/**
 * Clustering features: a hashed one-hot of the semantic category followed by the unit-length embedding.
 */
public final class FeatureVectors {

    public static final int CATEGORY_DIMENSIONS = 16;

    private FeatureVectors() {
    }

    /** Category hash that is identical across JVMs and runs. */
    public static int stableHash(String category) {
        return ByteBuffer.wrap(DigestUtils.sha256(category == null ? "" : category)).getInt();
    }

    public static float[] of(String category, float[] embedding) {
        float[] vector = new float[CATEGORY_DIMENSIONS + embedding.length];
        vector[Math.floorMod(stableHash(category), CATEGORY_DIMENSIONS)] = 1.0f;
        double norm = 0;
        for (float v : embedding) {
            norm += (double) v * v;
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < embedding.length; i++) {
            vector[CATEGORY_DIMENSIONS + i] = norm == 0 ? 0f : (float) (embedding[i] / norm);
        }
        return vector;
    }

    /**
     * Cosine similarity; vectors of different length (an embedding model change) are unrelated.
     */
    public static double cosine(float[] a, float[] b) {
        if (a.length != b.length) {
            return 0.0;
        }
        double dot = 0;
        double na = 0;
        double nb = 0;
        for (int i = 0; i < a.length; i++) {
            dot += (double) a[i] * b[i];
            na += (double) a[i] * a[i];
            nb += (double) b[i] * b[i];
        }
        if (na == 0 || nb == 0) {
            return 0.0;
        }
        return dot / (Math.sqrt(na) * Math.sqrt(nb));
    }
}
