package io.memoryrunr.embedding;

import java.util.Optional;

/**
 * Optional embedding collaborator. An empty result means clustering falls back to category-based
 * assignment for that record.
 */
public interface EmbeddingProvider {

    /** Provider used when no embedding model is configured. */
    EmbeddingProvider NONE = text -> Optional.empty();

    Optional<float[]> embed(String text);
}
