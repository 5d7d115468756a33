package io.memoryrunr.embedding;

import io.memoryrunr.error.TransientIoException;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.support.CollaboratorGuard;
import io.memoryrunr.support.ResponseCache;
import org.springframework.ai.embedding.EmbeddingModel;

import java.util.Optional;

/**
 * Embeddings from a Spring AI {@link EmbeddingModel}, guarded by timeout, retry and circuit breaker and
 * served from the injected cache when possible.
 */
public class SpringAiEmbeddingProvider implements EmbeddingProvider {

    private final EmbeddingModel embeddingModel;
    private final CollaboratorGuard guard;
    private final ResponseCache<String, float[]> cache;
    private final PipelineObserver observer;

    public SpringAiEmbeddingProvider(EmbeddingModel embeddingModel, CollaboratorGuard guard,
                                     ResponseCache<String, float[]> cache, PipelineObserver observer) {
        this.embeddingModel = embeddingModel;
        this.guard = guard;
        this.cache = cache;
        this.observer = observer;
    }

    @Override
    public Optional<float[]> embed(String text) {
        if (text == null || text.isBlank()) {
            return Optional.empty();
        }
        Optional<float[]> cached = cache.get(text);
        if (cached.isPresent()) {
            return cached;
        }
        try {
            float[] vector = guard.call(() -> embeddingModel.embed(text));
            if (vector == null || vector.length == 0) {
                return Optional.empty();
            }
            cache.put(text, vector);
            return Optional.of(vector);
        } catch (TransientIoException e) {
            observer.onFallback(guard.name(), e.getMessage());
            return Optional.empty();
        }
    }
}
