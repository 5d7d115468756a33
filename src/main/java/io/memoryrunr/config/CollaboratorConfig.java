package io.memoryrunr.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.embedding.SpringAiEmbeddingProvider;
import io.memoryrunr.enrichment.CachingEnrichmentProvider;
import io.memoryrunr.enrichment.EnrichmentProvider;
import io.memoryrunr.enrichment.RemoteEnrichmentProvider;
import io.memoryrunr.enrichment.ResilientEnrichmentProvider;
import io.memoryrunr.enrichment.RuleBasedEnrichmentProvider;
import io.memoryrunr.observability.GuardedPipelineObserver;
import io.memoryrunr.observability.LoggingPipelineObserver;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.support.CaffeineResponseCache;
import io.memoryrunr.support.CollaboratorGuard;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.ai.chat.client.ChatClient;
import org.springframework.ai.chat.model.ChatModel;
import org.springframework.ai.embedding.EmbeddingModel;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Wires the enrichment and embedding collaborators. A Spring AI model is used when one is on the
 * context and remote calls are enabled; otherwise the local rule-based provider does all the work.
 */
@Configuration
public class CollaboratorConfig {

    private static final Logger log = LoggerFactory.getLogger(CollaboratorConfig.class);

    @Bean
    public PipelineObserver pipelineObserver() {
        return new GuardedPipelineObserver(new LoggingPipelineObserver());
    }

    @Bean
    public EnrichmentProvider enrichmentProvider(PipelineProperties properties,
                                                 ObjectProvider<ChatModel> chatModel,
                                                 ObjectProvider<ObjectMapper> objectMapper,
                                                 @Qualifier("enrichmentGuard") CollaboratorGuard enrichmentGuard,
                                                 PipelineObserver observer) {
        RuleBasedEnrichmentProvider ruleBased = new RuleBasedEnrichmentProvider();
        PipelineProperties.Collaborators collaborators = properties.collaborators();
        ChatModel model = chatModel.getIfAvailable();
        if (!collaborators.remoteEnabled() || model == null) {
            log.info("Enrichment: rule-based provider (remote enabled: {}, chat model present: {})",
                    collaborators.remoteEnabled(), model != null);
            return ruleBased;
        }

        RemoteEnrichmentProvider remote = new RemoteEnrichmentProvider(
                ChatClient.builder(model).build(), objectMapper.getIfAvailable(ObjectMapper::new));
        Duration ttl = Duration.ofSeconds(collaborators.cacheTtlSeconds());
        log.info("Enrichment: remote provider with rule-based fallback, cache {} entries / {}",
                collaborators.cacheMaximumSize(), ttl);
        return new CachingEnrichmentProvider(
                new ResilientEnrichmentProvider(remote, ruleBased, enrichmentGuard, observer),
                new CaffeineResponseCache<>(collaborators.cacheMaximumSize(), ttl),
                new CaffeineResponseCache<>(collaborators.cacheMaximumSize(), ttl));
    }

    @Bean
    public EmbeddingProvider embeddingProvider(PipelineProperties properties,
                                               ObjectProvider<EmbeddingModel> embeddingModel,
                                               @Qualifier("embeddingGuard") CollaboratorGuard embeddingGuard,
                                               PipelineObserver observer) {
        EmbeddingModel model = embeddingModel.getIfAvailable();
        if (model == null) {
            log.info("Embedding: none configured, clustering by category");
            return EmbeddingProvider.NONE;
        }
        PipelineProperties.Collaborators collaborators = properties.collaborators();
        return new SpringAiEmbeddingProvider(model, embeddingGuard,
                new CaffeineResponseCache<>(collaborators.cacheMaximumSize(),
                        Duration.ofSeconds(collaborators.cacheTtlSeconds())),
                observer);
    }
}
