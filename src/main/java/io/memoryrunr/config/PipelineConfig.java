package io.memoryrunr.config;

import io.memoryrunr.attention.AttentionGate;
import io.memoryrunr.attention.AttentionStage;
import io.memoryrunr.attention.CapacityPolicy;
import io.memoryrunr.consolidation.AssociationSamplingStrategy;
import io.memoryrunr.consolidation.CompetitiveForgetting;
import io.memoryrunr.consolidation.ConsolidationEngine;
import io.memoryrunr.consolidation.ConsolidationStage;
import io.memoryrunr.consolidation.HebbianRule;
import io.memoryrunr.consolidation.RandomPairSamplingStrategy;
import io.memoryrunr.consolidation.SimilarityScorer;
import io.memoryrunr.embedding.EmbeddingProvider;
import io.memoryrunr.enrichment.EnrichmentProvider;
import io.memoryrunr.episode.EpisodeBuilder;
import io.memoryrunr.episode.EpisodeStage;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.pipeline.PipelineScheduler;
import io.memoryrunr.pipeline.StageJob;
import io.memoryrunr.pipeline.StageProcessor;
import io.memoryrunr.pipeline.StageRunner;
import io.memoryrunr.semantic.ClusterAssigner;
import io.memoryrunr.semantic.HomeostasisStage;
import io.memoryrunr.semantic.HomeostaticRescaler;
import io.memoryrunr.semantic.SemanticNetworkBuilder;
import io.memoryrunr.semantic.SemanticStage;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.writeback.IncrementalWriteback;
import io.memoryrunr.writeback.QuarantineService;
import org.jobrunr.scheduling.JobScheduler;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Clock;
import java.util.List;

/**
 * Stage processors and the runtime that drives them.
 */
@Configuration
public class PipelineConfig {

    // ── Write-back ──────────────────────────────────────────────────────────

    @Bean
    public QuarantineService quarantineService(MemoryStore store, PipelineObserver observer,
                                               PipelineProperties properties, Clock clock) {
        return new QuarantineService(store, observer, properties.writeback().deadLetterAfterRuns(), clock);
    }

    @Bean
    public IncrementalWriteback incrementalWriteback(MemoryStore store, QuarantineService quarantine,
                                                     PipelineObserver observer, PipelineProperties properties) {
        return new IncrementalWriteback(store, quarantine, observer, properties.writeback());
    }

    // ── Stages ──────────────────────────────────────────────────────────────

    @Bean
    public AttentionStage attentionStage(MemoryStore store, IncrementalWriteback writeback,
                                         QuarantineService quarantine, PipelineProperties properties) {
        PipelineProperties.Attention attention = properties.attention();
        CapacityPolicy policy = new CapacityPolicy(attention.baseCapacity(), attention.capacityVariance(), attention.seed());
        return new AttentionStage(store, new AttentionGate(policy, attention), writeback, quarantine, attention);
    }

    @Bean
    public EpisodeStage episodeStage(MemoryStore store, EnrichmentProvider enrichment, IncrementalWriteback writeback,
                                     QuarantineService quarantine, PipelineProperties properties) {
        return new EpisodeStage(store, enrichment, new EpisodeBuilder(properties.episode()), writeback, quarantine,
                properties.episode());
    }

    @Bean
    public AssociationSamplingStrategy associationSamplingStrategy(PipelineProperties properties) {
        return new RandomPairSamplingStrategy(properties.consolidation().seed());
    }

    @Bean
    public ConsolidationStage consolidationStage(MemoryStore store, EnrichmentProvider enrichment,
                                                 AssociationSamplingStrategy sampling, IncrementalWriteback writeback,
                                                 QuarantineService quarantine, PipelineProperties properties) {
        PipelineProperties.Consolidation consolidation = properties.consolidation();
        ConsolidationEngine engine = new ConsolidationEngine(
                new HebbianRule(consolidation.learningRate()),
                new CompetitiveForgetting(consolidation.decayThreshold(), consolidation.strengthenThreshold()),
                new SimilarityScorer(enrichment),
                sampling,
                consolidation,
                properties.episode().hebbianCap());
        return new ConsolidationStage(store, engine, writeback, quarantine, consolidation,
                properties.writeback().runLockTtl());
    }

    @Bean
    public SemanticStage semanticStage(MemoryStore store, EmbeddingProvider embeddings, IncrementalWriteback writeback,
                                       PipelineProperties properties) {
        PipelineProperties.Semantic semantic = properties.semantic();
        ClusterAssigner assigner = new ClusterAssigner(semantic.clusterCount(), semantic.newClusterSimilarity());
        return new SemanticStage(store, new SemanticNetworkBuilder(assigner, embeddings, semantic), writeback, semantic);
    }

    @Bean
    public HomeostasisStage homeostasisStage(MemoryStore store, IncrementalWriteback writeback,
                                             PipelineProperties properties) {
        return new HomeostasisStage(store, new HomeostaticRescaler(properties.semantic()), writeback);
    }

    // ── Runtime ─────────────────────────────────────────────────────────────

    @Bean
    public StageRunner stageRunner(MemoryStore store, List<StageProcessor> processors, PipelineObserver observer,
                                   Clock clock, PipelineProperties properties) {
        return new StageRunner(store, processors, observer, clock, properties.writeback().runLockTtl());
    }

    @Bean
    public StageJob stageJob(StageRunner stageRunner, SemanticStage semanticStage) {
        return new StageJob(stageRunner, semanticStage);
    }

    @Bean
    public PipelineScheduler pipelineScheduler(JobScheduler jobScheduler, StageJob stageJob,
                                               PipelineProperties properties) {
        return new PipelineScheduler(jobScheduler, stageJob, properties.schedule());
    }
}
