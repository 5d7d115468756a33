package io.memoryrunr.config;

import io.memoryrunr.error.ConfigurationException;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Immutable pipeline configuration, bound once at startup from {@code memory.pipeline.*}.
 *
 * <p>Every group falls back to its defaults when absent. The whole object is validated in its
 * constructor, so an out-of-range capacity, weight or threshold fails application startup with a
 * {@link ConfigurationException} before any record is processed.</p>
 *
 * <pre>
 * memory:
 *   pipeline:
 *     attention:
 *       base-capacity: 7
 *       capacity-variance: 2
 *       short-term-window-seconds: 1800
 *     consolidation:
 *       consolidation-threshold: 0.5
 *     writeback:
 *       batch-size: 1000
 *       min-batch-size: 50
 * </pre>
 */
@ConfigurationProperties(prefix = "memory.pipeline")
public record PipelineProperties(
        Attention attention,
        Episode episode,
        Consolidation consolidation,
        Semantic semantic,
        Writeback writeback,
        Collaborators collaborators,
        Schedule schedule
) {

    public PipelineProperties {
        if (attention == null) attention = new Attention(null, null, null, null, null, null, null, null);
        if (episode == null) episode = new Episode(null, null, null, null, null, null, null, null, null);
        if (consolidation == null) consolidation = new Consolidation(null, null, null, null, null, null, null, null, null);
        if (semantic == null) semantic = new Semantic(null, null, null, null, null, null, null, null, null, null, null, null);
        if (writeback == null) writeback = new Writeback(null, null, null, null, null, null, null);
        if (collaborators == null) collaborators = new Collaborators(null, null, null, null, null, null);
        if (schedule == null) schedule = new Schedule(null, null, null, null, null, null);
        validate(attention, episode, consolidation, semantic, writeback, collaborators);
    }

    public static PipelineProperties defaults() {
        return new PipelineProperties(null, null, null, null, null, null, null);
    }

    /**
     * Working-memory settings.
     *
     * @param baseCapacity           centre of the capacity range (Miller's 7)
     * @param capacityVariance       +/- spread around the base
     * @param seed                   seed for the per-cycle capacity draw
     * @param shortTermWindowSeconds sliding window of candidate items
     * @param attentionDecaySeconds  recency decay constant of the admission score
     * @param recencyWeight          weight of recency in the admission score
     * @param salienceWeight         weight of salience in the admission score
     * @param maxCandidates          upper bound on candidates loaded per cycle
     */
    public record Attention(
            Integer baseCapacity,
            Integer capacityVariance,
            Long seed,
            Long shortTermWindowSeconds,
            Double attentionDecaySeconds,
            Double recencyWeight,
            Double salienceWeight,
            Integer maxCandidates
    ) {
        public Attention {
            if (baseCapacity == null) baseCapacity = 7;
            if (capacityVariance == null) capacityVariance = 2;
            if (seed == null) seed = 42L;
            if (shortTermWindowSeconds == null) shortTermWindowSeconds = 1800L;
            if (attentionDecaySeconds == null) attentionDecaySeconds = 300.0;
            if (recencyWeight == null) recencyWeight = 0.5;
            if (salienceWeight == null) salienceWeight = 0.5;
            if (maxCandidates == null) maxCandidates = 10_000;
        }

        public Duration shortTermWindow() {
            return Duration.ofSeconds(shortTermWindowSeconds);
        }
    }

    /**
     * Short-term memory settings.
     *
     * @param coActivationWindowSeconds items of one category closer than this join the same episode
     * @param decayConstantSeconds      decay constant of the recency factor
     * @param sentimentWeight           weight of |sentiment| in emotional salience
     * @param importanceWeight          weight of importance in emotional salience
     * @param hebbianWindowSeconds      rolling window for counting co-activated episodes
     * @param hebbianCap                upper bound on hebbian potential
     * @param readinessCoActivations    K: minimum hebbian potential for consolidation
     * @param readinessSalience         S: emotional salience must exceed this for consolidation
     * @param batchSize                 admitted items consumed per run
     */
    public record Episode(
            Long coActivationWindowSeconds,
            Double decayConstantSeconds,
            Double sentimentWeight,
            Double importanceWeight,
            Long hebbianWindowSeconds,
            Integer hebbianCap,
            Integer readinessCoActivations,
            Double readinessSalience,
            Integer batchSize
    ) {
        public Episode {
            if (coActivationWindowSeconds == null) coActivationWindowSeconds = 300L;
            if (decayConstantSeconds == null) decayConstantSeconds = 1800.0;
            if (sentimentWeight == null) sentimentWeight = 0.4;
            if (importanceWeight == null) importanceWeight = 0.6;
            if (hebbianWindowSeconds == null) hebbianWindowSeconds = 3600L;
            if (hebbianCap == null) hebbianCap = 10;
            if (readinessCoActivations == null) readinessCoActivations = 3;
            if (readinessSalience == null) readinessSalience = 0.5;
            if (batchSize == null) batchSize = 1000;
        }
    }

    /**
     * Replay and consolidation settings.
     *
     * @param batchSize              N: episodes claimed per cycle
     * @param learningRate           Hebbian learning rate, bounded to [0.05, 0.2]
     * @param decayThreshold         strengths below this are scaled by 0.8 each cycle
     * @param strengthenThreshold    strengths above this are scaled by 1.2 each cycle
     * @param consolidationThreshold promotion threshold into long-term memory
     * @param discardThreshold       strengths below this are discarded
     * @param replayAdjacencySeconds episodes this close in time are replay partners
     * @param creativePairs          random pairs sampled per cycle for creative associations
     * @param seed                   seed for creative pair sampling
     */
    public record Consolidation(
            Integer batchSize,
            Double learningRate,
            Double decayThreshold,
            Double strengthenThreshold,
            Double consolidationThreshold,
            Double discardThreshold,
            Long replayAdjacencySeconds,
            Integer creativePairs,
            Long seed
    ) {
        public Consolidation {
            if (batchSize == null) batchSize = 100;
            if (learningRate == null) learningRate = 0.1;
            if (decayThreshold == null) decayThreshold = 0.3;
            if (strengthenThreshold == null) strengthenThreshold = 0.7;
            if (consolidationThreshold == null) consolidationThreshold = 0.5;
            if (discardThreshold == null) discardThreshold = 0.05;
            if (replayAdjacencySeconds == null) replayAdjacencySeconds = 3600L;
            if (creativePairs == null) creativePairs = 3;
            if (seed == null) seed = 7L;
        }
    }

    /**
     * Long-term memory settings.
     *
     * @param clusterCount            K: fixed number of clusters
     * @param strengthWeight          w1, weight of consolidated strength
     * @param rankWeight              w2, weight of {@code 1/(rank+1)}
     * @param frequencyWeight         w3, weight of {@code ln(access_frequency+1)}
     * @param recencyWeight           w4, weight of {@code exp(-age/age_decay)}
     * @param ageDecaySeconds         age decay constant
     * @param newClusterSimilarity    cosine similarity below which a new embedding cluster opens
     * @param pruneThreshold          remote nodes below this retrieval strength are deleted
     * @param consolidatingAccesses   weekly accesses at which a node becomes consolidating
     * @param schematizedAccesses     weekly accesses at which a node becomes schematized
     * @param batchSize               consolidated memories placed per run
     * @param accessWindowDays        rolling access-frequency window
     */
    public record Semantic(
            Integer clusterCount,
            Double strengthWeight,
            Double rankWeight,
            Double frequencyWeight,
            Double recencyWeight,
            Double ageDecaySeconds,
            Double newClusterSimilarity,
            Double pruneThreshold,
            Integer consolidatingAccesses,
            Integer schematizedAccesses,
            Integer batchSize,
            Integer accessWindowDays
    ) {
        public Semantic {
            if (clusterCount == null) clusterCount = 1000;
            if (strengthWeight == null) strengthWeight = 0.3;
            if (rankWeight == null) rankWeight = 0.2;
            if (frequencyWeight == null) frequencyWeight = 0.2;
            if (recencyWeight == null) recencyWeight = 0.3;
            if (ageDecaySeconds == null) ageDecaySeconds = 604_800.0;
            if (newClusterSimilarity == null) newClusterSimilarity = 0.75;
            if (pruneThreshold == null) pruneThreshold = 0.01;
            if (consolidatingAccesses == null) consolidatingAccesses = 3;
            if (schematizedAccesses == null) schematizedAccesses = 10;
            if (batchSize == null) batchSize = 500;
            if (accessWindowDays == null) accessWindowDays = 7;
        }
    }

    /**
     * Durable write-back settings.
     *
     * @param batchSize               records per transaction
     * @param minBatchSize            floor for batch halving
     * @param poolSize                maximum pooled store connections
     * @param connectionTimeoutMillis how long a caller blocks for a pooled connection
     * @param deadLetterAfterRuns     consecutive quarantines before a record is dead-lettered
     * @param runLockTtlSeconds       lifetime of a stage run lock
     * @param databaseUrl             JDBC url of the durable store
     */
    public record Writeback(
            Integer batchSize,
            Integer minBatchSize,
            Integer poolSize,
            Long connectionTimeoutMillis,
            Integer deadLetterAfterRuns,
            Long runLockTtlSeconds,
            String databaseUrl
    ) {
        public Writeback {
            if (batchSize == null) batchSize = 1000;
            if (minBatchSize == null) minBatchSize = 50;
            if (poolSize == null) poolSize = 4;
            if (connectionTimeoutMillis == null) connectionTimeoutMillis = 30_000L;
            if (deadLetterAfterRuns == null) deadLetterAfterRuns = 3;
            if (runLockTtlSeconds == null) runLockTtlSeconds = 900L;
            if (databaseUrl == null || databaseUrl.isBlank()) databaseUrl = "jdbc:sqlite:./data/memory.db";
        }

        public Duration runLockTtl() {
            return Duration.ofSeconds(runLockTtlSeconds);
        }
    }

    /**
     * Enrichment and embedding collaborator settings.
     *
     * @param timeoutSeconds   per-call timeout
     * @param maxRetries       retries after the first attempt
     * @param backoffMillis    initial backoff, doubled on each retry
     * @param cacheMaximumSize bounded response cache size
     * @param cacheTtlSeconds  response cache time-to-live
     * @param remoteEnabled    whether a remote chat model is used for enrichment
     */
    public record Collaborators(
            Long timeoutSeconds,
            Integer maxRetries,
            Long backoffMillis,
            Long cacheMaximumSize,
            Long cacheTtlSeconds,
            Boolean remoteEnabled
    ) {
        public Collaborators {
            if (timeoutSeconds == null) timeoutSeconds = 30L;
            if (maxRetries == null) maxRetries = 3;
            if (backoffMillis == null) backoffMillis = 500L;
            if (cacheMaximumSize == null) cacheMaximumSize = 10_000L;
            if (cacheTtlSeconds == null) cacheTtlSeconds = 3600L;
            if (remoteEnabled == null) remoteEnabled = false;
        }

        public Duration timeout() {
            return Duration.ofSeconds(timeoutSeconds);
        }
    }

    /**
     * Recurring job cron expressions.
     */
    public record Schedule(
            Boolean enabled,
            String attentionCron,
            String episodeCron,
            String consolidationCron,
            String semanticCron,
            String homeostasisCron
    ) {
        public Schedule {
            if (enabled == null) enabled = true;
            if (attentionCron == null) attentionCron = "* * * * *";
            if (episodeCron == null) episodeCron = "*/5 * * * *";
            if (consolidationCron == null) consolidationCron = "*/15 * * * *";
            if (semanticCron == null) semanticCron = "0 * * * *";
            if (homeostasisCron == null) homeostasisCron = "0 3 * * 0";
        }
    }

    private static void validate(Attention attention, Episode episode, Consolidation consolidation,
                                 Semantic semantic, Writeback writeback, Collaborators collaborators) {
        List<String> errors = new ArrayList<>();

        int low = attention.baseCapacity() - attention.capacityVariance();
        int high = attention.baseCapacity() + attention.capacityVariance();
        if (attention.capacityVariance() < 0 || low < 5 || high > 9) {
            errors.add("attention capacity %d+/-%d must stay within [5,9]"
                    .formatted(attention.baseCapacity(), attention.capacityVariance()));
        }
        positive(errors, "attention.short-term-window-seconds", attention.shortTermWindowSeconds());
        positive(errors, "attention.attention-decay-seconds", attention.attentionDecaySeconds());
        unit(errors, "attention.recency-weight", attention.recencyWeight());
        unit(errors, "attention.salience-weight", attention.salienceWeight());
        positive(errors, "attention.max-candidates", attention.maxCandidates());

        positive(errors, "episode.co-activation-window-seconds", episode.coActivationWindowSeconds());
        positive(errors, "episode.decay-constant-seconds", episode.decayConstantSeconds());
        unit(errors, "episode.sentiment-weight", episode.sentimentWeight());
        unit(errors, "episode.importance-weight", episode.importanceWeight());
        positive(errors, "episode.hebbian-window-seconds", episode.hebbianWindowSeconds());
        positive(errors, "episode.hebbian-cap", episode.hebbianCap());
        positive(errors, "episode.readiness-co-activations", episode.readinessCoActivations());
        unit(errors, "episode.readiness-salience", episode.readinessSalience());
        positive(errors, "episode.batch-size", episode.batchSize());

        positive(errors, "consolidation.batch-size", consolidation.batchSize());
        if (consolidation.learningRate() < 0.05 || consolidation.learningRate() > 0.2) {
            errors.add("consolidation.learning-rate %.3f must be within [0.05, 0.2]"
                    .formatted(consolidation.learningRate()));
        }
        unit(errors, "consolidation.decay-threshold", consolidation.decayThreshold());
        unit(errors, "consolidation.strengthen-threshold", consolidation.strengthenThreshold());
        unit(errors, "consolidation.consolidation-threshold", consolidation.consolidationThreshold());
        unit(errors, "consolidation.discard-threshold", consolidation.discardThreshold());
        if (consolidation.decayThreshold() > consolidation.strengthenThreshold()) {
            errors.add("consolidation.decay-threshold must not exceed consolidation.strengthen-threshold");
        }
        if (consolidation.creativePairs() < 0) {
            errors.add("consolidation.creative-pairs must not be negative");
        }

        positive(errors, "semantic.cluster-count", semantic.clusterCount());
        unit(errors, "semantic.strength-weight", semantic.strengthWeight());
        unit(errors, "semantic.rank-weight", semantic.rankWeight());
        unit(errors, "semantic.frequency-weight", semantic.frequencyWeight());
        unit(errors, "semantic.recency-weight", semantic.recencyWeight());
        double weightSum = semantic.strengthWeight() + semantic.rankWeight()
                + semantic.frequencyWeight() + semantic.recencyWeight();
        if (Math.abs(weightSum - 1.0) > 1e-9) {
            errors.add("semantic retrieval weights must sum to 1 (was %.4f)".formatted(weightSum));
        }
        positive(errors, "semantic.age-decay-seconds", semantic.ageDecaySeconds());
        unit(errors, "semantic.new-cluster-similarity", semantic.newClusterSimilarity());
        unit(errors, "semantic.prune-threshold", semantic.pruneThreshold());
        if (semantic.consolidatingAccesses() > semantic.schematizedAccesses()) {
            errors.add("semantic.consolidating-accesses must not exceed semantic.schematized-accesses");
        }
        positive(errors, "semantic.batch-size", semantic.batchSize());
        positive(errors, "semantic.access-window-days", semantic.accessWindowDays());

        positive(errors, "writeback.batch-size", writeback.batchSize());
        positive(errors, "writeback.min-batch-size", writeback.minBatchSize());
        if (writeback.minBatchSize() > writeback.batchSize()) {
            errors.add("writeback.min-batch-size must not exceed writeback.batch-size");
        }
        positive(errors, "writeback.pool-size", writeback.poolSize());
        if (writeback.connectionTimeoutMillis() < 250) {
            errors.add("writeback.connection-timeout-millis must be at least 250");
        }
        positive(errors, "writeback.dead-letter-after-runs", writeback.deadLetterAfterRuns());
        positive(errors, "writeback.run-lock-ttl-seconds", writeback.runLockTtlSeconds());

        positive(errors, "collaborators.timeout-seconds", collaborators.timeoutSeconds());
        if (collaborators.maxRetries() < 0) {
            errors.add("collaborators.max-retries must not be negative");
        }
        positive(errors, "collaborators.cache-maximum-size", collaborators.cacheMaximumSize());
        positive(errors, "collaborators.cache-ttl-seconds", collaborators.cacheTtlSeconds());

        if (!errors.isEmpty()) {
            throw new ConfigurationException(errors);
        }
    }

    private static void unit(List<String> errors, String name, double value) {
        if (Double.isNaN(value) || value < 0.0 || value > 1.0) {
            errors.add("%s must be within [0,1] (was %s)".formatted(name, value));
        }
    }

    private static void positive(List<String> errors, String name, Number value) {
        if (value.doubleValue() <= 0) {
            errors.add("%s must be positive (was %s)".formatted(name, value));
        }
    }
}
