package io.memoryrunr.episode;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.enrichment.EnrichmentError;
import io.memoryrunr.enrichment.EnrichmentProvider;
import io.memoryrunr.enrichment.EnrichmentRequest;
import io.memoryrunr.enrichment.EnrichmentResult;
import io.memoryrunr.enrichment.Features;
import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.model.Episode;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.pipeline.RunContext;
import io.memoryrunr.pipeline.StageProcessor;
import io.memoryrunr.pipeline.StageReport;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.Tables;
import io.memoryrunr.writeback.IncrementalWriteback;
import io.memoryrunr.writeback.PendingWrite;
import io.memoryrunr.writeback.QuarantineService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Short-term memory stage: enriches newly admitted items, groups them into episodes and binds the
 * items to their episode.
 */
public class EpisodeStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(EpisodeStage.class);

    private final MemoryStore store;
    private final EnrichmentProvider enrichment;
    private final EpisodeBuilder builder;
    private final IncrementalWriteback writeback;
    private final QuarantineService quarantine;
    private final PipelineProperties.Episode properties;

    public EpisodeStage(MemoryStore store, EnrichmentProvider enrichment, EpisodeBuilder builder,
                        IncrementalWriteback writeback, QuarantineService quarantine,
                        PipelineProperties.Episode properties) {
        this.store = store;
        this.enrichment = enrichment;
        this.builder = builder;
        this.writeback = writeback;
        this.quarantine = quarantine;
        this.properties = properties;
    }

    @Override
    public MemoryStage stage() {
        return MemoryStage.EPISODE;
    }

    @Override
    public StageReport process(RunContext context) {
        List<MemoryItem> admitted = new ArrayList<>(store.findUnboundItems(properties.batchSize()));
        if (admitted.isEmpty()) {
            log.debug("No unbound active items");
            return StageReport.empty();
        }
        admitted.sort(Comparator.comparing(MemoryItem::createdAt).thenComparingLong(MemoryItem::arrivalSeq));

        List<EnrichedItem> enriched = new ArrayList<>();
        List<String> errors = new ArrayList<>();
        int quarantined = 0;
        for (MemoryItem item : admitted) {
            try {
                enriched.add(new EnrichedItem(item, features(item)));
            } catch (DataIntegrityException e) {
                quarantine.quarantine(MemoryStage.EPISODE, item.id(), e.getMessage());
                errors.add(item.id() + ": " + e.getMessage());
                quarantined++;
            }
        }
        if (enriched.isEmpty()) {
            return new StageReport(0, quarantined, errors, false);
        }

        Instant earliest = enriched.get(0).item().createdAt();
        Duration lookBack = Duration.ofSeconds(Math.max(properties.coActivationWindowSeconds(), properties.hebbianWindowSeconds()));
        List<Episode> recent = store.findEpisodesEndingAfter(earliest.minus(lookBack));

        EpisodeBatch batch = builder.build(enriched, recent, store::findItem, context.startedAt());
        log.debug("Grouped {} items into {} episodes ({} neighbours co-activated)",
                enriched.size(), batch.episodes().size(), batch.coActivated().size());

        StageReport written = writeback.write(MemoryStage.EPISODE, writes(batch), context).toReport();
        return written.plus(new StageReport(0, quarantined, errors, false));
    }

    /**
     * Episodes carry the earliest admission time of the batch so they are always written before the
     * bindings of their items, which are only accepted once the stored episode lists the item. Items
     * carry their own admission time, which drives the watermark.
     */
    private static List<PendingWrite<?>> writes(EpisodeBatch batch) {
        Instant earliestAdmission = batch.items().stream()
                .map(EpisodeStage::writeTimestamp)
                .min(Comparator.naturalOrder())
                .orElse(Instant.EPOCH);
        List<PendingWrite<?>> writes = new ArrayList<>();
        for (Episode episode : batch.episodes()) {
            writes.add(PendingWrite.upsert(Tables.EPISODES, episode, earliestAdmission));
        }
        for (Episode episode : batch.coActivated()) {
            writes.add(PendingWrite.upsert(Tables.EPISODES, episode, earliestAdmission));
        }
        for (MemoryItem item : batch.items()) {
            writes.add(PendingWrite.upsert(Tables.ITEM_BINDINGS, item, writeTimestamp(item)));
        }
        return writes;
    }

    private static Instant writeTimestamp(MemoryItem item) {
        return item.admittedAt() != null ? item.admittedAt() : item.createdAt();
    }

    private Features features(MemoryItem item) {
        EnrichmentResult<Features> result = enrichment.enrich(
                new EnrichmentRequest(item.enrichmentText(), item.sentiment(), item.importance()));
        if (!result.isOk()) {
            String message = result.error().map(EnrichmentError::message).orElse("enrichment failed");
            throw new DataIntegrityException(item.id(), "enrichment failed: " + message);
        }
        Features features = result.value().orElseThrow();
        if (features.category() == null || features.category().isBlank()) {
            throw new DataIntegrityException(item.id(), "enrichment returned no category");
        }
        if (features.sentiment() < -1 || features.sentiment() > 1) {
            throw new DataIntegrityException(item.id(), "sentiment " + features.sentiment() + " outside [-1,1]");
        }
        if (features.importance() < 0 || features.importance() > 1) {
            throw new DataIntegrityException(item.id(), "importance " + features.importance() + " outside [0,1]");
        }
        return features;
    }
}
