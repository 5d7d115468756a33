package io.memoryrunr.attention;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.model.ItemStage;
import io.memoryrunr.model.MemoryItem;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.SourceMemory;
import io.memoryrunr.model.WatermarkRecord;
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

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Working-memory stage. Each cycle admits the best candidates from new source records, the current
 * active set and the pending pool; pending items that left the sliding window are discarded.
 */
public class AttentionStage implements StageProcessor {

    private static final Logger log = LoggerFactory.getLogger(AttentionStage.class);

    private static final double DEFAULT_SALIENCE = 0.5;
    private static final double DEFAULT_IMPORTANCE = 0.5;
    private static final double DEFAULT_SENTIMENT = 0.0;

    private final MemoryStore store;
    private final AttentionGate gate;
    private final IncrementalWriteback writeback;
    private final QuarantineService quarantine;
    private final PipelineProperties.Attention properties;

    public AttentionStage(MemoryStore store, AttentionGate gate, IncrementalWriteback writeback,
                          QuarantineService quarantine, PipelineProperties.Attention properties) {
        this.store = store;
        this.gate = gate;
        this.writeback = writeback;
        this.quarantine = quarantine;
        this.properties = properties;
    }

    @Override
    public MemoryStage stage() {
        return MemoryStage.ATTENTION;
    }

    @Override
    public StageReport process(RunContext context) {
        Instant now = context.startedAt();
        Instant windowStart = now.minus(properties.shortTermWindow());
        WatermarkRecord watermark = store.getWatermark(MemoryStage.ATTENTION);

        Map<String, MemoryItem> candidates = new LinkedHashMap<>();
        List<PendingWrite<?>> writes = new ArrayList<>();

        for (MemoryItem item : store.findItemsByStage(ItemStage.ACTIVE, properties.maxCandidates())) {
            candidates.put(item.id(), item);
        }
        for (MemoryItem item : store.findItemsByStage(ItemStage.PENDING, properties.maxCandidates())) {
            if (item.createdAt().isBefore(windowStart)) {
                writes.add(PendingWrite.upsert(Tables.MEMORY_ITEMS, item.withStage(ItemStage.DISCARDED), item.createdAt()));
            } else {
                candidates.put(item.id(), item);
            }
        }

        List<SourceMemory> sources = store.findSourcesForAttention(
                watermark.lastProcessedTimestamp(), windowStart, properties.maxCandidates());
        Map<String, Long> arrival = store.findArrivalSequences(sources.stream().map(SourceMemory::id).toList());
        List<String> errors = new ArrayList<>();
        int quarantined = 0;
        for (SourceMemory source : sources) {
            try {
                MemoryItem existing = candidates.get(source.id());
                candidates.put(source.id(), toItem(source, arrival.getOrDefault(source.id(), Long.MAX_VALUE), existing));
            } catch (DataIntegrityException e) {
                quarantine.quarantine(MemoryStage.ATTENTION, source.id(), e.getMessage());
                errors.add(source.id() + ": " + e.getMessage());
                quarantined++;
            }
        }

        AdmissionResult result = gate.admit(new ArrayList<>(candidates.values()), now, context.cycle());
        log.debug("Attention cycle {}: capacity={}, candidates={}, admitted={}, evicted={}, discarded={}",
                context.cycle(), result.capacity(), candidates.size(), result.admitted().size(),
                result.evicted().size(), writes.size());

        for (MemoryItem item : result.admitted()) {
            writes.add(PendingWrite.upsert(Tables.MEMORY_ITEMS, item, item.createdAt()));
        }
        for (MemoryItem item : result.evicted()) {
            writes.add(PendingWrite.upsert(Tables.MEMORY_ITEMS, item, item.createdAt()));
        }

        StageReport written = writeback.write(MemoryStage.ATTENTION, writes, context).toReport();
        return written.plus(new StageReport(0, quarantined, errors, false));
    }

    /**
     * Converts a source record into a working-memory item. A corrected source keeps the stage and
     * admission time of the item it replaces.
     */
    static MemoryItem toItem(SourceMemory source, long arrivalSeq, MemoryItem existing) {
        double salience = metadata(source, "salience", DEFAULT_SALIENCE);
        double importance = metadata(source, "importance", DEFAULT_IMPORTANCE);
        double sentiment = metadata(source, "sentiment", DEFAULT_SENTIMENT);
        if (salience < 0 || salience > 1) {
            throw new DataIntegrityException(source.id(), "salience " + salience + " outside [0,1]");
        }
        if (importance < 0 || importance > 1) {
            throw new DataIntegrityException(source.id(), "importance " + importance + " outside [0,1]");
        }
        if (sentiment < -1 || sentiment > 1) {
            throw new DataIntegrityException(source.id(), "sentiment " + sentiment + " outside [-1,1]");
        }
        ItemStage stage = existing == null ? ItemStage.PENDING : existing.stage();
        Instant admittedAt = existing == null ? null : existing.admittedAt();
        return new MemoryItem(source.id(), source.contentRef(), source.metadataString("content"), source.createdAt(),
                salience, importance, sentiment, stage, 0.0, 0, admittedAt, arrivalSeq, null, source.contentHash());
    }

    private static double metadata(SourceMemory source, String key, double defaultValue) {
        try {
            double value = source.metadataDouble(key, defaultValue);
            if (Double.isNaN(value) || Double.isInfinite(value)) {
                throw new DataIntegrityException(source.id(), key + " is not a finite number");
            }
            return value;
        } catch (NumberFormatException e) {
            throw new DataIntegrityException(source.id(), key + " is not numeric: " + source.metadataString(key), e);
        }
    }
}
