package io.memoryrunr.writeback;

import io.memoryrunr.config.PipelineProperties;
import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.error.PipelineException;
import io.memoryrunr.model.MemoryStage;
import io.memoryrunr.model.WatermarkRecord;
import io.memoryrunr.observability.BatchMetrics;
import io.memoryrunr.observability.PipelineObserver;
import io.memoryrunr.pipeline.RunContext;
import io.memoryrunr.store.MemoryStore;
import io.memoryrunr.store.StoreTransaction;
import io.memoryrunr.store.TableMapping;
import io.memoryrunr.support.ContentHashes;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * Persists stage output in fixed-size transactional batches and advances the stage watermark inside
 * each batch transaction.
 *
 * <ul>
 *   <li>Records at or before the watermark whose stored hash equals theirs are skipped, so re-running
 *       a stage after a crash only writes what is missing.</li>
 *   <li>A failing batch is rolled back and retried at half the size, down to the configured floor.
 *       The reduced size is kept for the rest of the pass.</li>
 *   <li>A failing floor-sized batch is applied one record per transaction. A record rejected by a store
 *       constraint is quarantined; any other failure aborts the pass.</li>
 * </ul>
 */
public class IncrementalWriteback {

    private static final Logger log = LoggerFactory.getLogger(IncrementalWriteback.class);

    private final MemoryStore store;
    private final QuarantineService quarantine;
    private final PipelineObserver observer;
    private final int batchSize;
    private final int minBatchSize;

    public IncrementalWriteback(MemoryStore store, QuarantineService quarantine, PipelineObserver observer,
                                PipelineProperties.Writeback properties) {
        this(store, quarantine, observer, properties.batchSize(), properties.minBatchSize());
    }

    public IncrementalWriteback(MemoryStore store, QuarantineService quarantine, PipelineObserver observer,
                                int batchSize, int minBatchSize) {
        this.store = store;
        this.quarantine = quarantine;
        this.observer = observer;
        this.batchSize = batchSize;
        this.minBatchSize = minBatchSize;
    }

    public WritebackResult write(MemoryStage stage, List<PendingWrite<?>> writes, RunContext context) {
        long started = System.nanoTime();
        WatermarkRecord watermark = store.getWatermark(stage);

        List<PendingWrite<?>> ordered = new ArrayList<>(writes);
        // Stable: records sharing a timestamp keep the order the stage produced them in.
        ordered.sort(Comparator.comparing(PendingWrite::timestamp));

        List<PendingWrite<?>> pending = selectChanged(stage, ordered, watermark);
        int skipped = ordered.size() - pending.size();
        if (pending.isEmpty()) {
            log.debug("[{}] nothing to write ({} unchanged)", stage, skipped);
            return new WritebackResult(0, skipped, 0, 0, batchSize, List.of(), false, elapsedSince(started));
        }

        int size = batchSize;
        int committed = 0;
        int quarantined = 0;
        int batches = 0;
        List<String> errors = new ArrayList<>();
        int index = 0;

        while (index < pending.size()) {
            if (context.isCancelled()) {
                log.info("[{}] write-back cancelled after {} of {} records", stage, committed, pending.size());
                return new WritebackResult(committed, skipped, quarantined, batches, size, errors, true, elapsedSince(started));
            }
            List<PendingWrite<?>> batch = pending.subList(index, Math.min(pending.size(), index + size));
            long batchStarted = System.nanoTime();
            try {
                commitBatch(stage, batch);
                batches++;
                committed += batch.size();
                index += batch.size();
                quarantine.clear(stage, ids(batch));
                observer.onBatchCommitted(new BatchMetrics(stage, size, batch.size(), batch.size(), 0, elapsedSince(batchStarted)));
            } catch (PipelineException e) {
                if (size > minBatchSize && batch.size() > minBatchSize) {
                    int reduced = Math.max(minBatchSize, size / 2);
                    observer.onBatchSizeReduced(stage, size, reduced, e.getMessage());
                    size = reduced;
                    continue;
                }
                RecordByRecord outcome = commitRecordByRecord(stage, batch, errors);
                batches += outcome.committed();
                committed += outcome.committed();
                quarantined += outcome.quarantined();
                index += batch.size();
                observer.onBatchCommitted(new BatchMetrics(stage, size, batch.size(), outcome.committed(),
                        outcome.quarantined(), elapsedSince(batchStarted)));
            }
        }

        log.debug("[{}] wrote {} records in {} batches ({} skipped, {} quarantined)",
                stage, committed, batches, skipped, quarantined);
        return new WritebackResult(committed, skipped, quarantined, batches, size, errors, false, elapsedSince(started));
    }

    private List<PendingWrite<?>> selectChanged(MemoryStage stage, List<PendingWrite<?>> ordered, WatermarkRecord watermark) {
        Set<String> deadLettered = store.findDeadLettered(stage);

        Map<TableMapping<?>, Set<String>> idsByTable = new LinkedHashMap<>();
        for (PendingWrite<?> write : ordered) {
            if (!write.timestamp().isAfter(watermark.lastProcessedTimestamp())) {
                idsByTable.computeIfAbsent(write.table(), t -> new LinkedHashSet<>()).add(write.id());
            }
        }
        Map<TableMapping<?>, Map<String, String>> stored = new HashMap<>();
        idsByTable.forEach((table, ids) -> stored.put(table, store.findStoredHashes(table, ids)));

        List<PendingWrite<?>> changed = new ArrayList<>();
        for (PendingWrite<?> write : ordered) {
            if (deadLettered.contains(write.id())) {
                continue;
            }
            if (!write.timestamp().isAfter(watermark.lastProcessedTimestamp())) {
                String storedHash = stored.getOrDefault(write.table(), Map.of()).get(write.id());
                boolean unchanged = write.delete() ? storedHash == null : write.hash().equals(storedHash);
                if (unchanged) {
                    continue;
                }
            }
            changed.add(write);
        }
        return changed;
    }

    private void commitBatch(MemoryStage stage, List<PendingWrite<?>> batch) {
        try (StoreTransaction tx = store.beginTransaction()) {
            PendingWrite.applyAll(tx, batch);
            PendingWrite<?> newest = batch.get(batch.size() - 1);
            tx.setWatermark(stage, newest.timestamp(), ContentHashes.ofBatch(hashes(batch)));
            tx.commit();
        }
    }

    private RecordByRecord commitRecordByRecord(MemoryStage stage, List<PendingWrite<?>> batch, List<String> errors) {
        int committed = 0;
        int quarantined = 0;
        for (PendingWrite<?> write : batch) {
            try {
                commitBatch(stage, List.of(write));
                quarantine.clear(stage, List.of(write.id()));
                committed++;
            } catch (DataIntegrityException e) {
                String reason = e.getMessage();
                quarantine.quarantine(stage, write.id(), reason);
                errors.add(write.id() + ": " + reason);
                quarantined++;
            }
        }
        return new RecordByRecord(committed, quarantined);
    }

    private static List<String> ids(List<PendingWrite<?>> batch) {
        return batch.stream().map(PendingWrite::id).toList();
    }

    private static List<String> hashes(List<PendingWrite<?>> batch) {
        return batch.stream().map(PendingWrite::hash).toList();
    }

    private static Duration elapsedSince(long startedNanos) {
        return Duration.ofNanos(System.nanoTime() - startedNanos);
    }

    private record RecordByRecord(int committed, int quarantined) {
    }
}
