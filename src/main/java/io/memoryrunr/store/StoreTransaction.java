package io.memoryrunr.store;

import io.memoryrunr.model.MemoryStage;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * One all-or-nothing unit of work against the durable store. Closing a transaction that was not
 * committed rolls it back.
 *
 * <pre>
 * try (StoreTransaction tx = store.beginTransaction()) {
 *     tx.upsertBatch(Tables.MEMORY_ITEMS, items);
 *     tx.setWatermark(MemoryStage.ATTENTION, newest, batchHash);
 *     tx.commit();
 * }
 * </pre>
 */
public interface StoreTransaction extends AutoCloseable {

    /**
     * Upserts every record keyed by its stable id.
     *
     * @return number of rows actually changed (identical records are skipped)
     */
    <T> int upsertBatch(TableMapping<T> table, List<T> records);

    /** Hard-deletes rows by id. */
    int delete(TableMapping<?> table, Collection<String> ids);

    /** Advances the stage watermark inside this transaction. */
    void setWatermark(MemoryStage stage, Instant lastProcessed, String contentHash);

    void commit();

    void rollback();

    @Override
    void close();
}
