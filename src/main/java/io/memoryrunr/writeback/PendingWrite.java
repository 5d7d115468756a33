package io.memoryrunr.writeback;

import io.memoryrunr.store.StoreTransaction;
import io.memoryrunr.store.TableMapping;

import java.time.Instant;
import java.util.List;

/**
 * One record a stage wants persisted (or removed), together with the timestamp that advances the
 * stage watermark once the record is committed.
 *
 * @param table     target table
 * @param record    record to upsert, null for deletions
 * @param id        stable id of the row
 * @param timestamp watermark timestamp of the record
 * @param hash      content hash used for change detection
 * @param delete    whether the row is removed instead of upserted
 * @param <T>       record type
 */
public record PendingWrite<T>(TableMapping<T> table, T record, String id, Instant timestamp, String hash, boolean delete) {

    private static final String DELETED = "deleted";

    public static <T> PendingWrite<T> upsert(TableMapping<T> table, T record, Instant timestamp) {
        return new PendingWrite<>(table, record, table.idOf(record), timestamp, table.hash(record), false);
    }

    public static <T> PendingWrite<T> delete(TableMapping<T> table, String id, Instant timestamp) {
        return new PendingWrite<>(table, null, id, timestamp, DELETED, true);
    }

    /**
     * Applies writes in order, each within {@code tx}.
     *
     * @return rows changed
     */
    static int applyAll(StoreTransaction tx, List<PendingWrite<?>> writes) {
        int changed = 0;
        for (PendingWrite<?> write : writes) {
            changed += write.applyTo(tx);
        }
        return changed;
    }

    int applyTo(StoreTransaction tx) {
        return delete ? tx.delete(table, List.of(id)) : tx.upsertBatch(table, List.of(record));
    }
}
