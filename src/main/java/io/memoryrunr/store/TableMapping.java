package io.memoryrunr.store;

import io.memoryrunr.support.ContentHashes;

import java.sql.PreparedStatement;
import java.sql.SQLException;

/**
 * Typed upsert definition for one durable table. Every table is keyed by a stable text id and carries
 * a {@code content_hash} column, so re-applying an identical record is a no-op.
 *
 * @param <T> record type
 */
public interface TableMapping<T> {

    /** Table name. */
    String table();

    /** Parameterized upsert statement keyed on {@code id}. */
    String upsertSql();

    /** Binds one record (and its content hash) to {@link #upsertSql()}. */
    void bind(PreparedStatement statement, T record, String contentHash) throws SQLException;

    /** Stable id of the record. */
    String idOf(T record);

    /** Content hash of the record. */
    default String hash(T record) {
        return ContentHashes.of(record);
    }
}
