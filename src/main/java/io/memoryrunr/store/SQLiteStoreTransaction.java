package io.memoryrunr.store;

import io.memoryrunr.error.PipelineException;
import io.memoryrunr.model.MemoryStage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * JDBC transaction on a pooled connection. The connection goes back to the pool on close.
 */
class SQLiteStoreTransaction implements StoreTransaction {

    private static final Logger log = LoggerFactory.getLogger(SQLiteStoreTransaction.class);

    static final String WATERMARK_SQL = """
        INSERT INTO watermarks (stage, last_processed, content_hash)
        VALUES (?, ?, ?)
        ON CONFLICT(stage) DO UPDATE SET
            last_processed = excluded.last_processed,
            content_hash = excluded.content_hash
        WHERE excluded.last_processed >= watermarks.last_processed
        """;

    private final Connection connection;
    private boolean finished;

    SQLiteStoreTransaction(Connection connection) throws SQLException {
        this.connection = connection;
        connection.setAutoCommit(false);
    }

    @Override
    public <T> int upsertBatch(TableMapping<T> table, List<T> records) {
        if (records.isEmpty()) {
            return 0;
        }
        String currentId = null;
        try (PreparedStatement ps = connection.prepareStatement(table.upsertSql())) {
            int changed = 0;
            for (T record : records) {
                currentId = table.idOf(record);
                table.bind(ps, record, table.hash(record));
                changed += ps.executeUpdate();
            }
            return changed;
        } catch (SQLException e) {
            // A single-record batch can name its offender.
            String recordId = records.size() == 1 ? currentId : null;
            throw SqlErrors.translate(e, "Upsert into " + table.table(), recordId);
        }
    }

    @Override
    public int delete(TableMapping<?> table, Collection<String> ids) {
        if (ids.isEmpty()) {
            return 0;
        }
        try (PreparedStatement ps = connection.prepareStatement("DELETE FROM " + table.table() + " WHERE id = ?")) {
            int deleted = 0;
            for (String id : ids) {
                ps.setString(1, id);
                deleted += ps.executeUpdate();
            }
            return deleted;
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Delete from " + table.table());
        }
    }

    @Override
    public void setWatermark(MemoryStage stage, Instant lastProcessed, String contentHash) {
        try (PreparedStatement ps = connection.prepareStatement(WATERMARK_SQL)) {
            ps.setString(1, stage.name());
            ps.setLong(2, lastProcessed.toEpochMilli());
            ps.setString(3, contentHash);
            ps.executeUpdate();
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Watermark update for " + stage);
        }
    }

    @Override
    public void commit() {
        try {
            connection.commit();
            finished = true;
        } catch (SQLException e) {
            throw SqlErrors.translate(e, "Commit");
        }
    }

    @Override
    public void rollback() {
        if (finished) {
            return;
        }
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new PipelineException("Rollback failed", e);
        } finally {
            finished = true;
        }
    }

    @Override
    public void close() {
        try {
            if (!finished) {
                connection.rollback();
                finished = true;
            }
        } catch (SQLException e) {
            log.error("Rollback on close failed", e);
        } finally {
            try {
                connection.setAutoCommit(true);
                connection.close();
            } catch (SQLException e) {
                log.error("Failed to return connection to the pool", e);
            }
        }
    }
}
