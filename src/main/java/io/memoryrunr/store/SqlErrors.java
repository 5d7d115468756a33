package io.memoryrunr.store;

import io.memoryrunr.error.DataIntegrityException;
import io.memoryrunr.error.PipelineException;
import io.memoryrunr.error.TransientIoException;

import java.sql.SQLException;
import java.sql.SQLIntegrityConstraintViolationException;
import java.sql.SQLTransientException;

/**
 * Maps JDBC failures onto the pipeline exception hierarchy.
 */
final class SqlErrors {

    private static final int SQLITE_BUSY = 5;
    private static final int SQLITE_LOCKED = 6;
    private static final int SQLITE_CONSTRAINT = 19;

    private SqlErrors() {
    }

    static boolean isConstraintViolation(SQLException e) {
        return e instanceof SQLIntegrityConstraintViolationException
                || (e.getErrorCode() & 0xff) == SQLITE_CONSTRAINT;
    }

    static boolean isTransient(SQLException e) {
        int code = e.getErrorCode() & 0xff;
        return e instanceof SQLTransientException || code == SQLITE_BUSY || code == SQLITE_LOCKED;
    }

    /**
     * @param recordId id of the record being written, or null for multi-record statements
     */
    static PipelineException translate(SQLException e, String action, String recordId) {
        String message = action + " failed: " + e.getMessage();
        if (isConstraintViolation(e)) {
            return new DataIntegrityException(recordId, message, e);
        }
        if (isTransient(e)) {
            return new TransientIoException(message, e);
        }
        return new PipelineException(message, e);
    }

    static PipelineException translate(SQLException e, String action) {
        return translate(e, action, null);
    }
}
