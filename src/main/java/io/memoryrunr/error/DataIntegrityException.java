package io.memoryrunr.error;

/**
 * A single record is malformed or violates a store constraint.
 * The record is quarantined so that it cannot block the rest of its batch.
 */
public class DataIntegrityException extends PipelineException {

    private final String recordId;

    public DataIntegrityException(String recordId, String message) {
        super(message);
        this.recordId = recordId;
    }

    public DataIntegrityException(String recordId, String message, Throwable cause) {
        super(message, cause);
        this.recordId = recordId;
    }

    public String recordId() {
        return recordId;
    }
}
