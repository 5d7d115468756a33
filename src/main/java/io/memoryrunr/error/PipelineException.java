package io.memoryrunr.error;

/**
 * Base type for every failure raised by the consolidation pipeline.
 * Subclasses map one-to-one onto the handling policies applied by the stage runner.
 */
public class PipelineException extends RuntimeException {

    public PipelineException(String message) {
        super(message);
    }

    public PipelineException(String message, Throwable cause) {
        super(message, cause);
    }
}
