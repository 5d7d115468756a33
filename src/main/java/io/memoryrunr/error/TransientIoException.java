package io.memoryrunr.error;

/**
 * Network or store timeout. Retried with backoff; on exhaustion the caller degrades
 * (enrichment fallback, smaller write-back batch) instead of aborting the run.
 */
public class TransientIoException extends PipelineException {

    public TransientIoException(String message) {
        super(message);
    }

    public TransientIoException(String message, Throwable cause) {
        super(message, cause);
    }
}
