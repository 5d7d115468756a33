package io.memoryrunr.error;

/**
 * Another instance of the same stage holds the run lock.
 */
public class ConcurrencyConflictException extends PipelineException {

    public ConcurrencyConflictException(String stage) {
        super("Stage '%s' is already running".formatted(stage));
    }
}
