package io.memoryrunr.error;

/**
 * A computed value left its contract (strength outside [0,1], illegal state transition, bad rank).
 */
public class InvariantViolationException extends PipelineException {

    public InvariantViolationException(String message) {
        super(message);
    }
}
