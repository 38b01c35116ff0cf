package io.tradeload.error;

/**
 * Base of every failure raised while loading entity batches. All subclasses are recovered at the
 * orchestrator boundary into a step result.
 */
public class PipelineException extends RuntimeException {
    public PipelineException(String message) { super(message); }
    public PipelineException(String message, Throwable cause) { super(message, cause); }
}
