package io.tradeload.error;

/** Raised at startup when an entity or column descriptor is incomplete or inconsistent. */
public class InvalidDescriptorException extends PipelineException {
    public InvalidDescriptorException(String message) { super(message); }
}
