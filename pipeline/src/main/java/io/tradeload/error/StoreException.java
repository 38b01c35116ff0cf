package io.tradeload.error;

/** Failure reported by the persistent-store collaborator. Retry policy belongs to the store side. */
public class StoreException extends PipelineException {
    public StoreException(String message, Throwable cause) { super(message, cause); }
}
