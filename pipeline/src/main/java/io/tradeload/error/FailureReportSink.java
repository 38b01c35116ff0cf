package io.tradeload.error;

import io.tradeload.validate.FieldViolation;

import java.util.List;

/** Receives every failed pipeline step for later diagnosis. Implementations must not throw. */
public interface FailureReportSink extends AutoCloseable {
    void acceptFailure(String entityName, String phase, String message, List<FieldViolation> violations);

    @Override default void close() {}
}
