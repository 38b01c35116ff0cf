package io.tradeload.error;

/** Store-level failure during the staging, update or insert phase of an upsert. */
public class UpsertException extends PipelineException {
    public enum Phase { STAGING, UPDATE, INSERT, COMMIT }

    private final Phase phase;

    public UpsertException(Phase phase, String message) {
        super(phase.name().toLowerCase() + " phase: " + message);
        this.phase = phase;
    }

    public UpsertException(Phase phase, String message, Throwable cause) {
        super(phase.name().toLowerCase() + " phase: " + message, cause);
        this.phase = phase;
    }

    public Phase phase() { return phase; }
}
