package io.tradeload.runtime;

/** Lifecycle of one entity step within a run. DONE, FAILED and SKIPPED are terminal. */
public enum StepState {
    PENDING,
    VALIDATING,
    COERCING,
    UPSERTING,
    DONE,
    FAILED,
    SKIPPED;

    public boolean isTerminal() {
        return this == DONE || this == FAILED || this == SKIPPED;
    }
}
