package io.tradeload.runtime;

/** Observes step state changes. Called on the thread running the pipeline. */
@FunctionalInterface
public interface StepListener {
    StepListener NONE = (entityName, from, to) -> {};

    /** {@code from} is null for the first transition of a step. */
    void onTransition(String entityName, StepState from, StepState to);
}
