package io.tradeload.runtime;

import io.tradeload.validate.FieldViolation;

import java.util.List;

/**
 * Outcome of one entity step. A skipped step carries no rows and an error message naming the
 * step whose failure caused the skip.
 */
public record PipelineStepResult(
        String entityName,
        boolean success,
        int rowsLoaded,
        String errorMessage,
        StepState finalState,
        String failedPhase,
        List<FieldViolation> violations
) {
    public PipelineStepResult {
        if (success && errorMessage != null) throw new IllegalArgumentException("a successful step has no error message");
        if (!success && errorMessage == null) throw new IllegalArgumentException("a failed step needs an error message");
        violations = violations == null ? List.of() : List.copyOf(violations);
    }

    public static PipelineStepResult done(String entityName, int rowsLoaded) {
        return new PipelineStepResult(entityName, true, rowsLoaded, null, StepState.DONE, null, List.of());
    }

    public static PipelineStepResult failed(String entityName, String phase, String message, List<FieldViolation> violations) {
        return new PipelineStepResult(entityName, false, 0, message, StepState.FAILED, phase, violations);
    }

    public static PipelineStepResult skipped(String entityName, String reason) {
        return new PipelineStepResult(entityName, false, 0, reason, StepState.SKIPPED, null, List.of());
    }

    public boolean skipped() { return finalState == StepState.SKIPPED; }
}
