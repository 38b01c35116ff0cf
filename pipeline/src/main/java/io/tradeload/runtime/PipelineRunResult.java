package io.tradeload.runtime;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

/** Outcome of a whole run: every registered entity appears once, in processing order. */
public record PipelineRunResult(
        List<PipelineStepResult> steps,
        boolean success,
        Instant startedAt,
        Instant completedAt,
        String errorMessage
) {
    public PipelineRunResult {
        steps = List.copyOf(steps);
        if (success && errorMessage != null) throw new IllegalArgumentException("a successful run has no error message");
        if (!success && errorMessage == null) throw new IllegalArgumentException("a failed run needs an error message");
    }

    public Optional<PipelineStepResult> step(String entityName) {
        return steps.stream().filter(s -> s.entityName().equals(entityName)).findFirst();
    }

    public int totalRowsLoaded() {
        return steps.stream().mapToInt(PipelineStepResult::rowsLoaded).sum();
    }

    public List<String> skippedEntities() {
        return steps.stream().filter(PipelineStepResult::skipped).map(PipelineStepResult::entityName).toList();
    }

    public Duration elapsed() { return Duration.between(startedAt, completedAt); }
}
