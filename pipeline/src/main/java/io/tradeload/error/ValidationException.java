package io.tradeload.error;

import io.tradeload.validate.FieldViolation;

import java.util.List;

/**
 * Batch-level validation failure. Carries every violation found by the first failing rule class.
 */
public class ValidationException extends PipelineException {
    private final String entityName;
    private final List<FieldViolation> violations;

    public ValidationException(String entityName, List<FieldViolation> violations) {
        super(summarize(entityName, violations));
        this.entityName = entityName;
        this.violations = List.copyOf(violations);
    }

    public String entityName() { return entityName; }
    public List<FieldViolation> violations() { return violations; }

    private static String summarize(String entityName, List<FieldViolation> violations) {
        if (violations.isEmpty()) return "validation failed for '" + entityName + "'";
        FieldViolation first = violations.get(0);
        return "validation failed for '" + entityName + "' (rule " + first.rule() + "): "
                + violations.size() + " violation(s); first: " + first;
    }
}
