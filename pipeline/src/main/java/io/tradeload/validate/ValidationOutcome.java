package io.tradeload.validate;

import io.tradeload.core.Batch;

import java.util.List;
import java.util.Optional;

/**
 * Whole-batch verdict. The batch is handed on only when no rule failed; there is no partial acceptance.
 */
public final class ValidationOutcome {
    private final boolean valid;
    private final List<FieldViolation> errors;
    private final Batch passedData;

    private ValidationOutcome(boolean valid, List<FieldViolation> errors, Batch passedData) {
        this.valid = valid;
        this.errors = List.copyOf(errors);
        this.passedData = passedData;
    }

    public static ValidationOutcome passed(Batch batch) { return new ValidationOutcome(true, List.of(), batch); }

    public static ValidationOutcome failed(List<FieldViolation> errors) {
        if (errors.isEmpty()) throw new IllegalArgumentException("a failed outcome needs at least one violation");
        return new ValidationOutcome(false, errors, null);
    }

    public boolean valid() { return valid; }
    public List<FieldViolation> errors() { return errors; }
    public Optional<Batch> passedData() { return Optional.ofNullable(passedData); }

    /** Rule class that stopped validation, or empty when the batch passed. */
    public Optional<RuleClass> failedRule() {
        return errors.isEmpty() ? Optional.empty() : Optional.of(errors.get(0).rule());
    }

    @Override
    public String toString() {
        return valid ? "ValidationOutcome{valid}" : "ValidationOutcome{invalid, errors=" + errors.size() + '}';
    }
}
