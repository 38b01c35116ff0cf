package io.tradeload.validate;

/** One failed rule for one row and field. */
public record FieldViolation(int rowIndex, String field, RuleClass rule, String message) {
    @Override
    public String toString() {
        return "row " + rowIndex + ", field " + field + ": " + message;
    }
}
