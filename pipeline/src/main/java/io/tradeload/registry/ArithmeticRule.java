package io.tradeload.registry;

import java.math.BigDecimal;
import java.util.List;
import java.util.function.Function;

/**
 * Cross-field invariant of the form {@code target = a + b + ...} or {@code target = a * b * ...}.
 */
public final class ArithmeticRule {
    public enum Operation { SUM, PRODUCT }

    private final String target;
    private final Operation operation;
    private final List<String> operands;

    private ArithmeticRule(String target, Operation operation, List<String> operands) {
        this.target = target;
        this.operation = operation;
        this.operands = List.copyOf(operands);
    }

    public static ArithmeticRule sum(String target, String... operands) { return new ArithmeticRule(target, Operation.SUM, List.of(operands)); }
    public static ArithmeticRule product(String target, String... operands) { return new ArithmeticRule(target, Operation.PRODUCT, List.of(operands)); }

    public String target() { return target; }
    public Operation operation() { return operation; }
    public List<String> operands() { return operands; }

    /** Computes the expected target value from the operand values supplied by {@code values}. */
    public BigDecimal expected(Function<String, BigDecimal> values) {
        BigDecimal acc = operation == Operation.SUM ? BigDecimal.ZERO : BigDecimal.ONE;
        for (String op : operands) {
            BigDecimal v = values.apply(op);
            acc = operation == Operation.SUM ? acc.add(v) : acc.multiply(v);
        }
        return acc;
    }

    public String expression() {
        return String.join(operation == Operation.SUM ? " + " : " * ", operands);
    }

    @Override
    public String toString() { return target + " = " + expression(); }
}
