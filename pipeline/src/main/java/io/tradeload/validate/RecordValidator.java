package io.tradeload.validate;

import io.tradeload.coerce.LooseValues;
import io.tradeload.core.Batch;
import io.tradeload.core.Row;
import io.tradeload.registry.ArithmeticRule;
import io.tradeload.registry.ColumnDescriptor;
import io.tradeload.registry.ColumnType;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;
import io.tradeload.registry.ValueKind;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Checks a batch against its entity's presence, type/range, cross-field and referential rules, in
 * that order. The first rule class with any violation fails the entire batch; violations are reported
 * in row order, and within a row in column order.
 *
 * <p>Rows are independent of each other, so with {@code parallel} enabled each rule class is
 * evaluated on a parallel stream. Results are identical either way.
 */
public class RecordValidator {
    private static final Logger log = LoggerFactory.getLogger(RecordValidator.class);

    public static final BigDecimal DEFAULT_TOLERANCE = new BigDecimal("0.01");

    private final EntityRegistry registry;
    private final BigDecimal tolerance;
    private final boolean parallel;

    public RecordValidator(EntityRegistry registry) { this(registry, DEFAULT_TOLERANCE, false); }

    public RecordValidator(EntityRegistry registry, BigDecimal tolerance, boolean parallel) {
        this.registry = Objects.requireNonNull(registry);
        if (tolerance.signum() < 0) throw new IllegalArgumentException("tolerance must be non-negative");
        this.tolerance = tolerance;
        this.parallel = parallel;
    }

    public BigDecimal tolerance() { return tolerance; }

    public ValidationOutcome validate(String entityName, Batch batch) {
        return validate(entityName, batch, null);
    }

    /**
     * @param parentKeys conflict-key values already committed for the parent entity; required when the
     *                   entity declares a parent, ignored otherwise
     */
    public ValidationOutcome validate(String entityName, Batch batch, Set<String> parentKeys) {
        EntityDescriptor entity = registry.lookup(entityName);
        boolean dependent = entity.parentEntity().isPresent();
        if (dependent && parentKeys == null) {
            log.warn("no parent keys supplied for dependent entity '{}'; every reference will fail", entityName);
        }
        Set<String> keys = parentKeys == null ? Set.of() : parentKeys;

        for (RuleClass rule : RuleClass.values()) {
            if (rule == RuleClass.REFERENTIAL && !dependent) continue;
            List<FieldViolation> violations = evaluate(batch, row -> check(rule, entity, row, keys));
            if (!violations.isEmpty()) {
                log.info("validation of {} '{}' rows failed at {}: {} violation(s)", batch.size(), entityName, rule, violations.size());
                return ValidationOutcome.failed(violations);
            }
        }
        log.info("validated {} '{}' rows", batch.size(), entityName);
        return ValidationOutcome.passed(batch);
    }

    private List<FieldViolation> evaluate(Batch batch, Function<Row, List<FieldViolation>> check) {
        Stream<Row> rows = parallel ? batch.rows().parallelStream() : batch.rows().stream();
        return rows.map(check).flatMap(List::stream).collect(Collectors.toList());
    }

    private List<FieldViolation> check(RuleClass rule, EntityDescriptor entity, Row row, Set<String> parentKeys) {
        return switch (rule) {
            case PRESENCE -> presence(entity, row);
            case TYPE_RANGE -> typeRange(entity, row);
            case CROSS_FIELD -> crossField(entity, row);
            case REFERENTIAL -> referential(entity, row, parentKeys);
        };
    }

    private static List<FieldViolation> presence(EntityDescriptor entity, Row row) {
        List<FieldViolation> out = new ArrayList<>(0);
        for (ColumnDescriptor c : entity.columns()) {
            if (!c.nullable() && LooseValues.isMissing(row.get(c.name()))) {
                out.add(new FieldViolation(row.index(), c.name(), RuleClass.PRESENCE, "required value is missing"));
            }
        }
        return out;
    }

    private static List<FieldViolation> typeRange(EntityDescriptor entity, Row row) {
        List<FieldViolation> out = new ArrayList<>(0);
        for (ColumnDescriptor c : entity.columns()) {
            Object v = row.get(c.name());
            if (LooseValues.isMissing(v)) continue;
            String problem = typeRangeProblem(c, v);
            if (problem != null) out.add(new FieldViolation(row.index(), c.name(), RuleClass.TYPE_RANGE, problem));
        }
        return out;
    }

    private static String typeRangeProblem(ColumnDescriptor c, Object v) {
        switch (c.type()) {
            case STRING: {
                int len = v.toString().length();
                return c.maxLength() > 0 && len > c.maxLength() ? "length " + len + " exceeds " + c.maxLength() : null;
            }
            case INT32:
            case INT64: {
                long n;
                try {
                    n = LooseValues.toLong(v);
                } catch (NumberFormatException e) {
                    return "'" + v + "' is not an integer";
                }
                if (c.type() == ColumnType.INT32 && (n < Integer.MIN_VALUE || n > Integer.MAX_VALUE)) return n + " does not fit a 32-bit integer";
                if (c.kind() == ValueKind.QUANTITY && n <= 0) return "quantity must be a positive integer, got " + n;
                if (c.kind() == ValueKind.ENUMERATED && !c.allowedValues().contains(n)) return n + " is not one of " + c.allowedValues();
                return null;
            }
            case DECIMAL: {
                BigDecimal d;
                try {
                    d = LooseValues.toDecimal(v);
                } catch (NumberFormatException e) {
                    return "'" + v + "' is not a decimal number";
                }
                String bounds = LooseValues.decimalBoundsProblem(d, c.precision(), c.scale());
                if (bounds != null) return "'" + v + "' " + bounds;
                return c.kind() == ValueKind.MONETARY && d.signum() < 0 ? "monetary amount must be non-negative, got " + d.toPlainString() : null;
            }
            case TIMESTAMP: {
                try {
                    LooseValues.toTimestamp(v, c.formatter());
                    return null;
                } catch (DateTimeException e) {
                    return "'" + v + "' does not match timestamp format '" + c.format() + "'";
                }
            }
            default:
                return null;
        }
    }

    private List<FieldViolation> crossField(EntityDescriptor entity, Row row) {
        List<FieldViolation> out = new ArrayList<>(0);
        for (ArithmeticRule r : entity.crossFieldRules()) {
            if (LooseValues.isMissing(row.get(r.target())) || r.operands().stream().anyMatch(op -> LooseValues.isMissing(row.get(op)))) {
                continue;
            }
            BigDecimal actual = LooseValues.toDecimal(row.get(r.target()));
            BigDecimal expected = r.expected(op -> LooseValues.toDecimal(row.get(op)));
            BigDecimal discrepancy = actual.subtract(expected).abs();
            if (discrepancy.compareTo(tolerance) > 0) {
                out.add(new FieldViolation(row.index(), r.target(), RuleClass.CROSS_FIELD,
                        r.target() + " " + actual.toPlainString() + " does not equal " + r.expression() + " = " + expected.toPlainString()
                                + " (discrepancy " + discrepancy.toPlainString() + ", tolerance " + tolerance.toPlainString() + ")"));
            }
        }
        return out;
    }

    private static List<FieldViolation> referential(EntityDescriptor entity, Row row, Set<String> parentKeys) {
        String column = entity.parentKeyColumn();
        String key = LooseValues.keyOf(row.get(column));
        if (parentKeys.contains(key)) return List.of();
        return List.of(new FieldViolation(row.index(), column, RuleClass.REFERENTIAL,
                "'" + key + "' not found among loaded '" + entity.parentEntity().orElse("?") + "' keys (" + entity.referencedKeyColumn() + ")"));
    }
}
