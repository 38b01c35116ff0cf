package io.tradeload.coerce;

import io.tradeload.core.Batch;
import io.tradeload.core.CoercedBatch;
import io.tradeload.core.Row;
import io.tradeload.core.TypedRow;
import io.tradeload.error.CoercionException;
import io.tradeload.registry.ColumnDescriptor;
import io.tradeload.registry.EntityDescriptor;
import io.tradeload.registry.EntityRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.DateTimeException;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Converts validated batches into the physical types declared by the registry. Values whose runtime
 * type already matches the column are passed through untouched; decimals are rounded half away from
 * zero to the column scale.
 */
public class TypeCoercer {
    private static final Logger log = LoggerFactory.getLogger(TypeCoercer.class);

    private final EntityRegistry registry;

    public TypeCoercer(EntityRegistry registry) {
        this.registry = Objects.requireNonNull(registry);
    }

    public CoercedBatch coerce(String entityName, Batch batch) {
        EntityDescriptor entity = registry.lookup(entityName);
        List<ColumnDescriptor> columns = entity.columns();
        List<String> names = entity.columnNames();
        List<TypedRow> out = new ArrayList<>(batch.size());
        int passedThrough = 0;
        for (Row row : batch.rows()) {
            Object[] values = new Object[columns.size()];
            for (int i = 0; i < values.length; i++) {
                ColumnDescriptor c = columns.get(i);
                Object raw = row.get(c.name());
                if (isAlreadyTyped(c, raw)) {
                    values[i] = raw;
                    passedThrough++;
                } else {
                    values[i] = convert(c, raw, row.index());
                }
            }
            out.add(new TypedRow(row.index(), names, values));
        }
        log.debug("coerced {} rows of '{}' ({} values already typed)", out.size(), entityName, passedThrough);
        return new CoercedBatch(entityName, names, out);
    }

    private static boolean isAlreadyTyped(ColumnDescriptor c, Object raw) {
        if (raw == null || !c.type().javaType().isInstance(raw)) return false;
        // a decimal at a different scale still needs rounding
        return !(raw instanceof BigDecimal d) || d.scale() == c.scale();
    }

    Object convert(ColumnDescriptor c, Object raw, int rowIndex) {
        if (LooseValues.isMissing(raw)) {
            if (c.nullable()) return null;
            throw new CoercionException(c.name(), rowIndex, "missing value for non-nullable " + c.type() + " column", null);
        }
        try {
            switch (c.type()) {
                case STRING:
                    return raw instanceof BigDecimal d ? d.toPlainString() : raw.toString();
                case INT32:
                    return Math.toIntExact(LooseValues.toLong(raw));
                case INT64:
                    return LooseValues.toLong(raw);
                case DECIMAL:
                    BigDecimal parsed = LooseValues.toDecimal(raw);
                    String bounds = LooseValues.decimalBoundsProblem(parsed, c.precision(), c.scale());
                    if (bounds != null) throw new CoercionException(c.name(), rowIndex, "'" + raw + "' " + bounds, null);
                    BigDecimal scaled = parsed.setScale(c.scale(), RoundingMode.HALF_UP);
                    if (scaled.precision() > c.precision()) {
                        throw new CoercionException(c.name(), rowIndex, scaled.toPlainString() + " exceeds DECIMAL(" + c.precision() + "," + c.scale() + ")", null);
                    }
                    return scaled;
                case TIMESTAMP:
                    return LooseValues.toTimestamp(raw, c.formatter());
                default:
                    throw new IllegalStateException("unhandled column type " + c.type());
            }
        } catch (NumberFormatException | ArithmeticException | DateTimeException e) {
            throw new CoercionException(c.name(), rowIndex, "'" + raw + "' is not a valid " + c.type() + " value", e);
        }
    }
}
