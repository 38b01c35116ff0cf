package io.tradeload.core;

import java.math.BigDecimal;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.List;

/**
 * A coerced record: values in physical types, positioned exactly like the entity's column list.
 */
public final class TypedRow {
    private final int index;
    private final List<String> columns;
    private final Object[] values;

    public TypedRow(int index, List<String> columns, Object[] values) {
        if (columns.size() != values.length) throw new IllegalArgumentException("expected " + columns.size() + " values, got " + values.length);
        this.index = index;
        this.columns = columns;
        this.values = values.clone();
    }

    public int index() { return index; }
    public List<String> columns() { return columns; }

    public Object get(String column) {
        int i = columns.indexOf(column);
        if (i < 0) throw new IllegalArgumentException("no column '" + column + "'");
        return values[i];
    }

    public String getString(String column) { return (String) get(column); }
    public BigDecimal getDecimal(String column) { return (BigDecimal) get(column); }
    public OffsetDateTime getTimestamp(String column) { return (OffsetDateTime) get(column); }

    public Number getNumber(String column) { return (Number) get(column); }

    /** Values restricted to {@code subset}, in the subset's order. */
    public Object[] project(List<String> subset) {
        Object[] out = new Object[subset.size()];
        for (int i = 0; i < out.length; i++) out[i] = get(subset.get(i));
        return out;
    }

    @Override
    public String toString() { return "TypedRow{index=" + index + ", values=" + Arrays.toString(values) + '}'; }
}
