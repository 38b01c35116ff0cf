package io.tradeload.core;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One loosely-typed record of a batch: column name to string, number or null. The index is the
 * row's position in the source batch and is what diagnostics refer to.
 */
public final class Row {
    private final int index;
    private final Map<String, Object> values;

    public Row(int index, Map<String, ?> values) {
        this.index = index;
        this.values = new LinkedHashMap<>(values);
    }

    public int index() { return index; }
    public Object get(String column) { return values.get(column); }
    public void put(String column, Object value) { values.put(column, value); }
    public Map<String, Object> values() { return Collections.unmodifiableMap(values); }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Row that)) return false;
        return index == that.index && Objects.equals(values, that.values);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, values);
    }

    @Override
    public String toString() {
        return "Row{" +
                "index=" + index +
                ", values=" + values +
                '}';
    }
}
