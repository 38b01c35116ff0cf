package io.tradeload.core;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Ordered, same-shaped records of one entity type, processed as a unit.
 */
public final class Batch {
    private final String entityName;
    private final List<Row> rows;

    private Batch(String entityName, List<Row> rows) {
        this.entityName = entityName;
        this.rows = rows;
    }

    /** Builds a batch from raw records, numbering rows from zero. All records must share one column set. */
    public static Batch of(String entityName, List<? extends Map<String, ?>> records) {
        List<Row> rows = new ArrayList<>(records.size());
        Set<String> shape = null;
        for (Map<String, ?> r : records) {
            if (shape == null) {
                shape = r.keySet();
            } else if (!shape.equals(r.keySet())) {
                throw new IllegalArgumentException("record " + rows.size() + " of '" + entityName + "' has columns "
                        + r.keySet() + ", expected " + shape);
            }
            rows.add(new Row(rows.size(), r));
        }
        return new Batch(entityName, rows);
    }

    public static Batch empty(String entityName) { return new Batch(entityName, new ArrayList<>()); }

    public String entityName() { return entityName; }
    public List<Row> rows() { return Collections.unmodifiableList(rows); }
    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }

    public Set<String> columns() {
        return rows.isEmpty() ? Set.of() : rows.get(0).values().keySet();
    }

    @Override
    public String toString() { return "Batch{" + entityName + ", rows=" + rows.size() + '}'; }
}
