package io.tradeload.core;

import java.util.List;

/** Output of the coercer; input of the upsert engine. */
public record CoercedBatch(String entityName, List<String> columns, List<TypedRow> rows) {
    public CoercedBatch {
        columns = List.copyOf(columns);
        rows = List.copyOf(rows);
    }

    public int size() { return rows.size(); }
    public boolean isEmpty() { return rows.isEmpty(); }
}
