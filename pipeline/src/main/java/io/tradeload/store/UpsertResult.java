package io.tradeload.store;

import io.tradeload.error.UpsertException;

import java.util.Optional;

/**
 * Outcome of one upsert. {@code updatedRows + insertedRows} never exceeds {@code attemptedRows}; a
 * failed upsert reports zero written rows because its transaction was rolled back.
 */
public record UpsertResult(int attemptedRows, int updatedRows, int insertedRows, UpsertException failure) {
    public UpsertResult {
        if (updatedRows < 0 || insertedRows < 0 || updatedRows + insertedRows > attemptedRows) {
            throw new IllegalArgumentException("inconsistent counts: attempted=" + attemptedRows + " updated=" + updatedRows + " inserted=" + insertedRows);
        }
    }

    public static UpsertResult failed(int attemptedRows, UpsertException failure) {
        return new UpsertResult(attemptedRows, 0, 0, failure);
    }

    public Optional<UpsertException> error() { return Optional.ofNullable(failure); }
    public boolean success() { return failure == null; }
    public int rowsLoaded() { return updatedRows + insertedRows; }
}
