package io.tradeload.store;

import java.util.Collection;
import java.util.List;
import java.util.Set;

/**
 * One connected session against the persistent store, owned by the orchestrator for a run. Every
 * operation participates in the session's current transaction until {@link #commit()} or
 * {@link #rollback()}. Failures surface as {@link io.tradeload.error.StoreException}.
 *
 * <p>Key values are compared in their canonical string form (see
 * {@link io.tradeload.coerce.LooseValues#keyOf(Object)}).
 */
public interface StoreSession extends AutoCloseable {
    /** Subset of {@code keyValues} that already has a row in {@code table}. */
    Set<String> existingKeys(String table, String keyColumn, Collection<?> keyValues);

    /**
     * Overwrites every non-key column of the row matching each input row's key.
     *
     * @param rows values positioned like {@code columns}, which must include {@code keyColumn}
     * @return rows affected, per input row
     */
    int[] updateByKey(String table, String keyColumn, List<String> columns, List<Object[]> rows);

    /** Inserts full rows; values positioned like {@code columns}. */
    int[] insert(String table, List<String> columns, List<Object[]> rows);

    /** Every committed key value of {@code table}. */
    Set<String> listKeys(String table, String keyColumn);

    void commit();

    void rollback();

    @Override
    void close();
}
