package io.tradeload.store;

import io.tradeload.coerce.LooseValues;
import io.tradeload.core.CoercedBatch;
import io.tradeload.core.TypedRow;
import io.tradeload.error.StoreException;
import io.tradeload.error.UpsertException;
import io.tradeload.error.UpsertException.Phase;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Statement;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Applies a coerced batch with an update pass followed by an insert pass instead of a single
 * insert-or-update statement. The update pass only touches rows whose key already exists; the insert
 * pass re-checks non-existence against the table and adds the remaining rows. Both passes run in one
 * transaction: any failure rolls back the whole batch.
 *
 * <p>Upserts are serialized across the engine so two entity types never write concurrently.
 */
public class UpsertEngine {
    private static final Logger log = LoggerFactory.getLogger(UpsertEngine.class);

    private final ReentrantLock writeLock = new ReentrantLock();

    public UpsertResult upsert(StoreSession session, CoercedBatch batch, String tableName, String conflictKey, List<String> columns) {
        int attempted = batch.size();
        if (attempted == 0) return new UpsertResult(0, 0, 0, null);

        Map<String, TypedRow> staged;
        try {
            staged = stage(batch, conflictKey, columns);
        } catch (UpsertException e) {
            return UpsertResult.failed(attempted, e);
        }

        writeLock.lock();
        Phase phase = Phase.UPDATE;
        try {
            int updated = updatePhase(session, staged, tableName, conflictKey, columns);
            phase = Phase.INSERT;
            int inserted = insertPhase(session, staged, tableName, conflictKey, columns);
            if (updated + inserted < attempted) {
                throw new UpsertException(Phase.INSERT, (attempted - updated - inserted)
                        + " row(s) of " + tableName + " were neither updated nor inserted; the table changed during the upsert");
            }
            phase = Phase.COMMIT;
            session.commit();
            log.debug("upsert into {}: attempted={} updated={} inserted={}", tableName, attempted, updated, inserted);
            return new UpsertResult(attempted, updated, inserted, null);
        } catch (UpsertException e) {
            rollback(session, e);
            return UpsertResult.failed(attempted, e);
        } catch (StoreException e) {
            UpsertException failure = new UpsertException(phase, e.getMessage() + causeDetail(e), e);
            rollback(session, failure);
            return UpsertResult.failed(attempted, failure);
        } finally {
            writeLock.unlock();
        }
    }

    private static Map<String, TypedRow> stage(CoercedBatch batch, String conflictKey, List<String> columns) {
        if (!columns.contains(conflictKey)) {
            throw new UpsertException(Phase.STAGING, "conflict key '" + conflictKey + "' is not among columns " + columns);
        }
        Map<String, TypedRow> staged = new LinkedHashMap<>();
        for (TypedRow row : batch.rows()) {
            String key = LooseValues.keyOf(row.get(conflictKey));
            if (key == null) throw new UpsertException(Phase.STAGING, "row " + row.index() + " has no value for " + conflictKey);
            TypedRow previous = staged.putIfAbsent(key, row);
            if (previous != null) {
                throw new UpsertException(Phase.STAGING, "duplicate " + conflictKey + " '" + key + "' at rows " + previous.index() + " and " + row.index());
            }
        }
        return staged;
    }

    private static int updatePhase(StoreSession session, Map<String, TypedRow> staged, String table, String conflictKey, List<String> columns) {
        Set<String> existing = session.existingKeys(table, conflictKey, keyValues(staged, conflictKey));
        List<Object[]> rows = new ArrayList<>();
        for (Map.Entry<String, TypedRow> e : staged.entrySet()) {
            if (existing.contains(e.getKey())) rows.add(e.getValue().project(columns));
        }
        if (rows.isEmpty()) return 0;
        if (columns.size() == 1) return rows.size(); // key-only table, nothing to overwrite
        int updated = 0;
        for (int count : session.updateByKey(table, conflictKey, columns, rows)) {
            if (count > 0 || count == Statement.SUCCESS_NO_INFO) updated++;
        }
        return updated;
    }

    private static int insertPhase(StoreSession session, Map<String, TypedRow> staged, String table, String conflictKey, List<String> columns) {
        Set<String> present = session.existingKeys(table, conflictKey, keyValues(staged, conflictKey));
        List<Object[]> rows = new ArrayList<>();
        for (Map.Entry<String, TypedRow> e : staged.entrySet()) {
            if (!present.contains(e.getKey())) rows.add(e.getValue().project(columns));
        }
        if (rows.isEmpty()) return 0;
        session.insert(table, columns, rows);
        return rows.size();
    }

    private static List<Object> keyValues(Map<String, TypedRow> staged, String conflictKey) {
        List<Object> out = new ArrayList<>(staged.size());
        for (TypedRow row : staged.values()) out.add(row.get(conflictKey));
        return out;
    }

    private static String causeDetail(StoreException e) {
        return e.getCause() == null ? "" : " (" + e.getCause().getMessage() + ")";
    }

    private static void rollback(StoreSession session, Exception failure) {
        try {
            session.rollback();
        } catch (StoreException re) {
            log.warn("rollback after failed upsert also failed: {}", re.getMessage());
            failure.addSuppressed(re);
        }
    }
}
