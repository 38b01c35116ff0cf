package io.tradeload.store;

import io.tradeload.coerce.LooseValues;
import io.tradeload.error.StoreException;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * JDBC store session over a single connection with auto-commit off. Statements are plain
 * UPDATE / INSERT / SELECT so any relational store works, including ones without a native upsert.
 */
public class JdbcStoreSession implements StoreSession {
    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*(\\.[A-Za-z_][A-Za-z0-9_]*)?");
    static final int KEY_CHUNK = 500;

    private final Connection connection;

    public JdbcStoreSession(Connection connection) {
        this.connection = connection;
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            throw new StoreException("cannot disable auto-commit", e);
        }
    }

    @Override
    public Set<String> existingKeys(String table, String keyColumn, Collection<?> keyValues) {
        checkIdentifiers(table, keyColumn);
        Set<String> found = new HashSet<>();
        List<?> all = new ArrayList<>(keyValues);
        for (int from = 0; from < all.size(); from += KEY_CHUNK) {
            List<?> chunk = all.subList(from, Math.min(all.size(), from + KEY_CHUNK));
            String marks = chunk.stream().map(k -> "?").collect(Collectors.joining(", "));
            String sql = "SELECT " + keyColumn + " FROM " + table + " WHERE " + keyColumn + " IN (" + marks + ")";
            try (PreparedStatement ps = connection.prepareStatement(sql)) {
                for (int i = 0; i < chunk.size(); i++) bind(ps, i + 1, chunk.get(i));
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) found.add(LooseValues.keyOf(rs.getObject(1)));
                }
            } catch (SQLException e) {
                throw new StoreException("existence check on " + table + "." + keyColumn + " failed", e);
            }
        }
        return found;
    }

    @Override
    public int[] updateByKey(String table, String keyColumn, List<String> columns, List<Object[]> rows) {
        checkIdentifiers(table, keyColumn);
        checkIdentifiers(columns.toArray(new String[0]));
        int keyPos = columns.indexOf(keyColumn);
        if (keyPos < 0) throw new IllegalArgumentException("columns " + columns + " do not include key " + keyColumn);
        List<Integer> setPositions = new ArrayList<>();
        List<String> assignments = new ArrayList<>();
        for (int i = 0; i < columns.size(); i++) {
            if (i == keyPos) continue;
            setPositions.add(i);
            assignments.add(columns.get(i) + " = ?");
        }
        if (setPositions.isEmpty()) throw new IllegalArgumentException("nothing to update besides key " + keyColumn);
        String sql = "UPDATE " + table + " SET " + String.join(", ", assignments) + " WHERE " + keyColumn + " = ?";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Object[] row : rows) {
                int p = 1;
                for (int pos : setPositions) bind(ps, p++, row[pos]);
                bind(ps, p, row[keyPos]);
                ps.addBatch();
            }
            return ps.executeBatch();
        } catch (SQLException e) {
            throw new StoreException("update of " + table + " failed", e);
        }
    }

    @Override
    public int[] insert(String table, List<String> columns, List<Object[]> rows) {
        checkIdentifiers(table);
        checkIdentifiers(columns.toArray(new String[0]));
        String marks = columns.stream().map(c -> "?").collect(Collectors.joining(", "));
        String sql = "INSERT INTO " + table + " (" + String.join(", ", columns) + ") VALUES (" + marks + ")";
        try (PreparedStatement ps = connection.prepareStatement(sql)) {
            for (Object[] row : rows) {
                for (int i = 0; i < row.length; i++) bind(ps, i + 1, row[i]);
                ps.addBatch();
            }
            return ps.executeBatch();
        } catch (SQLException e) {
            throw new StoreException("insert into " + table + " failed", e);
        }
    }

    @Override
    public Set<String> listKeys(String table, String keyColumn) {
        checkIdentifiers(table, keyColumn);
        Set<String> keys = new HashSet<>();
        try (PreparedStatement ps = connection.prepareStatement("SELECT DISTINCT " + keyColumn + " FROM " + table);
             ResultSet rs = ps.executeQuery()) {
            while (rs.next()) keys.add(LooseValues.keyOf(rs.getObject(1)));
        } catch (SQLException e) {
            throw new StoreException("listing " + table + "." + keyColumn + " failed", e);
        }
        return keys;
    }

    @Override
    public void commit() {
        try {
            connection.commit();
        } catch (SQLException e) {
            throw new StoreException("commit failed", e);
        }
    }

    @Override
    public void rollback() {
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw new StoreException("rollback failed", e);
        }
    }

    @Override
    public void close() {
        try {
            connection.close();
        } catch (SQLException e) {
            throw new StoreException("closing connection failed", e);
        }
    }

    private static void bind(PreparedStatement ps, int index, Object value) throws SQLException {
        if (value == null) ps.setNull(index, Types.NULL);
        else ps.setObject(index, value);
    }

    private static void checkIdentifiers(String... names) {
        for (String n : names) {
            if (n == null || !IDENTIFIER.matcher(n).matches()) throw new IllegalArgumentException("not a plain SQL identifier: " + n);
        }
    }
}
