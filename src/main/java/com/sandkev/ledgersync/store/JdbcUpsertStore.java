package com.sandkev.ledgersync.store;

import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Batch upsert by natural key using H2 {@code MERGE INTO ... KEY (...)}: rows whose key
 * exists are replaced whole, others inserted. One transaction per batch; within a batch
 * a later row with the same key wins.
 */
@Repository
public class JdbcUpsertStore {

    private static final Pattern IDENT = Pattern.compile("[A-Za-z_][A-Za-z0-9_]*");

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public JdbcUpsertStore(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    public int upsert(String table, List<String> columns, List<String> keyColumns, List<Object[]> rows) {
        if (rows.isEmpty()) return 0;
        if (!columns.containsAll(keyColumns)) {
            throw new IllegalArgumentException("key columns " + keyColumns + " not all in " + columns);
        }
        String sql = mergeSql(table, columns, keyColumns);
        Integer n = tx.execute(status -> {
            jdbc.batchUpdate(sql, rows);
            return rows.size();
        });
        return n == null ? 0 : n;
    }

    static String mergeSql(String table, List<String> columns, List<String> keyColumns) {
        ident(table);
        columns.forEach(JdbcUpsertStore::ident);
        keyColumns.forEach(JdbcUpsertStore::ident);
        return "merge into " + table + " (" + String.join(", ", columns) + ")"
                + " key (" + String.join(", ", keyColumns) + ")"
                + " values (" + String.join(", ", Collections.nCopies(columns.size(), "?")) + ")";
    }

    private static void ident(String s) {
        if (s == null || !IDENT.matcher(s).matches()) {
            throw new IllegalArgumentException("Illegal SQL identifier: " + s);
        }
    }
}
