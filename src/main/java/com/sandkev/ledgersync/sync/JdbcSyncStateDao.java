package com.sandkev.ledgersync.sync;

import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.domain.SyncWatermark;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.Instant;
import java.util.List;
import java.util.Optional;

@Repository
public class JdbcSyncStateDao implements SyncStateDao {

    private static final RowMapper<SyncWatermark> ROW = (rs, i) -> new SyncWatermark(
            rs.getString("source"),
            toInstant(rs.getTimestamp("last_sync_at")),
            rs.getInt("last_run_record_count"),
            RunStatus.valueOf(rs.getString("last_run_status")),
            rs.getString("last_error"),
            toInstant(rs.getTimestamp("updated_at")));

    private final JdbcTemplate jdbc;

    public JdbcSyncStateDao(JdbcTemplate jdbc) { this.jdbc = jdbc; }

    @Override
    public Optional<SyncWatermark> find(String source) {
        var list = jdbc.query("""
            select source, last_sync_at, last_run_record_count, last_run_status, last_error, updated_at
            from sync_state where source = ?
        """, ROW, source);
        return list.isEmpty() ? Optional.empty() : Optional.of(list.get(0));
    }

    @Override
    public void save(SyncWatermark w) {
        jdbc.update("""
            merge into sync_state (source, last_sync_at, last_run_record_count, last_run_status, last_error, updated_at)
            key (source)
            values (?, ?, ?, ?, ?, ?)
        """,
                w.source(),
                w.lastSyncAt() == null ? null : Timestamp.from(w.lastSyncAt()),
                w.lastRunRecordCount(),
                w.lastRunStatus().name(),
                w.lastError(),
                Timestamp.from(w.updatedAt()));
    }

    @Override
    public List<SyncWatermark> findAll() {
        return jdbc.query("""
            select source, last_sync_at, last_run_record_count, last_run_status, last_error, updated_at
            from sync_state order by source
        """, ROW);
    }

    private static Instant toInstant(Timestamp ts) {
        return ts == null ? null : ts.toInstant();
    }
}
