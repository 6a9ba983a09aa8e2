package com.sandkev.ledgersync.unified;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.TxAction;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.support.TransactionTemplate;

import java.util.ArrayList;
import java.util.List;

/**
 * Read side of the ledger: {@code v_tx_unified} is a plain union of the staged tables, and
 * {@code tx_unified} is its materialized copy, recreated in full by {@link #rebuild()}.
 */
@Slf4j
@Repository
public class UnifiedTxDao {

    private static final String COLUMNS = """
            domain, source, occurred_at, external_id, log_index, base_asset, quote_asset, action, amount, price,
            fee_asset, fee_amount, counterparty_from, counterparty_to, chain, raw_payload, tx_year, tx_month""";

    private static final RowMapper<CanonicalTx> ROW = (rs, i) -> CanonicalTx.builder()
            .domain(Domain.fromCode(rs.getString("domain")))
            .source(rs.getString("source"))
            .occurredAt(rs.getTimestamp("occurred_at").toInstant())
            .externalId(rs.getString("external_id"))
            .logIndex(rs.getInt("log_index"))
            .baseAsset(rs.getString("base_asset"))
            .quoteAsset(rs.getString("quote_asset"))
            .action(TxAction.fromCode(rs.getString("action")))
            .amount(rs.getBigDecimal("amount"))
            .price(rs.getBigDecimal("price"))
            .feeAsset(rs.getString("fee_asset"))
            .feeAmount(rs.getBigDecimal("fee_amount"))
            .counterpartyFrom(rs.getString("counterparty_from"))
            .counterpartyTo(rs.getString("counterparty_to"))
            .chain(rs.getString("chain"))
            .rawPayload(rs.getString("raw_payload"))
            .build();

    private final JdbcTemplate jdbc;
    private final TransactionTemplate tx;

    public UnifiedTxDao(JdbcTemplate jdbc, TransactionTemplate tx) {
        this.jdbc = jdbc;
        this.tx = tx;
    }

    /** Live union of both domains, newest first. */
    public List<CanonicalTx> query(UnifiedFilter f, int limit) {
        var where = Where.of(f);
        List<Object> args = new ArrayList<>(where.args());
        args.add(limit);
        return jdbc.query("select " + COLUMNS + " from v_tx_unified" + where.sql()
                + " order by occurred_at desc, source, external_id, log_index limit ?", ROW, args.toArray());
    }

    /** Recreates {@code tx_unified} from the staged tables in one transaction. */
    public int rebuild() {
        Integer n = tx.execute(status -> {
            jdbc.update("delete from tx_unified");
            return jdbc.update("insert into tx_unified (" + COLUMNS + ") select " + COLUMNS + " from v_tx_unified");
        });
        int rows = n == null ? 0 : n;
        log.info("Rebuilt tx_unified with {} row(s)", rows);
        return rows;
    }

    public long materializedCount() {
        Long n = jdbc.queryForObject("select count(*) from tx_unified", Long.class);
        return n == null ? 0 : n;
    }

    public List<MonthlySummary> monthlySummary(UnifiedFilter f) {
        var where = Where.of(f);
        return jdbc.query("""
            select tx_year, tx_month, domain, source, count(*) as tx_count, coalesce(sum(amount), 0) as total_amount
            from v_tx_unified""" + where.sql() + """
            group by tx_year, tx_month, domain, source
            order by tx_year desc, tx_month desc, domain, source
            """, (rs, i) -> new MonthlySummary(
                rs.getInt("tx_year"), rs.getInt("tx_month"), rs.getString("domain"), rs.getString("source"),
                rs.getLong("tx_count"), rs.getBigDecimal("total_amount")
        ), where.args().toArray());
    }

    public List<QualityCheck> qualityChecks() {
        List<QualityCheck> out = new ArrayList<>();
        for (Domain d : Domain.values()) {
            String table = d.stagedTable();
            Long rows = jdbc.queryForObject("select count(*) from " + table, Long.class);
            Long keys = jdbc.queryForObject(
                    "select count(*) from (select distinct source, external_id, log_index from " + table + ")", Long.class);
            var check = new QualityCheck(table, rows == null ? 0 : rows, keys == null ? 0 : keys);
            if (!check.passed()) {
                log.warn("{} has {} duplicate natural key(s)", table, check.duplicates());
            }
            out.add(check);
        }
        return out;
    }

    /** Only the filters that are set, so no untyped null parameters reach the database. */
    private record Where(String sql, List<Object> args) {

        static Where of(UnifiedFilter f) {
            List<String> clauses = new ArrayList<>();
            List<Object> args = new ArrayList<>();
            if (f.domain() != null) { clauses.add("domain = ?"); args.add(f.domain().code()); }
            if (f.source() != null) {
                // an exchange name also matches its entity-qualified sources (binance -> binance_trades)
                clauses.add("(lower(source) = lower(?) or lower(source) like lower(?) escape '!')");
                args.add(f.source());
                args.add(f.source().replace("!", "!!").replace("%", "!%").replace("_", "!_") + "!_%");
            }
            if (f.chain() != null) { clauses.add("lower(chain) = lower(?)"); args.add(f.chain()); }
            if (f.year() != null) { clauses.add("tx_year = ?"); args.add(f.year()); }
            if (f.month() != null) { clauses.add("tx_month = ?"); args.add(f.month()); }
            String sql = clauses.isEmpty() ? " " : " where " + String.join(" and ", clauses) + " ";
            return new Where(sql, args);
        }
    }
}
