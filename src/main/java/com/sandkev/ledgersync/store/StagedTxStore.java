package com.sandkev.ledgersync.store;

import com.sandkev.ledgersync.domain.CanonicalTx;
import com.sandkev.ledgersync.domain.Domain;
import com.sandkev.ledgersync.domain.NaturalKey;
import com.sandkev.ledgersync.domain.TxAction;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.stereotype.Repository;

import java.sql.Timestamp;
import java.time.YearMonth;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Per-domain staged tables ({@code staged_exchange_tx}, {@code staged_onchain_tx}) keyed by
 * (source, external_id, log_index). Invalid records are logged and skipped before the write.
 */
@Slf4j
@Repository
@RequiredArgsConstructor
public class StagedTxStore {

    static final List<String> COLUMNS = List.of(
            "source", "external_id", "log_index", "occurred_at", "tx_year", "tx_month",
            "base_asset", "quote_asset", "action", "amount", "price", "fee_asset", "fee_amount",
            "counterparty_from", "counterparty_to", "chain", "raw_payload");

    private static final String SELECT = """
            select source, external_id, log_index, occurred_at, base_asset, quote_asset, action, amount, price,
                   fee_asset, fee_amount, counterparty_from, counterparty_to, chain, raw_payload
            from %s
            """;

    private final JdbcUpsertStore upserts;
    private final JdbcTemplate jdbc;
    private final CanonicalTxValidator validator;

    public UpsertReport upsert(List<CanonicalTx> records) {
        UpsertReport total = UpsertReport.EMPTY;
        for (Domain domain : Domain.values()) {
            List<CanonicalTx> ofDomain = records.stream().filter(r -> r.domain() == domain).toList();
            if (!ofDomain.isEmpty()) total = total.plus(upsert(domain, ofDomain));
        }
        int noDomain = (int) records.stream().filter(r -> r.domain() == null).count();
        if (noDomain > 0) {
            log.warn("Skipping {} record(s) without domain", noDomain);
            total = total.plus(new UpsertReport(0, noDomain));
        }
        return total;
    }

    public UpsertReport upsert(Domain domain, List<CanonicalTx> records) {
        List<Object[]> rows = new ArrayList<>(records.size());
        int skipped = 0;
        for (CanonicalTx tx : records) {
            var problem = validator.violation(tx);
            if (problem.isEmpty() && tx.domain() != domain) {
                problem = Optional.of("domain " + tx.domain() + " routed to " + domain);
            }
            if (problem.isPresent()) {
                skipped++;
                log.warn("[{}] skipping invalid record {}: {}", tx.source(), tx.externalId(), problem.get());
                continue;
            }
            rows.add(toRow(tx));
        }
        int n = upserts.upsert(domain.stagedTable(), COLUMNS, NaturalKey.COLUMNS, rows);
        log.debug("Upserted {} row(s) into {} ({} skipped)", n, domain.stagedTable(), skipped);
        return new UpsertReport(n, skipped);
    }

    public List<CanonicalTx> findAll(Domain domain) {
        return jdbc.query(SELECT.formatted(domain.stagedTable()) + " order by occurred_at, source, external_id, log_index",
                mapper(domain));
    }

    public List<CanonicalTx> findBySource(Domain domain, String source) {
        return jdbc.query(SELECT.formatted(domain.stagedTable())
                        + " where source = ? order by occurred_at, external_id, log_index",
                mapper(domain), source);
    }

    public List<CanonicalTx> findByPeriod(Domain domain, String source, YearMonth period) {
        return jdbc.query(SELECT.formatted(domain.stagedTable())
                        + " where source = ? and tx_year = ? and tx_month = ? order by occurred_at, external_id, log_index",
                mapper(domain), source, period.getYear(), period.getMonthValue());
    }

    public long count(Domain domain) {
        Long n = jdbc.queryForObject("select count(*) from " + domain.stagedTable(), Long.class);
        return n == null ? 0 : n;
    }

    public long countDistinctKeys(Domain domain) {
        Long n = jdbc.queryForObject("""
            select count(*) from (select distinct source, external_id, log_index from %s)
        """.formatted(domain.stagedTable()), Long.class);
        return n == null ? 0 : n;
    }

    private static Object[] toRow(CanonicalTx tx) {
        return new Object[]{
                tx.source(), tx.externalId(), tx.logIndex(), Timestamp.from(tx.occurredAt()), tx.year(), tx.month(),
                nullToEmpty(tx.baseAsset()), tx.quoteAsset(), tx.action().code(), tx.amount(), tx.price(),
                tx.feeAsset(), tx.feeAmount(), tx.counterpartyFrom(), tx.counterpartyTo(), tx.chain(), tx.rawPayload()
        };
    }

    private static String nullToEmpty(String s) { return s == null ? "" : s; }

    private static RowMapper<CanonicalTx> mapper(Domain domain) {
        return (rs, i) -> CanonicalTx.builder()
                .domain(domain)
                .source(rs.getString("source"))
                .externalId(rs.getString("external_id"))
                .logIndex(rs.getInt("log_index"))
                .occurredAt(rs.getTimestamp("occurred_at").toInstant())
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
    }
}
