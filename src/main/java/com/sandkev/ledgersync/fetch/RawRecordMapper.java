package com.sandkev.ledgersync.fetch;

import com.sandkev.ledgersync.normalize.RawExchangeTrade;
import com.sandkev.ledgersync.normalize.RawExchangeTransfer;
import com.sandkev.ledgersync.normalize.RawOnchainTx;
import com.sandkev.ledgersync.normalize.RawTokenTransferLog;
import com.sandkev.ledgersync.normalize.TokenApproval;
import com.sandkev.ledgersync.normalize.TokenLeg;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Maps decoded JSON objects (as returned by the provider APIs and the CCXT unified
 * structures) onto the raw record types. Missing fields become nulls; validation is
 * left to the normalizers.
 */
public final class RawRecordMapper {

    private RawRecordMapper() {}

    public static RawExchangeTrade exchangeTrade(Map<String, Object> m) {
        Map<String, Object> fee = map(m.get("fee"));
        return new RawExchangeTrade(
                str(m.get("id")),
                str(m.get("order")),
                m.get("timestamp") != null ? m.get("timestamp") : m.get("datetime"),
                str(m.get("symbol")),
                str(m.get("side")),
                dec(m.get("amount")),
                dec(m.get("price")),
                str(fee.get("currency")),
                dec(fee.get("cost")));
    }

    public static RawExchangeTransfer exchangeTransfer(Map<String, Object> m) {
        Map<String, Object> fee = map(m.get("fee"));
        return new RawExchangeTransfer(
                str(m.get("id")),
                str(m.get("txid")),
                m.get("timestamp") != null ? m.get("timestamp") : m.get("datetime"),
                str(m.get("currency")),
                dec(m.get("amount")),
                str(m.get("address")),
                str(m.get("tag")),
                str(m.get("status")),
                str(fee.get("currency")),
                dec(fee.get("cost")));
    }

    /** DeBank {@code history_list} entry; {@code defaultChain} is used when the row has no chain. */
    public static RawOnchainTx onchainTx(Map<String, Object> m, String defaultChain) {
        Map<String, Object> tx = map(m.get("tx"));
        Map<String, Object> approve = map(m.get("token_approve"));

        List<TokenLeg> sends = new ArrayList<>();
        for (Map<String, Object> s : list(m.get("sends"))) {
            sends.add(new TokenLeg(str(s.get("token_id")), dec(s.get("amount")), str(s.get("to_addr"))));
        }
        List<TokenLeg> receives = new ArrayList<>();
        for (Map<String, Object> r : list(m.get("receives"))) {
            receives.add(new TokenLeg(str(r.get("token_id")), dec(r.get("amount")), str(r.get("from_addr"))));
        }
        TokenApproval approval = approve.isEmpty() ? null
                : new TokenApproval(str(approve.get("token_id")), dec(approve.get("value")), str(approve.get("spender")));

        String chain = str(m.get("chain"));
        return new RawOnchainTx(
                str(m.get("id")),
                m.get("time_at"),
                chain != null ? chain : defaultChain,
                str(m.get("cate_id")),
                Boolean.TRUE.equals(m.get("is_scam")),
                sends,
                receives,
                approval,
                str(tx.get("from_addr")),
                str(tx.get("to_addr")),
                dec(tx.get("eth_gas_fee")));
    }

    public static RawTokenTransferLog tokenTransferLog(Map<String, Object> m) {
        Object value = m.get("value");
        Object block = m.get("blockNumber");
        return new RawTokenTransferLog(
                str(m.get("transactionHash")),
                m.get("logIndex") == null ? null : toInteger(m.get("logIndex")).intValue(),
                str(m.get("address")),
                str(m.get("from")),
                str(m.get("to")),
                value == null ? null : toInteger(value),
                block == null ? null : toInteger(block).longValue(),
                m.get("timeStamp"));
    }

    static String str(Object o) {
        if (o == null) return null;
        String s = String.valueOf(o).trim();
        return s.isEmpty() ? null : s;
    }

    static BigDecimal dec(Object o) {
        if (o == null) return null;
        if (o instanceof BigDecimal bd) return bd;
        String s = String.valueOf(o).trim();
        if (s.isEmpty()) return null;
        try {
            return new BigDecimal(s);
        } catch (NumberFormatException e) {
            return null;
        }
    }

    /** Accepts decimal or {@code 0x}-prefixed hex, as emitted by JSON-RPC log payloads. */
    static BigInteger toInteger(Object o) {
        if (o instanceof BigInteger bi) return bi;
        if (o instanceof Number n && !(o instanceof BigDecimal)) return BigInteger.valueOf(n.longValue());
        String s = String.valueOf(o).trim();
        if (s.startsWith("0x") || s.startsWith("0X")) {
            return s.length() == 2 ? BigInteger.ZERO : new BigInteger(s.substring(2), 16);
        }
        return new BigDecimal(s).toBigIntegerExact();
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> map(Object o) {
        return o instanceof Map<?, ?> m ? (Map<String, Object>) m : Map.of();
    }

    @SuppressWarnings("unchecked")
    private static List<Map<String, Object>> list(Object o) {
        if (!(o instanceof List<?> l)) return List.of();
        List<Map<String, Object>> out = new ArrayList<>();
        for (Object e : l) {
            if (e instanceof Map<?, ?> m) out.add((Map<String, Object>) m);
        }
        return out;
    }
}
