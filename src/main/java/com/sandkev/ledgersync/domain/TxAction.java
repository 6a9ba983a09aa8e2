package com.sandkev.ledgersync.domain;

import java.util.Locale;

/**
 * Action taxonomy of the canonical ledger. Amounts are always stored as magnitudes;
 * the direction of a movement lives here.
 */
public enum TxAction {
    TRADE_BUY("trade-buy"),
    TRADE_SELL("trade-sell"),
    DEPOSIT("deposit"),
    WITHDRAWAL("withdrawal"),
    SEND("send"),
    RECEIVE("receive"),
    // movement between two owned addresses
    TRANSFER_IN("transfer-in"),
    TRANSFER_OUT("transfer-out"),
    APPROVE("approve"),
    SWAP("swap"),
    UNKNOWN("unknown");

    private final String code;

    TxAction(String code) { this.code = code; }

    public String code() { return code; }

    public static TxAction fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (TxAction a : values()) {
            if (a.code.equals(c)) return a;
        }
        throw new IllegalArgumentException("Unknown action: " + code);
    }
}
