package com.sandkev.ledgersync.domain;

import java.util.Locale;

/** Origin category of a canonical record; each domain has its own staged table. */
public enum Domain {
    EXCHANGE("exchange", "staged_exchange_tx"),
    ONCHAIN("onchain", "staged_onchain_tx");

    private final String code;
    private final String stagedTable;

    Domain(String code, String stagedTable) {
        this.code = code;
        this.stagedTable = stagedTable;
    }

    public String code() { return code; }

    public String stagedTable() { return stagedTable; }

    public static Domain fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (Domain d : values()) {
            if (d.code.equals(c)) return d;
        }
        throw new IllegalArgumentException("Unknown domain: " + code);
    }
}
