package com.sandkev.ledgersync.domain;

import java.util.Locale;

/** Kind of record a source stream produces; names the partition files. */
public enum EntityKind {
    TRADES("trades", Domain.EXCHANGE),
    DEPOSITS("deposits", Domain.EXCHANGE),
    WITHDRAWALS("withdrawals", Domain.EXCHANGE),
    TRANSFERS("transfers", Domain.ONCHAIN);

    private final String code;
    private final Domain domain;

    EntityKind(String code, Domain domain) {
        this.code = code;
        this.domain = domain;
    }

    public String code() { return code; }

    public Domain domain() { return domain; }

    /** Entity a stored record belongs to, used when partitions are re-derived from the store. */
    public static EntityKind of(Domain domain, TxAction action) {
        if (domain == Domain.ONCHAIN) return TRANSFERS;
        return switch (action) {
            case DEPOSIT -> DEPOSITS;
            case WITHDRAWAL -> WITHDRAWALS;
            default -> TRADES;
        };
    }

    public static EntityKind fromCode(String code) {
        String c = code == null ? "" : code.trim().toLowerCase(Locale.ROOT);
        for (EntityKind k : values()) {
            if (k.code.equals(c)) return k;
        }
        throw new IllegalArgumentException("Unknown entity kind: " + code);
    }
}
