package com.sandkev.ledgersync.unified;

import com.sandkev.ledgersync.domain.Domain;

/** Optional filters over the unified ledger; null means "any". */
public record UnifiedFilter(Domain domain, String source, String chain, Integer year, Integer month) {

    public static UnifiedFilter all() {
        return new UnifiedFilter(null, null, null, null, null);
    }

    public UnifiedFilter {
        if (month != null && (month < 1 || month > 12)) {
            throw new IllegalArgumentException("month must be 1..12: " + month);
        }
        source = blankToNull(source);
        chain = blankToNull(chain);
    }

    private static String blankToNull(String s) {
        return s == null || s.isBlank() ? null : s.trim();
    }
}
