package com.sandkev.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import java.util.List;

@ConfigurationProperties("ledger.scam-filter")
public record ScamFilterProperties(
        boolean enabled,
        List<String> blocklist      // contracts / EOAs, case-insensitive
) {
    public ScamFilterProperties {
        blocklist = blocklist == null ? List.of() : List.copyOf(blocklist);
    }
}
