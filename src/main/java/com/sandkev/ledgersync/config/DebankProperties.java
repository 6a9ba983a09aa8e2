package com.sandkev.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("ledger.debank")
public record DebankProperties(
        @DefaultValue("https://pro-openapi.debank.com") String baseUrl,
        String apiKey,
        @DefaultValue("AccessKey") String apiKeyHeader,
        @DefaultValue("15000") int timeoutMs,
        @DefaultValue("ledgersync/0.1") String userAgent
) {

    public boolean configured() {
        return apiKey != null && !apiKey.isBlank();
    }
}
