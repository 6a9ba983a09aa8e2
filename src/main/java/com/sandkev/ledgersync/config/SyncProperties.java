package com.sandkev.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

import java.time.Duration;

/**
 * @param overlap re-fetch margin subtracted from the last successful sync
 */
@ConfigurationProperties("ledger.sync")
public record SyncProperties(
        @DefaultValue("PT1H") Duration overlap
) {}
