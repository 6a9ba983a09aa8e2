package com.sandkev.ledgersync.config;

import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;

@ConfigurationProperties("ledger.partitions")
public record PartitionProperties(
        @DefaultValue("true") boolean enabled,
        @DefaultValue("./data/partitions") String dir
) {}
