package com.sandkev.ledgersync.normalize;

import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class TimestampsTest {

    @Test
    void millisecondsAndSecondsNormalizeToTheSameInstant() {
        assertThat(Timestamps.toUtc(1700000000000L)).isEqualTo(Timestamps.toUtc(1700000000L));
        assertThat(Timestamps.toUtc("1700000000000")).isEqualTo(Instant.ofEpochSecond(1700000000L));
    }

    @Test
    void fractionalSecondsAreTruncated() {
        assertThat(Timestamps.toUtc(1710500000.75)).isEqualTo(Instant.ofEpochSecond(1710500000L));
    }

    @Test
    void isoStringsAreReadAsUtc() {
        assertThat(Timestamps.toUtc("2024-03-15T10:53:20Z")).isEqualTo(Instant.ofEpochSecond(1710500000L));
        assertThat(Timestamps.toUtc("2024-03-15T11:53:20+01:00")).isEqualTo(Instant.ofEpochSecond(1710500000L));
        assertThat(Timestamps.toUtc("2024-03-15 10:53:20")).isEqualTo(Instant.ofEpochSecond(1710500000L));
        assertThat(Timestamps.toUtc("2024-03-15T10:53:20.123")).isEqualTo(Instant.ofEpochSecond(1710500000L));
    }

    @Test
    void rejectsMissingOrGarbage() {
        assertThatThrownBy(() -> Timestamps.toUtc(null)).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.toUtc("  ")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.toUtc("yesterday")).isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Timestamps.toUtc(-5)).isInstanceOf(IllegalArgumentException.class);
    }
}
