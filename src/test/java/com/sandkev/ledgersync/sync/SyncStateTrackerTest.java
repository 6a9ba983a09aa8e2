package com.sandkev.ledgersync.sync;

import com.sandkev.ledgersync.config.SyncProperties;
import com.sandkev.ledgersync.domain.RunStatus;
import com.sandkev.ledgersync.testsupport.InMemorySyncStateDao;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class SyncStateTrackerTest {

    private static final Instant START = Instant.parse("2024-01-01T00:00:00Z");
    private static final Instant RUN_1 = Instant.parse("2024-03-15T12:00:00Z");

    private final Clock clock = Clock.fixed(Instant.parse("2024-03-15T12:05:00Z"), ZoneOffset.UTC);
    private final InMemorySyncStateDao dao = new InMemorySyncStateDao();
    private final SyncStateTracker tracker = new SyncStateTracker(dao, new SyncProperties(Duration.ofHours(1)), clock);

    @Test
    void firstRunStartsAtConfiguredStart() {
        assertThat(tracker.getWatermark("binance:trades:main", START)).isEqualTo(START);
    }

    @Test
    void laterRunsBackOffByTheOverlap() {
        tracker.recordRun("binance:trades:main", 10, RunStatus.SUCCESS, null, RUN_1);

        assertThat(tracker.getWatermark("binance:trades:main", START)).isEqualTo(Instant.parse("2024-03-15T11:00:00Z"));
    }

    @Test
    void watermarkNeverPrecedesConfiguredStart() {
        tracker.recordRun("s", 1, RunStatus.SUCCESS, null, START.plusSeconds(60));

        assertThat(tracker.getWatermark("s", START)).isEqualTo(START);
    }

    @Test
    void failedRunIsRecordedButDoesNotMoveTheWatermark() {
        tracker.recordRun("s", 5, RunStatus.SUCCESS, null, RUN_1);
        tracker.recordRun("s", 2, RunStatus.FAILED, "HTTP 500", RUN_1.plus(Duration.ofDays(1)));

        var row = dao.find("s").orElseThrow();
        assertThat(row.lastRunStatus()).isEqualTo(RunStatus.FAILED);
        assertThat(row.lastError()).isEqualTo("HTTP 500");
        assertThat(row.lastRunRecordCount()).isEqualTo(2);
        assertThat(row.lastSyncAt()).isEqualTo(RUN_1);
        assertThat(row.updatedAt()).isEqualTo(clock.instant());
    }

    @Test
    void firstRunFailingStillCreatesTheRow() {
        tracker.recordRun("s", 0, RunStatus.FAILED, "no route", RUN_1);

        assertThat(dao.find("s")).hasValueSatisfying(w -> assertThat(w.lastSyncAt()).isNull());
        assertThat(tracker.getWatermark("s", START)).isEqualTo(START);
    }

    @Test
    void partialSuccessKeepsThePreviousWatermark() {
        tracker.recordRun("s", 5, RunStatus.SUCCESS, null, RUN_1);
        tracker.recordRun("s", 3, RunStatus.SUCCESS, "skipped: BTC", RUN_1.plus(Duration.ofDays(1)), false);

        var row = dao.find("s").orElseThrow();
        assertThat(row.lastRunStatus()).isEqualTo(RunStatus.SUCCESS);
        assertThat(row.lastSyncAt()).isEqualTo(RUN_1);
    }

    @Test
    void unreadableStateDegradesToFullRange() {
        var broken = mock(SyncStateDao.class);
        when(broken.find(anyString())).thenThrow(new DataAccessResourceFailureException("db down"));
        var t = new SyncStateTracker(broken, new SyncProperties(Duration.ofHours(1)), clock);

        assertThat(t.getWatermark("s", START)).isEqualTo(START);
    }

    @Test
    void unwritableStateIsLoggedNotThrown() {
        var broken = mock(SyncStateDao.class);
        doThrow(new DataAccessResourceFailureException("db down")).when(broken).save(any());
        var t = new SyncStateTracker(broken, new SyncProperties(Duration.ofHours(1)), clock);

        assertThatCode(() -> t.recordRun("s", 1, RunStatus.SUCCESS, null, RUN_1)).doesNotThrowAnyException();
    }
}
