package dev.jobtracker.service;

import dev.jobtracker.model.DashboardStats;
import dev.jobtracker.model.NotificationStatus;
import dev.jobtracker.model.RunStatus;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.RunTrigger;
import dev.jobtracker.model.SchedulerState;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class DashboardServiceTest {

    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T15:30:00Z"), ZoneOffset.UTC);
    private static final LocalDateTime START_OF_DAY = LocalDateTime.parse("2026-03-02T00:00:00");

    @Mock
    private JobStoreService store;

    @Mock
    private SchedulerService schedulerService;

    @Test
    @DisplayName("Should combine store counters with scheduler state")
    void shouldAggregateStats() {
        LocalDateTime lastStart = LocalDateTime.parse("2026-03-02T14:00:00");
        LocalDateTime nextRun = LocalDateTime.parse("2026-03-02T16:00:00");
        when(store.countPostings()).thenReturn(12L);
        when(store.countSources()).thenReturn(3L);
        when(store.countRunsSince(START_OF_DAY)).thenReturn(4L);
        when(store.countNewPostingsSince(START_OF_DAY)).thenReturn(5L);
        when(store.latestRun()).thenReturn(Optional.of(new RunSummary(9L, RunTrigger.SCHEDULED,
                RunStatus.COMPLETED, lastStart, lastStart.plusMinutes(2), 1, 1, NotificationStatus.DELIVERED,
                false, null, null, List.of())));
        when(schedulerService.state()).thenReturn(new SchedulerState(true, 120, false, nextRun, lastStart));

        DashboardStats stats = new DashboardService(store, schedulerService, CLOCK).stats();

        assertThat(stats.totalJobs()).isEqualTo(12);
        assertThat(stats.totalSources()).isEqualTo(3);
        assertThat(stats.checksToday()).isEqualTo(4);
        assertThat(stats.changesDetected()).isEqualTo(5);
        assertThat(stats.schedulerEnabled()).isTrue();
        assertThat(stats.runInProgress()).isFalse();
        assertThat(stats.intervalMinutes()).isEqualTo(120);
        assertThat(stats.lastRun()).isEqualTo(lastStart);
        assertThat(stats.nextRun()).isEqualTo(nextRun);
    }

    @Test
    @DisplayName("Should report no last run on a fresh store")
    void shouldHandleEmptyStore() {
        when(store.latestRun()).thenReturn(Optional.empty());
        when(schedulerService.state()).thenReturn(new SchedulerState(false, 60, false, null, null));

        DashboardStats stats = new DashboardService(store, schedulerService, CLOCK).stats();

        assertThat(stats.lastRun()).isNull();
        assertThat(stats.nextRun()).isNull();
        assertThat(stats.totalJobs()).isZero();
    }
}
