package dev.jobtracker.service;

import dev.jobtracker.model.DashboardStats;
import dev.jobtracker.model.RunSummary;
import dev.jobtracker.model.SchedulerState;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.Optional;

/**
 * Aggregate figures for the dashboard.
 */
@Service
@RequiredArgsConstructor
public class DashboardService {

    private final JobStoreService store;
    private final SchedulerService schedulerService;
    private final Clock clock;

    public DashboardStats stats() {
        LocalDateTime startOfToday = LocalDate.now(clock).atStartOfDay();
        SchedulerState scheduler = schedulerService.state();
        Optional<RunSummary> latest = store.latestRun();

        return new DashboardStats(
                store.countPostings(),
                store.countSources(),
                store.countRunsSince(startOfToday),
                store.countNewPostingsSince(startOfToday),
                scheduler.enabled(),
                scheduler.running(),
                scheduler.intervalMinutes(),
                latest.map(RunSummary::startedAt).orElse(null),
                scheduler.nextRunAt());
    }
}
