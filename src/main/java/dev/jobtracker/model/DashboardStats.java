package dev.jobtracker.model;

import java.time.LocalDateTime;

public record DashboardStats(
        long totalJobs,
        long totalSources,
        long checksToday,
        long changesDetected,
        boolean schedulerEnabled,
        boolean runInProgress,
        int intervalMinutes,
        LocalDateTime lastRun,
        LocalDateTime nextRun) {
}
