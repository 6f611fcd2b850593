package dev.jobtracker.model;

import java.time.LocalDateTime;

public record SchedulerState(
        boolean enabled,
        int intervalMinutes,
        boolean running,
        LocalDateTime nextRunAt,
        LocalDateTime lastRunAt) {
}
