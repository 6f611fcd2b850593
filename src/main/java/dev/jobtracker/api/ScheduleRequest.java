package dev.jobtracker.api;

import dev.jobtracker.model.ScheduleConfiguration;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;

/**
 * Body of {@code POST /api/scheduler}.
 */
public record ScheduleRequest(
        @NotNull Boolean enabled,
        @NotNull
        @Min(ScheduleConfiguration.MIN_INTERVAL_MINUTES)
        @Max(ScheduleConfiguration.MAX_INTERVAL_MINUTES) Integer intervalMinutes) {
}
