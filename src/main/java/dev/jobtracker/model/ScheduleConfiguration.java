package dev.jobtracker.model;

/**
 * Recurrence settings of the pipeline scheduler.
 */
public record ScheduleConfiguration(boolean enabled, int intervalMinutes) {

    public static final int MIN_INTERVAL_MINUTES = 1;
    public static final int MAX_INTERVAL_MINUTES = 7 * 24 * 60;

    public ScheduleConfiguration {
        if (intervalMinutes < MIN_INTERVAL_MINUTES || intervalMinutes > MAX_INTERVAL_MINUTES) {
            throw new IllegalArgumentException("intervalMinutes must be between "
                    + MIN_INTERVAL_MINUTES + " and " + MAX_INTERVAL_MINUTES + " but was " + intervalMinutes);
        }
    }
}
