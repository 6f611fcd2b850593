package dev.jobtracker.model;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.List;

/**
 * Finalized view of a pipeline run, returned to the trigger and exposed on the dashboard.
 */
public record RunSummary(
        Long runId,
        RunTrigger trigger,
        RunStatus status,
        LocalDateTime startedAt,
        LocalDateTime endedAt,
        int newPostings,
        int notifiedPostings,
        NotificationStatus notificationStatus,
        boolean aborted,
        String abortReason,
        String errorMessage,
        List<SourceOutcome> outcomes) {

    public RunSummary {
        outcomes = outcomes == null ? List.of() : List.copyOf(outcomes);
    }

    public Duration duration() {
        if (startedAt == null || endedAt == null) {
            return Duration.ZERO;
        }
        return Duration.between(startedAt, endedAt);
    }

    public long failedSources() {
        return outcomes.stream().filter(o -> o.status() == OutcomeStatus.FAILED).count();
    }
}
