package dev.jobtracker.model;

/**
 * Lifecycle of a pipeline run: PENDING, then RUNNING, then COMPLETED or FAILED.
 */
public enum RunStatus {
    PENDING,
    RUNNING,
    COMPLETED,
    FAILED;

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }
}
