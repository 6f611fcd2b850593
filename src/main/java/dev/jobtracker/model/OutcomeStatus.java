package dev.jobtracker.model;

/**
 * Result of processing one source within a run.
 */
public enum OutcomeStatus {
    SUCCESS,
    PARTIAL,
    FAILED,
    /** Not attempted because the run was aborted before reaching the source. */
    DEFERRED
}
