package dev.jobtracker.model;

public enum NotificationStatus {
    NOT_ATTEMPTED,
    DELIVERED,
    FAILED,
    /** Delivery intentionally not performed (dry run). */
    SKIPPED
}
