package dev.jobtracker.model;

public enum RunTrigger {
    SCHEDULED,
    MANUAL
}
