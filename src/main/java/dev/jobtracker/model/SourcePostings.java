package dev.jobtracker.model;

import dev.jobtracker.entity.JobPosting;
import dev.jobtracker.entity.TrackedSource;

import java.util.List;

public record SourcePostings(TrackedSource source, List<JobPosting> jobs) {
}
