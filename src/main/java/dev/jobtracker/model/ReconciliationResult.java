package dev.jobtracker.model;

import dev.jobtracker.entity.JobPosting;

import java.util.List;

/**
 * Partition of one source's candidates against stored state.
 *
 * @param newPostings     postings to insert
 * @param updatedPostings existing postings carrying merged field values
 * @param unchanged       existing postings that were sighted again without changes
 * @param faults          candidates skipped because of an integrity fault
 * @param collapsed       candidates dropped because an earlier candidate in the batch had the same key
 */
public record ReconciliationResult(
        List<JobPosting> newPostings,
        List<JobPosting> updatedPostings,
        List<JobPosting> unchanged,
        List<IntegrityFault> faults,
        int collapsed) {

    public ReconciliationResult {
        newPostings = List.copyOf(newPostings);
        updatedPostings = List.copyOf(updatedPostings);
        unchanged = List.copyOf(unchanged);
        faults = List.copyOf(faults);
    }

    public static ReconciliationResult empty() {
        return new ReconciliationResult(List.of(), List.of(), List.of(), List.of(), 0);
    }

    public boolean hasFaults() {
        return !faults.isEmpty();
    }
}
