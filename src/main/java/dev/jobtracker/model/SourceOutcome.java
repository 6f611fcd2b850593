package dev.jobtracker.model;

/**
 * Per-source entry of a run record.
 */
public record SourceOutcome(
        long sourceId,
        String sourceName,
        OutcomeStatus status,
        String errorKind,
        String message,
        int extracted,
        int newPostings,
        int updatedPostings) {

    public static SourceOutcome success(long sourceId, String sourceName, int extracted, int created, int updated) {
        return new SourceOutcome(sourceId, sourceName, OutcomeStatus.SUCCESS, null, null, extracted, created, updated);
    }

    public static SourceOutcome partial(long sourceId, String sourceName, String message,
                                        int extracted, int created, int updated) {
        return new SourceOutcome(sourceId, sourceName, OutcomeStatus.PARTIAL, "integrity_fault", message,
                extracted, created, updated);
    }

    public static SourceOutcome failed(long sourceId, String sourceName, String errorKind, String message) {
        return new SourceOutcome(sourceId, sourceName, OutcomeStatus.FAILED, errorKind, message, 0, 0, 0);
    }

    public static SourceOutcome deferred(long sourceId, String sourceName) {
        return new SourceOutcome(sourceId, sourceName, OutcomeStatus.DEFERRED, null,
                "run aborted before this source", 0, 0, 0);
    }
}
