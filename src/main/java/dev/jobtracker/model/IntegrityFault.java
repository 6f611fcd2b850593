package dev.jobtracker.model;

/**
 * A candidate that could not be reconciled because stored state violates the identity invariant.
 */
public record IntegrityFault(Kind kind, long sourceId, String identityKey, String title, int matches) {

    public enum Kind {
        DUPLICATE_IDENTITY_KEY
    }

    public static IntegrityFault duplicateIdentityKey(long sourceId, String identityKey, String title, int matches) {
        return new IntegrityFault(Kind.DUPLICATE_IDENTITY_KEY, sourceId, identityKey, title, matches);
    }

    public String describe() {
        return String.format("%s: '%s' matches %d stored postings", kind.name().toLowerCase(), title, matches);
    }
}
