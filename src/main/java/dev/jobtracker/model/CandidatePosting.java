package dev.jobtracker.model;

import java.util.Objects;

/**
 * A validated posting produced by the extraction step, before reconciliation.
 * <p>
 * {@code title} and {@code company} are always non-blank. {@code location} and {@code url}
 * are either null or non-blank; {@code url} is always an absolute http(s) URL.
 */
public record CandidatePosting(String title, String company, String location, String url) {

    public CandidatePosting {
        Objects.requireNonNull(title, "title");
        Objects.requireNonNull(company, "company");
        if (title.isBlank()) {
            throw new IllegalArgumentException("title must not be blank");
        }
        if (company.isBlank()) {
            throw new IllegalArgumentException("company must not be blank");
        }
        location = blankToNull(location);
        url = blankToNull(url);
    }

    public boolean hasUrl() {
        return url != null;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }
}
