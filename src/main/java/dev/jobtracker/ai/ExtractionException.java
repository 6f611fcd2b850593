package dev.jobtracker.ai;

import lombok.Getter;

/**
 * The extraction step could not turn page content into postings.
 */
@Getter
public class ExtractionException extends RuntimeException {

    public enum Kind {
        UPSTREAM_FAILURE,
        MALFORMED_RESPONSE,
        RATE_LIMITED,
        EMPTY_CONTENT;

        public String code() {
            return name().toLowerCase();
        }
    }

    private final Kind kind;

    public ExtractionException(Kind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ExtractionException(Kind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public boolean isRateLimited() {
        return kind == Kind.RATE_LIMITED;
    }
}
