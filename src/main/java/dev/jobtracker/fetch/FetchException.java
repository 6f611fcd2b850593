package dev.jobtracker.fetch;

import lombok.Getter;

/**
 * A page could not be retrieved. The kind tells the orchestrator whether a retry makes sense.
 */
@Getter
public class FetchException extends RuntimeException {

    public enum Kind {
        NETWORK,
        TIMEOUT,
        HTTP_STATUS,
        BROWSER_CRASH,
        INVALID_URL;

        public String code() {
            return name().toLowerCase();
        }
    }

    private final Kind kind;
    private final Integer statusCode;

    public FetchException(Kind kind, String message) {
        this(kind, message, null, null);
    }

    public FetchException(Kind kind, String message, Throwable cause) {
        this(kind, message, null, cause);
    }

    private FetchException(Kind kind, String message, Integer statusCode, Throwable cause) {
        super(message, cause);
        this.kind = kind;
        this.statusCode = statusCode;
    }

    public static FetchException httpStatus(int statusCode, String url) {
        return new FetchException(Kind.HTTP_STATUS, "HTTP " + statusCode + " from " + url, statusCode, null);
    }

    /**
     * Network failures and timeouts are usually transient.
     */
    public boolean isTransient() {
        return kind == Kind.NETWORK || kind == Kind.TIMEOUT;
    }
}
