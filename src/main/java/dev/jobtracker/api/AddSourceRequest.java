package dev.jobtracker.api;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

/**
 * Body of {@code POST /api/sources}. A blank name defaults to the URL host.
 */
public record AddSourceRequest(
        @Size(max = 255) String name,
        @NotBlank @Size(max = 2048) String url,
        Boolean requiresBrowser) {

    public boolean requiresBrowserOrDefault() {
        return requiresBrowser != null && requiresBrowser;
    }
}
