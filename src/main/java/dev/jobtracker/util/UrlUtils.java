package dev.jobtracker.util;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Locale;

public final class UrlUtils {

    private UrlUtils() {
    }

    /**
     * @return true when the value is an absolute http or https URL with a host
     */
    public static boolean isAbsoluteHttpUrl(String value) {
        URI uri = safeUri(value);
        return uri != null && isHttp(uri) && uri.getHost() != null;
    }

    /**
     * Resolve a possibly relative link against the page it was found on.
     *
     * @return the absolute http(s) URL, or null when the link is unusable
     */
    public static String resolve(String baseUrl, String link) {
        if (link == null || link.isBlank()) {
            return null;
        }
        String trimmed = link.trim().replace(" ", "%20");
        URI target = safeUri(trimmed);
        if (target == null) {
            return null;
        }
        if (!target.isAbsolute()) {
            URI base = safeUri(baseUrl);
            if (base == null || !base.isAbsolute()) {
                return null;
            }
            target = base.resolve(target);
        }
        if (!isHttp(target) || target.getHost() == null) {
            return null;
        }
        return target.toString();
    }

    /**
     * Form of a URL used for identity comparison: case-folded, without fragment and trailing slash.
     */
    public static String canonicalForm(String url) {
        String folded = TextNormalizer.fold(url);
        int hash = folded.indexOf('#');
        if (hash >= 0) {
            folded = folded.substring(0, hash);
        }
        while (folded.endsWith("/")) {
            folded = folded.substring(0, folded.length() - 1);
        }
        return folded;
    }

    public static String hostOf(String url) {
        URI uri = safeUri(url);
        return uri == null ? null : uri.getHost();
    }

    public static URI safeUri(String url) {
        if (url == null) {
            return null;
        }
        try {
            return new URI(url.trim());
        } catch (URISyntaxException ignored) {
            return null;
        }
    }

    private static boolean isHttp(URI uri) {
        String scheme = uri.getScheme();
        if (scheme == null) {
            return false;
        }
        String lower = scheme.toLowerCase(Locale.ROOT);
        return "http".equals(lower) || "https".equals(lower);
    }
}
