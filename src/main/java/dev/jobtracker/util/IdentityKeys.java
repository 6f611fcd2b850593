package dev.jobtracker.util;

import dev.jobtracker.model.CandidatePosting;

/**
 * Identity of a posting within its source.
 * <p>
 * URL first: when a posting has a link, the key is derived from the source id and the canonical
 * link. Otherwise it falls back to the source id, title and company. Both forms are case-folded
 * and whitespace-collapsed so cosmetic changes between fetches do not create new postings.
 * The stored key is a prefixed SHA-256 of the composite.
 */
public final class IdentityKeys {

    static final String URL_PREFIX = "u:";
    static final String TITLE_COMPANY_PREFIX = "t:";

    private IdentityKeys() {
    }

    public static String of(long sourceId, CandidatePosting candidate) {
        return of(sourceId, candidate.title(), candidate.company(), candidate.url());
    }

    public static String of(long sourceId, String title, String company, String url) {
        if (url != null && !url.isBlank()) {
            return URL_PREFIX + HashUtils.sha256Hex(composite("url", sourceId, UrlUtils.canonicalForm(url)));
        }
        return TITLE_COMPANY_PREFIX + HashUtils.sha256Hex(
                composite("tc", sourceId, TextNormalizer.fold(title) + "|" + TextNormalizer.fold(company)));
    }

    private static String composite(String kind, long sourceId, String body) {
        return kind + "|" + sourceId + "|" + body;
    }
}
