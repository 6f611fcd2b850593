package dev.jobtracker.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Normalization used for identity comparison and for cleaning extracted text.
 */
public final class TextNormalizer {

    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u00A0\\u200B-\\u200D\\uFEFF]+");

    private TextNormalizer() {
    }

    /**
     * Collapse runs of whitespace (including non-breaking and zero-width characters) to one space and trim.
     * Returns null for null input.
     */
    public static String collapseWhitespace(String value) {
        if (value == null) {
            return null;
        }
        return WHITESPACE.matcher(value).replaceAll(" ").trim();
    }

    /**
     * Case-folded, NFKC-normalized, whitespace-collapsed form. Null becomes the empty string.
     */
    public static String fold(String value) {
        if (value == null) {
            return "";
        }
        String normalized = Normalizer.normalize(value, Normalizer.Form.NFKC);
        return collapseWhitespace(normalized).toLowerCase(Locale.ROOT);
    }
}
