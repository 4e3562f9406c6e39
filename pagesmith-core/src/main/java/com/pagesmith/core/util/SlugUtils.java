package com.pagesmith.core.util;

import java.text.Normalizer;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Builds URL-safe identifiers from free text.
 */
public final class SlugUtils {

    private static final Pattern DIACRITICS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9]+");
    private static final Pattern EDGE_DASHES = Pattern.compile("^-+|-+$");
    private static final Pattern SLUG = Pattern.compile("[a-z0-9-]*");

    private SlugUtils() {
        // Utility class
    }

    /**
     * Converts text to a slug.
     *
     * <p>Accents are stripped, letters lowercased, every run of other characters
     * becomes a single {@code -}, and dashes at either end are removed.
     * {@code "Hello, Wörld!"} becomes {@code "hello-world"}.
     *
     * @param text text to convert, may be null
     * @return slug matching {@code [a-z0-9-]*}
     */
    public static String slugify(String text) {
        if (text == null) {
            return "";
        }
        String decomposed = Normalizer.normalize(text, Normalizer.Form.NFKD);
        String ascii = DIACRITICS.matcher(decomposed).replaceAll("");
        String dashed = NON_ALPHANUMERIC.matcher(ascii.toLowerCase(Locale.ROOT)).replaceAll("-");
        return EDGE_DASHES.matcher(dashed).replaceAll("");
    }

    /**
     * @param slug candidate slug
     * @return true if {@code slug} contains only {@code [a-z0-9-]}
     */
    public static boolean isSlug(String slug) {
        return slug != null && SLUG.matcher(slug).matches();
    }
}
