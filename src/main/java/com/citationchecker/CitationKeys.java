package com.citationchecker;

import java.util.regex.Pattern;

/**
 * Canonical identity for citations and references.
 *
 * <p>A key is {@code "<author>|<year>"} where the author has every character other than word
 * characters, whitespace and {@code &} removed and its whitespace collapsed. Case is preserved:
 * {@code "smith"} and {@code "Smith"} are different keys.
 */
public final class CitationKeys {

    private static final Pattern NON_KEY_CHARS = Pattern.compile("[^\\w\\s&]", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);

    private CitationKeys() {
    }

    public static String normalize(String author, String year) {
        return normalizeAuthor(author) + "|" + (year == null ? "" : year);
    }

    /**
     * Author half of a key, independent of the year.
     */
    public static String normalizeAuthor(String author) {
        if (author == null) return "";
        String clean = NON_KEY_CHARS.matcher(author).replaceAll("").strip();
        return WHITESPACE.matcher(clean).replaceAll(" ");
    }

    public static String authorPart(String key) {
        if (key == null) return "";
        int bar = key.lastIndexOf('|');
        return bar < 0 ? key : key.substring(0, bar);
    }

    public static String yearPart(String key) {
        if (key == null) return "";
        int bar = key.lastIndexOf('|');
        return bar < 0 ? "" : key.substring(bar + 1);
    }
}
