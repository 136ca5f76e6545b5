package com.citationchecker;

import java.util.Set;
import java.util.regex.Pattern;

/**
 * Patterns shared by the name-year style parsers.
 */
final class CitationPatterns {

    private CitationPatterns() {
    }

    /** Four-digit year 19xx/20xx with an optional letter suffix, captured whole ({@code 2020a}). */
    static final Pattern YEAR_WITH_SUFFIX = Pattern.compile("\\b((?:19|20)\\d{2}[a-z]?)\\b");

    /** Four-digit year 19xx/20xx, suffix letter allowed but not captured. */
    static final Pattern YEAR = Pattern.compile("\\b((?:19|20)\\d{2})[a-z]?\\b");

    static final Pattern MONTH_NAME = Pattern.compile(
            "(January|February|March|April|May|June|July|August|September|October|November|December)",
            Pattern.CASE_INSENSITIVE);

    static final Pattern PAGE_ONLY = Pattern.compile("^p\\.?\\s*\\d+", Pattern.CASE_INSENSITIVE);

    static final Pattern PAGE_ANYWHERE = Pattern.compile("\\bp\\.?\\s*\\d+", Pattern.CASE_INSENSITIVE);

    static final Pattern NO_DATE = Pattern.compile("\\bn\\.?d\\.?(?:-[a-z])?\\b", Pattern.CASE_INSENSITIVE);

    static final Pattern IN_PRESS = Pattern.compile("\\bin\\s+press\\b", Pattern.CASE_INSENSITIVE);

    /** Things written like a citation that are not one: {@code (Table 2)}, {@code Figure 1 (2020)}. */
    static final Pattern NON_CITATION_LEAD = Pattern.compile(
            "^(Table|Figure|Fig|Eds?|Vol|Suppl|Appendix|Chapter|Section|Part|between|except|UK)\\b",
            Pattern.CASE_INSENSITIVE);

    static final Pattern HAS_LETTER = Pattern.compile("[A-Za-z]");

    static final Set<String> NAME_STOPWORDS = Set.of(
            "of", "the", "and", "for", "a", "an", "in", "on", "at", "to", "from", "with", "by", "as",
            "et", "al", "al.");

    static boolean containsMonthName(String text) {
        return MONTH_NAME.matcher(text).find();
    }

    static String stripEdges(String text) {
        String s = text.replaceAll("^[.,;: ]+", "").strip();
        return s.replaceAll("[.,;: ]+$", "").strip();
    }
}
