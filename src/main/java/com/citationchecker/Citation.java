package com.citationchecker;

import java.util.List;
import java.util.Locale;

/**
 * An in-text name-year citation, merged over all its occurrences in the manuscript.
 *
 * @param key       normalized author+year, see {@link CitationKeys}
 * @param display   how the citation is shown in reports, e.g. {@code (Smith, 2020)}
 * @param warnings  format problems found while parsing, in first-seen order
 * @param raw       text of the first occurrence
 * @param locations paragraph index of every occurrence, in document order
 */
public record Citation(
        String key,
        String display,
        String author,
        String year,
        CitationType type,
        List<String> warnings,
        String raw,
        List<Integer> locations
) {

    public Citation {
        warnings = List.copyOf(warnings);
        locations = List.copyOf(locations);
    }

    public static String display(String author, String year, CitationType type) {
        return type == CitationType.PARENTHETICAL
                ? "(" + author + ", " + year + ")"
                : author + " (" + year + ")";
    }

    public boolean usesEtAl() {
        return author.toLowerCase(Locale.ROOT).contains("et al");
    }
}
