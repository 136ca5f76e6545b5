package com.citationchecker;

import java.util.List;
import java.util.regex.Pattern;

/**
 * A bibliography entry of a name-year manuscript.
 *
 * @param author         short display form used for matching, e.g. {@code Smith & Jones}
 * @param fullAuthor     author block as printed, e.g. {@code Smith, J., & Jones, M.}
 * @param abbreviations  declared or inferred abbreviations, e.g. {@code WHO}; the first is preferred
 * @param paragraphIndex where the entry was found
 * @param text           full entry text
 */
public record Reference(
        String key,
        String author,
        String fullAuthor,
        String year,
        List<String> abbreviations,
        int paragraphIndex,
        String text
) {

    public static final int SNIPPET_LENGTH = 150;

    private static final Pattern INITIALS = Pattern.compile("^(?:[A-Z]\\.?[\\s-]*)+$");

    public Reference {
        abbreviations = List.copyOf(abbreviations);
    }

    /**
     * Number of authors in an APA author block. {@code "Smith, J., Jones, M., & Brown, K."} has
     * three: the surnames before {@code &} plus the one after it. Without {@code &} the block
     * is a single (possibly corporate) author.
     */
    public static int countAuthors(String fullAuthor) {
        if (fullAuthor == null || !fullAuthor.contains("&")) return 1;
        String beforeLast = fullAuthor.split("&", -1)[0];
        int count = 0;
        for (String segment : beforeLast.split(",")) {
            String s = segment.strip();
            if (!s.isEmpty() && !INITIALS.matcher(s).matches()) count++;
        }
        return count + 1;
    }

    public int authorCount() {
        return countAuthors(fullAuthor);
    }

    public String display() {
        return author + " (" + year + ")";
    }

    public String snippet() {
        if (text == null) return "";
        return text.length() > SNIPPET_LENGTH ? text.substring(0, SNIPPET_LENGTH) + "..." : text;
    }
}
