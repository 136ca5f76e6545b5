package com.citationchecker;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Author-year variant of Vancouver: {@code (Smith 2020)}, {@code (Smith and Jones 2020)}.
 * References look like {@code Smith J, Jones M. Title. Journal. 2020;10(2):123-45.}
 */
public class VancouverCitationParser implements CitationParser {

    private static final Pattern PARENTHESES = Pattern.compile("\\(([^()]+)\\)");
    private static final Pattern SQUARE_BRACKETS = Pattern.compile("\\[[^\\]]+\\]");
    private static final Pattern LEADING_PREFIX = Pattern.compile(
            "^(see|cf\\.?|e\\.g\\.?,?|i\\.e\\.?,?)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+\\s*");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;:]+$");
    private static final Pattern REFERENCE = Pattern.compile("^([A-Z][^.]+?)\\.\\s*([^.]+?)\\.\\s*.*?(\\d{4})");

    private static final int MAX_AUTHOR_WORDS = 6;

    @Override
    public List<ParsedCitation> parseCitations(String text) {
        List<ParsedCitation> results = new ArrayList<>();
        if (text == null) return results;

        Matcher m = PARENTHESES.matcher(text.strip());
        while (m.find()) {
            String content = m.group(1).strip();
            content = SQUARE_BRACKETS.matcher(content).replaceAll("").strip();
            content = LEADING_PREFIX.matcher(content).replaceFirst("").strip();

            if (CitationPatterns.PAGE_ANYWHERE.matcher(content).find()) continue;
            if (CitationPatterns.containsMonthName(content)) continue;

            List<String> years = new ArrayList<>();
            Matcher y = CitationPatterns.YEAR.matcher(content);
            while (y.find()) {
                years.add(y.group(1));
            }
            if (years.isEmpty()) continue;

            String author = content;
            for (String year : years) {
                author = author.replaceAll("\\b" + year + "[a-z]?\\b", "");
            }
            author = LEADING_NUMBER.matcher(author.strip()).replaceFirst("").strip();
            author = TRAILING_PUNCTUATION.matcher(author).replaceFirst("").strip();

            if (author.split("\\s+").length > MAX_AUTHOR_WORDS) continue;
            if (author.length() < 2) continue;

            for (String year : years) {
                results.add(new ParsedCitation(author, year, CitationType.PARENTHETICAL, List.of(),
                        "(" + content + ")"));
            }
        }
        return results;
    }

    @Override
    public ParsedReference parseReference(String text) {
        if (text == null) return null;
        Matcher m = REFERENCE.matcher(text);
        if (!m.lookingAt()) return null;

        String authorPart = m.group(1).strip();
        String year = m.group(3).strip();

        String display = authorPart;
        if (authorPart.contains(",")) {
            String[] authors = authorPart.split(",");
            String first = authors[0].strip();
            if (authors.length >= 3) {
                display = first + " et al";
            } else if (authors.length == 2) {
                display = first + " and " + authors[1].strip();
            } else {
                display = first;
            }
        }
        return new ParsedReference(display, year, authorPart, List.of(), text);
    }
}
