package com.citationchecker;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * APA 7 name-year grammar.
 *
 * <p>Citations:
 * <ul>
 *   <li>parenthetical {@code (Smith, 2020)}, {@code (Smith & Jones, 2020; WHO, 2019)},
 *       {@code (see also Smith, 2020, p. 4)}, {@code (Smith, n.d.-a)}, {@code (Smith, in press)}</li>
 *   <li>narrative {@code Smith (2020)}, {@code Smith and Jones (2020, 2021)}, {@code Rumbaut's (2005)}</li>
 * </ul>
 * A narrative pair already seen parenthetically in the same paragraph is not reported twice.
 *
 * <p>References: {@code Smith, J., & Jones, M. (2020). Title. Publisher.}, with {@code (n.d.)},
 * {@code (in press)}, {@code (2020, May 15)}, {@code (Ed.)}, and organization abbreviations
 * declared as {@code [WHO]} / {@code (WHO)} or inferred from a capitalized name.
 */
public final class ApaCitationParser implements CitationParser {

    static final String MISSING_COMMA =
            "Format Error: Missing comma between author and year (APA requires comma)";
    static final String AND_IN_PARENTHESES = "Format Error: Use '&' inside parentheses, not 'and'";
    static final String AMPERSAND_IN_NARRATIVE = "Format Error: Use 'and' in narrative citations, not '&'";
    static final String MISSING_AUTHOR = "Warning: Missing Author";
    static final String UNKNOWN_AUTHOR = "Unknown";

    private static final Pattern PARENTHESES = Pattern.compile("\\(([^()]+)\\)");
    private static final Pattern NARRATIVE = Pattern.compile(
            "\\b([A-Z][A-Za-z\\s&.'\"`’–-]{0,100}?)\\s*\\(([^)]+)\\)");
    private static final Pattern REFERENCE = Pattern.compile(
            "^(.+?)\\s*\\(((?:(?:19|20)\\d{2}[a-z]?|n\\.?d\\.?(?:-[a-z])?|in press).*?)\\)\\.?");

    private static final Pattern NAME_WITHOUT_COMMA = Pattern.compile("^[A-Z][a-z]+\\s+\\d{4}$");
    private static final Pattern LEADING_PREFIX = Pattern.compile(
            "^(?:see, for example,|see,\\s*for example|see also|for example|also|see|cf\\.?|e\\.g\\.?,?|i\\.e\\.?,?)(?:,)?\\s+",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern PAGE_LOCATOR = Pattern.compile(
            ",?\\s*\\bpp?\\.?\\s*\\d+[-–]?\\d*", Pattern.CASE_INSENSITIVE);
    private static final Pattern YEAR_TOKEN = Pattern.compile(",?\\s*(?:19|20)\\d{2}[a-z]?,?\\s*");
    private static final Pattern NO_DATE_TOKEN = Pattern.compile(
            ",?\\s*\\bn\\.?d\\.?(?:-[a-z])?\\b,?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern IN_PRESS_TOKEN = Pattern.compile(
            ",?\\s*\\bin\\s+press\\b,?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern LEADING_NUMBER = Pattern.compile("^\\d+,?\\s*");
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;: ]+$");
    private static final Pattern ENDS_WITH_NAME = Pattern.compile("([A-Z][\\w.]*['’]?s?|et al\\.?)\\s*$");
    private static final Pattern SECONDARY_SOURCE = Pattern.compile("\\b(?:as cited in|in)\\s+([A-Z][A-Za-z\\s&]+)");

    private static final Pattern NARRATIVE_NO_DATE = Pattern.compile("\\bn\\.?\\s*d\\.?\\b", Pattern.CASE_INSENSITIVE);
    private static final Pattern THREE_LETTERS = Pattern.compile("[A-Za-z]{3,}");
    private static final Pattern POSSESSIVE = Pattern.compile("['’]s?(?!\\w)");
    private static final Pattern NARRATIVE_LEAD_IN = Pattern.compile(
            "^(According to|As cited by|As stated by|See also)\\s+", Pattern.CASE_INSENSITIVE);
    private static final Pattern INSTRUMENT_NAME = Pattern.compile(
            "\\b(Tool|Scale|Measure|Assessment|Instrument|Inventory|Index|Test|Battery|Questionnaire|Survey|Protocol)\\b",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_ACRONYM = Pattern.compile("\\b[A-Z]{2,}s?$");
    private static final Set<String> NON_AUTHOR_WORDS = new HashSet<>(Arrays.asList(
            "see", "date", "january", "february", "march", "april", "may", "june", "july",
            "august", "september", "october", "november", "december"));

    private static final int MAX_NARRATIVE_WORDS = 6;
    private static final double MIN_CAPITALIZED_SHARE = 0.7;

    private static final Pattern EDITOR_MARK = Pattern.compile("\\s*\\(\\s*Eds?\\.?\\s*\\)", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_COMMA = Pattern.compile(",\\s*$");
    private static final Pattern DECLARED_ABBREVIATION = Pattern.compile("[\\[(]([A-Z]{2,})[\\])]");
    private static final Pattern BRACKETED = Pattern.compile("\\s*[\\[(][^\\])]+[\\])]\\s*");
    private static final int MIN_INFERRED_ABBREVIATION = 3;

    @Override
    public List<ParsedCitation> parseCitations(String text) {
        List<ParsedCitation> results = new ArrayList<>();
        if (text == null) return results;
        String clean = text.strip();

        Set<String> parentheticalPairs = new HashSet<>();
        parseParenthetical(clean, results, parentheticalPairs);
        parseNarrative(clean, results, parentheticalPairs);
        return results;
    }

    private void parseParenthetical(String text, List<ParsedCitation> results, Set<String> seenPairs) {
        Matcher m = PARENTHESES.matcher(text);
        while (m.find()) {
            String content = m.group(1).strip();
            String preceding = text.substring(0, m.start()).strip();
            boolean precededByName = ENDS_WITH_NAME.matcher(preceding).find();

            for (String part : content.split(";")) {
                String segment = part.strip();
                if (segment.isEmpty()) continue;
                if (CitationPatterns.PAGE_ONLY.matcher(segment).find()) continue;
                if (CitationPatterns.containsMonthName(segment)) continue;

                List<String> warnings = new ArrayList<>();
                if (NAME_WITHOUT_COMMA.matcher(segment).find()) {
                    warnings.add(MISSING_COMMA);
                }
                if (segment.contains(" and ") && !segment.contains("&")) {
                    warnings.add(AND_IN_PARENTHESES);
                }

                List<String> years = parentheticalYears(segment);

                String author = LEADING_PREFIX.matcher(segment).replaceFirst("").strip();
                author = PAGE_LOCATOR.matcher(author).replaceAll("").strip();
                if (!years.isEmpty()) {
                    author = YEAR_TOKEN.matcher(author).replaceAll("").strip();
                    author = NO_DATE_TOKEN.matcher(author).replaceAll("").strip();
                    author = IN_PRESS_TOKEN.matcher(author).replaceAll("").strip();
                }
                author = CitationPatterns.stripEdges(author);
                author = LEADING_NUMBER.matcher(author).replaceFirst("").strip();

                if (!years.isEmpty() && !CitationPatterns.HAS_LETTER.matcher(author).find()) {
                    // "Smith (2020)": the narrative pass owns it
                    if (precededByName) continue;
                    author = UNKNOWN_AUTHOR;
                    warnings.add(MISSING_AUTHOR);
                }

                if (author.length() <= 1 || years.isEmpty()) continue;
                if (CitationPatterns.NON_CITATION_LEAD.matcher(author).find()) continue;

                Matcher secondary = SECONDARY_SOURCE.matcher(author);
                if (secondary.find()) {
                    author = secondary.group(1).strip();
                }
                if (!CitationPatterns.HAS_LETTER.matcher(author).find()) continue;

                for (String year : years) {
                    results.add(new ParsedCitation(author, year, CitationType.PARENTHETICAL, warnings,
                            "(" + segment + ")"));
                    seenPairs.add(pairKey(author, year));
                }
            }
        }
    }

    private static List<String> parentheticalYears(String segment) {
        Matcher noDate = CitationPatterns.NO_DATE.matcher(segment);
        if (noDate.find()) {
            return List.of(noDate.group());
        }
        if (CitationPatterns.IN_PRESS.matcher(segment).find()) {
            return List.of("in press");
        }
        List<String> years = new ArrayList<>();
        Matcher y = CitationPatterns.YEAR_WITH_SUFFIX.matcher(segment);
        while (y.find()) {
            years.add(y.group(1));
        }
        return years;
    }

    private void parseNarrative(String text, List<ParsedCitation> results, Set<String> seenPairs) {
        Matcher m = NARRATIVE.matcher(text);
        while (m.find()) {
            String authorRaw = m.group(1).strip();
            String parens = m.group(2);

            List<String> years = new ArrayList<>();
            Matcher y = CitationPatterns.YEAR_WITH_SUFFIX.matcher(parens);
            while (y.find()) {
                years.add(y.group(1));
            }
            boolean noDate = NARRATIVE_NO_DATE.matcher(parens).find();
            boolean inPress = CitationPatterns.IN_PRESS.matcher(parens).find();
            if (years.isEmpty() && !noDate && !inPress) continue;

            // "(First Nations Pedagogy Online, 2019)" is parenthetical, not narrative
            String leftover = CitationPatterns.IN_PRESS.matcher(
                    NARRATIVE_NO_DATE.matcher(parens).replaceAll("")).replaceAll("");
            if (THREE_LETTERS.matcher(leftover).find()) continue;

            if (noDate) {
                Matcher nd = CitationPatterns.NO_DATE.matcher(parens);
                years = List.of(nd.find() ? nd.group() : "n.d");
            } else if (inPress) {
                years = List.of("in press");
            }

            String author = narrativeAuthor(authorRaw);
            if (author == null) continue;

            List<String> warnings = author.contains("&") ? List.of(AMPERSAND_IN_NARRATIVE) : List.of();
            for (String year : years) {
                if (seenPairs.contains(pairKey(author, year))) continue;
                results.add(new ParsedCitation(author, year, CitationType.NARRATIVE, warnings, m.group()));
            }
        }
    }

    /**
     * Cleans the text in front of {@code (2020)} down to an author name, or returns {@code null}
     * when it does not look like one.
     */
    private static String narrativeAuthor(String raw) {
        String author = POSSESSIVE.matcher(raw).replaceAll("").strip();

        String[] words = author.split("\\s+");
        if (words.length > 1) {
            int capStart = -1;
            for (int i = words.length - 1; i >= 0; i--) {
                String word = words[i];
                if (word.isEmpty()) continue;
                boolean stop = CitationPatterns.NAME_STOPWORDS.contains(word.toLowerCase(Locale.ROOT));
                if (Character.isUpperCase(word.charAt(0)) && !stop) {
                    capStart = i;
                } else if (Character.isLowerCase(word.charAt(0)) && !stop) {
                    break;
                }
            }
            if (capStart > 0) {
                author = String.join(" ", Arrays.asList(words).subList(capStart, words.length));
            }
        }

        author = NARRATIVE_LEAD_IN.matcher(author).replaceFirst("").strip();
        if (author.isEmpty()) return null;

        if (CitationPatterns.NON_CITATION_LEAD.matcher(author).find()) return null;
        if (INSTRUMENT_NAME.matcher(author).find()) return null;
        if (TRAILING_ACRONYM.matcher(author).find()) return null;
        if (NON_AUTHOR_WORDS.contains(author.toLowerCase(Locale.ROOT))) return null;

        String[] nameWords = author.split("\\s+");
        if (nameWords.length > MAX_NARRATIVE_WORDS) return null;
        if (nameWords.length > 2) {
            int meaningful = 0;
            int capitalized = 0;
            for (String w : nameWords) {
                if (!Character.isLetter(w.charAt(0))) continue;
                if (CitationPatterns.NAME_STOPWORDS.contains(w.toLowerCase(Locale.ROOT))) continue;
                meaningful++;
                if (Character.isUpperCase(w.charAt(0))) capitalized++;
            }
            if (meaningful == 0) return null;
            if ((double) capitalized / meaningful < MIN_CAPITALIZED_SHARE) return null;
        }
        return author;
    }

    private static String pairKey(String author, String year) {
        String trimmed = TRAILING_PUNCTUATION.matcher(author).replaceAll("").strip();
        return trimmed.toLowerCase(Locale.ROOT) + "|" + year;
    }

    @Override
    public ParsedReference parseReference(String text) {
        if (text == null) return null;
        Matcher m = REFERENCE.matcher(text);
        if (!m.lookingAt()) return null;

        String authorPart = m.group(1).strip();
        String year = referenceYear(m.group(2).strip());

        authorPart = EDITOR_MARK.matcher(authorPart).replaceAll("").strip();
        authorPart = TRAILING_COMMA.matcher(authorPart).replaceFirst("");

        List<String> abbreviations = new ArrayList<>();
        Matcher abbr = DECLARED_ABBREVIATION.matcher(authorPart);
        while (abbr.find()) {
            abbreviations.add(abbr.group(1));
        }
        String authorClean = BRACKETED.matcher(authorPart).replaceAll(" ").strip();
        authorClean = TRAILING_PUNCTUATION.matcher(authorClean).replaceAll("");

        if (abbreviations.isEmpty()) {
            String inferred = inferAcronym(authorClean);
            if (inferred != null) abbreviations.add(inferred);
        }

        return new ParsedReference(displayAuthor(authorClean), year, authorPart, abbreviations, text);
    }

    private static String referenceYear(String datePart) {
        Matcher y = CitationPatterns.YEAR_WITH_SUFFIX.matcher(datePart);
        if (y.find()) return y.group(1);
        String lower = datePart.toLowerCase(Locale.ROOT);
        if (lower.contains("n.d")) {
            Matcher nd = CitationPatterns.NO_DATE.matcher(datePart);
            return nd.find() ? nd.group() : "n.d.";
        }
        if (lower.contains("in press")) return "in press";
        return datePart;
    }

    /**
     * "World Health Organization" -> "WHO". Person names ("Smith, J.") and short names are left alone.
     */
    private static String inferAcronym(String author) {
        if (author.contains(",")) return null;
        String[] words = author.split("\\s+");
        if (words.length < 2) return null;
        StringBuilder sb = new StringBuilder();
        for (String w : words) {
            if (w.isEmpty()) continue;
            if (!Character.isUpperCase(w.charAt(0))) return null;
            sb.append(w.charAt(0));
        }
        return sb.length() >= MIN_INFERRED_ABBREVIATION ? sb.toString() : null;
    }

    private static String displayAuthor(String authorClean) {
        if (authorClean.contains("&")) {
            String[] authors = authorClean.split("&");
            String first = surname(authors[0]);
            if (authors.length == 2 && Reference.countAuthors(authorClean) == 2) {
                return first + " & " + surname(authors[1]);
            }
            return first;
        }
        if (authorClean.contains(",")) {
            return authorClean.split(",")[0].strip();
        }
        return authorClean.strip();
    }

    private static String surname(String author) {
        return author.strip().split(",")[0].strip();
    }
}
