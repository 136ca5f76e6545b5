package com.citationchecker;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Resolves citations to references.
 *
 * <p>Cascade, first hit wins: exact key, declared/inferred abbreviation, then a per-reference
 * "smart" comparison tolerant of {@code and}/{@code &}, punctuation, abbreviation introductions
 * ({@code World Health Organization [WHO]}), {@code et al.} and partial author lists. Candidates
 * are tried in bibliography order and the first acceptable one is taken; there is no ranking.
 */
public final class CitationMatcher {

    private static final Pattern AND_WORD = Pattern.compile("\\band\\b",
            Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern PERIODS_AND_COMMAS = Pattern.compile("[.,]");
    private static final Pattern LEADING_THE = Pattern.compile("^the\\s+");
    private static final Pattern ABBREVIATION_INTRODUCTION = Pattern.compile("^(.*?)\\s*\\[.*?\\]");
    private static final Pattern WORD = Pattern.compile("\\b[a-z]{2,}\\b");
    private static final Set<String> SUBSET_STOPWORDS = Set.of("and", "the", "et", "al");

    private CitationMatcher() {
    }

    public enum MatchStrategy {
        EXACT,
        ABBREVIATION,
        NORMALIZED_TEXT,
        ABBREVIATION_DEFINITION,
        ET_AL,
        WORD_SUBSET
    }

    /**
     * Citation key -> reference key, with the strategy that produced each pair.
     */
    public record MatchResult(
            Map<String, String> pairs,
            Map<String, MatchStrategy> strategies
    ) {
        public MatchResult {
            pairs = Collections.unmodifiableMap(new LinkedHashMap<>(pairs));
            strategies = Collections.unmodifiableMap(new LinkedHashMap<>(strategies));
        }

        public Set<String> matchedCitations() {
            return Collections.unmodifiableSet(new LinkedHashSet<>(pairs.keySet()));
        }

        public Set<String> matchedReferences() {
            return Collections.unmodifiableSet(new LinkedHashSet<>(pairs.values()));
        }

        public boolean isMatched(String citationKey) {
            return pairs.containsKey(citationKey);
        }

        public String referenceFor(String citationKey) {
            return pairs.get(citationKey);
        }
    }

    private record Hit(String referenceKey, MatchStrategy strategy) {}

    public static MatchResult match(Map<String, Citation> citations, CitationExtractor.ReferenceTable table) {
        Objects.requireNonNull(citations, "citations");
        Objects.requireNonNull(table, "table");

        Map<String, String> pairs = new LinkedHashMap<>();
        Map<String, MatchStrategy> strategies = new LinkedHashMap<>();
        for (Citation c : citations.values()) {
            Hit hit = resolve(c, table);
            if (hit != null) {
                pairs.put(c.key(), hit.referenceKey());
                strategies.put(c.key(), hit.strategy());
            }
        }
        return new MatchResult(pairs, strategies);
    }

    private static Hit resolve(Citation citation, CitationExtractor.ReferenceTable table) {
        if (table.references().containsKey(citation.key())) {
            return new Hit(citation.key(), MatchStrategy.EXACT);
        }
        String abbreviationKey = citation.author().strip() + "|" + citation.year();
        String viaAbbreviation = table.abbreviations().get(abbreviationKey);
        if (viaAbbreviation != null) {
            return new Hit(viaAbbreviation, MatchStrategy.ABBREVIATION);
        }
        return smartMatch(citation, table.references());
    }

    private static Hit smartMatch(Citation citation, Map<String, Reference> references) {
        String year = citation.year() == null ? "" : citation.year();
        String citeNorm = normalizeForComparison(citation.author());

        Matcher intro = ABBREVIATION_INTRODUCTION.matcher(citation.author());
        String introducedName = intro.lookingAt() ? normalizeForComparison(intro.group(1)) : null;

        boolean etAl = citeNorm.contains("et al");
        String citeFirst = firstToken(citeNorm);

        Set<String> citeWords = words(citeNorm);
        citeWords.removeAll(SUBSET_STOPWORDS);

        for (Reference ref : references.values()) {
            if (!year.isEmpty() && !year.equals(ref.year())) continue;

            String refNorm = normalizeForComparison(ref.fullAuthor() != null ? ref.fullAuthor() : ref.author());

            if (citeNorm.equals(refNorm)) {
                return new Hit(ref.key(), MatchStrategy.NORMALIZED_TEXT);
            }
            if (introducedName != null && !introducedName.isEmpty() && introducedName.equals(refNorm)) {
                return new Hit(ref.key(), MatchStrategy.ABBREVIATION_DEFINITION);
            }
            if (etAl && !citeFirst.isEmpty() && citeFirst.equals(firstToken(refNorm))) {
                return new Hit(ref.key(), MatchStrategy.ET_AL);
            }
            if (!citeWords.isEmpty() && words(refNorm).containsAll(citeWords)) {
                return new Hit(ref.key(), MatchStrategy.WORD_SUBSET);
            }
        }
        return null;
    }

    /**
     * Lowercase comparison form: {@code and} becomes {@code &}, periods and commas go, a leading
     * {@code the} goes. {@code "The Smith and Jones, Inc."} -> {@code "smith & jones inc"}.
     */
    static String normalizeForComparison(String text) {
        if (text == null) return "";
        String s = AND_WORD.matcher(text).replaceAll("&");
        s = PERIODS_AND_COMMAS.matcher(s).replaceAll("");
        s = s.strip().toLowerCase(Locale.ROOT);
        return LEADING_THE.matcher(s).replaceFirst("");
    }

    private static String firstToken(String normalized) {
        String s = normalized.strip();
        if (s.isEmpty()) return "";
        return s.split("\\s+")[0];
    }

    private static Set<String> words(String normalized) {
        Set<String> words = new HashSet<>();
        Matcher m = WORD.matcher(normalized);
        while (m.find()) {
            words.add(m.group());
        }
        return words;
    }
}
