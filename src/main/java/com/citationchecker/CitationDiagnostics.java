package com.citationchecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Turns extracted citations, references and their resolution into findings.
 *
 * <p>All checks are pure functions of their inputs; running them twice gives the same result.
 */
public final class CitationDiagnostics {

    /** A cited author this similar to a reference author is reported as a misspelling. */
    public static final double SPELLING_THRESHOLD = 0.80;

    private static final Pattern ET_AL = Pattern.compile("\\s*et\\s+al\\.?\\s*", Pattern.CASE_INSENSITIVE);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[.,;: ]+$");

    private CitationDiagnostics() {
    }

    public static ValidationResult diagnose(String styleName,
                                            Map<String, Citation> citations,
                                            CitationExtractor.ReferenceTable table,
                                            CitationMatcher.MatchResult matches) {
        Objects.requireNonNull(citations, "citations");
        Objects.requireNonNull(table, "table");
        Objects.requireNonNull(matches, "matches");

        Map<String, Reference> references = table.references();

        List<Diagnostic.MissingReference> missing = new ArrayList<>();
        List<Diagnostic.YearMismatch> yearMismatches = new ArrayList<>();
        List<Diagnostic.SpellingMismatch> spellingMismatches = new ArrayList<>();
        List<Diagnostic.FormatError> formatErrors = new ArrayList<>();
        List<Diagnostic.EtAlError> etAlErrors = new ArrayList<>();
        List<String> valid = new ArrayList<>();

        for (Citation c : citations.values()) {
            String refKey = matches.referenceFor(c.key());
            if (refKey != null) {
                valid.add(c.display());
                Diagnostic.EtAlError etAl = checkEtAl(c, references.get(refKey));
                if (etAl != null) etAlErrors.add(etAl);
            } else {
                Diagnostic.YearMismatch year = findYearMismatch(c, references);
                if (year != null) {
                    yearMismatches.add(year);
                } else {
                    Diagnostic.SpellingMismatch spelling = findSpellingMismatch(c, references);
                    if (spelling != null) {
                        spellingMismatches.add(spelling);
                    } else {
                        missing.add(new Diagnostic.MissingReference(c.display(), c.locations()));
                    }
                }
            }
            if (!c.warnings().isEmpty()) {
                formatErrors.add(new Diagnostic.FormatError(c.display(), c.warnings(), c.locations()));
            }
        }

        List<Diagnostic.AbbreviationError> abbreviationErrors = checkAbbreviationUsage(citations, references, matches);
        List<Diagnostic.UnusedReference> unused = findUnused(references, matches, yearMismatches, spellingMismatches);
        List<Diagnostic.DuplicateReference> duplicates = findDuplicates(table.entries());

        Collections.sort(valid);
        return new ValidationResult(styleName, citations, table, matches,
                missing, unused, yearMismatches, spellingMismatches, formatErrors,
                etAlErrors, abbreviationErrors, duplicates, valid);
    }

    static Diagnostic.YearMismatch findYearMismatch(Citation c, Map<String, Reference> references) {
        String author = CitationKeys.normalizeAuthor(c.author().strip());
        for (Reference ref : references.values()) {
            if (CitationKeys.normalizeAuthor(ref.author()).equals(author)) {
                return new Diagnostic.YearMismatch(c.display(), c.year(), ref.year(), ref.key(), c.locations());
            }
        }
        return null;
    }

    static Diagnostic.SpellingMismatch findSpellingMismatch(Citation c, Map<String, Reference> references) {
        String cited = CitationMatcher.normalizeForComparison(c.author());
        Reference best = null;
        double bestRatio = 0.0;
        for (Reference ref : references.values()) {
            double ratio = SequenceSimilarity.ratio(cited, CitationMatcher.normalizeForComparison(ref.author()));
            if (ratio > SPELLING_THRESHOLD && ratio > bestRatio) {
                bestRatio = ratio;
                best = ref;
            }
        }
        if (best == null) return null;
        return new Diagnostic.SpellingMismatch(c.display(), c.author().strip(), best.author(), best.key(),
                bestRatio, c.locations());
    }

    /**
     * APA 7: one or two authors are always named; three or more are cited as
     * {@code First et al.}.
     */
    static Diagnostic.EtAlError checkEtAl(Citation c, Reference ref) {
        if (ref == null) return null;
        int count = ref.authorCount();
        if (c.usesEtAl() && count <= 2) {
            String correct = ref.author();
            String message = "Change author per reference - use '" + correct + "', not 'et al.' (reference has only "
                    + count + " author" + (count > 1 ? "s" : "") + ")";
            return new Diagnostic.EtAlError(c.display(), Diagnostic.Severity.ERROR, message, correct, count,
                    c.locations());
        }
        if (!c.usesEtAl() && count >= 3) {
            String correct = firstSurname(ref.fullAuthor()) + " et al.";
            String message = "Consider using 'et al.' - reference has " + count + " authors, APA allows '"
                    + correct + "'";
            return new Diagnostic.EtAlError(c.display(), Diagnostic.Severity.WARNING, message, correct, count,
                    c.locations());
        }
        return null;
    }

    static String firstSurname(String author) {
        if (author == null) return "";
        String s = ET_AL.matcher(author.strip()).replaceAll("");
        if (s.contains(",")) {
            return s.split(",")[0].strip();
        }
        String[] parts = s.strip().split("\\s+");
        return parts.length == 0 ? "" : parts[0];
    }

    private record Usage(int location, String text, boolean introduction, boolean abbreviation, boolean fullForm) {}

    /**
     * An abbreviated organization must be introduced as {@code Full Name [ABBR]} at its first
     * citation and cited by the abbreviation afterwards.
     */
    static List<Diagnostic.AbbreviationError> checkAbbreviationUsage(Map<String, Citation> citations,
                                                                     Map<String, Reference> references,
                                                                     CitationMatcher.MatchResult matches) {
        Map<String, List<Usage>> usagesByReference = new LinkedHashMap<>();
        for (Map.Entry<String, String> pair : matches.pairs().entrySet()) {
            Citation c = citations.get(pair.getKey());
            Reference ref = references.get(pair.getValue());
            if (c == null || ref == null || ref.abbreviations().isEmpty()) continue;

            String author = c.author().strip();
            boolean introduction = author.contains("[");
            boolean abbreviation = ref.abbreviations().contains(author);
            String fullName = fullNameWithoutAbbreviation(ref.fullAuthor());
            boolean fullForm = !fullName.isEmpty()
                    && author.toLowerCase(Locale.ROOT).startsWith(fullName.toLowerCase(Locale.ROOT));
            if (introduction) {
                fullForm = true;
                abbreviation = false;
            }

            List<Usage> usages = usagesByReference.computeIfAbsent(ref.key(), k -> new ArrayList<>());
            for (int location : c.locations()) {
                usages.add(new Usage(location, c.display(), introduction, abbreviation, fullForm));
            }
        }

        List<Diagnostic.AbbreviationError> errors = new ArrayList<>();
        for (Map.Entry<String, List<Usage>> e : usagesByReference.entrySet()) {
            List<Usage> usages = e.getValue();
            if (usages.isEmpty()) continue;
            usages.sort((a, b) -> Integer.compare(a.location(), b.location()));
            String abbr = references.get(e.getKey()).abbreviations().get(0);

            Usage first = usages.get(0);
            if (first.abbreviation() && !first.fullForm()) {
                errors.add(new Diagnostic.AbbreviationError(first.text(), Diagnostic.Severity.ERROR,
                        "First confirmation of abbreviation should define it. Use 'Full Name [Abbr]' instead of '"
                                + first.text() + "'.",
                        abbr, List.of(first.location())));
            }
            for (Usage u : usages.subList(1, usages.size())) {
                if (u.introduction()) {
                    errors.add(new Diagnostic.AbbreviationError(u.text(), Diagnostic.Severity.ERROR,
                            "Abbreviation already introduced. Use '" + abbr + "' instead.",
                            abbr, List.of(u.location())));
                } else if (u.fullForm() && !u.abbreviation()) {
                    errors.add(new Diagnostic.AbbreviationError(u.text(), Diagnostic.Severity.WARNING,
                            "Abbreviation previously introduced. Consider using '" + abbr + "' instead.",
                            abbr, List.of(u.location())));
                }
            }
        }
        return errors;
    }

    /**
     * {@code "World Health Organization [WHO]."} -> {@code "World Health Organization"}.
     */
    private static String fullNameWithoutAbbreviation(String fullAuthor) {
        if (fullAuthor == null) return "";
        String s = fullAuthor;
        int bracket = s.indexOf('[');
        int paren = s.indexOf('(');
        int cut = bracket < 0 ? paren : (paren < 0 ? bracket : Math.min(bracket, paren));
        if (cut >= 0) s = s.substring(0, cut);
        return TRAILING_PUNCTUATION.matcher(s.strip()).replaceAll("");
    }

    static List<Diagnostic.UnusedReference> findUnused(Map<String, Reference> references,
                                                       CitationMatcher.MatchResult matches,
                                                       List<Diagnostic.YearMismatch> yearMismatches,
                                                       List<Diagnostic.SpellingMismatch> spellingMismatches) {
        Set<String> accountedFor = new HashSet<>(matches.matchedReferences());
        for (Diagnostic.YearMismatch y : yearMismatches) accountedFor.add(y.referenceKey());
        for (Diagnostic.SpellingMismatch s : spellingMismatches) accountedFor.add(s.referenceKey());

        List<Diagnostic.UnusedReference> unused = new ArrayList<>();
        for (Reference ref : references.values()) {
            if (accountedFor.contains(ref.key())) continue;
            unused.add(new Diagnostic.UnusedReference(ref.display(), ref.key(), ref.paragraphIndex(), ref.snippet()));
        }
        return unused;
    }

    /**
     * Near-duplicates among all bibliography entries. A repeated key is told apart by its
     * occurrence, e.g. {@code garcia|2017#2} for the second entry keyed {@code garcia|2017}.
     */
    static List<Diagnostic.DuplicateReference> findDuplicates(List<Reference> entries) {
        List<DuplicateDetector.Candidate<String>> candidates = new ArrayList<>();
        Map<String, Integer> seen = new HashMap<>();
        for (Reference ref : entries) {
            int occurrence = seen.merge(ref.key(), 1, Integer::sum);
            String id = occurrence == 1 ? ref.key() : ref.key() + "#" + occurrence;
            candidates.add(new DuplicateDetector.Candidate<>(id, ref.text()));
        }
        List<Diagnostic.DuplicateReference> duplicates = new ArrayList<>();
        for (DuplicateDetector.DuplicateRecord<String> d : DuplicateDetector.findDuplicates(candidates)) {
            duplicates.add(new Diagnostic.DuplicateReference(d.id(), d.text(), d.duplicateOf(), d.score()));
        }
        return duplicates;
    }
}
