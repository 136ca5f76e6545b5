package com.citationchecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Everything one name-year validation pass found.
 *
 * @param styleName       display name of the style the manuscript was parsed with
 * @param citations       extracted citations, keyed and ordered as found
 * @param references      the parsed bibliography
 * @param matches         citation -> reference resolution
 * @param validCitations  display strings of the matched citations, sorted
 */
public record ValidationResult(
        String styleName,
        Map<String, Citation> citations,
        CitationExtractor.ReferenceTable references,
        CitationMatcher.MatchResult matches,
        List<Diagnostic.MissingReference> missingReferences,
        List<Diagnostic.UnusedReference> unusedReferences,
        List<Diagnostic.YearMismatch> yearMismatches,
        List<Diagnostic.SpellingMismatch> spellingMismatches,
        List<Diagnostic.FormatError> formatErrors,
        List<Diagnostic.EtAlError> etAlErrors,
        List<Diagnostic.AbbreviationError> abbreviationErrors,
        List<Diagnostic.DuplicateReference> duplicates,
        List<String> validCitations
) {

    public ValidationResult {
        citations = Collections.unmodifiableMap(new LinkedHashMap<>(citations));
        missingReferences = List.copyOf(missingReferences);
        unusedReferences = List.copyOf(unusedReferences);
        yearMismatches = List.copyOf(yearMismatches);
        spellingMismatches = List.copyOf(spellingMismatches);
        formatErrors = List.copyOf(formatErrors);
        etAlErrors = List.copyOf(etAlErrors);
        abbreviationErrors = List.copyOf(abbreviationErrors);
        duplicates = List.copyOf(duplicates);
        validCitations = List.copyOf(validCitations);
    }

    public int totalCitations() {
        return citations.size();
    }

    public int totalReferences() {
        return references.size();
    }

    public int validCount() {
        return matches.pairs().size();
    }

    /**
     * Number of findings that would be written into the manuscript as comments. Duplicates are
     * reported but not counted.
     */
    public int commentCount() {
        return missingReferences.size() + unusedReferences.size() + formatErrors.size()
                + yearMismatches.size() + spellingMismatches.size() + etAlErrors.size()
                + abbreviationErrors.size();
    }

    /**
     * All findings, grouped by kind in report order.
     */
    public List<Diagnostic> diagnostics() {
        List<Diagnostic> all = new ArrayList<>();
        all.addAll(missingReferences);
        all.addAll(yearMismatches);
        all.addAll(spellingMismatches);
        all.addAll(etAlErrors);
        all.addAll(abbreviationErrors);
        all.addAll(duplicates);
        all.addAll(formatErrors);
        all.addAll(unusedReferences);
        return all;
    }

    public boolean hasErrors() {
        for (Diagnostic d : diagnostics()) {
            if (d.severity() == Diagnostic.Severity.ERROR) return true;
        }
        return false;
    }
}
