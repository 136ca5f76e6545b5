package com.citationchecker;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Plain-text reports for name-year and numeric validation.
 */
public final class ValidationReport {

    private static final String HEAVY_RULE = "=".repeat(60);
    private static final String LIGHT_RULE = "-".repeat(60);

    private ValidationReport() {
    }

    public static String render(ValidationResult r, String documentName) {
        List<String> out = new ArrayList<>();
        out.add("STATUS: Name/Year: " + r.commentCount() + " comments");
        out.add("");
        out.add(HEAVY_RULE);
        out.add("CITATION VALIDATION REPORT");
        out.add(HEAVY_RULE);
        out.add("");
        out.add("Document: " + documentName);
        out.add("Style: " + r.styleName());
        out.add(LIGHT_RULE);

        out.add("");
        out.add("SUMMARY:");
        out.add("  Total in-text citations found: " + r.totalCitations());
        out.add("  Total references in bibliography: " + r.totalReferences());
        out.add("  Valid (matched) citations: " + r.validCount());
        out.add("  Missing references: " + r.missingReferences().size());
        out.add("  Unused references: " + r.unusedReferences().size());
        out.add("  Format Errors: " + r.formatErrors().size());
        out.add("  Year Mismatches: " + r.yearMismatches().size());
        out.add("  Spelling Mismatches: " + r.spellingMismatches().size());
        out.add("  Et Al. Errors: " + r.etAlErrors().size());
        out.add("  Abbreviation Errors: " + r.abbreviationErrors().size());
        out.add("  Duplicate References: " + r.duplicates().size());

        if (!r.missingReferences().isEmpty()) {
            section(out, "MISSING REFERENCES (cited but not in bibliography):");
            for (Diagnostic.MissingReference m : r.missingReferences()) {
                out.add("");
                out.add("  " + m.citation());
                out.add("    Cited in paragraph(s): " + join(m.locations()));
            }
        }

        if (!r.yearMismatches().isEmpty()) {
            section(out, "YEAR MISMATCHES (Author matches but year differs):");
            for (Diagnostic.YearMismatch y : r.yearMismatches()) {
                out.add("");
                out.add("  Citation: " + y.citation());
                out.add("  Reference Year: " + y.referenceYear());
                out.add("  Cited in paragraph(s): " + join(y.locations()));
            }
        }

        if (!r.spellingMismatches().isEmpty()) {
            section(out, "SPELLING MISMATCHES (Author spelling differs):");
            for (Diagnostic.SpellingMismatch s : r.spellingMismatches()) {
                out.add("");
                out.add("  Citation: " + s.citation());
                out.add("  Cited Author: " + s.citedAuthor());
                out.add("  Ref Author: " + s.referenceAuthor());
                out.add("  Cited in paragraph(s): " + join(s.locations()));
            }
        }

        if (!r.etAlErrors().isEmpty()) {
            section(out, "ET AL. ERRORS (Incorrect use of 'et al.'):");
            for (Diagnostic.EtAlError e : r.etAlErrors()) {
                out.add("");
                out.add("  Citation: " + e.citation() + severityTag(e));
                out.add("  Issue: " + e.message());
                out.add("  Correct Form: " + e.correctForm());
                out.add("  Cited in paragraph(s): " + join(e.locations()));
            }
        }

        if (!r.abbreviationErrors().isEmpty()) {
            section(out, "ABBREVIATION ERRORS (First vs Subsequent Usage):");
            for (Diagnostic.AbbreviationError a : r.abbreviationErrors()) {
                out.add("");
                out.add("  Citation: " + a.citation() + severityTag(a));
                out.add("  Issue: " + a.message());
                out.add("  Cited in paragraph(s): " + join(a.locations()));
            }
        }

        if (!r.duplicates().isEmpty()) {
            section(out, "DUPLICATE REFERENCES:");
            for (Diagnostic.DuplicateReference d : r.duplicates()) {
                out.add("");
                out.add("  Original ID: " + d.duplicateOf());
                out.add("  Duplicate ID: " + d.id());
                out.add("  Text: " + d.text());
                out.add("  Similarity Score: " + d.score() + "%");
            }
        }

        if (!r.formatErrors().isEmpty()) {
            section(out, "FORMAT ERRORS (Style Violations):");
            for (Diagnostic.FormatError f : r.formatErrors()) {
                out.add("");
                out.add("  Citation: " + f.citation());
                for (String w : f.warnings()) {
                    out.add("    - " + w);
                }
                out.add("    Cited in paragraph(s): " + join(f.locations()));
            }
        }

        if (!r.unusedReferences().isEmpty()) {
            section(out, "UNUSED REFERENCES (in bibliography but never cited):");
            for (Diagnostic.UnusedReference u : r.unusedReferences()) {
                out.add("");
                out.add("  " + u.reference());
                out.add("    Line: " + u.line());
                out.add("    Text: " + u.text());
            }
        }

        if (!r.validCitations().isEmpty()) {
            section(out, "VALID CITATIONS:");
            for (String v : r.validCitations()) {
                out.add("  " + v);
            }
        }

        endOfReport(out);
        return String.join("\n", out);
    }

    public static String renderNumeric(NumericSequencer.RenumberOutcome outcome, String documentName) {
        List<String> out = new ArrayList<>();
        out.add("STATUS: " + outcome.status());
        out.add("");
        out.add(HEAVY_RULE);
        out.add("NUMERIC CITATION REPORT");
        out.add(HEAVY_RULE);
        out.add("");
        out.add("Document: " + documentName);
        out.add(LIGHT_RULE);

        numericSection(out, "VALIDATION BEFORE", outcome.before());
        if (!outcome.plan().isEmpty()) {
            numericSection(out, "VALIDATION AFTER", outcome.after());
        }

        if (!outcome.mapping().isEmpty()) {
            section(out, "RENUMBERING MAPPING (Old -> New):");
            outcome.mapping().entrySet().stream()
                    .sorted(Map.Entry.comparingByValue())
                    .forEach(e -> out.add("  " + e.getKey() + " -> " + e.getValue()));
        }

        endOfReport(out);
        return String.join("\n", out);
    }

    private static void numericSection(List<String> out, String title, NumericSequencer.NumericValidation v) {
        section(out, title + ":");
        out.add("  Total references: " + v.totalReferences());
        out.add("  Total citations: " + v.totalCitations());
        out.add("  Missing references: " + (v.missingReferences().isEmpty() ? "none" : join(v.missingReferences())));
        out.add("  Unused references: " + (v.unusedReferences().isEmpty() ? "none" : join(v.unusedReferences())));
        out.add("  Sequence issues: " + v.sequenceIssues().size());
        for (NumericSequencer.SequenceIssue s : v.sequenceIssues()) {
            out.add("    - position " + s.position() + ": cited " + s.current() + ", expected " + s.expected());
        }
        out.add("  Duplicate references: " + v.duplicates().size());
        for (DuplicateDetector.DuplicateRecord<Integer> d : v.duplicates()) {
            out.add("    - " + d.id() + " duplicates " + d.duplicateOf() + " (" + d.score() + "%): " + d.text());
        }
        out.add("  Perfect: " + (v.perfect() ? "yes" : "no"));
    }

    private static void section(List<String> out, String title) {
        out.add("");
        out.add(LIGHT_RULE);
        out.add(title);
        out.add(LIGHT_RULE);
    }

    private static void endOfReport(List<String> out) {
        out.add("");
        out.add(HEAVY_RULE);
        out.add("END OF REPORT");
        out.add(HEAVY_RULE);
    }

    private static String severityTag(Diagnostic d) {
        return d.severity() == Diagnostic.Severity.WARNING ? " [warning]" : "";
    }

    private static String join(List<Integer> values) {
        return values.stream().map(String::valueOf).collect(Collectors.joining(", "));
    }
}
