package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ValidationReportJUnitTest {

    private static ValidationResult validate(String text) {
        return CitationValidator.validate(Paragraph.of(List.of(text.split("\n"))), CitationStyle.APA);
    }

    @Test
    void render_listsFindingsBySection() {
        var result = validate("""
                Smith (2019) argued that citations matter.
                Later work by Jones (2020) disagreed.
                <ref-open>
                Smith, J. (2019). Citations matter. Journal of Things, 1(1), 1-10.
                Brown, K. (2020). Another view entirely on reference practice. Academic Press.
                <ref-close>
                """);

        String report = ValidationReport.render(result, "paper.txt");

        assertTrue(report.startsWith("STATUS: Name/Year: 2 comments\n"));
        assertTrue(report.contains("Document: paper.txt"));
        assertTrue(report.contains("Style: APA (American Psychological Association)"));
        assertTrue(report.contains("  Total in-text citations found: 2"));
        assertTrue(report.contains("MISSING REFERENCES (cited but not in bibliography):\n"));
        assertTrue(report.contains("  Jones (2020)\n    Cited in paragraph(s): 2"));
        assertTrue(report.contains("  Brown (2020)\n    Line: 5\n    Text: Brown, K. (2020)."));
        assertTrue(report.contains("VALID CITATIONS:"));
        assertTrue(report.contains("  Smith (2019)"));
        assertFalse(report.contains("YEAR MISMATCHES"));
        assertTrue(report.endsWith("END OF REPORT\n" + "=".repeat(60)));
    }

    @Test
    void render_severityTagOnWarnings() {
        var result = validate("""
                Health outcomes improved (World Health Organization [WHO], 2020).
                Again stated (World Health Organization, 2020).
                <ref-open>
                World Health Organization [WHO]. (2020). World health statistics. Geneva.
                <ref-close>
                """);

        String report = ValidationReport.render(result, "who.txt");

        assertTrue(report.contains("  Citation: (World Health Organization, 2020) [warning]"));
        assertTrue(report.contains("  Abbreviation Errors: 1"));
    }

    @Test
    void renderNumeric_showsMappingInNewOrder() {
        var outcome = NumericSequencer.renumber(NumericSequencerJUnitTest.outOfOrder());

        String report = ValidationReport.renderNumeric(outcome, "numbered.txt");

        assertTrue(report.startsWith("STATUS: " + NumericSequencer.STATUS_RENUMBERED));
        assertTrue(report.contains("VALIDATION BEFORE:"));
        assertTrue(report.contains("    - position 1: cited 5, expected 1"));
        assertTrue(report.contains("VALIDATION AFTER:"));
        assertTrue(report.contains("  5 -> 1\n  2 -> 2\n  9 -> 3"));
        assertTrue(report.contains("  Perfect: yes"));
    }

    @Test
    void renderNumeric_abortedHasNoAfterSection() {
        var doc = NumericSequencerJUnitTest.document(
                "Cites [1].",
                "<ref-open>",
                "1. Brown K. Soil chemistry of alpine meadows. Ecology Letters. 2019.",
                "12. Zhang Q. Coastal erosion modelling with satellite imagery. Remote Sensing. 2020.",
                "<ref-close>");

        String report = ValidationReport.renderNumeric(NumericSequencer.renumber(doc), "numbered.txt");

        assertTrue(report.startsWith("STATUS: " + NumericSequencer.STATUS_UNUSED));
        assertTrue(report.contains("  Unused references: 12"));
        assertFalse(report.contains("VALIDATION AFTER"));
        assertFalse(report.contains("RENUMBERING MAPPING"));
    }
}
