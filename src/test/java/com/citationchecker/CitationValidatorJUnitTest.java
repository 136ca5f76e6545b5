package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CitationValidatorJUnitTest {

    private static List<Paragraph> paragraphs(String text) {
        return Paragraph.of(List.of(text.split("\n")));
    }

    @Test
    void validate_missingValidAndUnused() {
        String manuscript = """
                Smith (2019) argued that citations matter.
                Later work by Jones (2020) disagreed.
                <ref-open>
                Smith, J. (2019). Citations matter. Journal of Things, 1(1), 1-10.
                Brown, K. (2020). Another view entirely on reference practice. Academic Press.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(2, r.totalCitations());
        assertEquals(2, r.totalReferences());
        assertEquals(List.of("Smith (2019)"), r.validCitations());
        assertEquals(1, r.missingReferences().size());
        assertEquals("Jones (2020)", r.missingReferences().get(0).citation());
        assertEquals(List.of(2), r.missingReferences().get(0).locations());
        assertEquals(1, r.unusedReferences().size());
        assertEquals("Brown (2020)", r.unusedReferences().get(0).reference());
        assertEquals(5, r.unusedReferences().get(0).line());
        assertTrue(r.duplicates().isEmpty());
        assertEquals(2, r.commentCount());
    }

    @Test
    void validate_autoDetectsApa() {
        String manuscript = """
                Shown before (Smith, 2019).
                <ref-open>
                Smith, J. (2019). Citations matter. Journal of Things.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript));

        assertEquals(CitationStyle.APA.displayName(), r.styleName());
        assertFalse(r.hasErrors());
        assertEquals(0, r.commentCount());
    }

    @Test
    void validate_mergesRepeatedCitations() {
        String manuscript = """
                First mention (Smith, 2019).
                Second mention (Smith, 2019).
                <ref-open>
                Smith, J. (2019). Citations matter. Journal of Things.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.totalCitations());
        assertEquals(List.of(1, 2), r.citations().get("Smith|2019").locations());
    }

    @Test
    void validate_citationsAfterBibliographyAreIgnored() {
        String manuscript = """
                <ref-open>
                Smith, J. (2019). Citations matter. Journal of Things.
                <ref-close>
                Appendix text mentions (Jones, 2020).
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(0, r.totalCitations());
        assertEquals(1, r.unusedReferences().size());
    }

    @Test
    void validate_abbreviationUsedAfterFullName() {
        String manuscript = """
                Health outcomes improved (World Health Organization [WHO], 2020).
                Later data confirmed this (WHO, 2020).
                Again stated (World Health Organization, 2020).
                <ref-open>
                World Health Organization [WHO]. (2020). World health statistics. Geneva.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(3, r.validCount());
        assertEquals(1, r.abbreviationErrors().size());
        var e = r.abbreviationErrors().get(0);
        assertEquals(Diagnostic.Severity.WARNING, e.severity());
        assertEquals("WHO", e.abbreviation());
        assertEquals(List.of(3), e.locations());
        assertTrue(e.message().contains("Consider using 'WHO'"));
    }

    @Test
    void validate_abbreviationUsedBeforeDefinition() {
        String manuscript = """
                Health outcomes improved (WHO, 2020).
                <ref-open>
                World Health Organization [WHO]. (2020). World health statistics. Geneva.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.abbreviationErrors().size());
        assertEquals(Diagnostic.Severity.ERROR, r.abbreviationErrors().get(0).severity());
        assertTrue(r.abbreviationErrors().get(0).message().startsWith("First confirmation of abbreviation"));
    }

    @Test
    void validate_abbreviationIntroducedTwice() {
        String manuscript = """
                Health outcomes improved (World Health Organization [WHO], 2020).
                The trend continued (World Health Organization [WHO], 2020).
                <ref-open>
                World Health Organization [WHO]. (2020). World health statistics. Geneva.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.abbreviationErrors().size());
        var e = r.abbreviationErrors().get(0);
        assertEquals(Diagnostic.Severity.ERROR, e.severity());
        assertEquals(List.of(2), e.locations());
        assertTrue(e.message().startsWith("Abbreviation already introduced"));
        assertTrue(e.message().contains("'WHO'"));
    }

    @Test
    void validate_formatWarningsAndEtAl() {
        String manuscript = """
                Early claim (Smith 2020).
                Smith et al. (2021) extended it.
                <ref-open>
                Smith, J. (2020). A single author paper. Press.
                Smith, J., & Jones, M. (2021). A two author paper. Other Press.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.formatErrors().size());
        assertEquals(List.of(ApaCitationParser.MISSING_COMMA), r.formatErrors().get(0).warnings());
        assertEquals(1, r.etAlErrors().size());
        assertEquals(2, r.etAlErrors().get(0).authorCount());
        assertEquals(Diagnostic.Severity.ERROR, r.etAlErrors().get(0).severity());
    }

    @Test
    void validate_duplicateReferences() {
        String manuscript = """
                Cited (Garcia, 2017).
                <ref-open>
                Garcia, L. (2017). Outcomes of community health worker programs. Global Health Action, 10(1), 1.
                Garcia, L. (2017a). Outcomes of community health worker programs. Global Health Action, 10(1), 1.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.duplicates().size());
        assertEquals("Garcia|2017", r.duplicates().get(0).duplicateOf());
        assertEquals("Garcia|2017a", r.duplicates().get(0).id());
    }

    @Test
    void validate_sameKeyDuplicateIsReported() {
        String manuscript = """
                Cited (Garcia, 2017).
                <ref-open>
                Garcia, L. (2017). Outcomes of community health worker programs. Global Health Action, 10(1), 1.
                Garcia, L. (2017). Outcomes of community health worker programs. Global Health Action, 10(1), 2.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(1, r.totalReferences());
        assertEquals(2, r.references().entries().size());
        assertTrue(r.unusedReferences().isEmpty());
        assertEquals(1, r.duplicates().size());
        assertEquals("Garcia|2017", r.duplicates().get(0).duplicateOf());
        assertEquals("Garcia|2017#2", r.duplicates().get(0).id());
    }

    @Test
    void validate_sameKeyDifferentWorksAreNotDuplicates() {
        String manuscript = """
                Cited (Garcia, 2017).
                <ref-open>
                Garcia, L. (2017). Outcomes of community health worker programs. Global Health Action, 10(1), 1.
                Garcia, L. (2017). Soil moisture retrieval from radar. Remote Sensing of Environment, 5, 77-90.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript), CitationStyle.APA);

        assertEquals(2, r.references().entries().size());
        assertTrue(r.duplicates().isEmpty());
    }

    @Test
    void validate_customParser() {
        var r = CitationValidator.validate(paragraphs("Nothing cited."), new VancouverCitationParser());
        assertEquals("VancouverCitationParser", r.styleName());
        assertEquals(0, r.totalCitations());
    }

    @Test
    void validate_vancouverManuscript() {
        String manuscript = """
                Shown before (Smith 2020) and confirmed (Brown 2018).
                <ref-open>
                Smith J. A title here. Journal. 2020;10(2):123-45.
                Brown K. Another title. Journal. 2018;1:2-3.
                <ref-close>
                """;

        var r = CitationValidator.validate(paragraphs(manuscript));

        assertEquals(CitationStyle.VANCOUVER.displayName(), r.styleName());
        assertEquals(2, r.validCount());
        assertTrue(r.missingReferences().isEmpty());
        assertTrue(r.unusedReferences().isEmpty());
    }
}
