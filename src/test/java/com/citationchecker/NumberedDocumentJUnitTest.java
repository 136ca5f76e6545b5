package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NumberedDocumentJUnitTest {

    @Test
    void fromPlainParagraphs_liftsBracketCitations() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of("Intro cites [1, 3-5] first."));

        assertEquals(List.of(
                StyledRun.plain("Intro cites ["),
                new StyledRun("1, 3-5", NumberedDocument.CITATION_STYLE, false),
                StyledRun.plain("] first.")), doc.paragraph(1).runs());
    }

    @Test
    void fromPlainParagraphs_ignoresBracketsThatAreNotNumberLists() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of("Defined as [WHO] or [1234] here."));
        assertEquals(List.of(StyledRun.plain("Defined as [WHO] or [1234] here.")), doc.paragraph(1).runs());
    }

    @Test
    void fromPlainParagraphs_bibliographyEntries() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of(
                "Body.",
                "<ref-open>",
                "[3] Okafor T. Urban heat islands.",
                "4. Brown K. Soil chemistry.",
                "Unnumbered note in the list.",
                "",
                "<ref-close>",
                "After."));

        assertEquals(8, doc.size());
        assertFalse(doc.paragraph(1).isBibliography());
        assertFalse(doc.paragraph(2).isBibliography());
        assertTrue(doc.paragraph(3).isBibliography());
        assertEquals(new StyledRun("[3] ", NumberedDocument.BIB_NUMBER_STYLE, false), doc.paragraph(3).runs().get(0));
        assertEquals(new StyledRun("4. ", NumberedDocument.BIB_NUMBER_STYLE, false), doc.paragraph(4).runs().get(0));
        assertEquals(List.of(StyledRun.plain("Unnumbered note in the list.")), doc.paragraph(5).runs());
        assertFalse(doc.paragraph(6).isBibliography());
        assertFalse(doc.paragraph(8).isBibliography());
    }

    @Test
    void plainTextRoundTrip() {
        var lines = List.of("See [2] and ^1^.", "<ref-open>", "1. A entry.", "2. B entry.", "<ref-close>");
        assertEquals(String.join("\n", lines), NumberedDocument.fromPlainParagraphs(lines).toPlainText());
    }

    @Test
    void bracketedEntryNumberIsRenumberedInPlace() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of(
                "Cites [2] then [1].",
                "<ref-open>",
                "[1] Brown K. Soil chemistry of alpine meadows. Ecology Letters. 2019.",
                "[2] Alvarez M, Chen L. Deep learning for protein folding. Nature Methods. 2018.",
                "<ref-close>"));

        var out = NumericSequencer.renumber(doc).document().toPlainText().split("\n");

        assertEquals("Cites [1] then [2].", out[0]);
        assertEquals("[1] Alvarez M, Chen L. Deep learning for protein folding. Nature Methods. 2018.", out[2]);
        assertEquals("[2] Brown K. Soil chemistry of alpine meadows. Ecology Letters. 2019.", out[3]);
    }

    @Test
    void constructor_rejectsDuplicateIds() {
        var p = new StyledParagraph(1, null, List.of(StyledRun.plain("x")));
        assertThrows(IllegalArgumentException.class, () -> new NumberedDocument(List.of(p, p)));
    }

    @Test
    void apply_isNonDestructive() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of("a", "b", "c"));
        var plan = new MutationPlan(List.of(
                new MutationPlan.SetRuns(1, List.of(StyledRun.plain("A"))),
                new MutationPlan.RemoveParagraph(3),
                new MutationPlan.InsertParagraph(3, 0)));

        var result = doc.apply(plan);

        assertEquals("c\nA\nb", result.toPlainText());
        assertEquals("a\nb\nc", doc.toPlainText());
    }

    @Test
    void apply_rejectsInvalidOperations() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of("a", "b"));

        assertThrows(IllegalArgumentException.class,
                () -> doc.apply(new MutationPlan(List.of(new MutationPlan.RemoveParagraph(9)))));
        assertThrows(IllegalArgumentException.class,
                () -> doc.apply(new MutationPlan(List.of(new MutationPlan.InsertParagraph(1, 0)))));
        assertThrows(IllegalArgumentException.class, () -> doc.apply(new MutationPlan(List.of(
                new MutationPlan.RemoveParagraph(1),
                new MutationPlan.RemoveParagraph(1)))));
        assertThrows(IllegalArgumentException.class, () -> doc.apply(new MutationPlan(List.of(
                new MutationPlan.RemoveParagraph(1),
                new MutationPlan.InsertParagraph(1, 5)))));
    }

    @Test
    void emptyPlanLeavesDocumentEqual() {
        var doc = NumberedDocument.fromPlainParagraphs(List.of("a [1]"));
        assertEquals(doc.toPlainText(), doc.apply(MutationPlan.EMPTY).toPlainText());
        assertTrue(MutationPlan.EMPTY.isEmpty());
    }
}
