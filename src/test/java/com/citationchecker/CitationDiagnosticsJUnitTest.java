package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.citationchecker.CitationMatcherJUnitTest.citation;
import static com.citationchecker.CitationMatcherJUnitTest.citations;
import static com.citationchecker.CitationMatcherJUnitTest.reference;
import static com.citationchecker.CitationMatcherJUnitTest.table;
import static org.junit.jupiter.api.Assertions.*;

class CitationDiagnosticsJUnitTest {

    @Test
    void etAl_singleAuthorReference_isError() {
        var ref = reference("Smith", "Smith, J.", "2020", List.of());
        var e = CitationDiagnostics.checkEtAl(citation("Smith et al.", "2020"), ref);

        assertNotNull(e);
        assertEquals(Diagnostic.Severity.ERROR, e.severity());
        assertEquals(1, e.authorCount());
        assertEquals("Smith", e.correctForm());
        assertTrue(e.message().contains("only 1 author)"));
    }

    @Test
    void etAl_twoAuthorReference_isError() {
        var ref = reference("Smith & Jones", "Smith, J., & Jones, M.", "2020", List.of());
        var e = CitationDiagnostics.checkEtAl(citation("Smith et al.", "2020"), ref);

        assertNotNull(e);
        assertEquals(Diagnostic.Severity.ERROR, e.severity());
        assertEquals(2, e.authorCount());
        assertEquals("Smith & Jones", e.correctForm());
        assertTrue(e.message().contains("only 2 authors)"));
    }

    @Test
    void etAl_threeAuthorsWithoutEtAl_isWarning() {
        var ref = reference("Smith", "Smith, J., Jones, M., & Brown, K.", "2020", List.of());
        var e = CitationDiagnostics.checkEtAl(citation("Smith", "2020"), ref);

        assertNotNull(e);
        assertEquals(Diagnostic.Severity.WARNING, e.severity());
        assertEquals(3, e.authorCount());
        assertEquals("Smith et al.", e.correctForm());
    }

    @Test
    void etAl_threeAuthorsWithEtAl_isFine() {
        var ref = reference("Smith", "Smith, J., Jones, M., & Brown, K.", "2020", List.of());
        assertNull(CitationDiagnostics.checkEtAl(citation("Smith et al.", "2020"), ref));
    }

    @Test
    void yearMismatch_takesPrecedenceOverMissing() {
        var ref = reference("Smith", "Smith, J.", "2020", List.of());
        var cite = citation("Smith", "2021");
        var refs = table(ref);
        var cites = citations(cite);

        var r = CitationDiagnostics.diagnose("APA", cites, refs, CitationMatcher.match(cites, refs));

        assertEquals(1, r.yearMismatches().size());
        assertEquals("2021", r.yearMismatches().get(0).citedYear());
        assertEquals("2020", r.yearMismatches().get(0).referenceYear());
        assertTrue(r.missingReferences().isEmpty());
        assertTrue(r.unusedReferences().isEmpty(), "a year mismatch accounts for the reference");
    }

    @Test
    void spellingMismatch_aboveThreshold() {
        var ref = reference("Johnson", "Johnson, P.", "2020", List.of());
        var cite = citation("Jonson", "2020");
        var refs = table(ref);
        var cites = citations(cite);

        var r = CitationDiagnostics.diagnose("APA", cites, refs, CitationMatcher.match(cites, refs));

        assertEquals(1, r.spellingMismatches().size());
        var s = r.spellingMismatches().get(0);
        assertEquals("Jonson", s.citedAuthor());
        assertEquals("Johnson", s.referenceAuthor());
        assertTrue(s.similarity() > CitationDiagnostics.SPELLING_THRESHOLD);
        assertTrue(r.unusedReferences().isEmpty());
    }

    @Test
    void spellingMismatch_exactlyAtThresholdIsMissing() {
        // "smyth" vs "smith" is exactly 0.8
        var ref = reference("Smith", "Smith, J.", "2020", List.of());
        var cite = citation("Smyth", "2020");
        var refs = table(ref);
        var cites = citations(cite);

        var r = CitationDiagnostics.diagnose("APA", cites, refs, CitationMatcher.match(cites, refs));

        assertTrue(r.spellingMismatches().isEmpty());
        assertEquals(1, r.missingReferences().size());
        assertEquals(1, r.unusedReferences().size());
    }

    @Test
    void endToEnd_missingValidAndUnused() {
        var smith = reference("Smith", "Smith, J.", "2019", List.of());
        var brown = reference("Brown", "Brown, K.", "2020", List.of());
        var cites = citations(citation("Smith", "2019"), citation("Jones", "2020"));
        var refs = table(smith, brown);

        var r = CitationDiagnostics.diagnose("APA", cites, refs, CitationMatcher.match(cites, refs));

        assertEquals(1, r.missingReferences().size());
        assertEquals("(Jones, 2020)", r.missingReferences().get(0).citation());
        assertEquals(List.of("(Smith, 2019)"), r.validCitations());
        assertEquals(1, r.unusedReferences().size());
        assertEquals("Brown (2020)", r.unusedReferences().get(0).reference());
        assertTrue(r.hasErrors());
        assertEquals(2, r.commentCount());
    }

    @Test
    void diagnose_isRepeatable() {
        var refs = table(reference("Smith", "Smith, J.", "2019", List.of()));
        var cites = citations(citation("Smith", "2019"), citation("Jones", "2020"));
        var matches = CitationMatcher.match(cites, refs);

        assertEquals(CitationDiagnostics.diagnose("APA", cites, refs, matches),
                CitationDiagnostics.diagnose("APA", cites, refs, matches));
    }

    @Test
    void firstSurname() {
        assertEquals("Smith", CitationDiagnostics.firstSurname("Smith, J., Jones, M., & Brown, K."));
        assertEquals("World", CitationDiagnostics.firstSurname("World Health Organization"));
        assertEquals("Smith", CitationDiagnostics.firstSurname("Smith et al."));
        assertEquals("", CitationDiagnostics.firstSurname(null));
    }

    @Test
    void countAuthors() {
        assertEquals(1, Reference.countAuthors("World Health Organization"));
        assertEquals(2, Reference.countAuthors("Smith, J., & Jones, M."));
        assertEquals(3, Reference.countAuthors("Smith, J. K., Jones, M., & Brown, K."));
        assertEquals(1, Reference.countAuthors(null));
    }
}
