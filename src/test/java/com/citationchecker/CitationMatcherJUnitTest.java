package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class CitationMatcherJUnitTest {

    static Citation citation(String author, String year) {
        return new Citation(CitationKeys.normalize(author, year),
                Citation.display(author, year, CitationType.PARENTHETICAL),
                author, year, CitationType.PARENTHETICAL, List.of(), "(" + author + ", " + year + ")", List.of(1));
    }

    static Reference reference(String author, String fullAuthor, String year, List<String> abbreviations) {
        return new Reference(CitationKeys.normalize(author, year), author, fullAuthor, year, abbreviations, 10,
                fullAuthor + " (" + year + "). Some title. Some publisher.");
    }

    static CitationExtractor.ReferenceTable table(Reference... refs) {
        Map<String, Reference> references = new LinkedHashMap<>();
        Map<String, String> abbreviations = new LinkedHashMap<>();
        for (Reference r : refs) {
            references.put(r.key(), r);
            for (String a : r.abbreviations()) abbreviations.put(a + "|" + r.year(), r.key());
        }
        return new CitationExtractor.ReferenceTable(references, abbreviations);
    }

    static Map<String, Citation> citations(Citation... cites) {
        Map<String, Citation> map = new LinkedHashMap<>();
        for (Citation c : cites) map.put(c.key(), c);
        return map;
    }

    @Test
    void exactKeyWinsOverEverythingElse() {
        var smith = reference("Smith", "Smith, J.", "2020", List.of());
        var who = reference("World Health Organization", "World Health Organization [WHO].", "2020", List.of("WHO"));
        var cite = citation("Smith", "2020");

        var result = CitationMatcher.match(citations(cite), table(who, smith));

        assertEquals(smith.key(), result.referenceFor(cite.key()));
        assertEquals(CitationMatcher.MatchStrategy.EXACT, result.strategies().get(cite.key()));
    }

    @Test
    void abbreviationTable() {
        var who = reference("World Health Organization", "World Health Organization [WHO].", "2020", List.of("WHO"));
        var cite = citation("WHO", "2020");

        var result = CitationMatcher.match(citations(cite), table(who));

        assertEquals(who.key(), result.referenceFor(cite.key()));
        assertEquals(CitationMatcher.MatchStrategy.ABBREVIATION, result.strategies().get(cite.key()));
    }

    @Test
    void abbreviationIntroduction_matchesFullName() {
        var apa = reference("American Psychological Association", "American Psychological Association.", "2020",
                List.of("APA"));
        var cite = citation("American Psychological Association [APA]", "2020");

        var result = CitationMatcher.match(citations(cite), table(apa));

        assertEquals(CitationMatcher.MatchStrategy.ABBREVIATION_DEFINITION, result.strategies().get(cite.key()));
    }

    @Test
    void andVersusAmpersand_matchesByWords() {
        var ref = reference("Smith & Jones", "Smith, J., & Jones, M.", "2020", List.of());
        var cite = citation("Smith and Jones", "2020");

        var result = CitationMatcher.match(citations(cite), table(ref));

        assertEquals(ref.key(), result.referenceFor(cite.key()));
        assertEquals(CitationMatcher.MatchStrategy.WORD_SUBSET, result.strategies().get(cite.key()));
    }

    @Test
    void normalizedText_ignoresPunctuationAndLeadingThe() {
        var ref = reference("Smith and Jones Inc", "The Smith and Jones, Inc.", "2021", List.of());
        var cite = citation("Smith & Jones, Inc.", "2021");

        var result = CitationMatcher.match(citations(cite), table(ref));

        assertEquals(CitationMatcher.MatchStrategy.NORMALIZED_TEXT, result.strategies().get(cite.key()));
    }

    @Test
    void etAl_firstCandidateWins() {
        var first = reference("Smith", "Smith, A., Lee, B., & Park, C.", "2020", List.of());
        var second = reference("Smith B", "Smith, B., Kim, D., & Ortiz, E.", "2020", List.of());
        var cite = citation("Smith et al.", "2020");

        var forward = CitationMatcher.match(citations(cite), table(first, second));
        assertEquals(first.key(), forward.referenceFor(cite.key()));
        assertEquals(CitationMatcher.MatchStrategy.ET_AL, forward.strategies().get(cite.key()));

        var reversed = CitationMatcher.match(citations(cite), table(second, first));
        assertEquals(second.key(), reversed.referenceFor(cite.key()));
    }

    @Test
    void smartMatchRequiresSameYear() {
        var ref = reference("Smith & Jones", "Smith, J., & Jones, M.", "2019", List.of());
        var cite = citation("Smith and Jones", "2020");

        var result = CitationMatcher.match(citations(cite), table(ref));

        assertFalse(result.isMatched(cite.key()));
        assertTrue(result.matchedReferences().isEmpty());
    }

    @Test
    void normalizeForComparison() {
        assertEquals("smith & jones inc", CitationMatcher.normalizeForComparison("The Smith and Jones, Inc."));
        assertEquals("", CitationMatcher.normalizeForComparison(null));
    }

    @Test
    void usesEtAl_ignoresDefaultLocale() {
        Locale saved = Locale.getDefault();
        Locale.setDefault(Locale.forLanguageTag("tr-TR"));
        try {
            assertTrue(citation("Smith ET AL.", "2020").usesEtAl());
            assertTrue(citation("Smith et al.", "2020").usesEtAl());
            assertFalse(citation("Smith", "2020").usesEtAl());
        } finally {
            Locale.setDefault(saved);
        }
    }
}
