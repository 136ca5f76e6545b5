package com.citationchecker;

import java.util.List;

/**
 * Style-specific grammar for name-year citations and bibliography entries.
 *
 * <p>Implementations are stateless; one instance can parse any number of documents.
 */
public interface CitationParser {

    /**
     * One citation found in a paragraph.
     *
     * @param warnings format problems, e.g. a missing comma between author and year
     * @param raw      the citation text as it (approximately) appears in the paragraph
     */
    record ParsedCitation(
            String author,
            String year,
            CitationType type,
            List<String> warnings,
            String raw
    ) {
        public ParsedCitation {
            warnings = List.copyOf(warnings);
        }
    }

    record ParsedReference(
            String author,
            String year,
            String fullAuthor,
            List<String> abbreviations,
            String rawText
    ) {
        public ParsedReference {
            abbreviations = List.copyOf(abbreviations);
        }
    }

    /**
     * All citations (parenthetical and narrative) in a paragraph, in discovery order.
     */
    List<ParsedCitation> parseCitations(String text);

    /**
     * Parses one bibliography entry.
     *
     * @return the parsed entry, or {@code null} when the text does not look like a reference
     */
    ParsedReference parseReference(String text);
}
