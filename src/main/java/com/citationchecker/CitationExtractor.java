package com.citationchecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Pulls citations out of the manuscript body and references out of the bibliography section.
 *
 * <p>The bibliography is delimited by paragraphs containing {@value #REF_OPEN} and
 * {@value #REF_CLOSE}. Citations are only collected before the opening marker.
 */
public final class CitationExtractor {

    public static final String REF_OPEN = "<ref-open>";
    public static final String REF_CLOSE = "<ref-close>";

    private CitationExtractor() {
    }

    /**
     * References keyed by {@link CitationKeys#normalize}, in bibliography order, plus the
     * abbreviation table {@code "<abbr>|<year>" -> reference key}. {@code entries} holds every
     * parsed entry in bibliography order, including later entries whose key was already taken.
     */
    public record ReferenceTable(
            Map<String, Reference> references,
            Map<String, String> abbreviations,
            List<Reference> entries
    ) {
        public ReferenceTable {
            references = Collections.unmodifiableMap(new LinkedHashMap<>(references));
            abbreviations = Collections.unmodifiableMap(new LinkedHashMap<>(abbreviations));
            entries = List.copyOf(entries);
        }

        public ReferenceTable(Map<String, Reference> references, Map<String, String> abbreviations) {
            this(references, abbreviations, new ArrayList<>(references.values()));
        }

        public int size() {
            return references.size();
        }
    }

    /**
     * Citations keyed by {@link CitationKeys#normalize}, in first-seen order. Repeated occurrences
     * of a key are merged: every occurrence adds its paragraph index and any new warnings; the
     * display form, type and raw text stay those of the first occurrence.
     */
    public static Map<String, Citation> findCitations(List<Paragraph> paragraphs, CitationParser parser) {
        Objects.requireNonNull(paragraphs, "paragraphs");
        Objects.requireNonNull(parser, "parser");

        Map<String, Builder> builders = new LinkedHashMap<>();
        for (Paragraph p : paragraphs) {
            if (p.isBlank()) continue;
            if (p.text().contains(REF_OPEN)) break;

            for (CitationParser.ParsedCitation parsed : parser.parseCitations(p.text())) {
                String key = CitationKeys.normalize(parsed.author(), parsed.year());
                Builder b = builders.computeIfAbsent(key, k -> new Builder(k, parsed));
                for (String w : parsed.warnings()) {
                    if (!b.warnings.contains(w)) b.warnings.add(w);
                }
                b.locations.add(p.index());
            }
        }

        Map<String, Citation> citations = new LinkedHashMap<>();
        for (Builder b : builders.values()) {
            citations.put(b.key, b.build());
        }
        return citations;
    }

    /**
     * References found strictly between the bibliography markers. When two entries share a key the
     * first one is kept in the keyed table; the later ones are only listed in
     * {@link ReferenceTable#entries()}.
     */
    public static ReferenceTable findReferences(List<Paragraph> paragraphs, CitationParser parser) {
        Objects.requireNonNull(paragraphs, "paragraphs");
        Objects.requireNonNull(parser, "parser");

        Map<String, Reference> references = new LinkedHashMap<>();
        Map<String, String> abbreviations = new LinkedHashMap<>();
        List<Reference> entries = new ArrayList<>();

        boolean inBibliography = false;
        for (Paragraph p : paragraphs) {
            String text = p.text() == null ? "" : p.text().strip();
            if (text.contains(REF_OPEN)) {
                inBibliography = true;
                continue;
            }
            if (text.contains(REF_CLOSE)) {
                inBibliography = false;
                continue;
            }
            if (!inBibliography || text.isEmpty()) continue;

            CitationParser.ParsedReference parsed = parser.parseReference(text);
            if (parsed == null) continue;

            String key = CitationKeys.normalize(parsed.author(), parsed.year());
            Reference ref = new Reference(key, parsed.author(), parsed.fullAuthor(), parsed.year(),
                    parsed.abbreviations(), p.index(), text);
            entries.add(ref);
            if (references.containsKey(key)) continue;

            references.put(key, ref);
            for (String abbr : parsed.abbreviations()) {
                abbreviations.put(abbr + "|" + parsed.year(), key);
            }
        }
        return new ReferenceTable(references, abbreviations, entries);
    }

    private static final class Builder {
        final String key;
        final CitationParser.ParsedCitation first;
        final List<String> warnings = new ArrayList<>();
        final List<Integer> locations = new ArrayList<>();

        Builder(String key, CitationParser.ParsedCitation first) {
            this.key = key;
            this.first = first;
        }

        Citation build() {
            return new Citation(key,
                    Citation.display(first.author(), first.year(), first.type()),
                    first.author(), first.year(), first.type(),
                    warnings, first.raw(), locations);
        }
    }
}
