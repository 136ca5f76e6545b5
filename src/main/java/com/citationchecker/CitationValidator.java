package com.citationchecker;

import java.util.List;
import java.util.Map;
import java.util.Objects;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for checking a name-year manuscript: extract, match, diagnose.
 *
 * <pre>{@code
 * ValidationResult r = CitationValidator.validate(Paragraph.of(lines), CitationStyle.APA);
 * System.out.println(ValidationReport.render(r, "paper.docx"));
 * }</pre>
 */
public final class CitationValidator {

    private static final Logger log = LoggerFactory.getLogger(CitationValidator.class);

    private CitationValidator() {
    }

    /**
     * Detects the style from the first paragraphs, then validates.
     */
    public static ValidationResult validate(List<Paragraph> paragraphs) {
        Objects.requireNonNull(paragraphs, "paragraphs");
        CitationStyle style = CitationStyle.detect(paragraphs);
        log.info("Auto-detected citation style: {}", style.displayName());
        return validate(paragraphs, style);
    }

    public static ValidationResult validate(List<Paragraph> paragraphs, CitationStyle style) {
        Objects.requireNonNull(style, "style");
        return validate(paragraphs, style.parser(), style.displayName());
    }

    /**
     * Validates with a custom grammar.
     */
    public static ValidationResult validate(List<Paragraph> paragraphs, CitationParser parser) {
        Objects.requireNonNull(parser, "parser");
        return validate(paragraphs, parser, parser.getClass().getSimpleName());
    }

    private static ValidationResult validate(List<Paragraph> paragraphs, CitationParser parser, String styleName) {
        Objects.requireNonNull(paragraphs, "paragraphs");

        Map<String, Citation> citations = CitationExtractor.findCitations(paragraphs, parser);
        CitationExtractor.ReferenceTable references = CitationExtractor.findReferences(paragraphs, parser);
        log.debug("Extracted {} citation(s) and {} reference(s) from {} paragraph(s)",
                citations.size(), references.size(), paragraphs.size());

        CitationMatcher.MatchResult matches = CitationMatcher.match(citations, references);
        log.debug("Matched {} of {} citation(s)", matches.pairs().size(), citations.size());

        ValidationResult result = CitationDiagnostics.diagnose(styleName, citations, references, matches);
        log.info("Validation finished ({}): {} citation(s), {} reference(s), {} comment(s)",
                styleName, result.totalCitations(), result.totalReferences(), result.commentCount());
        return result;
    }
}
