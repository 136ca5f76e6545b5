package com.citationchecker;

import java.util.List;

/**
 * A paragraph of a numbered manuscript.
 *
 * @param id    stable identity, unchanged when the paragraph is edited or moved
 * @param style paragraph style name, or {@code null}
 */
public record StyledParagraph(int id, String style, List<StyledRun> runs) {

    public StyledParagraph {
        runs = List.copyOf(runs);
    }

    public String text() {
        StringBuilder sb = new StringBuilder();
        for (StyledRun r : runs) {
            sb.append(r.text());
        }
        return sb.toString();
    }

    public boolean isBibliography() {
        return NumberedDocument.BIBLIOGRAPHY_STYLE.equals(style);
    }

    public StyledParagraph withRuns(List<StyledRun> newRuns) {
        return new StyledParagraph(id, style, newRuns);
    }
}
