package com.citationchecker;

import java.util.ArrayList;
import java.util.List;

/**
 * One text block of a manuscript, as the host document models it (a body paragraph or the text
 * of a table cell). {@code index} is the 1-based position in document order.
 */
public record Paragraph(int index, String text) {

    /**
     * Numbers plain paragraph texts 1, 2, 3, ... in the given order.
     */
    public static List<Paragraph> of(List<String> texts) {
        List<Paragraph> paragraphs = new ArrayList<>(texts.size());
        for (int i = 0; i < texts.size(); i++) {
            paragraphs.add(new Paragraph(i + 1, texts.get(i)));
        }
        return paragraphs;
    }

    public boolean isBlank() {
        return text == null || text.isBlank();
    }
}
