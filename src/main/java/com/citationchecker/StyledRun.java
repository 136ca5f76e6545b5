package com.citationchecker;

/**
 * A stretch of paragraph text with uniform formatting.
 *
 * @param style character style name, or {@code null} for none
 */
public record StyledRun(String text, String style, boolean superscript) {

    public StyledRun {
        text = text == null ? "" : text;
    }

    public static StyledRun plain(String text) {
        return new StyledRun(text, null, false);
    }

    public StyledRun withText(String newText) {
        return new StyledRun(newText, style, superscript);
    }

    public boolean hasStyle(String name) {
        return name.equals(style);
    }
}
