package com.citationchecker;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Chicago author-date. In-text citations are written like Vancouver author-year ones; references
 * look like {@code Smith, John. 2020. Title of Book. Publisher.}
 */
public final class ChicagoCitationParser extends VancouverCitationParser {

    private static final Pattern REFERENCE = Pattern.compile("^([A-Z][^.]+?)\\.\\s*(\\d{4})\\.\\s*");

    @Override
    public ParsedReference parseReference(String text) {
        if (text == null) return null;
        Matcher m = REFERENCE.matcher(text);
        if (!m.lookingAt()) return null;

        String authorPart = m.group(1).strip();
        String year = m.group(2).strip();

        String display = authorPart;
        if (authorPart.contains(",")) {
            String[] parts = authorPart.split(",");
            display = parts.length >= 3 ? parts[0].strip() + " et al." : parts[0].strip();
        }
        return new ParsedReference(display, year, authorPart, List.of(), text);
    }
}
