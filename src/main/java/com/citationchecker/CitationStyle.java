package com.citationchecker;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The supported name-year citation styles, each with its parser.
 */
public enum CitationStyle {

    APA("APA (American Psychological Association)", new ApaCitationParser()),
    VANCOUVER("Vancouver", new VancouverCitationParser()),
    CHICAGO("Chicago (Author-Year)", new ChicagoCitationParser());

    /** Paragraphs sampled by {@link #detect(List)}. */
    public static final int DETECTION_SAMPLE_PARAGRAPHS = 50;

    private static final Pattern APA_SIGNATURE = Pattern.compile("\\([A-Z][a-z]+,\\s*\\d{4}\\)");
    private static final Pattern AUTHOR_YEAR_SIGNATURE = Pattern.compile("\\([A-Z][a-z]+\\s+\\d{4}\\)");

    private final String displayName;
    private final CitationParser parser;

    CitationStyle(String displayName, CitationParser parser) {
        this.displayName = displayName;
        this.parser = parser;
    }

    public String displayName() {
        return displayName;
    }

    public CitationParser parser() {
        return parser;
    }

    /**
     * Resolves {@code apa}, {@code vancouver} or {@code chicago}, ignoring case and surrounding blanks.
     *
     * @throws IllegalArgumentException for any other name
     */
    public static CitationStyle fromName(String name) {
        Objects.requireNonNull(name, "name");
        String n = name.strip().toLowerCase(Locale.ROOT);
        for (CitationStyle style : values()) {
            if (style.name().toLowerCase(Locale.ROOT).equals(n)) {
                return style;
            }
        }
        throw new IllegalArgumentException(
                "Unsupported citation style: " + name + ". Supported styles: apa, vancouver, chicago");
    }

    /**
     * Guesses the style from sample text: {@code (Smith, 2020)} counts for APA,
     * {@code (Smith 2020)} for Vancouver. APA wins ties and is the default.
     */
    public static CitationStyle detect(String sample) {
        if (sample == null) return APA;
        int apa = count(APA_SIGNATURE, sample);
        int authorYear = count(AUTHOR_YEAR_SIGNATURE, sample);
        if (apa > authorYear) return APA;
        if (authorYear > 0) return VANCOUVER;
        return APA;
    }

    public static CitationStyle detect(List<Paragraph> paragraphs) {
        StringBuilder sample = new StringBuilder();
        int limit = Math.min(paragraphs.size(), DETECTION_SAMPLE_PARAGRAPHS);
        for (int i = 0; i < limit; i++) {
            String text = paragraphs.get(i).text();
            if (text != null) sample.append(text).append('\n');
        }
        return detect(sample.toString());
    }

    private static int count(Pattern pattern, String text) {
        Matcher m = pattern.matcher(text);
        int n = 0;
        while (m.find()) n++;
        return n;
    }
}
