package com.citationchecker;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads a manuscript into the ordered paragraph list the checkers work on.
 *
 * <p>Supported inputs:
 * <ul>
 *   <li>{@code .txt} / {@code .md}: one paragraph per line</li>
 *   <li>{@code .pdf}: text extracted with Apache PDFBox, body split on blank lines, bibliography
 *       split into one paragraph per entry</li>
 * </ul>
 * When the text has no {@code <ref-open>} / {@code <ref-close>} markers yet, the bibliography is
 * located by its heading (References, Bibliography, Works Cited, ...) and wrapped in them.
 */
public final class ManuscriptReader {

    private static final Logger log = LoggerFactory.getLogger(ManuscriptReader.class);

    private static final Pattern REFERENCES_HEADER = Pattern.compile(
            "(?i)^\\s*(References|Reference\\s+List|Bibliography|Works\\s+Cited|Literature\\s+Cited)\\s*:?\\s*$");

    private static final Pattern NEXT_SECTION = Pattern.compile(
            "(?i)^\\s*(Appendix(\\s+\\w+)?|Acknowledge?ments?|About\\s+the\\s+Authors?|Author\\s+Bio|Supplementary(\\s+\\w+)*|Tables?|Figures?)\\s*:?\\s*$");

    private static final Pattern NUMBERED_BRACKET = Pattern.compile(
            "^\\s*\\[(\\d{1,3})]\\s*(.+?)(?=^\\s*\\[\\d{1,3}]|\\z)",
            Pattern.MULTILINE | Pattern.DOTALL);

    private static final Pattern NUMBERED_DOT = Pattern.compile(
            "(?:^|\\n)\\s*(\\d{1,3})\\.\\s+(.+?)(?=\\n\\s*\\d{1,3}\\.\\s|\\z)",
            Pattern.DOTALL);

    private static final Pattern NEW_AUTHOR_LINE = Pattern.compile(
            "^([A-Z][A-Za-z'\\-]+,\\s+[A-Z].*|[A-Z][a-z]+\\s+[A-Z]{1,2}[,.]?\\s.*|[A-Z][A-Za-z ]+\\.\\s*\\((?:19|20)\\d{2}.*)");

    private static final Pattern BLANK_LINES = Pattern.compile("\\n\\s*\\n+");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final int MIN_ENTRIES_FOR_STRATEGY = 2;
    private static final int MIN_ENTRY_LENGTH = 10;

    private ManuscriptReader() {
    }

    public static List<String> read(Path path) throws IOException {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        List<String> paragraphs;
        if (name.endsWith(".txt") || name.endsWith(".md")) {
            paragraphs = fromLines(Files.readAllLines(path, StandardCharsets.UTF_8));
        } else if (name.endsWith(".pdf")) {
            paragraphs = fromExtractedText(extractTextFromPdf(path.toFile()));
        } else {
            throw new IOException("Unsupported manuscript type: " + path.getFileName()
                    + " (expected .txt, .md or .pdf)");
        }
        log.info("Read {} paragraph(s) from {}", paragraphs.size(), path.getFileName());
        return paragraphs;
    }

    private static String extractTextFromPdf(File pdfFile) throws IOException {
        try (PDDocument document = Loader.loadPDF(pdfFile)) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setSortByPosition(true);
            return stripper.getText(document);
        }
    }

    /**
     * One paragraph per line. Lines after a references heading are wrapped in bibliography
     * markers unless the text already carries them.
     */
    public static List<String> fromLines(List<String> lines) {
        List<String> out = new ArrayList<>(lines);
        if (hasMarkers(out)) return out;

        int header = -1;
        for (int i = 0; i < out.size(); i++) {
            if (REFERENCES_HEADER.matcher(out.get(i)).matches()) header = i;
        }
        if (header < 0) return out;

        int end = out.size();
        for (int i = header + 1; i < out.size(); i++) {
            if (NEXT_SECTION.matcher(out.get(i)).matches()) {
                end = i;
                break;
            }
        }
        out.add(end, CitationExtractor.REF_CLOSE);
        out.add(header + 1, CitationExtractor.REF_OPEN);
        return out;
    }

    /**
     * Turns raw extracted text (page-wrapped lines) into paragraphs: body blocks separated by
     * blank lines, then one paragraph per bibliography entry between the markers.
     */
    public static List<String> fromExtractedText(String text) {
        String normalized = text == null ? "" : text.replace("\r\n", "\n").replace('\r', '\n');
        String[] lines = normalized.split("\n", -1);

        int header = -1;
        for (int i = 0; i < lines.length; i++) {
            if (REFERENCES_HEADER.matcher(lines[i]).matches()) header = i;
        }
        if (header < 0) {
            log.debug("No references heading found");
            return blocks(normalized);
        }

        int end = lines.length;
        for (int i = header + 1; i < lines.length; i++) {
            if (NEXT_SECTION.matcher(lines[i]).matches()) {
                end = i;
                break;
            }
        }

        List<String> out = new ArrayList<>(blocks(join(lines, 0, header + 1)));
        out.add(CitationExtractor.REF_OPEN);
        List<String> entries = splitEntries(join(lines, header + 1, end));
        log.debug("Bibliography section has {} entr{}", entries.size(), entries.size() == 1 ? "y" : "ies");
        out.addAll(entries);
        out.add(CitationExtractor.REF_CLOSE);
        out.addAll(blocks(join(lines, end, lines.length)));
        return out;
    }

    private static boolean hasMarkers(List<String> paragraphs) {
        for (String p : paragraphs) {
            if (p != null && p.contains(CitationExtractor.REF_OPEN)) return true;
        }
        return false;
    }

    private static String join(String[] lines, int from, int to) {
        StringBuilder sb = new StringBuilder();
        for (int i = from; i < to; i++) {
            if (sb.length() > 0) sb.append('\n');
            sb.append(lines[i]);
        }
        return sb.toString();
    }

    private static List<String> blocks(String text) {
        List<String> out = new ArrayList<>();
        for (String block : BLANK_LINES.split(text)) {
            String clean = collapse(block);
            if (!clean.isEmpty()) out.add(clean);
        }
        return out;
    }

    private static String collapse(String text) {
        return WHITESPACE.matcher(text).replaceAll(" ").strip();
    }

    /**
     * Splits a bibliography section into entries, trying {@code [1]} numbering, {@code 1.}
     * numbering, blank-line separation and finally author-name line starts.
     */
    static List<String> splitEntries(String section) {
        List<String> entries = numbered(NUMBERED_BRACKET, section, "[%d] ");
        if (entries.size() >= MIN_ENTRIES_FOR_STRATEGY) return entries;

        entries = numbered(NUMBERED_DOT, section, "%d. ");
        if (entries.size() >= MIN_ENTRIES_FOR_STRATEGY) return entries;

        entries = new ArrayList<>();
        for (String block : BLANK_LINES.split(section)) {
            String clean = collapse(block);
            if (clean.length() >= MIN_ENTRY_LENGTH) entries.add(clean);
        }
        if (entries.size() >= MIN_ENTRIES_FOR_STRATEGY) return entries;

        return byAuthorLines(section);
    }

    private static List<String> numbered(Pattern pattern, String section, String prefixFormat) {
        List<String> entries = new ArrayList<>();
        Matcher m = pattern.matcher(section);
        while (m.find()) {
            String body = collapse(m.group(2));
            if (body.length() >= MIN_ENTRY_LENGTH) {
                entries.add(String.format(Locale.ROOT, prefixFormat, Integer.parseInt(m.group(1))) + body);
            }
        }
        return entries;
    }

    private static List<String> byAuthorLines(String section) {
        List<String> entries = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        for (String line : section.split("\n")) {
            String trimmed = line.strip();
            if (trimmed.isEmpty()) continue;

            if (NEW_AUTHOR_LINE.matcher(trimmed).matches() && current.length() >= MIN_ENTRY_LENGTH) {
                entries.add(collapse(current.toString()));
                current.setLength(0);
            }
            if (current.length() > 0) current.append(' ');
            current.append(trimmed);
        }
        if (current.length() > 0) {
            entries.add(collapse(current.toString()));
        }
        return entries;
    }
}
