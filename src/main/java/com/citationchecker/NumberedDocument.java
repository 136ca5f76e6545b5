package com.citationchecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Snapshot of a manuscript with numeric citations: paragraphs by id plus their order.
 *
 * <p>Immutable. {@link #apply(MutationPlan)} returns a new document.
 *
 * <p>Style names follow the manuscript template: in-text citation runs use
 * {@value #CITATION_STYLE}, bibliography paragraphs {@value #BIBLIOGRAPHY_STYLE} and the run
 * holding an entry's number {@value #BIB_NUMBER_STYLE}.
 */
public final class NumberedDocument {

    public static final String CITATION_STYLE = "cite_bib";
    public static final String BIBLIOGRAPHY_STYLE = "REF-N";
    public static final String BIB_NUMBER_STYLE = "bib_number";

    private static final Pattern BRACKET_CITATION = Pattern.compile(
            "\\[(\\d{1,3}(?:\\s*[,\\-–—]\\s*\\d{1,3})*)\\]");
    private static final Pattern ENTRY_NUMBER = Pattern.compile("^\\s*\\[?\\d+\\]?\\.?\\s*");

    private final Map<Integer, StyledParagraph> paragraphs;
    private final List<Integer> order;

    public NumberedDocument(List<StyledParagraph> paragraphs) {
        Objects.requireNonNull(paragraphs, "paragraphs");
        Map<Integer, StyledParagraph> byId = new LinkedHashMap<>();
        List<Integer> ids = new ArrayList<>();
        for (StyledParagraph p : paragraphs) {
            if (byId.put(p.id(), p) != null) {
                throw new IllegalArgumentException("Duplicate paragraph id: " + p.id());
            }
            ids.add(p.id());
        }
        this.paragraphs = Collections.unmodifiableMap(byId);
        this.order = List.copyOf(ids);
    }

    private NumberedDocument(Map<Integer, StyledParagraph> paragraphs, List<Integer> order) {
        this.paragraphs = Collections.unmodifiableMap(paragraphs);
        this.order = List.copyOf(order);
    }

    /** Paragraphs in document order. */
    public List<StyledParagraph> paragraphs() {
        List<StyledParagraph> out = new ArrayList<>(order.size());
        for (int id : order) {
            out.add(paragraphs.get(id));
        }
        return out;
    }

    public List<Integer> order() {
        return order;
    }

    public StyledParagraph paragraph(int id) {
        return paragraphs.get(id);
    }

    public int size() {
        return order.size();
    }

    /**
     * Replays {@code plan} on a copy of this document.
     *
     * @throws IllegalArgumentException when an operation names an unknown paragraph, removes one
     *                                  that is not in the order or inserts one that already is
     */
    public NumberedDocument apply(MutationPlan plan) {
        Objects.requireNonNull(plan, "plan");
        Map<Integer, StyledParagraph> byId = new LinkedHashMap<>(paragraphs);
        List<Integer> ids = new ArrayList<>(order);

        for (MutationPlan.Operation op : plan.operations()) {
            int id = op.paragraphId();
            StyledParagraph current = byId.get(id);
            if (current == null) {
                throw new IllegalArgumentException("Unknown paragraph id: " + id);
            }
            if (op instanceof MutationPlan.SetRuns) {
                byId.put(id, current.withRuns(((MutationPlan.SetRuns) op).runs()));
            } else if (op instanceof MutationPlan.RemoveParagraph) {
                if (!ids.remove(Integer.valueOf(id))) {
                    throw new IllegalArgumentException("Paragraph " + id + " is not in the document");
                }
            } else if (op instanceof MutationPlan.InsertParagraph) {
                MutationPlan.InsertParagraph insert = (MutationPlan.InsertParagraph) op;
                if (ids.contains(id)) {
                    throw new IllegalArgumentException("Paragraph " + id + " is already in the document");
                }
                if (insert.position() < 0 || insert.position() > ids.size()) {
                    throw new IllegalArgumentException("Insert position out of range: " + insert.position());
                }
                ids.add(insert.position(), id);
            } else {
                throw new IllegalArgumentException("Unsupported operation: " + op);
            }
        }
        return new NumberedDocument(byId, ids);
    }

    /**
     * Lifts a plain-text manuscript into the numeric model. Lines between {@code <ref-open>} and
     * {@code <ref-close>} become bibliography paragraphs whose leading number
     * ({@code 3.}, {@code [3]}) is a {@value #BIB_NUMBER_STYLE} run; bracketed number lists in
     * body text ({@code [1, 3-5]}) become {@value #CITATION_STYLE} runs. {@code ^1-3^} markers are
     * left as text.
     */
    public static NumberedDocument fromPlainParagraphs(List<String> texts) {
        Objects.requireNonNull(texts, "texts");
        List<StyledParagraph> out = new ArrayList<>(texts.size());
        boolean inBibliography = false;
        int id = 1;
        for (String raw : texts) {
            String text = raw == null ? "" : raw;
            if (text.contains(CitationExtractor.REF_OPEN)) {
                inBibliography = true;
                out.add(new StyledParagraph(id++, null, List.of(StyledRun.plain(text))));
                continue;
            }
            if (text.contains(CitationExtractor.REF_CLOSE)) {
                inBibliography = false;
                out.add(new StyledParagraph(id++, null, List.of(StyledRun.plain(text))));
                continue;
            }
            if (inBibliography && !text.isBlank()) {
                out.add(new StyledParagraph(id++, BIBLIOGRAPHY_STYLE, entryRuns(text)));
            } else {
                out.add(new StyledParagraph(id++, null, bodyRuns(text)));
            }
        }
        return new NumberedDocument(out);
    }

    private static List<StyledRun> entryRuns(String text) {
        Matcher m = ENTRY_NUMBER.matcher(text);
        if (!m.lookingAt() || m.end() == 0 || NumberTokenizer.numbers(m.group()).isEmpty()) {
            return List.of(StyledRun.plain(text));
        }
        List<StyledRun> runs = new ArrayList<>();
        runs.add(new StyledRun(m.group(), BIB_NUMBER_STYLE, false));
        if (m.end() < text.length()) {
            runs.add(StyledRun.plain(text.substring(m.end())));
        }
        return runs;
    }

    private static List<StyledRun> bodyRuns(String text) {
        List<StyledRun> runs = new ArrayList<>();
        Matcher m = BRACKET_CITATION.matcher(text);
        int last = 0;
        while (m.find()) {
            String before = text.substring(last, m.start(1));
            if (!before.isEmpty()) runs.add(StyledRun.plain(before));
            runs.add(new StyledRun(m.group(1), CITATION_STYLE, false));
            last = m.end(1);
        }
        if (last < text.length() || runs.isEmpty()) {
            runs.add(StyledRun.plain(text.substring(last)));
        }
        return runs;
    }

    /**
     * One line per paragraph. Superscript citation runs are written as {@code ^n^}.
     */
    public String toPlainText() {
        StringBuilder sb = new StringBuilder();
        boolean first = true;
        for (StyledParagraph p : paragraphs()) {
            if (!first) sb.append('\n');
            first = false;
            for (StyledRun r : p.runs()) {
                if (r.superscript() && r.hasStyle(CITATION_STYLE)) {
                    sb.append('^').append(r.text()).append('^');
                } else {
                    sb.append(r.text());
                }
            }
        }
        return sb.toString();
    }
}
