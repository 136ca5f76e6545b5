package com.citationchecker;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Checks and repairs numeric citations ({@code ^1-3^}, superscript {@code 4,5}).
 *
 * <p>A manuscript is in order when every cited number has a bibliography entry, every entry is
 * cited, numbers are first cited in the order 1, 2, 3, ... and no two entries are near-copies.
 * {@link #renumber} fixes the order: citations are renumbered by first appearance and the
 * bibliography is sorted to match. It refuses to touch a manuscript with unused or missing
 * entries.
 */
public final class NumericSequencer {

    private static final Logger log = LoggerFactory.getLogger(NumericSequencer.class);

    public static final String STATUS_UNUSED = "Aborted: Document validation failed due to unused references.";
    public static final String STATUS_PERFECT = "Validation completed.";
    public static final String STATUS_MISSING = "Aborted: Missing references detected.";
    public static final String STATUS_RENUMBERED = "Renumbering completed successfully.";

    private static final Pattern TEXT_MARKER = Pattern.compile("\\^([\\d,\\-–—\\s]+)\\^");
    private static final Pattern LEADING_INTEGER = Pattern.compile("^(\\d+)");
    private static final Pattern DIGITS = Pattern.compile("\\d+");
    private static final Pattern LEADING_ENTRY_NUMBER = Pattern.compile("^\\[?\\d+\\]?[.\\s]*");

    private NumericSequencer() {
    }

    /**
     * A bibliography paragraph and the number it carries.
     *
     * @param idRunIndex index of the {@code bib_number} run holding the id, or -1 when the id was
     *                   read from the start of the paragraph text
     */
    public record BibEntry(int id, int paragraphId, int idRunIndex) {}

    /**
     * Numbers cited at one place in the text, in the order written.
     */
    public record CitationOccurrence(int paragraphId, int firstRun, int lastRun, List<Integer> numbers) {
        public CitationOccurrence {
            numbers = List.copyOf(numbers);
        }
    }

    /**
     * @param allCited        every cited number in reading order, repeats included
     * @param appearanceOrder distinct cited numbers in order of first citation
     * @param bibIds          numbers that have a bibliography entry
     */
    public record Discovery(
            List<Integer> allCited,
            List<Integer> appearanceOrder,
            SortedSet<Integer> bibIds,
            List<CitationOccurrence> occurrences,
            List<BibEntry> entries
    ) {
        public Discovery {
            allCited = List.copyOf(allCited);
            appearanceOrder = List.copyOf(appearanceOrder);
            bibIds = Collections.unmodifiableSortedSet(new TreeSet<>(bibIds));
            occurrences = List.copyOf(occurrences);
            entries = List.copyOf(entries);
        }
    }

    /**
     * A number cited for the first time out of turn.
     *
     * @param position 1-based count of distinct numbers seen, including this one
     */
    public record SequenceIssue(int position, int current, int expected) {}

    public record NumericValidation(
            int totalReferences,
            int totalCitations,
            List<Integer> missingReferences,
            List<Integer> unusedReferences,
            List<DuplicateDetector.DuplicateRecord<Integer>> duplicates,
            List<SequenceIssue> sequenceIssues
    ) {
        public NumericValidation {
            missingReferences = List.copyOf(missingReferences);
            unusedReferences = List.copyOf(unusedReferences);
            duplicates = List.copyOf(duplicates);
            sequenceIssues = List.copyOf(sequenceIssues);
        }

        public boolean perfect() {
            return missingReferences.isEmpty() && unusedReferences.isEmpty()
                    && duplicates.isEmpty() && sequenceIssues.isEmpty();
        }
    }

    /**
     * Result of {@link #renumber}. When the manuscript was left alone, {@code mapping} and
     * {@code plan} are empty, {@code after} equals {@code before} and {@code document} is the input.
     */
    public record RenumberOutcome(
            Map<Integer, Integer> mapping,
            MutationPlan plan,
            String status,
            NumericValidation before,
            NumericValidation after,
            NumberedDocument document
    ) {
        public RenumberOutcome {
            mapping = Collections.unmodifiableMap(new LinkedHashMap<>(mapping));
        }

        public boolean aborted() {
            return status.startsWith("Aborted");
        }
    }

    // ---- pass 1 ----

    public static Discovery discover(NumberedDocument document) {
        Objects.requireNonNull(document, "document");

        List<Integer> allCited = new ArrayList<>();
        List<CitationOccurrence> occurrences = new ArrayList<>();
        List<BibEntry> entries = new ArrayList<>();

        for (StyledParagraph p : document.paragraphs()) {
            if (p.isBibliography()) {
                BibEntry entry = bibEntry(p);
                if (entry != null) entries.add(entry);
                continue;
            }
            scanCitations(p, occurrences);
        }

        List<Integer> order = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (CitationOccurrence o : occurrences) {
            for (int n : o.numbers()) {
                allCited.add(n);
                if (seen.add(n)) order.add(n);
            }
        }

        SortedSet<Integer> bibIds = new TreeSet<>();
        for (BibEntry e : entries) bibIds.add(e.id());

        return new Discovery(allCited, order, bibIds, occurrences, entries);
    }

    private static void scanCitations(StyledParagraph p, List<CitationOccurrence> out) {
        List<StyledRun> runs = p.runs();
        int groupStart = -1;
        StringBuilder group = new StringBuilder();

        for (int i = 0; i < runs.size(); i++) {
            StyledRun run = runs.get(i);
            if (isCitationRun(run)) {
                if (groupStart < 0) groupStart = i;
                group.append(run.text());
                continue;
            }
            if (groupStart >= 0) {
                addOccurrence(out, p.id(), groupStart, i - 1, group.toString());
                groupStart = -1;
                group.setLength(0);
            }
            Matcher m = TEXT_MARKER.matcher(run.text());
            while (m.find()) {
                addOccurrence(out, p.id(), i, i, m.group(1));
            }
        }
        if (groupStart >= 0) {
            addOccurrence(out, p.id(), groupStart, runs.size() - 1, group.toString());
        }
    }

    private static void addOccurrence(List<CitationOccurrence> out, int paragraphId, int first, int last, String text) {
        List<Integer> numbers = NumberTokenizer.numbers(text);
        if (!numbers.isEmpty()) {
            out.add(new CitationOccurrence(paragraphId, first, last, numbers));
        }
    }

    static boolean isCitationRun(StyledRun run) {
        if (run.hasStyle(NumberedDocument.CITATION_STYLE)) return true;
        return run.superscript() && NumberTokenizer.isNumberList(run.text().strip());
    }

    private static BibEntry bibEntry(StyledParagraph p) {
        List<StyledRun> runs = p.runs();
        for (int i = 0; i < runs.size(); i++) {
            StyledRun run = runs.get(i);
            if (run.hasStyle(NumberedDocument.BIB_NUMBER_STYLE)) {
                List<Integer> numbers = NumberTokenizer.numbers(run.text());
                if (!numbers.isEmpty()) {
                    return new BibEntry(numbers.get(0), p.id(), i);
                }
            }
        }
        Matcher m = LEADING_INTEGER.matcher(p.text().strip());
        if (m.lookingAt()) {
            try {
                return new BibEntry(Integer.parseInt(m.group(1)), p.id(), -1);
            } catch (NumberFormatException e) {
                log.debug("Ignoring bibliography number too large for an int in paragraph {}", p.id());
            }
        }
        return null;
    }

    // ---- pass 2 ----

    public static NumericValidation validate(NumberedDocument document) {
        return validate(document, discover(document));
    }

    private static NumericValidation validate(NumberedDocument document, Discovery d) {
        Set<Integer> cited = new TreeSet<>(d.allCited());

        List<Integer> missing = new ArrayList<>();
        for (int n : cited) {
            if (!d.bibIds().contains(n)) missing.add(n);
        }
        List<Integer> unused = new ArrayList<>();
        for (int n : d.bibIds()) {
            if (!cited.contains(n)) unused.add(n);
        }

        List<DuplicateDetector.Candidate<Integer>> candidates = new ArrayList<>();
        for (BibEntry e : d.entries()) {
            String text = document.paragraph(e.paragraphId()).text().strip();
            candidates.add(new DuplicateDetector.Candidate<>(e.id(),
                    LEADING_ENTRY_NUMBER.matcher(text).replaceFirst("")));
        }
        List<DuplicateDetector.DuplicateRecord<Integer>> duplicates = DuplicateDetector.findDuplicates(candidates);

        List<SequenceIssue> issues = new ArrayList<>();
        Set<Integer> seen = new HashSet<>();
        for (int n : d.allCited()) {
            if (seen.contains(n)) continue;
            int expected = seen.size() + 1;
            if (n != expected) {
                issues.add(new SequenceIssue(expected, n, expected));
            }
            seen.add(n);
        }

        NumericValidation v = new NumericValidation(d.bibIds().size(), d.allCited().size(),
                missing, unused, duplicates, issues);
        log.debug("Numeric validation: {} citation(s), {} reference(s), missing={}, unused={}, duplicates={}, sequence issues={}",
                v.totalCitations(), v.totalReferences(), missing, unused, duplicates.size(), issues.size());
        return v;
    }

    // ---- gate + transform ----

    public static RenumberOutcome renumber(NumberedDocument document) {
        Objects.requireNonNull(document, "document");
        Discovery d = discover(document);
        NumericValidation before = validate(document, d);

        if (!before.unusedReferences().isEmpty()) {
            log.info("Not renumbering, unused references: {}", before.unusedReferences());
            return unchanged(document, before, STATUS_UNUSED);
        }
        if (before.perfect()) {
            log.info("Numbering already in order");
            return unchanged(document, before, STATUS_PERFECT);
        }
        if (!before.missingReferences().isEmpty()) {
            log.info("Not renumbering, missing references: {}", before.missingReferences());
            return unchanged(document, before, STATUS_MISSING);
        }

        Map<Integer, Integer> mapping = new LinkedHashMap<>();
        int next = 1;
        for (int old : d.appearanceOrder()) {
            mapping.put(old, next++);
        }

        List<MutationPlan.Operation> ops = new ArrayList<>();
        for (StyledParagraph p : document.paragraphs()) {
            if (p.isBibliography()) continue;
            List<StyledRun> rewritten = rewriteCitations(p.runs(), mapping);
            if (!rewritten.equals(p.runs())) {
                ops.add(new MutationPlan.SetRuns(p.id(), rewritten));
            }
        }
        reorderBibliography(document, d.entries(), mapping, ops);

        MutationPlan plan = new MutationPlan(ops);
        NumberedDocument result = document.apply(plan);
        NumericValidation after = validate(result);

        boolean changed = false;
        for (Map.Entry<Integer, Integer> e : mapping.entrySet()) {
            if (!e.getKey().equals(e.getValue())) {
                changed = true;
                break;
            }
        }
        String status;
        int dupes = before.duplicates().size();
        if (dupes > 0) {
            status = (changed ? "Renumbering" : "Validation") + " completed with " + dupes
                    + " duplicate" + (dupes > 1 ? "s" : "") + ".";
        } else if (changed) {
            status = STATUS_RENUMBERED;
        } else {
            status = STATUS_PERFECT;
        }
        log.info("{} ({} operation(s))", status, plan.operations().size());
        return new RenumberOutcome(mapping, plan, status, before, after, result);
    }

    private static RenumberOutcome unchanged(NumberedDocument document, NumericValidation before, String status) {
        return new RenumberOutcome(Map.of(), MutationPlan.EMPTY, status, before, before, document);
    }

    private static List<StyledRun> rewriteCitations(List<StyledRun> runs, Map<Integer, Integer> mapping) {
        List<StyledRun> out = new ArrayList<>();
        List<StyledRun> group = new ArrayList<>();
        for (StyledRun run : runs) {
            if (isCitationRun(run)) {
                group.add(run);
                continue;
            }
            flushGroup(group, out, mapping);
            rewriteMarkers(run, out, mapping);
        }
        flushGroup(group, out, mapping);
        return out;
    }

    private static void flushGroup(List<StyledRun> group, List<StyledRun> out, Map<Integer, Integer> mapping) {
        if (group.isEmpty()) return;
        StringBuilder text = new StringBuilder();
        for (StyledRun r : group) text.append(r.text());
        List<Integer> numbers = NumberTokenizer.numbers(text.toString());
        if (numbers.isEmpty()) {
            out.addAll(group);
        } else {
            out.add(group.get(0).withText(NumberTokenizer.format(remap(numbers, mapping))));
        }
        group.clear();
    }

    /**
     * Splits {@code ^1-3^} markers out of an ordinary run into superscript citation runs.
     */
    private static void rewriteMarkers(StyledRun run, List<StyledRun> out, Map<Integer, Integer> mapping) {
        String text = run.text();
        Matcher m = TEXT_MARKER.matcher(text);
        int last = 0;
        while (m.find()) {
            List<Integer> numbers = NumberTokenizer.numbers(m.group(1));
            if (numbers.isEmpty()) continue;
            if (m.start() > last) {
                out.add(run.withText(text.substring(last, m.start())));
            }
            out.add(new StyledRun(NumberTokenizer.format(remap(numbers, mapping)),
                    NumberedDocument.CITATION_STYLE, true));
            last = m.end();
        }
        if (last == 0) {
            out.add(run);
        } else if (last < text.length()) {
            out.add(run.withText(text.substring(last)));
        }
    }

    private static List<Integer> remap(List<Integer> numbers, Map<Integer, Integer> mapping) {
        List<Integer> out = new ArrayList<>(numbers.size());
        for (int n : numbers) {
            out.add(mapping.getOrDefault(n, n));
        }
        return out;
    }

    /**
     * Cited entries sorted by new number, then uncited ones in their old order, all placed where
     * the first entry used to be.
     */
    private static void reorderBibliography(NumberedDocument document, List<BibEntry> entries,
                                            Map<Integer, Integer> mapping, List<MutationPlan.Operation> ops) {
        if (entries.isEmpty()) return;

        List<BibEntry> cited = new ArrayList<>();
        List<BibEntry> uncited = new ArrayList<>();
        for (BibEntry e : entries) {
            if (mapping.containsKey(e.id())) {
                cited.add(e);
            } else {
                uncited.add(e);
            }
        }
        cited.sort((a, b) -> Integer.compare(mapping.get(a.id()), mapping.get(b.id())));

        for (BibEntry e : cited) {
            StyledParagraph p = document.paragraph(e.paragraphId());
            List<StyledRun> runs = renumberEntry(p, e, mapping.get(e.id()));
            if (!runs.equals(p.runs())) {
                ops.add(new MutationPlan.SetRuns(p.id(), runs));
            }
        }

        List<Integer> newEntryOrder = new ArrayList<>();
        for (BibEntry e : cited) newEntryOrder.add(e.paragraphId());
        for (BibEntry e : uncited) newEntryOrder.add(e.paragraphId());

        Set<Integer> entryIds = new HashSet<>(newEntryOrder);
        List<Integer> order = document.order();
        int anchor = -1;
        List<Integer> rest = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            int id = order.get(i);
            if (entryIds.contains(id)) {
                if (anchor < 0) anchor = rest.size();
            } else {
                rest.add(id);
            }
        }
        List<Integer> newOrder = new ArrayList<>(rest);
        newOrder.addAll(anchor, newEntryOrder);
        if (newOrder.equals(order)) return;

        for (int id : order) {
            if (entryIds.contains(id)) ops.add(new MutationPlan.RemoveParagraph(id));
        }
        int position = anchor;
        for (int id : newEntryOrder) {
            ops.add(new MutationPlan.InsertParagraph(id, position++));
        }
    }

    private static List<StyledRun> renumberEntry(StyledParagraph p, BibEntry e, int newId) {
        List<StyledRun> runs = new ArrayList<>(p.runs());
        if (e.idRunIndex() >= 0) {
            StyledRun run = runs.get(e.idRunIndex());
            runs.set(e.idRunIndex(), run.withText(replaceFirstInteger(run.text(), newId)));
            return runs;
        }
        String text = p.text();
        int start = 0;
        while (start < text.length() && Character.isWhitespace(text.charAt(start))) start++;
        int end = start;
        while (end < text.length() && text.charAt(end) >= '0' && text.charAt(end) <= '9') end++;
        if (end == start) return runs;
        return replaceSpan(runs, start, end, String.valueOf(newId));
    }

    private static String replaceFirstInteger(String text, int value) {
        Matcher m = DIGITS.matcher(text);
        if (!m.find()) return String.valueOf(value);
        return text.substring(0, m.start()) + value + text.substring(m.end());
    }

    /**
     * Replaces characters {@code [start, end)} of the concatenated run text, which may span runs.
     * The replacement goes into the run where the span starts.
     */
    static List<StyledRun> replaceSpan(List<StyledRun> runs, int start, int end, String replacement) {
        List<StyledRun> out = new ArrayList<>();
        int offset = 0;
        for (StyledRun run : runs) {
            String t = run.text();
            int runStart = offset;
            int runEnd = offset + t.length();
            offset = runEnd;

            if (runEnd <= start || runStart >= end) {
                out.add(run);
                continue;
            }
            int cutFrom = Math.max(start, runStart) - runStart;
            int cutTo = Math.min(end, runEnd) - runStart;
            String middle = (start >= runStart && start < runEnd) ? replacement : "";
            String newText = t.substring(0, cutFrom) + middle + t.substring(cutTo);
            if (!newText.isEmpty()) out.add(run.withText(newText));
        }
        return out;
    }
}
