package com.citationchecker;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds bibliography entries that are near-copies of each other.
 *
 * <p>Policy: the earlier entry is the original, every later entry whose full text is more than
 * 85% similar to it is reported as its duplicate. The full entry text is compared (not just
 * author and year) so two works by the same author in the same year are not confused.
 *
 * <p>Used for both the name-year reference table and the numbered bibliography.
 */
public final class DuplicateDetector {

    public static final double SIMILARITY_THRESHOLD = 0.85;
    public static final double MIN_LENGTH_RATIO = 0.6;
    public static final int MAX_TEXT_LENGTH = 100;

    private DuplicateDetector() {
    }

    /**
     * An entry to compare: its identifier and the text it is compared on.
     */
    public record Candidate<K>(K id, String text) {}

    public record DuplicateRecord<K>(
            K id,
            String text,
            K duplicateOf,
            double score
    ) {}

    public static <K> List<DuplicateRecord<K>> findDuplicates(List<Candidate<K>> candidates) {
        List<DuplicateRecord<K>> duplicates = new ArrayList<>();
        if (candidates == null || candidates.size() < 2) {
            return duplicates;
        }

        int n = candidates.size();
        for (int i = 0; i < n; i++) {
            Candidate<K> original = candidates.get(i);
            String textA = original.text() == null ? "" : original.text();
            if (textA.isEmpty()) continue;

            for (int j = i + 1; j < n; j++) {
                Candidate<K> later = candidates.get(j);
                String textB = later.text() == null ? "" : later.text();
                if (textB.isEmpty()) continue;

                int lenA = textA.length();
                int lenB = textB.length();
                if ((double) Math.min(lenA, lenB) / Math.max(lenA, lenB) < MIN_LENGTH_RATIO) {
                    continue;
                }

                // cheap upper bounds first
                if (SequenceSimilarity.realQuickRatio(textA, textB) < SIMILARITY_THRESHOLD) continue;
                if (SequenceSimilarity.quickRatio(textA, textB) < SIMILARITY_THRESHOLD) continue;

                double ratio = SequenceSimilarity.ratio(textA, textB);
                if (ratio > SIMILARITY_THRESHOLD) {
                    duplicates.add(new DuplicateRecord<>(
                            later.id(),
                            truncate(textB),
                            original.id(),
                            score(ratio)));
                }
            }
        }
        return duplicates;
    }

    /**
     * Ratio as a percentage with one decimal, e.g. {@code 0.9234 -> 92.3}.
     */
    static double score(double ratio) {
        return Math.round(ratio * 1000.0) / 10.0;
    }

    private static String truncate(String text) {
        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }
}
