package com.citationchecker;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SequenceSimilarityJUnitTest {

    @Test
    void ratio_identicalAndEmpty() {
        assertEquals(1.0, SequenceSimilarity.ratio("Smith", "Smith"));
        assertEquals(1.0, SequenceSimilarity.ratio("", ""));
        assertEquals(0.0, SequenceSimilarity.ratio("abc", ""));
        assertEquals(0.0, SequenceSimilarity.ratio("abc", "xyz"));
    }

    @Test
    void ratio_countsLongestBlocksRecursively() {
        // "bcd" is the only common block
        assertEquals(0.75, SequenceSimilarity.ratio("abcd", "bcde"), 1e-9);
        // J-o-n + s-o-n: 6 of 13 characters
        assertEquals(12.0 / 13.0, SequenceSimilarity.ratio("Jonson", "Johnson"), 1e-9);
    }

    @Test
    void quickRatios_areUpperBounds() {
        String a = "Smith, J. (2020). Deep learning for citation analysis.";
        String b = "Smyth, J. (2021). Shallow learning for reference analysis.";
        double ratio = SequenceSimilarity.ratio(a, b);
        assertTrue(SequenceSimilarity.quickRatio(a, b) >= ratio);
        assertTrue(SequenceSimilarity.realQuickRatio(a, b) >= SequenceSimilarity.quickRatio(a, b));
    }
}
