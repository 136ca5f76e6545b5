package com.citationchecker;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NumberTokenizerJUnitTest {

    @Test
    void numbers_listsAndRanges() {
        assertEquals(List.of(1, 2, 3, 5), NumberTokenizer.numbers("1, 2, 3, 5"));
        assertEquals(List.of(3, 4, 5), NumberTokenizer.numbers("3-5"));
        assertEquals(List.of(2, 3, 4, 7), NumberTokenizer.numbers("2–4,7"));
        assertEquals(List.of(1, 2, 3), NumberTokenizer.numbers("1 — 3"));
    }

    @Test
    void numbers_descendingRangeYieldsNothing() {
        assertEquals(List.of(), NumberTokenizer.numbers("5-3"));
        assertEquals(List.of(1), NumberTokenizer.numbers("1, 5-3"));
    }

    @Test
    void numbers_oversizedRangeYieldsNothing() {
        assertEquals(List.of(), NumberTokenizer.numbers("1-2000000000"));
        assertEquals(List.of(4), NumberTokenizer.numbers("1-2000000000, 4"));
        assertEquals(NumberTokenizer.MAX_RANGE_SPAN,
                NumberTokenizer.numbers("1-" + NumberTokenizer.MAX_RANGE_SPAN).size());
        assertEquals(List.of(), NumberTokenizer.numbers("1-" + (NumberTokenizer.MAX_RANGE_SPAN + 1)));
    }

    @Test
    void numbers_skipsOverflow() {
        assertEquals(List.of(4), NumberTokenizer.numbers("99999999999, 4"));
        assertEquals(List.of(), NumberTokenizer.numbers(null));
        assertEquals(List.of(), NumberTokenizer.numbers(""));
    }

    @Test
    void format_compactsRuns() {
        assertEquals("1-3, 5", NumberTokenizer.format(NumberTokenizer.numbers("1, 2, 3, 5")));
        assertEquals("1-3, 5, 7,8", NumberTokenizer.format(List.of(5, 1, 2, 3, 7, 8)));
        assertEquals("4", NumberTokenizer.format(List.of(4, 4)));
        assertEquals("", NumberTokenizer.format(List.of()));
    }

    @Test
    void format_thenNumbers_givesSortedDistinctIds() {
        List<List<Integer>> sets = List.of(
                List.of(1),
                List.of(1, 2),
                List.of(1, 2, 3, 9),
                List.of(2, 4, 6),
                List.of(10, 11, 12, 13, 20, 21));
        for (List<Integer> ids : sets) {
            assertEquals(ids, NumberTokenizer.numbers(NumberTokenizer.format(ids)));
        }
    }

    @Test
    void isNumberList() {
        assertTrue(NumberTokenizer.isNumberList("1, 3-5"));
        assertTrue(NumberTokenizer.isNumberList("2–4"));
        assertFalse(NumberTokenizer.isNumberList("a1"));
        assertFalse(NumberTokenizer.isNumberList(""));
        assertFalse(NumberTokenizer.isNumberList("   "));
        assertFalse(NumberTokenizer.isNumberList(null));
    }
}
