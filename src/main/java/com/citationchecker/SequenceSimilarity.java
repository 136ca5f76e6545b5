package com.citationchecker;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Edit-similarity ratio between two strings (Ratcliff/Obershelp "gestalt pattern matching").
 *
 * <p>The ratio is {@code 2*M / T} where {@code T} is the total length of both strings and
 * {@code M} the number of characters in the matching blocks found by recursively taking the
 * longest common substring. Two empty strings are identical (ratio 1.0).
 *
 * <p>For a second string of 200 characters or more, characters occurring in more than 1% of its
 * positions are not used to seed matches (they can still extend one). This keeps long
 * bibliography entries, which repeat spaces and punctuation a lot, from being dominated by noise.
 *
 * <p>{@link #quickRatio} and {@link #realQuickRatio} are cheap upper bounds of {@link #ratio}
 * meant for pre-filtering.
 */
public final class SequenceSimilarity {

    private static final int AUTOJUNK_MIN_LENGTH = 200;

    private SequenceSimilarity() {
    }

    public static double ratio(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        int total = s1.length() + s2.length();
        if (total == 0) return 1.0;
        return 2.0 * matchingCharacters(s1, s2) / total;
    }

    /**
     * Upper bound of {@link #ratio} from the character multisets alone.
     */
    public static double quickRatio(String a, String b) {
        String s1 = a == null ? "" : a;
        String s2 = b == null ? "" : b;
        int total = s1.length() + s2.length();
        if (total == 0) return 1.0;

        Map<Character, Integer> available = new HashMap<>();
        for (int i = 0; i < s2.length(); i++) {
            available.merge(s2.charAt(i), 1, Integer::sum);
        }
        int matches = 0;
        for (int i = 0; i < s1.length(); i++) {
            char c = s1.charAt(i);
            Integer left = available.get(c);
            if (left != null && left > 0) {
                available.put(c, left - 1);
                matches++;
            }
        }
        return 2.0 * matches / total;
    }

    /**
     * Upper bound of {@link #ratio} from the lengths alone.
     */
    public static double realQuickRatio(String a, String b) {
        int la = a == null ? 0 : a.length();
        int lb = b == null ? 0 : b.length();
        int total = la + lb;
        if (total == 0) return 1.0;
        return 2.0 * Math.min(la, lb) / total;
    }

    private static int matchingCharacters(String a, String b) {
        if (a.isEmpty() || b.isEmpty()) return 0;

        Map<Character, int[]> positions = indexPositions(b);
        int[] lengths = new int[b.length() + 1];
        int[] next = new int[b.length() + 1];

        int matched = 0;
        Deque<int[]> queue = new ArrayDeque<>();
        queue.push(new int[]{0, a.length(), 0, b.length()});

        while (!queue.isEmpty()) {
            int[] range = queue.pop();
            int alo = range[0], ahi = range[1], blo = range[2], bhi = range[3];

            int[] best = longestMatch(a, b, positions, lengths, next, alo, ahi, blo, bhi);
            int i = best[0], j = best[1], k = best[2];
            if (k == 0) continue;

            matched += k;
            if (alo < i && blo < j) {
                queue.push(new int[]{alo, i, blo, j});
            }
            if (i + k < ahi && j + k < bhi) {
                queue.push(new int[]{i + k, ahi, j + k, bhi});
            }
        }
        return matched;
    }

    /**
     * Longest block {@code a[i..i+k) == b[j..j+k)} within the given bounds, earliest in {@code a}
     * and then in {@code b} on ties. Returns {@code {i, j, k}}.
     */
    private static int[] longestMatch(String a, String b, Map<Character, int[]> positions,
                                      int[] lengths, int[] next,
                                      int alo, int ahi, int blo, int bhi) {
        int besti = alo;
        int bestj = blo;
        int bestSize = 0;

        // lengths[j + 1] holds the length of the match ending at (i - 1, j) from the previous row
        List<Integer> touched = new ArrayList<>();
        List<Integer> nextTouched = new ArrayList<>();

        for (int i = alo; i < ahi; i++) {
            int[] js = positions.get(a.charAt(i));
            if (js != null) {
                for (int j : js) {
                    if (j < blo) continue;
                    if (j >= bhi) break;
                    int k = lengths[j] + 1;
                    next[j + 1] = k;
                    nextTouched.add(j + 1);
                    if (k > bestSize) {
                        besti = i - k + 1;
                        bestj = j - k + 1;
                        bestSize = k;
                    }
                }
            }
            for (int t : touched) lengths[t] = 0;
            for (int t : nextTouched) {
                lengths[t] = next[t];
                next[t] = 0;
            }
            List<Integer> swap = touched;
            touched = nextTouched;
            nextTouched = swap;
            nextTouched.clear();
        }
        for (int t : touched) lengths[t] = 0;

        while (besti > alo && bestj > blo && a.charAt(besti - 1) == b.charAt(bestj - 1)) {
            besti--;
            bestj--;
            bestSize++;
        }
        while (besti + bestSize < ahi && bestj + bestSize < bhi
                && a.charAt(besti + bestSize) == b.charAt(bestj + bestSize)) {
            bestSize++;
        }
        return new int[]{besti, bestj, bestSize};
    }

    private static Map<Character, int[]> indexPositions(String b) {
        Map<Character, List<Integer>> lists = new HashMap<>();
        for (int j = 0; j < b.length(); j++) {
            lists.computeIfAbsent(b.charAt(j), c -> new ArrayList<>()).add(j);
        }

        int n = b.length();
        int popularThreshold = n / 100 + 1;

        Map<Character, int[]> positions = new HashMap<>();
        for (Map.Entry<Character, List<Integer>> e : lists.entrySet()) {
            List<Integer> js = e.getValue();
            if (n >= AUTOJUNK_MIN_LENGTH && js.size() > popularThreshold) {
                continue;
            }
            int[] arr = new int[js.size()];
            for (int x = 0; x < arr.length; x++) arr[x] = js.get(x);
            positions.put(e.getKey(), arr);
        }
        return positions;
    }
}
