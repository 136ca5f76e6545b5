package com.citationchecker;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.TreeSet;

/**
 * Reads and writes numeric citation lists such as {@code 1, 3-5} or {@code 2–4,7}.
 *
 * <p>Scanning rules:
 * <ul>
 *   <li>{@code a-b} (hyphen, en dash or em dash, blanks allowed around it) expands to
 *       {@code a..b}; a descending range, or one spanning more than {@value #MAX_RANGE_SPAN}
 *       numbers, yields nothing</li>
 *   <li>any other digit run is a single number</li>
 *   <li>everything else separates numbers</li>
 *   <li>a digit run too large for an {@code int} is skipped</li>
 * </ul>
 */
public final class NumberTokenizer {

    public static final int MAX_RANGE_SPAN = 1000;

    private NumberTokenizer() {
    }

    public static List<Integer> numbers(String text) {
        List<Integer> out = new ArrayList<>();
        if (text == null || text.isEmpty()) {
            return out;
        }

        int n = text.length();
        int i = 0;
        while (i < n) {
            if (!isDigit(text.charAt(i))) {
                i++;
                continue;
            }

            int startEnd = digitsEnd(text, i);
            Integer start = parse(text, i, startEnd);

            int j = startEnd;
            while (j < n && Character.isWhitespace(text.charAt(j))) j++;
            if (j < n && isDash(text.charAt(j))) {
                int k = j + 1;
                while (k < n && Character.isWhitespace(text.charAt(k))) k++;
                if (k < n && isDigit(text.charAt(k))) {
                    int endEnd = digitsEnd(text, k);
                    Integer end = parse(text, k, endEnd);
                    if (start != null && end != null && start <= end
                            && (long) end - start < MAX_RANGE_SPAN) {
                        for (int v = start; v <= end; v++) {
                            out.add(v);
                            if (v == Integer.MAX_VALUE) break;
                        }
                    }
                    i = endEnd;
                    continue;
                }
            }

            if (start != null) out.add(start);
            i = startEnd;
        }
        return out;
    }

    /**
     * Compact form of a set of numbers: distinct, ascending, runs of three or more as
     * {@code a-b}, pairs as {@code a,b}, groups joined with {@code ", "}.
     * {@code [5, 1, 2, 3, 7, 8]} -> {@code "1-3, 5, 7,8"}.
     */
    public static String format(Collection<Integer> numbers) {
        if (numbers == null || numbers.isEmpty()) {
            return "";
        }
        List<Integer> sorted = new ArrayList<>(new TreeSet<>(numbers));

        StringBuilder sb = new StringBuilder();
        int start = sorted.get(0);
        int prev = start;
        for (int idx = 1; idx < sorted.size(); idx++) {
            int v = sorted.get(idx);
            if (v == prev + 1) {
                prev = v;
                continue;
            }
            appendRun(sb, start, prev);
            start = v;
            prev = v;
        }
        appendRun(sb, start, prev);
        return sb.toString();
    }

    private static void appendRun(StringBuilder sb, int start, int end) {
        if (sb.length() > 0) sb.append(", ");
        long length = (long) end - start + 1;
        if (length >= 3) {
            sb.append(start).append('-').append(end);
        } else if (length == 2) {
            sb.append(start).append(',').append(end);
        } else {
            sb.append(start);
        }
    }

    /**
     * True when {@code text} is non-blank and made only of digits, commas, dashes and blanks.
     */
    public static boolean isNumberList(String text) {
        if (text == null || text.isBlank()) return false;
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (!isDigit(c) && c != ',' && !isDash(c) && !Character.isWhitespace(c)) {
                return false;
            }
        }
        return true;
    }

    static boolean isDash(char c) {
        return c == '-' || c == '–' || c == '—';
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static int digitsEnd(String text, int from) {
        int i = from;
        while (i < text.length() && isDigit(text.charAt(i))) i++;
        return i;
    }

    private static Integer parse(String text, int from, int to) {
        try {
            return Integer.parseInt(text, from, to, 10);
        } catch (NumberFormatException e) {
            // longer than an int
            return null;
        }
    }
}
