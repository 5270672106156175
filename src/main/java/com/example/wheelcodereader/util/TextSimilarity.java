package com.example.wheelcodereader.util;

import java.util.Locale;

/**
 * Edit-distance helpers shared by deduplication and line fusion.
 */
public final class TextSimilarity {

    private TextSimilarity() {
    }

    /**
     * Normalized similarity {@code 1 - distance / maxLength}. Two empty strings are identical.
     */
    public static double similarity(String left, String right) {
        if (left.equals(right)) {
            return 1.0;
        }
        int maxLength = Math.max(left.length(), right.length());
        if (maxLength == 0) {
            return 1.0;
        }
        return 1.0 - (double) levenshteinDistance(left, right) / maxLength;
    }

    public static int levenshteinDistance(String left, String right) {
        int leftLength = left.length();
        int rightLength = right.length();
        if (leftLength == 0) {
            return rightLength;
        }
        if (rightLength == 0) {
            return leftLength;
        }

        int[] previous = new int[rightLength + 1];
        int[] current = new int[rightLength + 1];

        for (int j = 0; j <= rightLength; j++) {
            previous[j] = j;
        }

        for (int i = 1; i <= leftLength; i++) {
            current[0] = i;
            for (int j = 1; j <= rightLength; j++) {
                int cost = left.charAt(i - 1) == right.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                        Math.min(current[j - 1] + 1, previous[j] + 1),
                        previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }

        return previous[rightLength];
    }

    /**
     * Removes spaces and upper-cases, so that {@code "at 642 02"} and {@code "AT64202"} compare equal.
     */
    public static String compact(String value) {
        return value.replace(" ", "").toUpperCase(Locale.ROOT);
    }

    public static boolean isAllDigits(String value) {
        if (value.isEmpty()) {
            return false;
        }
        for (int i = 0; i < value.length(); i++) {
            if (!Character.isDigit(value.charAt(i))) {
                return false;
            }
        }
        return true;
    }
}
