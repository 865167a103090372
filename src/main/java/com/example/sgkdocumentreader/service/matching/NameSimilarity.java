package com.example.sgkdocumentreader.service.matching;

import com.example.sgkdocumentreader.util.TextNormalizer;

import java.util.List;

/**
 * String similarity measures used for name matching. All inputs are expected
 * in {@link TextNormalizer#normalize(String)} form; every measure returns a
 * value between 0 and 1 and 0 when either side is empty.
 */
public final class NameSimilarity {

    private static final int WINKLER_PREFIX_LIMIT = 4;
    private static final double WINKLER_SCALING = 0.1;

    private NameSimilarity() {
    }

    /** Mean of the four measures. */
    public static double combined(String first, String second) {
        return (levenshtein(first, second)
                + jaroWinkler(first, second)
                + tokenPairing(first, second)
                + lcsRatio(first, second)) / 4.0;
    }

    public static double levenshtein(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        if (first.equals(second)) {
            return 1.0;
        }
        int[] previous = new int[second.length() + 1];
        int[] current = new int[second.length() + 1];
        for (int j = 0; j <= second.length(); j++) {
            previous[j] = j;
        }
        for (int i = 1; i <= first.length(); i++) {
            current[0] = i;
            for (int j = 1; j <= second.length(); j++) {
                int cost = first.charAt(i - 1) == second.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(Math.min(current[j - 1] + 1, previous[j] + 1), previous[j - 1] + cost);
            }
            int[] swap = previous;
            previous = current;
            current = swap;
        }
        int distance = previous[second.length()];
        return 1.0 - distance / (double) Math.max(first.length(), second.length());
    }

    public static double jaroWinkler(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        if (first.equals(second)) {
            return 1.0;
        }
        int matchWindow = Math.max(0, Math.max(first.length(), second.length()) / 2 - 1);
        boolean[] firstMatches = new boolean[first.length()];
        boolean[] secondMatches = new boolean[second.length()];

        int matches = 0;
        for (int i = 0; i < first.length(); i++) {
            int start = Math.max(0, i - matchWindow);
            int end = Math.min(i + matchWindow + 1, second.length());
            for (int j = start; j < end; j++) {
                if (secondMatches[j] || first.charAt(i) != second.charAt(j)) {
                    continue;
                }
                firstMatches[i] = true;
                secondMatches[j] = true;
                matches++;
                break;
            }
        }
        if (matches == 0) {
            return 0.0;
        }

        int transpositions = 0;
        int k = 0;
        for (int i = 0; i < first.length(); i++) {
            if (!firstMatches[i]) {
                continue;
            }
            while (!secondMatches[k]) {
                k++;
            }
            if (first.charAt(i) != second.charAt(k)) {
                transpositions++;
            }
            k++;
        }

        double m = matches;
        double jaro = (m / first.length() + m / second.length() + (m - transpositions / 2.0) / m) / 3.0;

        int prefix = 0;
        int prefixLimit = Math.min(WINKLER_PREFIX_LIMIT, Math.min(first.length(), second.length()));
        while (prefix < prefixLimit && first.charAt(prefix) == second.charAt(prefix)) {
            prefix++;
        }
        return jaro + WINKLER_SCALING * prefix * (1.0 - jaro);
    }

    /**
     * For every token of {@code first}, the best Levenshtein similarity against
     * any token of {@code second}, averaged. Token order does not matter.
     */
    public static double tokenPairing(String first, String second) {
        List<String> firstTokens = TextNormalizer.tokens(first);
        List<String> secondTokens = TextNormalizer.tokens(second);
        if (firstTokens.isEmpty() || secondTokens.isEmpty()) {
            return 0.0;
        }
        double total = 0;
        for (String token : firstTokens) {
            double best = 0;
            for (String candidate : secondTokens) {
                best = Math.max(best, levenshtein(token, candidate));
            }
            total += best;
        }
        return total / firstTokens.size();
    }

    /** {@code 2 * lcs / (|first| + |second|)} over characters. */
    public static double lcsRatio(String first, String second) {
        if (first.isEmpty() || second.isEmpty()) {
            return 0.0;
        }
        int[][] table = new int[first.length() + 1][second.length() + 1];
        for (int i = 1; i <= first.length(); i++) {
            for (int j = 1; j <= second.length(); j++) {
                if (first.charAt(i - 1) == second.charAt(j - 1)) {
                    table[i][j] = table[i - 1][j - 1] + 1;
                } else {
                    table[i][j] = Math.max(table[i - 1][j], table[i][j - 1]);
                }
            }
        }
        return 2.0 * table[first.length()][second.length()] / (first.length() + second.length());
    }
}
