package com.example.sgkdocumentreader.util;

import java.text.Normalizer;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Folding rules shared by name extraction, identity matching and file naming.
 * Matching compares text in a canonical form: Turkish-aware lower case, no
 * diacritics, OCR digit confusions inside words replaced by the letters they
 * usually stand for, no punctuation.
 */
public final class TextNormalizer {

    public static final Locale TURKISH = Locale.forLanguageTag("tr-TR");

    private static final Pattern COMBINING_MARKS = Pattern.compile("\\p{M}+");
    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^a-z0-9\\s]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final Pattern HAS_LETTER = Pattern.compile(".*[a-z].*");

    private TextNormalizer() {
    }

    /** Replaces Turkish letters with their ASCII base letters, preserving case. */
    public static String foldTurkish(String input) {
        if (input == null) {
            return "";
        }
        StringBuilder builder = new StringBuilder(input.length());
        for (char c : input.toCharArray()) {
            builder.append(switch (c) {
                case 'ç' -> 'c';
                case 'Ç' -> 'C';
                case 'ğ' -> 'g';
                case 'Ğ' -> 'G';
                case 'ı' -> 'i';
                case 'İ' -> 'I';
                case 'ö' -> 'o';
                case 'Ö' -> 'O';
                case 'ş' -> 's';
                case 'Ş' -> 'S';
                case 'ü' -> 'u';
                case 'Ü' -> 'U';
                default -> c;
            });
        }
        return COMBINING_MARKS.matcher(Normalizer.normalize(builder, Normalizer.Form.NFD)).replaceAll("");
    }

    /** Canonical form used for similarity scoring. */
    public static String normalize(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        String folded = foldTurkish(input.toLowerCase(TURKISH)).toLowerCase(Locale.ROOT);
        String cleaned = NON_ALPHANUMERIC.matcher(folded).replaceAll(" ");
        String[] tokens = WHITESPACE.split(cleaned.trim());
        StringBuilder builder = new StringBuilder(cleaned.length());
        for (String token : tokens) {
            if (token.isEmpty()) {
                continue;
            }
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(HAS_LETTER.matcher(token).matches() ? foldConfusables(token) : token);
        }
        return builder.toString();
    }

    public static List<String> tokens(String normalized) {
        if (normalized == null || normalized.isBlank()) {
            return List.of();
        }
        return Arrays.asList(WHITESPACE.split(normalized.trim()));
    }

    /** Upper-cases the first letter of each token and lower-cases the rest, Turkish rules. */
    public static String toProperCase(String input) {
        if (input == null || input.isBlank()) {
            return "";
        }
        StringBuilder builder = new StringBuilder(input.length());
        for (String token : WHITESPACE.split(input.trim())) {
            if (builder.length() > 0) {
                builder.append(' ');
            }
            builder.append(token.substring(0, 1).toUpperCase(TURKISH))
                    .append(token.substring(1).toLowerCase(TURKISH));
        }
        return builder.toString();
    }

    private static String foldConfusables(String token) {
        StringBuilder builder = new StringBuilder(token.length());
        for (char c : token.toCharArray()) {
            builder.append(switch (c) {
                case '0' -> 'o';
                case '1' -> 'i';
                case '5' -> 's';
                case '8' -> 'b';
                case '6' -> 'g';
                default -> c;
            });
        }
        return builder.toString();
    }
}
