package com.example.sgkdocumentreader.service.extraction;

/**
 * Checksum rules of the Turkish national identity (TC) number: eleven digits,
 * no leading zero, digit 10 equals {@code (7 * (d1+d3+d5+d7+d9) - (d2+d4+d6+d8)) % 10}
 * with a non-negative difference, and digit 11 equals the sum of the first ten digits mod 10.
 */
public final class NationalIdValidator {

    private NationalIdValidator() {
    }

    public static boolean isValid(String candidate) {
        if (candidate == null || candidate.length() != 11) {
            return false;
        }
        int[] digits = new int[11];
        for (int i = 0; i < 11; i++) {
            char c = candidate.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
            digits[i] = c - '0';
        }
        if (digits[0] == 0) {
            return false;
        }
        int oddSum = digits[0] + digits[2] + digits[4] + digits[6] + digits[8];
        int evenSum = digits[1] + digits[3] + digits[5] + digits[7];
        int difference = oddSum * 7 - evenSum;
        if (difference < 0 || digits[9] != difference % 10) {
            return false;
        }
        int firstTenSum = 0;
        for (int i = 0; i < 10; i++) {
            firstTenSum += digits[i];
        }
        return digits[10] == firstTenSum % 10;
    }
}
