package com.labelcheck.backend.services.labels.upc;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.labelcheck.backend.services.labels.util.NormalizeUtil;

/**
 * UPC-A (12 digits) and EAN-13 (13 digits) check-digit validation and
 * lookup of number-shaped codes in label text.
 */
public final class UpcValidator {

    // Optional "EAN/UPC", "UPC" or "EAN" token, then a digit followed by 10-15 digits/spaces.
    private static final Pattern UPC_CANDIDATE_PATTERN = Pattern.compile(
            "(?i)(?:EAN/?UPC|EAN|UPC)?\\s*([0-9][0-9\\s]{10,15})");

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private UpcValidator() {
    }

    public static boolean isValidUpcEan(String code) {
        if (code == null || code.isEmpty()) return false;
        for (int i = 0; i < code.length(); i++) {
            char c = code.charAt(i);
            if (c < '0' || c > '9') return false;
        }

        int length = code.length();
        if (length != 12 && length != 13) return false;

        int check = code.charAt(length - 1) - '0';
        int bodyLength = length - 1;

        // UPC-A weights even body indexes by 3, EAN-13 weights odd ones.
        int tripledParity = length == 12 ? 0 : 1;

        int sum = 0;
        for (int i = 0; i < bodyLength; i++) {
            int digit = code.charAt(i) - '0';
            sum += (i % 2 == tripledParity) ? digit * 3 : digit;
        }

        int expected = (10 - (sum % 10)) % 10;
        return expected == check;
    }

    /**
     * Returns the first 12- or 13-digit run found in the text, without checksum validation.
     * Empty string when nothing number-shaped of the right length is present.
     */
    public static String extractUpcCandidate(String text) {
        String normalized = NormalizeUtil.normalize(text);
        if (normalized.isEmpty()) return "";

        Matcher m = UPC_CANDIDATE_PATTERN.matcher(normalized);
        if (!m.find()) return "";

        String digits = WHITESPACE.matcher(m.group(1)).replaceAll("");
        return (digits.length() == 12 || digits.length() == 13) ? digits : "";
    }

    public static String extractValidUpc(String text) {
        String candidate = extractUpcCandidate(text);
        if (candidate.isEmpty()) return "";
        return isValidUpcEan(candidate) ? candidate : "";
    }
}
