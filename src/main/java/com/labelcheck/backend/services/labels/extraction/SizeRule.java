package com.labelcheck.backend.services.labels.extraction;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.labelcheck.backend.enums.FieldKey;

/**
 * Letter size (longest token first so "XL" never wins inside "XXL"), its parenthesized range,
 * and optionally a numeric size mapped back to a letter size. Percentages ("60% Cotton") are never sizes.
 */
public class SizeRule implements FieldRule {

    private static final Pattern LETTER_SIZE_PATTERN = Pattern.compile("\\b(XXXL|XXL|XL|L|M|S|XS)\\b");
    private static final Pattern NUMERIC_SIZE_PATTERN = Pattern.compile("\\b(\\d{1,2}\\s*-\\s*\\d{1,2}|\\d{1,2})\\b(?!\\s*%)");
    private static final Pattern RANGE_PATTERN = Pattern.compile("\\s*\\(([^)]+)\\)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private static final Map<String, String> NUMERIC_TO_LETTER = Map.of(
            "0-2", "XS",
            "4-6", "S",
            "8-10", "M",
            "12-14", "L",
            "16-18", "XL",
            "20", "XXL",
            "22", "XXXL"
    );

    private final boolean requireRange;
    private final boolean numericFallback;

    private SizeRule(boolean requireRange, boolean numericFallback) {
        this.requireRange = requireRange;
        this.numericFallback = numericFallback;
    }

    /**
     * Care labels: letter size with optional range, numeric sizes as fallback.
     */
    public static SizeRule lenient() {
        return new SizeRule(false, true);
    }

    /**
     * Hang tags: a letter size counts only when printed with its range, e.g. "M (8-10)".
     */
    public static SizeRule withRangeOnly() {
        return new SizeRule(true, false);
    }

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        String normalized = text.normalized();

        Matcher letter = LETTER_SIZE_PATTERN.matcher(normalized);
        while (letter.find()) {
            String size = letter.group(1);
            String range = findRange(normalized, letter.end());
            if (requireRange && range == null) {
                continue;
            }
            fields.put(FieldKey.SIZE, size);
            fields.put(FieldKey.SIZE_RANGE, range);
            return;
        }

        if (!numericFallback) return;

        Matcher numeric = NUMERIC_SIZE_PATTERN.matcher(normalized);
        if (numeric.find()) {
            String range = WHITESPACE.matcher(numeric.group(1)).replaceAll("");
            fields.put(FieldKey.SIZE_RANGE, range);
            fields.put(FieldKey.SIZE, NUMERIC_TO_LETTER.get(range));
        }
    }

    private static String findRange(String normalized, int from) {
        Matcher m = RANGE_PATTERN.matcher(normalized);
        m.region(from, normalized.length());
        if (!m.lookingAt()) return null;
        String range = m.group(1).trim();
        return range.isEmpty() ? null : range;
    }
}
