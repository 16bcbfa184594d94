package com.labelcheck.backend.services.labels.extraction;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Every "NN% Material" occurrence, in document order. Percentages are not required to add up to 100.
 * A material name ends at the line break.
 */
public class CompositionRule implements FieldRule {

    private static final Pattern COMPOSITION_PATTERN = Pattern.compile("(\\d{1,3})%[ \\t]*([A-Za-z][A-Za-z \\t/&-]+)");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");
    private static final String TRIM_CHARS = " .;/";

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        List<CompositionEntry> entries = new ArrayList<>();

        Matcher m = COMPOSITION_PATTERN.matcher(text.raw());
        while (m.find()) {
            int percent = Integer.parseInt(m.group(1));
            if (percent > 100) continue;

            String material = strip(WHITESPACE.matcher(m.group(2)).replaceAll(" "));
            if (!material.isEmpty()) {
                entries.add(new CompositionEntry(percent, material));
            }
        }

        fields.composition(entries);
    }

    private static String strip(String value) {
        int start = 0;
        int end = value.length();
        while (start < end && TRIM_CHARS.indexOf(value.charAt(start)) >= 0) start++;
        while (end > start && TRIM_CHARS.indexOf(value.charAt(end - 1)) >= 0) end--;
        return value.substring(start, end);
    }
}
