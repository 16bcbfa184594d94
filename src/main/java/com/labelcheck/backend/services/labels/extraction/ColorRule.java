package com.labelcheck.backend.services.labels.extraction;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.labels.util.NormalizeUtil;

/**
 * Known catalog color names, plus the numeric color code printed right after the name.
 */
public class ColorRule implements FieldRule {

    private final Pattern colorPattern;
    private final Pattern colorCodePattern;

    public ColorRule(List<String> colors) {
        String alternation = colors.stream()
                .map(NormalizeUtil::normalizeKey)
                .filter(c -> !c.isEmpty())
                .map(ColorRule::toFlexibleSpacing)
                .collect(Collectors.joining("|"));

        if (alternation.isEmpty()) {
            this.colorPattern = null;
            this.colorCodePattern = null;
        } else {
            this.colorPattern = Pattern.compile("(?i)\\b(" + alternation + ")\\b");
            this.colorCodePattern = Pattern.compile("(?i)\\b(?:" + alternation + ")\\s+(\\d+)");
        }
    }

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        if (colorPattern == null) return;

        Matcher color = colorPattern.matcher(text.normalized());
        if (!color.find()) return;
        fields.put(FieldKey.COLOR, NormalizeUtil.normalizeKey(color.group(1)));

        Matcher code = colorCodePattern.matcher(text.normalized());
        if (code.find()) {
            fields.put(FieldKey.COLOR_CODE, code.group(1));
        }
    }

    // "BLACK SOOT" -> "BLACK\s+SOOT"
    private static String toFlexibleSpacing(String color) {
        return List.of(color.split(" ")).stream()
                .map(Pattern::quote)
                .collect(Collectors.joining("\\s+"));
    }
}
