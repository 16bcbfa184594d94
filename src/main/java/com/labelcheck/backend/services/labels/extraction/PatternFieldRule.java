package com.labelcheck.backend.services.labels.extraction;

import java.util.function.UnaryOperator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.labels.extraction.LabelText.TextSource;

/**
 * {field key, pattern, post-processing} entry of a rule table: first match of group 1 populates the key.
 */
public record PatternFieldRule(
        FieldKey key,
        Pattern pattern,
        TextSource source,
        UnaryOperator<String> postProcess
) implements FieldRule {

    public PatternFieldRule(FieldKey key, Pattern pattern, TextSource source) {
        this(key, pattern, source, String::trim);
    }

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        Matcher m = pattern.matcher(text.source(source));
        if (!m.find()) return;

        String value = postProcess.apply(m.group(1));
        if (value != null && !value.isBlank()) {
            fields.put(key, value);
        }
    }
}
