package com.labelcheck.backend.services.labels.extraction;

import java.util.regex.Pattern;

import com.labelcheck.backend.enums.FieldKey;

/**
 * Boolean field set to true when a fixed phrase appears anywhere in the raw text.
 */
public record PhraseFlagRule(FieldKey key, Pattern phrase) implements FieldRule {

    public PhraseFlagRule {
        if (key != FieldKey.EXCLUSIVE_OF_DECORATION) {
            throw new IllegalArgumentException("unsupported flag field: " + key);
        }
    }

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        if (phrase.matcher(text.raw()).find()) {
            fields.exclusiveOfDecoration(true);
        }
    }
}
