package com.labelcheck.backend.services.labels.extraction;

import com.labelcheck.backend.enums.DocumentType;

/**
 * Applies every rule of a {@link LabelRuleSet} independently to the same text.
 */
public class FieldExtractor implements LabelExtractionStrategy {

    private final LabelRuleSet ruleSet;

    public FieldExtractor(LabelRuleSet ruleSet) {
        this.ruleSet = ruleSet;
    }

    @Override
    public DocumentType documentType() {
        return ruleSet.documentType();
    }

    @Override
    public ExtractedFields extractFields(String text) {
        LabelText labelText = LabelText.of(text);
        if (labelText.raw().isBlank()) {
            return ExtractedFields.empty();
        }

        ExtractedFields.Builder fields = ExtractedFields.builder();
        for (FieldRule rule : ruleSet.rules()) {
            rule.apply(labelText, fields);
        }
        return fields.build();
    }
}
