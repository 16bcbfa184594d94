package com.labelcheck.backend.services.labels.extraction;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;

import com.labelcheck.backend.config.CatalogProperties;
import com.labelcheck.backend.enums.DocumentType;

/**
 * Picks the extraction strategy for a classified document type.
 */
public class LabelExtractorFactory {

    private final Map<DocumentType, LabelExtractionStrategy> strategies = new EnumMap<>(DocumentType.class);

    public LabelExtractorFactory(CatalogProperties catalog) {
        strategies.put(DocumentType.CARE_LABEL, new FieldExtractor(LabelRuleSet.careLabel(catalog)));
        strategies.put(DocumentType.RFID, new FieldExtractor(LabelRuleSet.hangTag(catalog)));
    }

    public Optional<LabelExtractionStrategy> getStrategy(DocumentType type) {
        if (type == null) return Optional.empty();
        return Optional.ofNullable(strategies.get(type));
    }

    public LabelExtractionStrategy careLabel() {
        return strategies.get(DocumentType.CARE_LABEL);
    }

    public LabelExtractionStrategy hangTag() {
        return strategies.get(DocumentType.RFID);
    }
}
