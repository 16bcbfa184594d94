package com.labelcheck.backend.services.labels.extraction;

import com.labelcheck.backend.enums.DocumentType;

public interface LabelExtractionStrategy {

    DocumentType documentType();

    /**
     * Extracts the fields of one label/tag region. Never throws for unmatched text;
     * missing fields are simply absent from the result.
     */
    ExtractedFields extractFields(String text);
}
