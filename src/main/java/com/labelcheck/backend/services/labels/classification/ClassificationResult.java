package com.labelcheck.backend.services.labels.classification;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.labelcheck.backend.enums.DocumentType;

public record ClassificationResult(
        DocumentType type,
        int careScore,
        int rfidScore,
        Map<String, List<String>> evidence
) {
    public ClassificationResult {
        evidence = evidence == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(evidence));
    }

    public static ClassificationResult unknown() {
        Map<String, List<String>> evidence = new LinkedHashMap<>();
        evidence.put(DocumentType.CARE_LABEL.getJsonName(), List.of());
        evidence.put(DocumentType.RFID.getJsonName(), List.of());
        return new ClassificationResult(DocumentType.UNKNOWN, 0, 0, evidence);
    }
}
