package com.labelcheck.backend.services.labels.classification;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.Test;

import com.labelcheck.backend.enums.DocumentType;

class DocumentClassifierTest {

    private final DocumentClassifier classifier = new DocumentClassifier();

    @Test
    void careLabelSheet() {
        ClassificationResult result = classifier.classify(
                "RN#12345\nMade In China\n60% Cotton 40% Polyester\nExclusive of Decoration\nBody & Pocket");

        assertEquals(DocumentType.CARE_LABEL, result.type());
        assertEquals(4, result.careScore());
        assertEquals(0, result.rfidScore());
        assertEquals(4, result.evidence().get("care_label").size());
        assertTrue(result.evidence().get("rfid").isEmpty());
    }

    @Test
    void hangTagSheet() {
        ClassificationResult result = classifier.classify(
                "AVIA STRETCH\nFind more at Walmart.com\nWALMART.COM/AVIA\nSALSA DELIGHT 650");

        assertEquals(DocumentType.RFID, result.type());
        assertEquals(0, result.careScore());
        assertEquals(4, result.rfidScore());
    }

    @Test
    void patternsMatchCaseInsensitively() {
        ClassificationResult result = classifier.classify("avia stretch / black   soot");

        assertEquals(DocumentType.RFID, result.type());
        assertEquals(2, result.rfidScore());
    }

    @Test
    void tie_goesToCareLabel() {
        ClassificationResult result = classifier.classify("Made In Vietnam BLACK SOOT");

        assertEquals(1, result.careScore());
        assertEquals(1, result.rfidScore());
        assertEquals(DocumentType.CARE_LABEL, result.type());
    }

    @Test
    void noIndicators_isUnknown() {
        ClassificationResult result = classifier.classify("Reference #: 4411\nJob #: 99");

        assertEquals(DocumentType.UNKNOWN, result.type());
        assertEquals(0, result.careScore());
        assertEquals(0, result.rfidScore());
        assertEquals(List.of(), result.evidence().get("care_label"));
        assertEquals(List.of(), result.evidence().get("rfid"));
    }

    @Test
    void emptyText_isUnknownWithEmptyEvidence() {
        ClassificationResult result = classifier.classify("");

        assertEquals(DocumentType.UNKNOWN, result.type());
        assertEquals(List.of("care_label", "rfid"), List.copyOf(result.evidence().keySet()));
        assertEquals(DocumentType.UNKNOWN, classifier.classify(null).type());
    }

    @Test
    void sameTextSameResult() {
        String text = "RN# 555 Hecho En Mexico REGISTERED TRADEMARK Inner Layer";

        assertEquals(classifier.classify(text), classifier.classify(text));
    }
}
