package com.labelcheck.backend.services.labels.classification;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

import com.labelcheck.backend.enums.DocumentType;
import com.labelcheck.backend.services.labels.util.NormalizeUtil;

import lombok.extern.slf4j.Slf4j;

/**
 * Decides whether a print sheet carries care labels or RFID hang tags by counting indicator
 * patterns of each kind. Every matching pattern adds exactly one point; ties go to care labels.
 */
@Slf4j
public class DocumentClassifier {

    static final List<Pattern> CARE_LABEL_PATTERNS = List.of(
            Pattern.compile("\\bRN#?\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bMade In\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bHecho En\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Exclusive of Decoration", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Body & Pocket", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Inner Layer", Pattern.CASE_INSENSITIVE)
    );

    static final List<Pattern> RFID_PATTERNS = List.of(
            Pattern.compile("WALMART\\.COM/AVIA", Pattern.CASE_INSENSITIVE),
            Pattern.compile("Find more at Walmart\\.com", Pattern.CASE_INSENSITIVE),
            Pattern.compile("REGISTERED TRADEMARK", Pattern.CASE_INSENSITIVE),
            Pattern.compile("AVIA STRETCH", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bBLACK\\s+SOOT\\b", Pattern.CASE_INSENSITIVE),
            Pattern.compile("\\bSALSA\\s+DELIGHT\\b", Pattern.CASE_INSENSITIVE)
    );

    public ClassificationResult classify(String text) {
        String normalized = NormalizeUtil.normalize(text);
        if (normalized.isEmpty()) {
            log.info("[Classifier] Empty text, type=unknown");
            return ClassificationResult.unknown();
        }

        List<String> careEvidence = matching(CARE_LABEL_PATTERNS, normalized);
        List<String> rfidEvidence = matching(RFID_PATTERNS, normalized);

        int careScore = careEvidence.size();
        int rfidScore = rfidEvidence.size();

        DocumentType type;
        if (careScore == 0 && rfidScore == 0) {
            type = DocumentType.UNKNOWN;
        } else {
            type = careScore >= rfidScore ? DocumentType.CARE_LABEL : DocumentType.RFID;
        }

        Map<String, List<String>> evidence = new LinkedHashMap<>();
        evidence.put(DocumentType.CARE_LABEL.getJsonName(), List.copyOf(careEvidence));
        evidence.put(DocumentType.RFID.getJsonName(), List.copyOf(rfidEvidence));

        log.info("[Classifier] type={} careScore={} rfidScore={}", type.getJsonName(), careScore, rfidScore);
        return new ClassificationResult(type, careScore, rfidScore, evidence);
    }

    private static List<String> matching(List<Pattern> patterns, String normalized) {
        List<String> matched = new ArrayList<>();
        for (Pattern pattern : patterns) {
            if (pattern.matcher(normalized).find()) {
                matched.add(pattern.pattern());
            }
        }
        return matched;
    }
}
