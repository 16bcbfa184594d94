package com.labelcheck.backend.services.labels.extraction;

import com.labelcheck.backend.services.labels.upc.UpcValidator;

/**
 * Checksum-valid code goes to {@code upc}; a number-shaped code that fails the checksum
 * is kept as {@code upc_candidate} for review.
 */
public class UpcRule implements FieldRule {

    @Override
    public void apply(LabelText text, ExtractedFields.Builder fields) {
        String candidate = UpcValidator.extractUpcCandidate(text.normalized());
        if (candidate.isEmpty()) return;

        if (UpcValidator.isValidUpcEan(candidate)) {
            fields.upc(candidate);
        } else {
            fields.upcCandidate(candidate);
        }
    }
}
