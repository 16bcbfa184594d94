package com.labelcheck.backend.services.labels.extraction;

/**
 * One independent extraction rule. A rule that does not match leaves the builder untouched.
 */
@FunctionalInterface
public interface FieldRule {

    void apply(LabelText text, ExtractedFields.Builder fields);
}
