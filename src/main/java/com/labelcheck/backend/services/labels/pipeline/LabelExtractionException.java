package com.labelcheck.backend.services.labels.pipeline;

/**
 * Thrown when an uploaded document cannot be opened as a PDF.
 */
public class LabelExtractionException extends IllegalArgumentException {

    public LabelExtractionException(String message) {
        super(message);
    }

    public LabelExtractionException(String message, Throwable cause) {
        super(message, cause);
    }
}
