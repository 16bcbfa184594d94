package com.labelcheck.backend.config;

/**
 * What the hosting environment can do, decided once from configuration and handed to the
 * components that would otherwise call OCR or barcode decoding.
 */
public record ExtractionCapabilities(boolean ocrEnabled, boolean barcodeEnabled) {

    public static ExtractionCapabilities textOnly() {
        return new ExtractionCapabilities(false, false);
    }
}
