package com.labelcheck.backend.services.ocr;

import java.awt.image.BufferedImage;

public interface OcrService {

    /**
     * Extracts text from an image using OCR. May return an empty string.
     */
    String extractText(BufferedImage image);
}
