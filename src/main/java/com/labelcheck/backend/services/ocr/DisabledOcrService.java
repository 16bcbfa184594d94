package com.labelcheck.backend.services.ocr;

import java.awt.image.BufferedImage;

public class DisabledOcrService implements OcrService {

    @Override
    public String extractText(BufferedImage image) {
        throw new OcrException("OCR is disabled. Enable it with labelcheck.ocr.enabled=true", null);
    }
}
