package com.labelcheck.backend.services.ocr;

import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.awt.image.RescaleOp;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;

public class TesseractOcrService implements OcrService {

    private final OcrProperties ocrProperties;

    /**
     * Tess4J's {@link Tesseract} is not thread-safe. Keep one instance per thread.
     */
    private final ThreadLocal<Tesseract> threadLocalTesseract;

    public TesseractOcrService(OcrProperties ocrProperties) {
        this.ocrProperties = ocrProperties;
        this.threadLocalTesseract = ThreadLocal.withInitial(this::createTesseract);
    }

    @Override
    public String extractText(BufferedImage image) {
        if (image == null) return "";

        try {
            String text = threadLocalTesseract.get().doOCR(toAutoContrastGray(image));
            return text == null ? "" : text;
        } catch (TesseractException e) {
            throw new OcrException("Tesseract OCR failed", e);
        }
    }

    private Tesseract createTesseract() {
        Tesseract tesseract = new Tesseract();

        String datapath = ocrProperties.getTessdataPath();
        if (datapath != null && !datapath.isBlank()) {
            tesseract.setDatapath(datapath);
        }

        String language = ocrProperties.getLanguage();
        if (language != null && !language.isBlank()) {
            tesseract.setLanguage(language);
        }

        tesseract.setPageSegMode(ocrProperties.getPageSegmentationMode());
        return tesseract;
    }

    /**
     * Grayscale, then stretch the darkest/lightest levels to 0..255.
     */
    static BufferedImage toAutoContrastGray(BufferedImage image) {
        BufferedImage gray = new BufferedImage(image.getWidth(), image.getHeight(), BufferedImage.TYPE_BYTE_GRAY);
        Graphics2D g = gray.createGraphics();
        try {
            g.drawImage(image, 0, 0, null);
        } finally {
            g.dispose();
        }

        int min = 255;
        int max = 0;
        for (int y = 0; y < gray.getHeight(); y++) {
            for (int x = 0; x < gray.getWidth(); x++) {
                int level = gray.getRaster().getSample(x, y, 0);
                if (level < min) min = level;
                if (level > max) max = level;
            }
        }
        if (max <= min) {
            return gray;
        }

        float scale = 255f / (max - min);
        return new RescaleOp(scale, -min * scale, null).filter(gray, null);
    }
}
