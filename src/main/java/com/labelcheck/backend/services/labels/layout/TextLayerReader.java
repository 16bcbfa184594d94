package com.labelcheck.backend.services.labels.layout;

import java.awt.image.BufferedImage;
import java.io.IOException;

import com.labelcheck.backend.config.ExtractionCapabilities;
import com.labelcheck.backend.services.labels.util.NormalizeUtil;
import com.labelcheck.backend.services.ocr.OcrException;
import com.labelcheck.backend.services.ocr.OcrService;
import com.labelcheck.backend.services.pdf.CropRegion;
import com.labelcheck.backend.services.pdf.LabelPage;

import lombok.extern.slf4j.Slf4j;

/**
 * Reads the embedded text layer of a page or region and falls back to OCR when it is too short.
 * Rendering and OCR failures degrade to empty output.
 */
@Slf4j
public class TextLayerReader {

    public static final int DEFAULT_MIN_TEXT_LENGTH = 20;

    private final OcrService ocrService;
    private final ExtractionCapabilities capabilities;
    private final int minTextLength;

    public TextLayerReader(OcrService ocrService, ExtractionCapabilities capabilities, int minTextLength) {
        this.ocrService = ocrService;
        this.capabilities = capabilities == null ? ExtractionCapabilities.textOnly() : capabilities;
        this.minTextLength = minTextLength > 0 ? minTextLength : DEFAULT_MIN_TEXT_LENGTH;
    }

    public ExtractionCapabilities capabilities() {
        return capabilities;
    }

    /**
     * Text layer com fallback para OCR. {@code clip} nulo = página inteira.
     */
    public String read(LabelPage page, CropRegion clip, float zoom) {
        String text = embeddedText(page, clip);
        if (!needsOcr(text)) {
            return text;
        }
        BufferedImage image = render(page, clip, zoom);
        return join(text, ocr(image, page.pageNumber()));
    }

    public boolean needsOcr(String embeddedText) {
        return capabilities.ocrEnabled() && NormalizeUtil.countNonWhitespace(embeddedText) < minTextLength;
    }

    public String embeddedText(LabelPage page, CropRegion clip) {
        try {
            String text = page.text(clip);
            return text == null ? "" : text;
        } catch (IOException | RuntimeException e) {
            log.warn("[Segmenter] Text layer unavailable page={} clip={}: {}", page.pageNumber(), clip, e.toString());
            return "";
        }
    }

    public BufferedImage render(LabelPage page, CropRegion clip, float zoom) {
        try {
            return page.render(clip, zoom);
        } catch (IOException | RuntimeException e) {
            log.warn("[Segmenter] Render failed page={} clip={}: {}", page.pageNumber(), clip, e.toString());
            return null;
        }
    }

    public String ocr(BufferedImage image, int pageNumber) {
        if (image == null || !capabilities.ocrEnabled() || ocrService == null) {
            return "";
        }
        try {
            String text = ocrService.extractText(image);
            return text == null ? "" : text;
        } catch (OcrException e) {
            log.warn("[OCR] Failed on page {}: {}", pageNumber, e.getMessage());
            return "";
        }
    }

    /**
     * Joins the non-blank parts with a line break.
     */
    public static String join(String embedded, String ocrText) {
        boolean hasEmbedded = embedded != null && !embedded.isBlank();
        boolean hasOcr = ocrText != null && !ocrText.isBlank();
        if (hasEmbedded && hasOcr) return embedded + "\n" + ocrText;
        if (hasEmbedded) return embedded;
        if (hasOcr) return ocrText;
        return "";
    }
}
