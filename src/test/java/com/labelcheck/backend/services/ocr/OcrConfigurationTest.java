package com.labelcheck.backend.services.ocr;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.image.BufferedImage;
import java.nio.file.Path;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class OcrConfigurationTest {

    private final OcrConfiguration configuration = new OcrConfiguration();

    @Test
    void disabledByDefault() {
        OcrService service = configuration.ocrService(new OcrProperties());

        assertInstanceOf(DisabledOcrService.class, service);
        assertThrows(OcrException.class, () -> service.extractText(new BufferedImage(1, 1, BufferedImage.TYPE_INT_RGB)));
    }

    @Test
    void missingTessdata_fallsBackToDisabled() {
        OcrProperties props = new OcrProperties();
        props.setEnabled(true);
        props.setTessdataPath("/nonexistent/tessdata-" + System.nanoTime());

        assertInstanceOf(DisabledOcrService.class, configuration.ocrService(props));
    }

    @Test
    void existingTessdata_usesTesseract(@TempDir Path tessdata) {
        OcrProperties props = new OcrProperties();
        props.setEnabled(true);
        props.setTessdataPath(tessdata.toString());

        OcrService service = configuration.ocrService(props);

        assertInstanceOf(TesseractOcrService.class, service);
        assertEquals("", service.extractText(null));
    }

    @Test
    void autoContrast_stretchesGrayLevels() {
        BufferedImage image = new BufferedImage(2, 1, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        g.setColor(new Color(100, 100, 100));
        g.fillRect(0, 0, 1, 1);
        g.setColor(new Color(150, 150, 150));
        g.fillRect(1, 0, 1, 1);
        g.dispose();

        BufferedImage gray = TesseractOcrService.toAutoContrastGray(image);

        // darkest pixel goes to black, lightest to white (allowing for rounding)
        assertTrue(gray.getRaster().getSample(0, 0, 0) <= 1);
        assertTrue(gray.getRaster().getSample(1, 0, 0) >= 254);
    }
}
