package com.labelcheck.backend.services.ocr;

import java.nio.file.Files;
import java.nio.file.Path;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import lombok.extern.slf4j.Slf4j;

/**
 * Chooses the OCR backend once at startup. A configured but missing tessdata directory
 * turns OCR off instead of failing every label region later.
 */
@Configuration
@EnableConfigurationProperties(OcrProperties.class)
@Slf4j
public class OcrConfiguration {

    @Bean
    public OcrService ocrService(OcrProperties ocrProperties) {
        if (!ocrProperties.isEnabled()) {
            log.info("[OCR] Disabled (labelcheck.ocr.enabled=false)");
            return new DisabledOcrService();
        }

        String tessdataPath = safe(ocrProperties.getTessdataPath()).trim();
        if (!tessdataPath.isEmpty() && !Files.isDirectory(Path.of(tessdataPath))) {
            log.warn("[OCR] tessdataPath '{}' does not exist, falling back to embedded text only", tessdataPath);
            return new DisabledOcrService();
        }

        log.info("[OCR] Enabled: language='{}' tessdataPath='{}' psm={} minTextLength={}",
                safe(ocrProperties.getLanguage()),
                tessdataPath,
                ocrProperties.getPageSegmentationMode(),
                ocrProperties.getMinTextLength());
        return new TesseractOcrService(ocrProperties);
    }

    private static String safe(String value) {
        return value == null ? "" : value;
    }
}
