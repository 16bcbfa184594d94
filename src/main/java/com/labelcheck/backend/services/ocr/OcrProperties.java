package com.labelcheck.backend.services.ocr;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "labelcheck.ocr")
public class OcrProperties {

    /**
     * Enables OCR fallback for label regions with little or no embedded text.
     */
    private boolean enabled = false;

    /**
     * Tesseract language(s), e.g. "eng" or "eng+spa".
     */
    private String language = "eng";

    /**
     * Optional path that contains the "tessdata" directory.
     * If empty, Tess4J/Tesseract will rely on OS installation and environment.
     */
    private String tessdataPath = "";

    /**
     * Tesseract page segmentation mode. 6 = single uniform block of text, which fits one label column.
     */
    private int pageSegmentationMode = 6;

    /**
     * Regions whose embedded text has fewer non-whitespace characters than this are OCR'd.
     */
    private int minTextLength = 20;

    /**
     * Zoom used when a whole page is rasterized (classification and parent info).
     */
    private float parentZoom = 2.0f;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getLanguage() {
        return language;
    }

    public void setLanguage(String language) {
        this.language = language;
    }

    public String getTessdataPath() {
        return tessdataPath;
    }

    public void setTessdataPath(String tessdataPath) {
        this.tessdataPath = tessdataPath;
    }

    public int getPageSegmentationMode() {
        return pageSegmentationMode;
    }

    public void setPageSegmentationMode(int pageSegmentationMode) {
        this.pageSegmentationMode = pageSegmentationMode;
    }

    public int getMinTextLength() {
        return minTextLength;
    }

    public void setMinTextLength(int minTextLength) {
        this.minTextLength = minTextLength;
    }

    public float getParentZoom() {
        return parentZoom;
    }

    public void setParentZoom(float parentZoom) {
        this.parentZoom = parentZoom;
    }
}
