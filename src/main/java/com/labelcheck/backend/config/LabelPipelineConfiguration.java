package com.labelcheck.backend.config;

import java.nio.file.Path;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.labelcheck.backend.services.barcode.BarcodeDecoder;
import com.labelcheck.backend.services.barcode.ZxingBarcodeDecoder;
import com.labelcheck.backend.services.labels.classification.DocumentClassifier;
import com.labelcheck.backend.services.labels.extraction.LabelExtractorFactory;
import com.labelcheck.backend.services.labels.layout.LayoutSegmenter;
import com.labelcheck.backend.services.labels.layout.ParentInfoExtractor;
import com.labelcheck.backend.services.labels.layout.TextLayerReader;
import com.labelcheck.backend.services.labels.pipeline.LabelExtractionPipeline;
import com.labelcheck.backend.services.labels.reconciliation.ReconciliationService;
import com.labelcheck.backend.services.labels.spreadsheet.ExpectedRowReader;
import com.labelcheck.backend.services.ocr.DisabledOcrService;
import com.labelcheck.backend.services.ocr.OcrProperties;
import com.labelcheck.backend.services.ocr.OcrService;
import com.labelcheck.backend.services.pdf.PdfBoxLabelDocument;

import lombok.extern.slf4j.Slf4j;

/**
 * Wires the label pipeline. The components themselves are plain classes; only this class knows Spring.
 */
@Configuration
@Slf4j
public class LabelPipelineConfiguration {

    @Bean
    public ExtractionCapabilities extractionCapabilities(
            OcrProperties ocrProperties,
            OcrService ocrService,
            @Value("${labelcheck.barcode.enabled:true}") boolean barcodeEnabled
    ) {
        boolean ocrEnabled = ocrProperties.isEnabled() && !(ocrService instanceof DisabledOcrService);
        ExtractionCapabilities capabilities = new ExtractionCapabilities(ocrEnabled, barcodeEnabled);
        log.info("[LabelExtraction] Capabilities ocr={} barcode={}", capabilities.ocrEnabled(), capabilities.barcodeEnabled());
        return capabilities;
    }

    @Bean
    public TextLayerReader textLayerReader(OcrService ocrService, ExtractionCapabilities capabilities, OcrProperties ocrProperties) {
        return new TextLayerReader(ocrService, capabilities, ocrProperties.getMinTextLength());
    }

    @Bean
    public BarcodeDecoder barcodeDecoder() {
        return new ZxingBarcodeDecoder();
    }

    @Bean
    public DocumentClassifier documentClassifier() {
        return new DocumentClassifier();
    }

    @Bean
    public LabelExtractorFactory labelExtractorFactory(CatalogProperties catalogProperties) {
        return new LabelExtractorFactory(catalogProperties);
    }

    @Bean
    public LayoutSegmenter layoutSegmenter(TextLayerReader textLayerReader, BarcodeDecoder barcodeDecoder, LayoutProperties layoutProperties) {
        String outputDir = layoutProperties.getImageOutputDir();
        Path imageOutputDir = (outputDir == null || outputDir.isBlank()) ? null : Path.of(outputDir.trim());
        if (imageOutputDir != null) {
            log.info("[Segmenter] Writing label crops to {}", imageOutputDir.toAbsolutePath());
        }
        return new LayoutSegmenter(textLayerReader, barcodeDecoder, imageOutputDir);
    }

    @Bean
    public ParentInfoExtractor parentInfoExtractor(TextLayerReader textLayerReader, CatalogProperties catalogProperties, OcrProperties ocrProperties) {
        return new ParentInfoExtractor(textLayerReader, catalogProperties, ocrProperties.getParentZoom());
    }

    @Bean
    public LabelExtractionPipeline labelExtractionPipeline(
            DocumentClassifier documentClassifier,
            LabelExtractorFactory labelExtractorFactory,
            LayoutSegmenter layoutSegmenter,
            ParentInfoExtractor parentInfoExtractor,
            TextLayerReader textLayerReader,
            LayoutProperties layoutProperties,
            OcrProperties ocrProperties
    ) {
        return new LabelExtractionPipeline(
                PdfBoxLabelDocument::load,
                documentClassifier,
                labelExtractorFactory,
                layoutSegmenter,
                parentInfoExtractor,
                textLayerReader,
                layoutProperties,
                ocrProperties.getParentZoom());
    }

    @Bean
    public ReconciliationService reconciliationService() {
        return new ReconciliationService();
    }

    @Bean
    public ExpectedRowReader expectedRowReader() {
        return new ExpectedRowReader();
    }
}
