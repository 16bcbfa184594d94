package com.labelcheck.backend.services.labels.pipeline;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

import com.labelcheck.backend.config.LayoutProperties;
import com.labelcheck.backend.enums.DocumentType;
import com.labelcheck.backend.services.labels.classification.ClassificationResult;
import com.labelcheck.backend.services.labels.classification.DocumentClassifier;
import com.labelcheck.backend.services.labels.extraction.LabelExtractionStrategy;
import com.labelcheck.backend.services.labels.extraction.LabelExtractorFactory;
import com.labelcheck.backend.services.labels.layout.LabelItem;
import com.labelcheck.backend.services.labels.layout.LayoutSegmenter;
import com.labelcheck.backend.services.labels.layout.ParentInfo;
import com.labelcheck.backend.services.labels.layout.ParentInfoExtractor;
import com.labelcheck.backend.services.labels.layout.TextLayerReader;
import com.labelcheck.backend.services.pdf.LabelDocument;
import com.labelcheck.backend.services.pdf.LabelDocumentLoader;
import com.labelcheck.backend.services.pdf.LabelPage;

import lombok.extern.slf4j.Slf4j;

/**
 * Classifies a print-sheet PDF by its first page and extracts it through the matching
 * rule table and grid.
 */
@Slf4j
public class LabelExtractionPipeline {

    private final LabelDocumentLoader documentLoader;
    private final DocumentClassifier classifier;
    private final LabelExtractorFactory extractorFactory;
    private final LayoutSegmenter segmenter;
    private final ParentInfoExtractor parentInfoExtractor;
    private final TextLayerReader textReader;
    private final LayoutProperties layout;
    private final float pageZoom;

    public LabelExtractionPipeline(
            LabelDocumentLoader documentLoader,
            DocumentClassifier classifier,
            LabelExtractorFactory extractorFactory,
            LayoutSegmenter segmenter,
            ParentInfoExtractor parentInfoExtractor,
            TextLayerReader textReader,
            LayoutProperties layout,
            float pageZoom
    ) {
        this.documentLoader = documentLoader;
        this.classifier = classifier;
        this.extractorFactory = extractorFactory;
        this.segmenter = segmenter;
        this.parentInfoExtractor = parentInfoExtractor;
        this.textReader = textReader;
        this.layout = layout;
        this.pageZoom = pageZoom > 0 ? pageZoom : 2.0f;
    }

    public ClassificationResult classify(byte[] pdfBytes) {
        try (LabelDocument document = open(pdfBytes)) {
            List<? extends LabelPage> pages = document.pages();
            if (pages.isEmpty()) {
                return ClassificationResult.unknown();
            }
            return classifier.classify(textReader.read(pages.get(0), null, pageZoom));
        } catch (IOException e) {
            throw new LabelExtractionException("Não foi possível ler o PDF: " + e.getMessage(), e);
        }
    }

    public DocumentExtraction extract(byte[] pdfBytes) {
        try (LabelDocument document = open(pdfBytes)) {
            return extract(document);
        } catch (IOException e) {
            throw new LabelExtractionException("Não foi possível ler o PDF: " + e.getMessage(), e);
        }
    }

    public DocumentExtraction extract(LabelDocument document) {
        List<? extends LabelPage> pages = document.pages();
        if (pages.isEmpty()) {
            log.info("[LabelExtraction] Document has no pages");
            return DocumentExtraction.careLabels(ClassificationResult.unknown(), ParentInfo.empty(), List.of());
        }

        // Page 1 text drives both the classification and the header fields.
        String firstPageText = textReader.read(pages.get(0), null, pageZoom);
        ClassificationResult classification = classifier.classify(firstPageText);
        ParentInfo parentInfo = parentInfoExtractor.extractFromText(firstPageText);

        DocumentExtraction result = extractorFactory.getStrategy(classification.type())
                .map(strategy -> extractWith(document, strategy, classification, parentInfo))
                .orElseGet(() -> extractUnknown(document, classification, parentInfo));

        log.info("[LabelExtraction] type={} pages={} careLabels={} hangTags={}",
                classification.type().getJsonName(), pages.size(),
                result.careLabels().size(), result.hangTags().size());
        return result;
    }

    /**
     * Extracts every document, then pools the items by kind with parent fallbacks applied.
     */
    public BatchExtraction extractBatch(List<byte[]> documents) {
        List<LabelItem> careLabels = new ArrayList<>();
        List<LabelItem> hangTags = new ArrayList<>();
        for (byte[] pdfBytes : documents) {
            DocumentExtraction extraction = extract(pdfBytes);
            careLabels.addAll(extraction.resolvedCareLabels());
            hangTags.addAll(extraction.resolvedHangTags());
        }
        log.info("[LabelExtraction] Batch documents={} careLabels={} hangTags={}",
                documents.size(), careLabels.size(), hangTags.size());
        return new BatchExtraction(careLabels, hangTags);
    }

    private DocumentExtraction extractWith(
            LabelDocument document,
            LabelExtractionStrategy strategy,
            ClassificationResult classification,
            ParentInfo parentInfo
    ) {
        if (strategy.documentType() == DocumentType.RFID) {
            return DocumentExtraction.hangTags(classification, parentInfo,
                    segmenter.extractItems(document, layout.getHangTag(), strategy));
        }
        return DocumentExtraction.careLabels(classification, parentInfo,
                segmenter.extractItems(document, layout.getCareLabel(), strategy));
    }

    // Unclassified sheets are tried as care labels first; hang tags only when no care item carries any field.
    private DocumentExtraction extractUnknown(LabelDocument document, ClassificationResult classification, ParentInfo parentInfo) {
        List<LabelItem> careLabels = careLabels(document);
        if (careLabels.stream().anyMatch(LabelItem::hasAnyField)) {
            return DocumentExtraction.careLabels(classification, parentInfo, careLabels);
        }
        log.info("[LabelExtraction] Unknown document yielded no care-label fields, trying hang-tag layout");
        return DocumentExtraction.hangTags(classification, parentInfo, hangTags(document));
    }

    private List<LabelItem> careLabels(LabelDocument document) {
        return segmenter.extractItems(document, layout.getCareLabel(), extractorFactory.careLabel());
    }

    private List<LabelItem> hangTags(LabelDocument document) {
        return segmenter.extractItems(document, layout.getHangTag(), extractorFactory.hangTag());
    }

    private LabelDocument open(byte[] pdfBytes) throws IOException {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new LabelExtractionException("PDF vazio (0 bytes)");
        }
        return documentLoader.load(pdfBytes);
    }
}
