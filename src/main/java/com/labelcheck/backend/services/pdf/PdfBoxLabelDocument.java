package com.labelcheck.backend.services.pdf;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.PDFRenderer;

import lombok.extern.slf4j.Slf4j;

@Slf4j
public class PdfBoxLabelDocument implements LabelDocument {

    private final PDDocument document;
    private final List<PdfBoxLabelPage> pages;

    private PdfBoxLabelDocument(PDDocument document) {
        this.document = document;
        PDFRenderer renderer = new PDFRenderer(document);
        List<PdfBoxLabelPage> list = new ArrayList<>();
        for (int i = 0; i < document.getNumberOfPages(); i++) {
            list.add(new PdfBoxLabelPage(document, renderer, i));
        }
        this.pages = Collections.unmodifiableList(list);
    }

    public static PdfBoxLabelDocument load(byte[] pdfBytes) throws IOException {
        PDDocument document = PDDocument.load(pdfBytes);
        try {
            document.setAllSecurityToBeRemoved(true);
        } catch (Exception e) {
            log.debug("[PDF] Could not drop security handler: {}", e.toString());
        }
        log.info("[PDF] Loaded bytes={} pages={}", pdfBytes.length, document.getNumberOfPages());
        return new PdfBoxLabelDocument(document);
    }

    @Override
    public List<PdfBoxLabelPage> pages() {
        return pages;
    }

    @Override
    public void close() throws IOException {
        document.close();
    }
}
