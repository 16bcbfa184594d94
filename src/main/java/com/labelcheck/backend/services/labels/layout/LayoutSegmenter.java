package com.labelcheck.backend.services.labels.layout;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import javax.imageio.ImageIO;

import com.labelcheck.backend.config.ExtractionCapabilities;
import com.labelcheck.backend.enums.FieldKey;
import com.labelcheck.backend.services.barcode.BarcodeDecoder;
import com.labelcheck.backend.services.labels.extraction.ExtractedFields;
import com.labelcheck.backend.services.labels.extraction.LabelExtractionStrategy;
import com.labelcheck.backend.services.pdf.CropRegion;
import com.labelcheck.backend.services.pdf.LabelDocument;
import com.labelcheck.backend.services.pdf.LabelPage;

import lombok.extern.slf4j.Slf4j;

/**
 * Cuts each page of a print sheet into its configured label columns and turns every
 * retained column into a {@link LabelItem}.
 */
@Slf4j
public class LayoutSegmenter {

    private final TextLayerReader textReader;
    private final BarcodeDecoder barcodeDecoder;
    private final Path imageOutputDir;

    public LayoutSegmenter(TextLayerReader textReader, BarcodeDecoder barcodeDecoder) {
        this(textReader, barcodeDecoder, null);
    }

    public LayoutSegmenter(TextLayerReader textReader, BarcodeDecoder barcodeDecoder, Path imageOutputDir) {
        this.textReader = textReader;
        this.barcodeDecoder = barcodeDecoder;
        this.imageOutputDir = imageOutputDir;
    }

    public List<LabelRegion> segment(LabelPage page, GridLayout grid) {
        float pageWidth = page.width();
        float pageHeight = page.height();
        float columnWidth = grid.effectiveColumnWidth(pageWidth);
        float top = pageHeight * grid.getTopRatio();
        float bottom = pageHeight * grid.getBottomRatio();

        List<LabelRegion> regions = new ArrayList<>();
        for (int i = grid.startIndex(); i < grid.getColumns(); i++) {
            float x0 = clamp(grid.getLeftOffset() + i * columnWidth, pageWidth);
            float x1 = clamp(grid.getLeftOffset() + (i + 1) * columnWidth, pageWidth);
            CropRegion region = new CropRegion(x0, top, x1, bottom);
            if (region.isDegenerate()) {
                log.debug("[Segmenter] Skipping empty region page={} position={} region={}", page.pageNumber(), i, region);
                continue;
            }
            regions.add(readRegion(page, i, region, grid.getZoom()));
        }
        return regions;
    }

    public List<LabelItem> extractItems(LabelDocument document, GridLayout grid, LabelExtractionStrategy strategy) {
        // Crops of one extraction get their own directory so documents never overwrite each other.
        Path cropDir = imageOutputDir == null ? null : imageOutputDir.resolve(UUID.randomUUID().toString());

        List<LabelItem> items = new ArrayList<>();
        int ocrRegions = 0;
        for (LabelPage page : document.pages()) {
            for (LabelRegion region : segment(page, grid)) {
                if (region.usedOcr()) {
                    ocrRegions++;
                }
                items.add(toItem(region, strategy, cropDir));
            }
        }
        log.info("[Segmenter] type={} pages={} items={} ocrRegions={}",
                strategy.documentType(), document.pages().size(), items.size(), ocrRegions);
        return items;
    }

    private LabelRegion readRegion(LabelPage page, int position, CropRegion region, float zoom) {
        ExtractionCapabilities capabilities = textReader.capabilities();
        String text = textReader.embeddedText(page, region);
        boolean useOcr = textReader.needsOcr(text);

        BufferedImage image = null;
        if (useOcr || capabilities.barcodeEnabled() || imageOutputDir != null) {
            image = textReader.render(page, region, zoom);
        }
        if (useOcr) {
            text = TextLayerReader.join(text, textReader.ocr(image, page.pageNumber()));
        }
        log.debug("[Segmenter] page={} position={} chars={} ocr={}", page.pageNumber(), position, text.length(), useOcr);
        return new LabelRegion(page.pageNumber(), position, region, text, image, useOcr);
    }

    private LabelItem toItem(LabelRegion region, LabelExtractionStrategy strategy, Path cropDir) {
        ExtractedFields fields = strategy.extractFields(region.text());

        String barcode = decodeFirst(region);
        if (!barcode.isEmpty()) {
            fields = fields.toBuilder().put(FieldKey.BARCODE, barcode).build();
        }

        return LabelItem.builder()
                .fields(fields)
                .page(region.page())
                .position(region.position())
                .imageRef(imageRef(region, cropDir))
                .build();
    }

    private String decodeFirst(LabelRegion region) {
        if (!textReader.capabilities().barcodeEnabled() || barcodeDecoder == null || region.image() == null) {
            return "";
        }
        try {
            for (String payload : barcodeDecoder.decode(region.image())) {
                if (payload != null && !payload.isBlank()) {
                    return payload.trim();
                }
            }
        } catch (RuntimeException e) {
            log.warn("[Segmenter] Barcode decoding failed page={} position={}: {}",
                    region.page(), region.position(), e.toString());
        }
        return "";
    }

    private String imageRef(LabelRegion region, Path cropDir) {
        String fileName = "page" + region.page() + "_label" + region.position() + ".png";
        if (cropDir == null) {
            return fileName;
        }
        if (region.image() == null) {
            return null;
        }
        Path target = cropDir.resolve(fileName);
        try {
            Files.createDirectories(cropDir);
            ImageIO.write(region.image(), "png", target.toFile());
            return target.toString();
        } catch (IOException e) {
            log.warn("[Segmenter] Could not write crop {}: {}", target, e.toString());
            return null;
        }
    }

    private static float clamp(float value, float max) {
        return Math.max(0f, Math.min(max, value));
    }
}
