package com.labelcheck.backend.services.pdf;

import java.awt.geom.Rectangle2D;
import java.awt.image.BufferedImage;
import java.io.IOException;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.apache.pdfbox.text.PDFTextStripper;
import org.apache.pdfbox.text.PDFTextStripperByArea;

public class PdfBoxLabelPage implements LabelPage {

    private static final String REGION_NAME = "label";

    private final PDDocument document;
    private final PDFRenderer renderer;
    private final int pageIndex;
    private final PDRectangle box;

    // Crops of the same page reuse one full-page raster per zoom.
    private BufferedImage cachedImage;
    private float cachedZoom;

    PdfBoxLabelPage(PDDocument document, PDFRenderer renderer, int pageIndex) {
        this.document = document;
        this.renderer = renderer;
        this.pageIndex = pageIndex;
        PDPage page = document.getPage(pageIndex);
        this.box = page.getCropBox();
    }

    @Override
    public int pageNumber() {
        return pageIndex + 1;
    }

    @Override
    public float width() {
        return box.getWidth();
    }

    @Override
    public float height() {
        return box.getHeight();
    }

    @Override
    public String text(CropRegion clip) throws IOException {
        if (clip == null) {
            PDFTextStripper stripper = new PDFTextStripper();
            stripper.setLineSeparator("\n");
            stripper.setStartPage(pageNumber());
            stripper.setEndPage(pageNumber());
            return stripper.getText(document);
        }

        PDFTextStripperByArea stripper = new PDFTextStripperByArea();
        stripper.setSortByPosition(true);
        stripper.setLineSeparator("\n");
        stripper.addRegion(REGION_NAME, new Rectangle2D.Float(clip.x0(), clip.y0(), clip.width(), clip.height()));
        stripper.extractRegions(document.getPage(pageIndex));
        String text = stripper.getTextForRegion(REGION_NAME);
        return text == null ? "" : text;
    }

    @Override
    public BufferedImage render(CropRegion clip, float zoom) throws IOException {
        BufferedImage full = renderPage(zoom);
        if (clip == null) {
            return full;
        }

        int x = clamp(Math.round(clip.x0() * zoom), full.getWidth());
        int y = clamp(Math.round(clip.y0() * zoom), full.getHeight());
        int right = clamp(Math.round(clip.x1() * zoom), full.getWidth());
        int bottom = clamp(Math.round(clip.y1() * zoom), full.getHeight());
        if (right <= x || bottom <= y) {
            throw new IOException("Empty crop " + clip + " on page " + pageNumber());
        }
        return full.getSubimage(x, y, right - x, bottom - y);
    }

    private BufferedImage renderPage(float zoom) throws IOException {
        if (cachedImage == null || cachedZoom != zoom) {
            cachedImage = renderer.renderImage(pageIndex, zoom, ImageType.RGB);
            cachedZoom = zoom;
        }
        return cachedImage;
    }

    private static int clamp(int value, int max) {
        return Math.max(0, Math.min(max, value));
    }
}
