package com.labelcheck.backend.services.pdf;

import java.awt.image.BufferedImage;
import java.io.IOException;

/**
 * One page of a print sheet as seen by the label pipeline: its size, its embedded text layer
 * and a rasterized view, both optionally clipped to a region.
 */
public interface LabelPage {

    /**
     * 1-based.
     */
    int pageNumber();

    float width();

    float height();

    /**
     * Embedded text for the clip, or the whole page when {@code clip} is null.
     */
    String text(CropRegion clip) throws IOException;

    BufferedImage render(CropRegion clip, float zoom) throws IOException;
}
