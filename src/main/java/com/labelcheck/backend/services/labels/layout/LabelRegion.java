package com.labelcheck.backend.services.labels.layout;

import java.awt.image.BufferedImage;

import com.labelcheck.backend.services.pdf.CropRegion;

/**
 * One retained grid cell: where it is, the text read from it and, when it was rasterized, its image.
 */
public record LabelRegion(
        int page,
        int position,
        CropRegion region,
        String text,
        BufferedImage image,
        boolean usedOcr
) {
}
