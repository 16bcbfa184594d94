package com.labelcheck.backend.services.barcode;

import java.awt.image.BufferedImage;
import java.util.List;

public interface BarcodeDecoder {

    /**
     * Decoded payloads found in the image, in reading order. Empty when none could be decoded.
     */
    List<String> decode(BufferedImage image);
}
