package com.labelcheck.backend.services.pdf;

/**
 * Rectangle in page coordinates (points, origin top-left, y growing downward).
 */
public record CropRegion(float x0, float y0, float x1, float y1) {

    public float width() {
        return x1 - x0;
    }

    public float height() {
        return y1 - y0;
    }

    public boolean isDegenerate() {
        return x1 <= x0 || y1 <= y0;
    }
}
