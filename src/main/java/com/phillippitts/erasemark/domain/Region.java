package com.phillippitts.erasemark.domain;

/**
 * Candidate watermark region reported by a detector.
 *
 * @param x left edge in source pixels
 * @param y top edge in source pixels
 * @param width width in pixels
 * @param height height in pixels
 * @param confidence detector confidence in [0, 1]
 * @param text recognised text, or null when the detector does not recognise text
 */
public record Region(
        int x,
        int y,
        int width,
        int height,
        double confidence,
        String text
) {
    public Region {
        if (width < 0 || height < 0) {
            throw new IllegalArgumentException("width and height must not be negative");
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
    }

    public Region(int x, int y, int width, int height, double confidence) {
        this(x, y, width, height, confidence, null);
    }

    public long area() {
        return (long) width * height;
    }

    public boolean hasText() {
        return text != null && !text.isBlank();
    }
}
