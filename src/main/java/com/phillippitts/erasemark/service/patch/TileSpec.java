package com.phillippitts.erasemark.service.patch;

import org.opencv.core.Rect;

/**
 * Axis-aligned rectangle in source-image pixels.
 *
 * @param x left edge
 * @param y top edge
 * @param width width, at most the model input size
 * @param height height, at most the model input size
 */
public record TileSpec(int x, int y, int width, int height) {
    public TileSpec {
        if (x < 0 || y < 0) {
            throw new IllegalArgumentException("Tile origin must not be negative: (" + x + ", " + y + ")");
        }
        if (width <= 0 || height <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + width + "x" + height);
        }
    }

    public Rect toRect() {
        return new Rect(x, y, width, height);
    }

    public int right() {
        return x + width;
    }

    public int bottom() {
        return y + height;
    }
}
