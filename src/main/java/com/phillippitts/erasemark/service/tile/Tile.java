package com.phillippitts.erasemark.service.tile;

import com.phillippitts.erasemark.service.patch.TileSpec;
import org.opencv.core.Mat;

import java.util.Objects;

/**
 * Image and mask crops for one planned tile. Owned by a single processor invocation.
 *
 * @param spec where the crops came from in the source image
 * @param image BGR crop of the source image
 * @param mask single-channel crop of the repaint mask
 */
public record Tile(TileSpec spec, Mat image, Mat mask) {
    public Tile {
        Objects.requireNonNull(spec, "spec");
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(mask, "mask");
        if (image.cols() != spec.width() || image.rows() != spec.height()
                || mask.cols() != spec.width() || mask.rows() != spec.height()) {
            throw new IllegalArgumentException("Crops do not match tile " + spec);
        }
    }

    public void release() {
        image.release();
        mask.release();
    }
}
