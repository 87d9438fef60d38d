package com.phillippitts.erasemark.domain;

import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.MatOfPoint;
import org.opencv.core.Rect;
import org.opencv.imgproc.Imgproc;

import java.util.Objects;
import java.util.Optional;

/**
 * Single-channel 8-bit raster aligned with the source image; values above 127 mark
 * pixels to repaint.
 *
 * <p>Immutable: the backing rasters are private copies and every accessor that hands out
 * pixel data returns a fresh {@link Mat}. A new mask is built when inputs change.
 */
public final class Mask {

    /** Pixel values strictly above this are "to be repainted". */
    public static final int THRESHOLD = 127;

    private final Mat gray;
    private final Mat binary;
    private final int maskedPixels;

    private Mask(Mat gray) {
        this.gray = gray;
        this.binary = new Mat();
        Imgproc.threshold(gray, binary, THRESHOLD, 255, Imgproc.THRESH_BINARY);
        this.maskedPixels = Core.countNonZero(binary);
    }

    /**
     * All-zero mask: the no-op signal.
     */
    public static Mask empty(int width, int height) {
        return new Mask(Mat.zeros(height, width, CvType.CV_8UC1));
    }

    /**
     * Copies a single-channel 8-bit raster into a new mask.
     *
     * @throws IllegalArgumentException if the raster is empty or not {@code CV_8UC1}
     */
    public static Mask of(Mat raster) {
        Objects.requireNonNull(raster, "raster");
        if (raster.empty() || raster.type() != CvType.CV_8UC1) {
            throw new IllegalArgumentException("mask raster must be non-empty CV_8UC1, got type="
                    + CvType.typeToString(raster.type()));
        }
        return new Mask(raster.clone());
    }

    public int width() {
        return gray.cols();
    }

    public int height() {
        return gray.rows();
    }

    public boolean isEmpty() {
        return maskedPixels == 0;
    }

    /** Number of pixels above {@link #THRESHOLD}. */
    public int maskedPixelCount() {
        return maskedPixels;
    }

    /** Number of masked pixels inside {@code area}; the area is clipped to the mask bounds. */
    public int maskedPixelCount(Rect area) {
        Rect clipped = clip(area);
        if (clipped.width <= 0 || clipped.height <= 0) {
            return 0;
        }
        return Core.countNonZero(binary.submat(clipped));
    }

    public boolean isMasked(int x, int y) {
        if (x < 0 || y < 0 || x >= width() || y >= height()) {
            return false;
        }
        return binary.get(y, x)[0] > 0;
    }

    /**
     * Tight bounding box of all masked pixels, empty when nothing is masked.
     */
    public Optional<Rect> boundingBox() {
        if (isEmpty()) {
            return Optional.empty();
        }
        MatOfPoint points = new MatOfPoint();
        try {
            Core.findNonZero(binary, points);
            return Optional.of(Imgproc.boundingRect(points));
        } finally {
            points.release();
        }
    }

    /** Copy of the raw (possibly soft-edged) raster. */
    public Mat toMat() {
        return gray.clone();
    }

    /** Copy of the binarised raster (0 or 255). */
    public Mat toBinaryMat() {
        return binary.clone();
    }

    /** Copy of the raw raster inside {@code area}. */
    public Mat crop(Rect area) {
        return gray.submat(clip(area)).clone();
    }

    /** True when every pixel of {@code other} equals this mask. */
    public boolean sameAs(Mask other) {
        if (other == null || other.width() != width() || other.height() != height()) {
            return false;
        }
        Mat diff = new Mat();
        try {
            Core.absdiff(gray, other.gray, diff);
            return Core.countNonZero(diff) == 0;
        } finally {
            diff.release();
        }
    }

    private Rect clip(Rect area) {
        int x0 = Math.max(0, area.x);
        int y0 = Math.max(0, area.y);
        int x1 = Math.min(width(), area.x + area.width);
        int y1 = Math.min(height(), area.y + area.height);
        return new Rect(x0, y0, Math.max(0, x1 - x0), Math.max(0, y1 - y0));
    }

    @Override
    public String toString() {
        return "Mask[" + width() + "x" + height() + ", masked=" + maskedPixels + "]";
    }
}
