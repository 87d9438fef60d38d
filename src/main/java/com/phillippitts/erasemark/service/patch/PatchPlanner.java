package com.phillippitts.erasemark.service.patch;

import com.phillippitts.erasemark.config.inpaint.PatchProperties;
import com.phillippitts.erasemark.domain.Mask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Core;
import org.opencv.core.Mat;
import org.opencv.core.Rect;
import org.opencv.core.Scalar;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Lays out fixed-size model tiles over the masked area of an image.
 *
 * <p>The tight bounding box of masked pixels is padded with context and then, per axis:
 * <ul>
 *   <li>if it fits in the model input size {@code S}, it is grown to {@code S} around its
 *       centre and shifted to stay inside the image (or spans the whole axis when the image
 *       is shorter than {@code S});</li>
 *   <li>otherwise it is covered by {@code S}-long tiles starting at the region origin with a
 *       stride of {@code S - overlap}, the last one shifted back inside the image.</li>
 * </ul>
 *
 * <p>Tiles containing fewer than {@code minTileMaskPixels} masked pixels are dropped unless
 * they hold masked pixels that no kept tile covers, so every masked pixel stays covered.
 */
@Component
public class PatchPlanner {
    private static final Logger LOG = LogManager.getLogger(PatchPlanner.class);

    private final PatchProperties props;

    public PatchPlanner(PatchProperties props) {
        this.props = props;
    }

    /**
     * Plans tiles for {@code mask}.
     *
     * @param width image width
     * @param height image height
     * @param mask repaint mask with the image's dimensions
     * @param tileSize model input size {@code S}
     * @return tiles in row-major order, or an empty plan when nothing is masked
     */
    public PlanResult plan(int width, int height, Mask mask, int tileSize) {
        if (tileSize <= 0) {
            throw new IllegalArgumentException("Tile size must be positive: " + tileSize);
        }
        if (mask.width() != width || mask.height() != height) {
            throw new IllegalArgumentException("Mask " + mask.width() + "x" + mask.height()
                    + " does not match image " + width + "x" + height);
        }
        Optional<Rect> bbox = mask.boundingBox();
        if (bbox.isEmpty()) {
            return PlanResult.empty();
        }

        Rect box = bbox.get();
        int pad = props.contextPadding();
        int x0 = Math.max(0, box.x - pad);
        int y0 = Math.max(0, box.y - pad);
        int x1 = Math.min(width, box.x + box.width + pad);
        int y1 = Math.min(height, box.y + box.height + pad);

        Axis xs = layout(x0, x1, width, tileSize);
        Axis ys = layout(y0, y1, height, tileSize);

        List<TileSpec> candidates = new ArrayList<>();
        for (int ty : ys.starts()) {
            for (int tx : xs.starts()) {
                candidates.add(new TileSpec(tx, ty, xs.length(), ys.length()));
            }
        }

        int rx = xs.starts().get(0);
        int ry = ys.starts().get(0);
        TileSpec region = new TileSpec(rx, ry, xs.end() - rx, ys.end() - ry);
        boolean multiTile = xs.starts().size() > 1 || ys.starts().size() > 1;
        List<TileSpec> tiles = multiTile ? dropWeakTiles(candidates, mask) : candidates;

        LOG.debug("Planned {} tile(s) over region {} (bbox={}, multiTile={})", tiles.size(), region, box, multiTile);
        return new PlanResult(tiles, region, multiTile);
    }

    private Axis layout(int start, int end, int imageLength, int tileSize) {
        int span = end - start;
        if (span <= tileSize) {
            int length = Math.min(tileSize, imageLength);
            int centre = (start + end) / 2;
            int origin = clamp(centre - length / 2, 0, imageLength - length);
            return new Axis(List.of(origin), length, origin + length);
        }

        int stride = Math.max(1, tileSize - props.overlap());
        Set<Integer> starts = new LinkedHashSet<>();
        int pos = start;
        while (true) {
            starts.add(Math.min(pos, imageLength - tileSize));
            if (pos + tileSize >= end) {
                break;
            }
            pos += stride;
        }
        List<Integer> ordered = new ArrayList<>(starts);
        int last = ordered.get(ordered.size() - 1);
        return new Axis(List.copyOf(ordered), tileSize, last + tileSize);
    }

    private List<TileSpec> dropWeakTiles(List<TileSpec> candidates, Mask mask) {
        int minPixels = props.minTileMaskPixels();
        boolean[] keep = new boolean[candidates.size()];
        Mat uncovered = mask.toBinaryMat();
        try {
            for (int i = 0; i < candidates.size(); i++) {
                Rect r = candidates.get(i).toRect();
                if (mask.maskedPixelCount(r) >= minPixels) {
                    keep[i] = true;
                    uncovered.submat(r).setTo(Scalar.all(0));
                }
            }
            for (int i = 0; i < candidates.size(); i++) {
                if (keep[i]) {
                    continue;
                }
                Rect r = candidates.get(i).toRect();
                if (Core.countNonZero(uncovered.submat(r)) > 0) {
                    keep[i] = true;
                    uncovered.submat(r).setTo(Scalar.all(0));
                }
            }
        } finally {
            uncovered.release();
        }

        List<TileSpec> kept = new ArrayList<>();
        for (int i = 0; i < candidates.size(); i++) {
            if (keep[i]) {
                kept.add(candidates.get(i));
            }
        }
        if (kept.size() < candidates.size()) {
            LOG.debug("Skipped {} tile(s) below {} masked pixels", candidates.size() - kept.size(), minPixels);
        }
        return kept;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    /** Tile origins along one axis, the common tile length and the far edge of the last tile. */
    private record Axis(List<Integer> starts, int length, int end) {
    }
}
