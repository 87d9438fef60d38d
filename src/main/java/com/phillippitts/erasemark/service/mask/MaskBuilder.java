package com.phillippitts.erasemark.service.mask;

import com.phillippitts.erasemark.config.inpaint.MaskProperties;
import com.phillippitts.erasemark.domain.Mask;
import com.phillippitts.erasemark.domain.Region;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Point;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Produces the repaint mask for a request, either from a caller-supplied raster or by
 * rasterising detected regions. Never fails: no usable input yields an all-zero mask.
 */
@Component
public class MaskBuilder {
    private static final Logger LOG = LogManager.getLogger(MaskBuilder.class);

    private static final Scalar MASKED = new Scalar(255);

    private final RegionFilter regionFilter;
    private final MaskProperties props;

    public MaskBuilder(RegionFilter regionFilter, MaskProperties props) {
        this.regionFilter = regionFilter;
        this.props = props;
    }

    /**
     * Builds a mask of exactly {@code width x height}.
     *
     * @param width source image width
     * @param height source image height
     * @param userMask decoded {@code CV_8UC1} mask, or null to use {@code regions}
     * @param regions detected regions, ignored when {@code userMask} is present; may be null
     * @return immutable mask aligned with the source image
     */
    public Mask build(int width, int height, Mat userMask, List<Region> regions) {
        if (userMask != null && !userMask.empty()) {
            return fromUserMask(width, height, userMask);
        }
        return fromRegions(width, height, regionFilter.filter(regions, width, height));
    }

    private Mask fromUserMask(int width, int height, Mat userMask) {
        if (userMask.cols() == width && userMask.rows() == height) {
            return Mask.of(userMask);
        }
        LOG.debug("Resizing mask {}x{} to image {}x{}", userMask.cols(), userMask.rows(), width, height);
        Mat resized = new Mat();
        Imgproc.resize(userMask, resized, new Size(width, height), 0, 0, Imgproc.INTER_NEAREST);
        return Mask.of(resized);
    }

    private Mask fromRegions(int width, int height, List<Region> regions) {
        if (regions.isEmpty()) {
            return Mask.empty(width, height);
        }
        int pad = props.regionPadding();
        Mat raster = Mat.zeros(height, width, CvType.CV_8UC1);
        for (Region r : regions) {
            int x0 = Math.max(0, r.x() - pad);
            int y0 = Math.max(0, r.y() - pad);
            int x1 = Math.min(width - 1, r.x() + r.width() + pad);
            int y1 = Math.min(height - 1, r.y() + r.height() + pad);
            if (x1 < x0 || y1 < y0) {
                continue;
            }
            Imgproc.rectangle(raster, new Point(x0, y0), new Point(x1, y1), MASKED, Imgproc.FILLED);
        }
        if (props.blurRadius() > 0) {
            Imgproc.GaussianBlur(raster, raster, new Size(0, 0), props.blurRadius());
        }
        Mask mask = Mask.of(raster);
        LOG.debug("Synthesized mask from {} regions: {}", regions.size(), mask);
        return mask;
    }
}
