package com.phillippitts.erasemark.service.blend;

import com.phillippitts.erasemark.config.inpaint.PatchProperties;
import com.phillippitts.erasemark.service.patch.TileSpec;
import org.opencv.core.Core;
import org.opencv.core.CvType;
import org.opencv.core.Mat;
import org.opencv.core.Scalar;
import org.opencv.core.Size;
import org.opencv.imgproc.Imgproc;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Composites inferred tiles back onto the working image with a feathered edge.
 *
 * <p>The alpha map is the binarised mask blurred with a {@code 2r+1} Gaussian kernel, scaled
 * to [0, 1] and forced to 1 inside the mask. Pixels more than {@code r} away from the mask
 * keep alpha 0 and are left untouched.
 */
@Component
public class Blender {

    private final PatchProperties props;

    public Blender(PatchProperties props) {
        this.props = props;
    }

    /**
     * Alpha map ({@code CV_32FC1}, values in [0, 1]) for a mask crop.
     */
    public Mat featherMap(Mat maskCrop) {
        Mat binary = new Mat();
        Imgproc.threshold(maskCrop, binary, 127, 255, Imgproc.THRESH_BINARY);

        Mat alpha = new Mat();
        binary.convertTo(alpha, CvType.CV_32FC1, 1.0 / 255.0);
        int radius = props.featherRadius();
        if (radius > 0) {
            int k = 2 * radius + 1;
            Imgproc.GaussianBlur(alpha, alpha, new Size(k, k), 0);
        }
        alpha.setTo(Scalar.all(1.0), binary);
        binary.release();
        return alpha;
    }

    /**
     * Blends {@code inferred} into {@code canvas} at {@code spec}, in place.
     *
     * @param canvas working BGR image, modified
     * @param inferred BGR crop with the tile's dimensions
     * @param maskCrop mask crop with the tile's dimensions
     * @param spec where the crop belongs
     */
    public void blend(Mat canvas, Mat inferred, Mat maskCrop, TileSpec spec) {
        if (inferred.cols() != spec.width() || inferred.rows() != spec.height()) {
            throw new IllegalArgumentException("Inferred crop " + inferred.cols() + "x" + inferred.rows()
                    + " does not match tile " + spec);
        }
        Mat roi = canvas.submat(spec.toRect());
        Mat alpha1 = featherMap(maskCrop);
        Mat alpha = new Mat();
        Core.merge(List.of(alpha1, alpha1, alpha1), alpha);

        Mat base = new Mat();
        roi.convertTo(base, CvType.CV_32FC3);
        Mat top = new Mat();
        inferred.convertTo(top, CvType.CV_32FC3);

        Mat ones = new Mat(alpha.size(), CvType.CV_32FC3, Scalar.all(1.0));
        Mat inverse = new Mat();
        Core.subtract(ones, alpha, inverse);
        Core.multiply(base, inverse, base);
        Core.multiply(top, alpha, top);
        Mat sum = new Mat();
        Core.add(base, top, sum);

        Mat blended = new Mat();
        sum.convertTo(blended, CvType.CV_8UC3);
        blended.copyTo(roi);

        for (Mat m : List.of(alpha1, alpha, base, top, ones, inverse, sum, blended)) {
            m.release();
        }
    }
}
