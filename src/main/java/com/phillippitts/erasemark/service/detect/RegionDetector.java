package com.phillippitts.erasemark.service.detect;

import com.phillippitts.erasemark.domain.Region;
import org.opencv.core.Mat;

import java.util.List;

/**
 * Finds candidate watermark regions (typically overlaid text) in an image.
 *
 * <p>Implementations must not throw: recognition problems degrade to an empty list.
 */
public interface RegionDetector {

    /**
     * @param image BGR image
     * @return unfiltered candidate regions in image coordinates
     */
    List<Region> detect(Mat image);

    String name();
}
