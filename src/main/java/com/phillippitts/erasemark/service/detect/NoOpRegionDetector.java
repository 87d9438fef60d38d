package com.phillippitts.erasemark.service.detect;

import com.phillippitts.erasemark.domain.Region;
import org.opencv.core.Mat;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Detector used when text detection is disabled; reports no regions, so requests
 * without a mask are no-ops.
 */
@Component
@ConditionalOnProperty(name = "inpaint.detector.enabled", havingValue = "false", matchIfMissing = true)
public class NoOpRegionDetector implements RegionDetector {

    @Override
    public List<Region> detect(Mat image) {
        return List.of();
    }

    @Override
    public String name() {
        return "noop";
    }
}
