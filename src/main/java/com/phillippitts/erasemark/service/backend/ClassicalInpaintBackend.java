package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.config.inpaint.ClassicalConfig;
import com.phillippitts.erasemark.domain.Mask;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.opencv.core.Mat;
import org.opencv.photo.Photo;
import org.springframework.stereotype.Component;

/**
 * Non-learned fallback using OpenCV's diffusion-based inpainting on the whole image.
 * Always available; its output is flagged best-effort.
 */
@Component
class ClassicalInpaintBackend implements InpaintBackend {
    private static final Logger LOG = LogManager.getLogger(ClassicalInpaintBackend.class);

    private final ClassicalConfig config;

    ClassicalInpaintBackend(ClassicalConfig config) {
        this.config = config;
    }

    @Override
    public String name() {
        return BackendNames.CLASSICAL;
    }

    @Override
    public boolean isAvailable() {
        return true;
    }

    @Override
    public BackendOutcome attempt(Mat image, Mask mask) {
        Mat binary = mask.toBinaryMat();
        try {
            Mat result = new Mat();
            int flags = config.method() == ClassicalConfig.Method.NS ? Photo.INPAINT_NS : Photo.INPAINT_TELEA;
            Photo.inpaint(image, binary, result, config.radius(), flags);
            LOG.debug("Classical inpaint done: method={}, radius={}, masked={}",
                    config.method(), config.radius(), mask.maskedPixelCount());
            return BackendOutcome.bestEffort(name(), result);
        } finally {
            binary.release();
        }
    }
}
