package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.domain.Mask;
import org.opencv.core.Mat;

/** Strategy that repaints the masked pixels of a whole image. */
public interface InpaintBackend {

    /** Name for logs/metrics; one of {@link BackendNames}. */
    String name();

    /** @return true if the backend can currently be attempted */
    boolean isAvailable();

    /**
     * Repaints {@code image} where {@code mask} is set. Must not modify either argument and
     * must report problems as an outcome rather than throw.
     *
     * @param image BGR source image
     * @param mask mask with the image's dimensions
     * @return success with a full-size image, or the reason the backend was skipped/failed
     */
    BackendOutcome attempt(Mat image, Mask mask);
}
