package com.phillippitts.erasemark.service;

import com.phillippitts.erasemark.domain.BackendStatus;
import com.phillippitts.erasemark.domain.Region;
import com.phillippitts.erasemark.domain.RemovalResult;
import com.phillippitts.erasemark.exception.AllBackendsExhaustedException;
import com.phillippitts.erasemark.exception.InvalidImageException;

import java.util.List;

/**
 * Entry point for watermark removal.
 */
public interface WatermarkRemovalService {

    /**
     * Removes the masked (or auto-detected) content from {@code image}.
     *
     * <p>An empty mask, or no detected regions, returns the input bytes unchanged.
     *
     * @param image encoded source image
     * @param mask encoded mask (white = repaint), or null to detect regions automatically
     * @return output image with the source dimensions and the backend that produced it
     * @throws InvalidImageException if the image or mask cannot be decoded
     * @throws AllBackendsExhaustedException if no backend produced an image
     */
    RemovalResult removeWatermark(byte[] image, byte[] mask);

    /**
     * Detects candidate watermark regions, filtered and ranked by confidence.
     *
     * @throws InvalidImageException if the image cannot be decoded
     */
    List<Region> detectRegions(byte[] image);

    BackendStatus getBackendStatus();
}
