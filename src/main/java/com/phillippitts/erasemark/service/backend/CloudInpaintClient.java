package com.phillippitts.erasemark.service.backend;

import com.phillippitts.erasemark.exception.InpaintException;

/**
 * Remote prediction service used by the cloud backend.
 *
 * <p>All methods throw {@link InpaintException} on transport or protocol errors.
 */
public interface CloudInpaintClient {

    /**
     * Submits an inpainting job.
     *
     * @param imagePng source image encoded as PNG
     * @param maskPng mask encoded as PNG, white = repaint
     * @return job identifier
     */
    String submit(byte[] imagePng, byte[] maskPng);

    PredictionStatus poll(String jobId);

    byte[] download(String url);
}
