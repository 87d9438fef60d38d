package com.phillippitts.erasemark.service.model;

import com.phillippitts.erasemark.exception.BackendUnavailableException;
import com.phillippitts.erasemark.exception.InpaintException;

import java.nio.file.Path;

/**
 * Contract for a fixed-input-size neural inpainting model.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Model is constructed with configuration</li>
 *   <li>{@link #load(Path)} creates the inference session; returns {@code false} instead of throwing</li>
 *   <li>{@link #infer(float[], float[])} runs one {@code S x S} tile</li>
 *   <li>{@link #close()} releases native resources</li>
 * </ol>
 *
 * <p>Thread Safety: a loaded model is shared read-only and must accept concurrent {@code infer} calls.
 */
public interface InpaintModel extends AutoCloseable {

    /**
     * Loads the model from {@code modelPath}.
     *
     * @return true if the model is ready for inference, false if the file is missing or unusable
     */
    boolean load(Path modelPath);

    boolean isLoaded();

    /** Square input side {@code S} the model expects. */
    int inputSize();

    /**
     * Runs inference on one tile.
     *
     * @param imageChw RGB pixels in [0, 1], channel-first, {@code 3 * S * S} values
     * @param maskChw mask in {0, 1}, {@code S * S} values
     * @return RGB output in [0, 255], channel-first, {@code 3 * S * S} values
     * @throws BackendUnavailableException if the model is not loaded
     * @throws InpaintException if inference fails
     */
    float[] infer(float[] imageChw, float[] maskChw);

    /** Name for logs and metrics. */
    String getModelName();

    @Override
    void close();
}
