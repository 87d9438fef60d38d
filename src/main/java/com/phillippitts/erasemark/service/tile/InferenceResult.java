package com.phillippitts.erasemark.service.tile;

/**
 * Raw model output for one padded tile.
 *
 * @param chw RGB output, channel-first, {@code 3 * tensorSize * tensorSize} values in [0, 255]
 * @param tensorSize padded square side fed to the model
 * @param cropWidth width of the real (unpadded) tile
 * @param cropHeight height of the real (unpadded) tile
 */
public record InferenceResult(float[] chw, int tensorSize, int cropWidth, int cropHeight) {
    public InferenceResult {
        if (chw == null || chw.length != 3 * tensorSize * tensorSize) {
            throw new IllegalArgumentException("Expected " + (3 * tensorSize * tensorSize)
                    + " output values, got " + (chw == null ? "null" : chw.length));
        }
        if (cropWidth > tensorSize || cropHeight > tensorSize) {
            throw new IllegalArgumentException("Crop " + cropWidth + "x" + cropHeight
                    + " exceeds tensor size " + tensorSize);
        }
    }
}
