package com.phillippitts.erasemark.exception;

/**
 * Thrown when the local inpainting model cannot be found or opened at the configured path.
 * The model loader catches it and leaves the local backend unavailable.
 */
public class ModelNotFoundException extends EraseMarkException {

    private final String modelPath;

    public ModelNotFoundException(String modelPath) {
        super("Inpainting model not found at path: " + modelPath);
        this.modelPath = modelPath;
    }

    public ModelNotFoundException(String modelPath, Throwable cause) {
        super("Inpainting model not found at path: " + modelPath, cause);
        this.modelPath = modelPath;
    }

    public String getModelPath() {
        return modelPath;
    }
}
