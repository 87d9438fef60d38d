package com.phillippitts.erasemark.exception;

/**
 * Thrown when a backend cannot run at all: the local model is not loaded or no cloud
 * credential is configured. Never surfaced to callers.
 */
public class BackendUnavailableException extends InpaintException {

    public BackendUnavailableException(String message, String backendName) {
        super(message, backendName);
    }
}
