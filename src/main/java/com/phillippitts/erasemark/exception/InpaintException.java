package com.phillippitts.erasemark.exception;

/**
 * Thrown when a backend attempt fails: inference threw, a remote job failed or the
 * attempt ran out of its time budget. The backend chain converts it into a fallback.
 */
public class InpaintException extends EraseMarkException {

    private final String backendName;

    public InpaintException(String message) {
        super(message);
        this.backendName = "unknown";
    }

    public InpaintException(String message, String backendName) {
        super(message + " (backend: " + backendName + ")");
        this.backendName = backendName;
    }

    public InpaintException(String message, Throwable cause) {
        super(message, cause);
        this.backendName = "unknown";
    }

    public InpaintException(String message, String backendName, Throwable cause) {
        super(message + " (backend: " + backendName + ")", cause);
        this.backendName = backendName;
    }

    public String getBackendName() {
        return backendName;
    }
}
