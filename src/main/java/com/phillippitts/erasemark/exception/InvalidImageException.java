package com.phillippitts.erasemark.exception;

/**
 * Thrown when an image or mask cannot be decoded, or has a channel layout / bit depth
 * that cannot be converted to what the pipeline expects. Raised before any backend runs.
 */
public class InvalidImageException extends EraseMarkException {

    private final int byteSize;
    private final String reason;

    public InvalidImageException(String reason) {
        super("Invalid image data: " + reason);
        this.byteSize = 0;
        this.reason = reason;
    }

    public InvalidImageException(int byteSize, String reason) {
        super("Invalid image data (" + byteSize + " bytes): " + reason);
        this.byteSize = byteSize;
        this.reason = reason;
    }

    public InvalidImageException(String reason, Throwable cause) {
        super("Invalid image data: " + reason, cause);
        this.byteSize = 0;
        this.reason = reason;
    }

    public int getByteSize() {
        return byteSize;
    }

    public String getReason() {
        return reason;
    }
}
