package com.phillippitts.erasemark.exception;

/**
 * Base exception for all eraseMark application-specific errors.
 * All domain exceptions should extend this class to enable centralized error handling.
 */
public class EraseMarkException extends RuntimeException {

    public EraseMarkException(String message) {
        super(message);
    }

    public EraseMarkException(String message, Throwable cause) {
        super(message, cause);
    }

    public EraseMarkException(Throwable cause) {
        super(cause);
    }
}
