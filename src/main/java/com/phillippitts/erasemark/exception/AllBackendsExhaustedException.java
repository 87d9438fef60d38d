package com.phillippitts.erasemark.exception;

import java.util.List;

/**
 * Thrown when no backend, including the classical fallback, produced an image.
 */
public class AllBackendsExhaustedException extends EraseMarkException {

    private final List<String> attempts;

    public AllBackendsExhaustedException(List<String> attempts) {
        super("All inpainting backends exhausted: " + String.join("; ", attempts));
        this.attempts = List.copyOf(attempts);
    }

    /** One "backend: KIND (reason)" entry per backend, in chain order. */
    public List<String> getAttempts() {
        return attempts;
    }
}
