package com.phillippitts.erasemark.domain;

import java.util.Objects;

/**
 * Outcome of a watermark removal request.
 *
 * @param image encoded output image (PNG, or the untouched input on a no-op)
 * @param backend name of the backend that produced the image, {@link #NO_OP_BACKEND} when nothing ran
 * @param bestEffort true when only the classical fallback succeeded
 * @param tiles number of tiles inferred (0 for non-tiled backends and no-ops)
 * @param elapsedMs wall-clock time spent on the request
 */
public record RemovalResult(byte[] image, String backend, boolean bestEffort, int tiles, long elapsedMs) {

    public static final String NO_OP_BACKEND = "none";

    public RemovalResult {
        Objects.requireNonNull(image, "image");
        Objects.requireNonNull(backend, "backend");
        if (tiles < 0) {
            throw new IllegalArgumentException("tiles must not be negative");
        }
    }

    public static RemovalResult noOp(byte[] original, long elapsedMs) {
        return new RemovalResult(original, NO_OP_BACKEND, false, 0, elapsedMs);
    }

    public boolean isNoOp() {
        return NO_OP_BACKEND.equals(backend);
    }
}
