package com.phillippitts.erasemark.service.backend;

import org.opencv.core.Mat;

import java.util.Objects;

/**
 * Result of one backend attempt.
 *
 * @param kind outcome tag
 * @param backend backend name
 * @param image repainted full-size image on success, null otherwise
 * @param reason why the backend did not succeed, null on success
 * @param tiles number of tiles inferred (0 for non-tiled backends)
 * @param bestEffort true when the image comes from a fallback of lower quality
 */
public record BackendOutcome(Kind kind, String backend, Mat image, String reason, int tiles, boolean bestEffort) {

    public enum Kind {
        SUCCESS,
        UNAVAILABLE,
        FAILED
    }

    public BackendOutcome {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(backend, "backend");
        if (kind == Kind.SUCCESS && image == null) {
            throw new IllegalArgumentException("Successful outcome requires an image");
        }
    }

    public static BackendOutcome success(String backend, Mat image, int tiles) {
        return new BackendOutcome(Kind.SUCCESS, backend, image, null, tiles, false);
    }

    public static BackendOutcome bestEffort(String backend, Mat image) {
        return new BackendOutcome(Kind.SUCCESS, backend, image, null, 0, true);
    }

    public static BackendOutcome unavailable(String backend, String reason) {
        return new BackendOutcome(Kind.UNAVAILABLE, backend, null, reason, 0, false);
    }

    public static BackendOutcome failed(String backend, String reason) {
        return new BackendOutcome(Kind.FAILED, backend, null, reason, 0, false);
    }

    public boolean isSuccess() {
        return kind == Kind.SUCCESS;
    }

    @Override
    public String toString() {
        return backend + ": " + kind + (reason == null ? "" : " (" + reason + ")");
    }
}
