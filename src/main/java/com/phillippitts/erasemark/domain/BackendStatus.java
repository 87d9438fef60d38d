package com.phillippitts.erasemark.domain;

import java.util.Objects;

/**
 * Snapshot of backend readiness.
 *
 * @param mode configured operating mode
 * @param localLoaded whether the local neural model is loaded
 * @param cloudAvailable whether the remote backend is configured with a token
 */
public record BackendStatus(InpaintMode mode, boolean localLoaded, boolean cloudAvailable) {
    public BackendStatus {
        Objects.requireNonNull(mode, "mode");
    }
}
