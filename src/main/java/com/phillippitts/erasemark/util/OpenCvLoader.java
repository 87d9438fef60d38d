package com.phillippitts.erasemark.util;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Loads the OpenCV native library bundled with the openpnp artifact exactly once.
 *
 * <p>{@code OpenCV.loadShared()} relies on a class-loader hack that no longer works on
 * JDK 12+, so the library is extracted and loaded with {@code loadLocally()}.
 */
public final class OpenCvLoader {
    private static final Logger LOG = LogManager.getLogger(OpenCvLoader.class);

    private static volatile boolean loaded = false;

    private OpenCvLoader() {
    }

    /**
     * Ensures the native library is loaded; safe to call from any thread.
     *
     * @throws IllegalStateException if the native library cannot be loaded
     */
    public static void ensureLoaded() {
        if (loaded) {
            return;
        }
        synchronized (OpenCvLoader.class) {
            if (loaded) {
                return;
            }
            try {
                nu.pattern.OpenCV.loadLocally();
                loaded = true;
                LOG.info("OpenCV loaded: version={}", org.opencv.core.Core.VERSION);
            } catch (Throwable t) { // UnsatisfiedLinkError included
                LOG.error("Failed to load OpenCV native library", t);
                throw new IllegalStateException("OpenCV native library unavailable", t);
            }
        }
    }
}
