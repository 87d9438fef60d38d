package com.phillippitts.erasemark.service.backend;

import java.util.List;

/**
 * Backend identifiers used in logs, metrics, events and {@link com.phillippitts.erasemark.domain.RemovalResult}.
 */
public final class BackendNames {

    public static final String CLOUD = "cloud";
    public static final String LOCAL = "local";
    public static final String CLASSICAL = "classical";

    /** Chain priority, highest first. */
    public static final List<String> PRIORITY = List.of(CLOUD, LOCAL, CLASSICAL);

    private BackendNames() {
    }
}
