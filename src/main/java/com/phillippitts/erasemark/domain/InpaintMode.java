package com.phillippitts.erasemark.domain;

/**
 * Operating mode of the backend chain. The remote backend is only tried in {@link #CLOUD}.
 */
public enum InpaintMode {
    LOCAL,
    CLOUD
}
