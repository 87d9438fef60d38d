package com.phillippitts.erasemark.service.backend;

import java.util.Locale;

/**
 * Status of a remote prediction job.
 *
 * @param status raw status string (starting, processing, succeeded, failed, canceled)
 * @param outputUrl URL of the produced image when succeeded, else null
 * @param error service-reported error, may be null
 */
public record PredictionStatus(String status, String outputUrl, String error) {

    public static final String SUCCEEDED = "succeeded";
    public static final String FAILED = "failed";
    public static final String CANCELED = "canceled";

    public boolean isSucceeded() {
        return SUCCEEDED.equals(normalized());
    }

    public boolean isFailed() {
        String s = normalized();
        return FAILED.equals(s) || CANCELED.equals(s);
    }

    private String normalized() {
        return status == null ? "" : status.toLowerCase(Locale.ROOT);
    }
}
