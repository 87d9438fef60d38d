package com.phillippitts.erasemark.exception;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link InpaintException} with contextual diagnostics.
 *
 * <p><b>Usage Examples:</b>
 * <pre>
 * throw InpaintExceptionBuilder.create("Remote job failed")
 *         .backend("cloud")
 *         .httpStatus(500)
 *         .metadata("jobId", jobId)
 *         .build();
 *
 * throw InpaintExceptionBuilder.create("Tile inference failed")
 *         .backend("local")
 *         .cause(e)
 *         .durationMs(840)
 *         .metadata("tile", spec)
 *         .build();
 * </pre>
 */
public final class InpaintExceptionBuilder {

    private final String message;
    private String backendName;
    private Throwable cause;
    private Integer httpStatus;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private InpaintExceptionBuilder(String message) {
        this.message = message;
    }

    /**
     * Creates a new builder with the base error message.
     *
     * @param message base error message (must not be null)
     * @return new builder instance
     */
    public static InpaintExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new InpaintExceptionBuilder(message);
    }

    public InpaintExceptionBuilder backend(String backendName) {
        this.backendName = backendName;
        return this;
    }

    public InpaintExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /**
     * Sets the HTTP status returned by a remote backend.
     */
    public InpaintExceptionBuilder httpStatus(int httpStatus) {
        this.httpStatus = httpStatus;
        return this;
    }

    public InpaintExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a metadata key-value pair to the exception message. Null keys or values are ignored.
     *
     * <p>Common keys: jobId, status, tile, modelPath.
     */
    public InpaintExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (httpStatus={code}, durationMs={ms}, {key1}={val1}, ...) (backend: {name})
     * </pre>
     */
    public InpaintException build() {
        String detailedMessage = buildDetailedMessage();
        String backend = backendName != null ? backendName : "unknown";

        if (cause != null) {
            return new InpaintException(detailedMessage, backend, cause);
        }
        return new InpaintException(detailedMessage, backend);
    }

    private String buildDetailedMessage() {
        Map<String, String> details = new LinkedHashMap<>();
        if (httpStatus != null) {
            details.put("httpStatus", String.valueOf(httpStatus));
        }
        if (durationMs != null) {
            details.put("durationMs", String.valueOf(durationMs));
        }
        details.putAll(metadata);
        if (details.isEmpty()) {
            return message;
        }

        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        for (Map.Entry<String, String> entry : details.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
