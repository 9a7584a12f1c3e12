package com.phillippitts.hazardscan.exception;

import com.phillippitts.hazardscan.domain.BackendTier;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link BackendFailureException} with contextual metadata.
 *
 * <pre>
 * throw BackendExceptionBuilder.create("Cloud request failed")
 *         .tier(BackendTier.CLOUD)
 *         .statusCode(503)
 *         .durationMs(1200)
 *         .metadata("endpoint", endpoint)
 *         .build();
 * </pre>
 */
public final class BackendExceptionBuilder {

    private final String message;
    private BackendTier tier;
    private Throwable cause;
    private Integer statusCode;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendExceptionBuilder(String message) {
        this.message = message;
    }

    public static BackendExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendExceptionBuilder(message);
    }

    public BackendExceptionBuilder tier(BackendTier tier) {
        this.tier = tier;
        return this;
    }

    public BackendExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    /** HTTP status or runtime error code returned by the backend. */
    public BackendExceptionBuilder statusCode(int statusCode) {
        this.statusCode = statusCode;
        return this;
    }

    public BackendExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    public BackendExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * {@code {message} (statusCode={code}, durationMs={ms}, {key}={value}, ...)}
     */
    public BackendFailureException build() {
        if (tier == null) {
            throw new IllegalStateException("tier must be set");
        }
        String detailed = buildDetailedMessage();
        return cause != null
                ? new BackendFailureException(detailed, tier, cause)
                : new BackendFailureException(detailed, tier);
    }

    private String buildDetailedMessage() {
        if (statusCode == null && durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        boolean first = true;
        if (statusCode != null) {
            sb.append("statusCode=").append(statusCode);
            first = false;
        }
        if (durationMs != null) {
            if (!first) {
                sb.append(", ");
            }
            sb.append("durationMs=").append(durationMs);
            first = false;
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            if (!first) {
                sb.append(", ");
            }
            sb.append(entry.getKey()).append('=').append(entry.getValue());
            first = false;
        }
        return sb.append(')').toString();
    }
}
