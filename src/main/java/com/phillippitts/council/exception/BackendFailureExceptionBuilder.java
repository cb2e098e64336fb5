package com.phillippitts.council.exception;

import com.phillippitts.council.domain.FailureKind;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Fluent builder for {@link BackendFailureException} with contextual metadata.
 *
 * <pre>
 * throw BackendFailureExceptionBuilder.create("Provider returned 502")
 *         .backend("openai/gpt-5.1")
 *         .kind(FailureKind.PROVIDER_ERROR)
 *         .durationMs(1500)
 *         .metadata("status", 502)
 *         .build();
 * </pre>
 */
public final class BackendFailureExceptionBuilder {

    private final String message;
    private String backendId;
    private FailureKind kind = FailureKind.UNKNOWN;
    private Throwable cause;
    private Long durationMs;
    private final Map<String, String> metadata = new LinkedHashMap<>();

    private BackendFailureExceptionBuilder(String message) {
        this.message = message;
    }

    public static BackendFailureExceptionBuilder create(String message) {
        if (message == null || message.isEmpty()) {
            throw new IllegalArgumentException("message must not be null or empty");
        }
        return new BackendFailureExceptionBuilder(message);
    }

    public BackendFailureExceptionBuilder backend(String backendId) {
        this.backendId = backendId;
        return this;
    }

    public BackendFailureExceptionBuilder kind(FailureKind kind) {
        this.kind = kind;
        return this;
    }

    public BackendFailureExceptionBuilder cause(Throwable cause) {
        this.cause = cause;
        return this;
    }

    public BackendFailureExceptionBuilder durationMs(long durationMs) {
        this.durationMs = durationMs;
        return this;
    }

    /**
     * Adds a key-value pair to the message. Null keys or values are ignored.
     */
    public BackendFailureExceptionBuilder metadata(String key, Object value) {
        if (key != null && value != null) {
            this.metadata.put(key, String.valueOf(value));
        }
        return this;
    }

    /**
     * Builds the exception. Message format:
     * <pre>
     * {message} (durationMs={ms}, {key1}={val1}, ...) (backend: {id})
     * </pre>
     */
    public BackendFailureException build() {
        String backend = backendId != null ? backendId : "unknown";
        String detailed = detailedMessage();
        return cause != null
                ? new BackendFailureException(detailed, backend, kind, cause)
                : new BackendFailureException(detailed, backend, kind);
    }

    private String detailedMessage() {
        if (durationMs == null && metadata.isEmpty()) {
            return message;
        }
        StringBuilder sb = new StringBuilder(message).append(" (");
        String sep = "";
        if (durationMs != null) {
            sb.append("durationMs=").append(durationMs);
            sep = ", ";
        }
        for (Map.Entry<String, String> entry : metadata.entrySet()) {
            sb.append(sep).append(entry.getKey()).append('=').append(entry.getValue());
            sep = ", ";
        }
        return sb.append(')').toString();
    }
}
