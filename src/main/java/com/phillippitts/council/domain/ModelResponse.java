package com.phillippitts.council.domain;

import java.util.Objects;

/**
 * Outcome of one backend call in a pipeline stage. Immutable once recorded.
 *
 * <p>Failed responses carry a {@link FailureKind} and an error message and have empty text;
 * they are kept so that callers can report which backends were attempted.
 */
public record ModelResponse(
        String backendId,
        String text,
        int promptTokens,
        int completionTokens,
        long latencyMs,
        double cost,
        boolean success,
        FailureKind failureKind,
        String error,
        boolean cached
) {

    public ModelResponse {
        Objects.requireNonNull(backendId, "backendId");
        text = text == null ? "" : text;
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
        if (cost < 0.0) {
            throw new IllegalArgumentException("Cost must not be negative, got: " + cost);
        }
        if (success && failureKind != null) {
            throw new IllegalArgumentException("Successful response must not carry a failure kind");
        }
        if (!success && failureKind == null) {
            failureKind = FailureKind.UNKNOWN;
        }
    }

    public static ModelResponse success(String backendId, String text, int promptTokens, int completionTokens,
                                        long latencyMs, double cost, boolean cached) {
        return new ModelResponse(backendId, text, promptTokens, completionTokens, latencyMs, cost,
                true, null, null, cached);
    }

    public static ModelResponse failure(String backendId, FailureKind kind, String error, long latencyMs) {
        return new ModelResponse(backendId, "", 0, 0, latencyMs, 0.0, false, kind, error, false);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
