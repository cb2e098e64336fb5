package com.phillippitts.council.service.gateway;

import java.util.Objects;

/**
 * Successful gateway reply. Stored verbatim in the response cache.
 */
public record GatewayCompletion(String text, int promptTokens, int completionTokens, long latencyMs) {

    public GatewayCompletion {
        Objects.requireNonNull(text, "text");
        if (promptTokens < 0 || completionTokens < 0) {
            throw new IllegalArgumentException("Token counts must not be negative");
        }
    }
}
