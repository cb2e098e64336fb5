package com.phillippitts.council.service.gateway;

import java.time.Duration;
import java.util.Objects;

/**
 * Generation parameters passed through to the gateway.
 *
 * @param maxCompletionTokens upper bound on completion length, also used for cost estimation
 * @param temperature         sampling temperature
 * @param timeout             how long the gateway may wait for the provider
 */
public record CompletionParams(int maxCompletionTokens, double temperature, Duration timeout) {

    public CompletionParams {
        if (maxCompletionTokens <= 0) {
            throw new IllegalArgumentException("maxCompletionTokens must be positive, got: " + maxCompletionTokens);
        }
        Objects.requireNonNull(timeout, "timeout");
    }

    public CompletionParams withMaxCompletionTokens(int tokens) {
        return new CompletionParams(tokens, temperature, timeout);
    }

    public CompletionParams withTimeout(Duration newTimeout) {
        return new CompletionParams(maxCompletionTokens, temperature, newTimeout);
    }
}
