package com.phillippitts.council.domain;

import java.util.Objects;

/**
 * Final answer written by the synthesizer backend.
 */
public record SynthesisResult(String authorBackendId, String text, TokenTier tier, int candidateCount) {

    public SynthesisResult {
        Objects.requireNonNull(authorBackendId, "authorBackendId");
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(tier, "tier");
        if (candidateCount < 1) {
            throw new IllegalArgumentException("Synthesis needs at least one candidate");
        }
    }
}
