package com.phillippitts.council.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * How much Stage1/Stage2 material the synthesizer receives.
 */
public enum TokenTier {
    /** The single top-ranked response, or the first successful one without rankings. */
    MINIMAL,
    /** The top two responses. */
    STANDARD,
    /** Every successful response plus ranking rationale. */
    COMPREHENSIVE;

    public static Optional<TokenTier> fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
