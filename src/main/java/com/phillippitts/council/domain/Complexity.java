package com.phillippitts.council.domain;

import java.util.Locale;
import java.util.Optional;

/**
 * Query complexity as decided by the intent classifier, ordered from cheapest to most demanding.
 */
public enum Complexity {
    SIMPLE,
    MODERATE,
    COMPLEX,
    EXPERT;

    public boolean isAtLeast(Complexity other) {
        return compareTo(other) >= 0;
    }

    /**
     * Parses a lower- or upper-case label ("simple", "Moderate", ...).
     *
     * @return the matching complexity, or empty if the label is unknown
     */
    public static Optional<Complexity> fromLabel(String label) {
        if (label == null) {
            return Optional.empty();
        }
        try {
            return Optional.of(valueOf(label.trim().toUpperCase(Locale.ROOT)));
        } catch (IllegalArgumentException e) {
            return Optional.empty();
        }
    }
}
