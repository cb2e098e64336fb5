package com.phillippitts.council.domain;

/**
 * Which classifier tier produced an {@link IntentDecision}.
 */
public enum DecisionSource {
    RULES,
    MODEL,
    DEFAULT
}
