package com.phillippitts.council.domain;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;

/**
 * Routing decision for one query. Immutable once computed.
 *
 * @param complexity     classified complexity
 * @param workflow       workflow derived from complexity and backend count
 * @param backends       ordered, distinct backend ids (1 to {@value #MAX_BACKENDS})
 * @param suggestedTools tool ids to run before Stage1 (may be empty)
 * @param rationale      short human-readable reason
 * @param confidence     classifier confidence in [0,1]
 * @param source         tier that produced the decision
 */
public record IntentDecision(
        Complexity complexity,
        Workflow workflow,
        List<String> backends,
        List<String> suggestedTools,
        String rationale,
        double confidence,
        DecisionSource source
) {

    public static final int MAX_BACKENDS = 5;

    public IntentDecision {
        Objects.requireNonNull(complexity, "complexity");
        Objects.requireNonNull(workflow, "workflow");
        Objects.requireNonNull(backends, "backends");
        if (backends.isEmpty() || backends.size() > MAX_BACKENDS) {
            throw new IllegalArgumentException(
                    "Selected backends must contain 1 to " + MAX_BACKENDS + " ids, got: " + backends.size());
        }
        if (new LinkedHashSet<>(backends).size() != backends.size()) {
            throw new IllegalArgumentException("Selected backends must be distinct: " + backends);
        }
        if (confidence < 0.0 || confidence > 1.0) {
            throw new IllegalArgumentException("Confidence must be between 0.0 and 1.0, got: " + confidence);
        }
        backends = List.copyOf(backends);
        suggestedTools = suggestedTools == null ? List.of() : List.copyOf(suggestedTools);
        rationale = rationale == null ? "" : rationale;
        Objects.requireNonNull(source, "source");
    }
}
