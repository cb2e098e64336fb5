package com.phillippitts.council.service.classifier;

import com.phillippitts.council.domain.Complexity;

import java.util.List;
import java.util.Objects;

/**
 * A keyword rule that fired.
 */
public record RuleMatch(Complexity complexity, double confidence, String rationale, List<String> suggestedTools) {

    public RuleMatch {
        Objects.requireNonNull(complexity, "complexity");
        suggestedTools = suggestedTools == null ? List.of() : List.copyOf(suggestedTools);
    }
}
