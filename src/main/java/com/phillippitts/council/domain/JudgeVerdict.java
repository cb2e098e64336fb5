package com.phillippitts.council.domain;

import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Independent quality assessment of the final answer.
 *
 * <p>An unavailable verdict ({@code available == false}) means the judge ran but failed; scores
 * are empty and the recommendation is {@code null}.
 *
 * @param judgeBackendId backend that judged
 * @param available      whether the judge produced a usable verdict
 * @param scores         named scores in [0,1], e.g. accuracy, completeness, coherence
 * @param recommendation approve or revise; null when unavailable
 * @param concerns       concerns listed by the judge
 * @param reasoning      judge reasoning, or the failure reason when unavailable
 */
public record JudgeVerdict(
        String judgeBackendId,
        boolean available,
        Map<String, Double> scores,
        Recommendation recommendation,
        List<String> concerns,
        String reasoning
) {

    public JudgeVerdict {
        Objects.requireNonNull(judgeBackendId, "judgeBackendId");
        scores = scores == null ? Map.of() : Map.copyOf(scores);
        scores.forEach((name, score) -> {
            if (score < 0.0 || score > 1.0) {
                throw new IllegalArgumentException("Score " + name + " must be in [0,1], got: " + score);
            }
        });
        if (available && recommendation == null) {
            throw new IllegalArgumentException("Available verdict requires a recommendation");
        }
        concerns = concerns == null ? List.of() : List.copyOf(concerns);
        reasoning = reasoning == null ? "" : reasoning;
    }

    public static JudgeVerdict unavailable(String judgeBackendId, String reason) {
        return new JudgeVerdict(judgeBackendId, false, Map.of(), null, List.of(), reason);
    }
}
