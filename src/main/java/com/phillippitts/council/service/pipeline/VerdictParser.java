package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.JudgeVerdict;
import com.phillippitts.council.domain.Recommendation;
import com.phillippitts.council.exception.ParseFailureException;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parses the judge reply.
 *
 * <pre>
 * ACCURACY SCORE: 8
 * COMPLETENESS SCORE: 7
 * COHERENCE SCORE: 9
 * CONCERNS:
 * - ...
 * RECOMMENDATION: APPROVE | REVISE | ESCALATE
 * REASONING: ...
 * </pre>
 *
 * Scores on the 0-10 scale are normalised to [0,1]. ESCALATE maps to {@link Recommendation#REVISE}.
 * Without a recommendation the mean score is compared to the approve threshold.
 */
public final class VerdictParser {

    public static final List<String> DIMENSIONS = List.of("accuracy", "completeness", "coherence");

    private static final Pattern RECOMMENDATION =
            Pattern.compile("RECOMMENDATION:\\s*\\[?\\s*(APPROVE|REVISE|ESCALATE)", Pattern.CASE_INSENSITIVE);
    private static final Pattern CONCERNS =
            Pattern.compile("CONCERNS:\\s*(.*?)(?=RECOMMENDATION:|REASONING:|$)",
                    Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Pattern REASONING =
            Pattern.compile("REASONING:\\s*(.*)", Pattern.CASE_INSENSITIVE | Pattern.DOTALL);
    private static final Set<String> NO_CONCERNS = Set.of("none", "n/a", "no concerns", "[none]");

    private VerdictParser() {
    }

    /**
     * @throws ParseFailureException if the reply has neither scores nor a recommendation
     */
    public static JudgeVerdict parse(String judgeBackendId, String reply, double approveThreshold) {
        if (reply == null || reply.isBlank()) {
            throw new ParseFailureException("verdict", "empty reply");
        }
        Map<String, Double> scores = new LinkedHashMap<>();
        for (String dim : DIMENSIONS) {
            Matcher m = Pattern.compile(dim + "\\s+SCORE:\\s*\\[?\\s*(\\d+(?:\\.\\d+)?)", Pattern.CASE_INSENSITIVE)
                    .matcher(reply);
            if (m.find()) {
                double raw = Double.parseDouble(m.group(1));
                scores.put(dim, Math.max(0.0, Math.min(1.0, raw / 10.0)));
            }
        }

        Recommendation recommendation = null;
        Matcher rec = RECOMMENDATION.matcher(reply);
        if (rec.find()) {
            recommendation = "APPROVE".equalsIgnoreCase(rec.group(1)) ? Recommendation.APPROVE : Recommendation.REVISE;
        }
        if (recommendation == null && scores.isEmpty()) {
            throw new ParseFailureException("verdict", "no scores and no recommendation found");
        }
        if (recommendation == null) {
            double mean = scores.values().stream().mapToDouble(Double::doubleValue).average().orElse(0.0);
            recommendation = mean >= approveThreshold ? Recommendation.APPROVE : Recommendation.REVISE;
        }
        return new JudgeVerdict(judgeBackendId, true, scores, recommendation, concerns(reply), reasoning(reply));
    }

    static List<String> concerns(String reply) {
        Matcher m = CONCERNS.matcher(reply);
        if (!m.find()) {
            return List.of();
        }
        List<String> concerns = new ArrayList<>();
        for (String line : m.group(1).split("\\R")) {
            String item = line.strip().replaceFirst("^[-*•]+\\s*", "").strip();
            if (!item.isEmpty() && !NO_CONCERNS.contains(item.toLowerCase(Locale.ROOT))) {
                concerns.add(item);
            }
        }
        return concerns;
    }

    private static String reasoning(String reply) {
        Matcher m = REASONING.matcher(reply);
        return m.find() ? m.group(1).strip() : "";
    }
}
