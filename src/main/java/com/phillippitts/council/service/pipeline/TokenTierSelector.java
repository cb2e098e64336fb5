package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.TokenTier;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Chooses the Stage1 responses handed to the synthesizer.
 *
 * <p>Responses are ordered by aggregate ranking first; responses without a rank follow in
 * selection order. The tier then keeps one ({@link TokenTier#MINIMAL}), two
 * ({@link TokenTier#STANDARD}) or all ({@link TokenTier#COMPREHENSIVE}) of them.
 */
public final class TokenTierSelector {

    private TokenTierSelector() {
    }

    /**
     * @param successful successful Stage1 responses in selection order
     * @param aggregate  aggregate ranking, best first; may be empty
     * @param labels     label map of the Stage2 run, or null when Stage2 did not run
     */
    public static List<ModelResponse> select(TokenTier tier, List<ModelResponse> successful,
                                             List<AggregateRanking> aggregate, AnonymizationMap labels) {
        List<ModelResponse> ranked = rankedOrder(successful, aggregate, labels);
        int keep = switch (tier) {
            case MINIMAL -> 1;
            case STANDARD -> 2;
            case COMPREHENSIVE -> ranked.size();
        };
        return List.copyOf(ranked.subList(0, Math.min(keep, ranked.size())));
    }

    static List<ModelResponse> rankedOrder(List<ModelResponse> successful, List<AggregateRanking> aggregate,
                                           AnonymizationMap labels) {
        Map<String, ModelResponse> remaining = new LinkedHashMap<>();
        successful.forEach(r -> remaining.put(r.backendId(), r));
        List<ModelResponse> ordered = new ArrayList<>(successful.size());
        if (labels != null && aggregate != null) {
            for (AggregateRanking a : aggregate) {
                labels.backendOf(a.label())
                        .map(remaining::remove)
                        .ifPresent(ordered::add);
            }
        }
        ordered.addAll(remaining.values());
        return ordered;
    }
}
