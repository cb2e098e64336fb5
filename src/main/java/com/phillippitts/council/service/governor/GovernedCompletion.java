package com.phillippitts.council.service.governor;

import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.service.gateway.GatewayCompletion;

/**
 * Gateway completion as returned by the governor, with the cost actually charged.
 *
 * @param completion the gateway payload (verbatim from cache on a hit)
 * @param cost       charged cost; zero for cache hits
 * @param latencyMs  observed latency; zero for cache hits
 * @param cached     whether the payload came from the response cache
 */
public record GovernedCompletion(GatewayCompletion completion, double cost, long latencyMs, boolean cached) {

    static GovernedCompletion fromCache(GatewayCompletion completion) {
        return new GovernedCompletion(completion, 0.0, 0L, true);
    }

    public String text() {
        return completion.text();
    }

    public ModelResponse toResponse(String backendId) {
        return ModelResponse.success(backendId, completion.text(), completion.promptTokens(),
                completion.completionTokens(), latencyMs, cost, cached);
    }
}
