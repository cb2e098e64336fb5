package com.phillippitts.council.service.governor;

import com.phillippitts.council.config.properties.CostGovernorProperties;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Component;

import java.nio.charset.StandardCharsets;
import java.util.List;

/**
 * Upper-bound cost estimate used for admission.
 *
 * <p>A tokenizer never emits more tokens than the UTF-8 bytes it consumes, so the prompt is
 * bounded by its byte length plus a fixed per-message overhead. Completion tokens are assumed
 * to reach {@link CompletionParams#maxCompletionTokens()}. The priced bound is multiplied by
 * {@code council.governor.estimate-safety-factor}.
 *
 * <p>{@link #estimateTokens(String)} is the cheaper typical-case approximation (four characters
 * per token) used for sizing context, never for admission.
 */
@Component
public class CostEstimator {

    public static final int CHARS_PER_TOKEN = 4;
    static final int MESSAGE_OVERHEAD_TOKENS = 4;

    private final PricingTable pricing;
    private final double safetyFactor;

    public CostEstimator(PricingTable pricing) {
        this(pricing, 1.0);
    }

    @Autowired
    public CostEstimator(PricingTable pricing, CostGovernorProperties properties) {
        this(pricing, properties.getEstimateSafetyFactor());
    }

    CostEstimator(PricingTable pricing, double safetyFactor) {
        if (safetyFactor < 1.0) {
            throw new IllegalArgumentException("estimate safety factor must be >= 1.0, was " + safetyFactor);
        }
        this.pricing = pricing;
        this.safetyFactor = safetyFactor;
    }

    public double estimate(String backendId, List<ChatMessage> messages, CompletionParams params) {
        return pricing.cost(backendId, maxPromptTokens(messages), params.maxCompletionTokens()) * safetyFactor;
    }

    /**
     * Largest prompt token count any tokenizer could report for these messages.
     */
    public static int maxPromptTokens(List<ChatMessage> messages) {
        int tokens = 0;
        for (ChatMessage m : messages) {
            String content = m.content();
            int bytes = content == null ? 0 : content.getBytes(StandardCharsets.UTF_8).length;
            tokens += bytes + MESSAGE_OVERHEAD_TOKENS;
        }
        return tokens;
    }

    public static int estimateTokens(String text) {
        if (text == null || text.isEmpty()) {
            return 0;
        }
        return (text.length() + CHARS_PER_TOKEN - 1) / CHARS_PER_TOKEN;
    }
}
