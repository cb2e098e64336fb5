package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.TokenTier;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class TokenTierSelectorTest {

    private final List<ModelResponse> responses = List.of(response("gpt"), response("claude"), response("gemini"));
    private final AnonymizationMap labels = AnonymizationMap.assign(List.of("gpt", "claude", "gemini"), false, 0L);
    private final List<AggregateRanking> aggregate = List.of(
            new AggregateRanking("Response C", 1.0, 3, 0),
            new AggregateRanking("Response A", 2.0, 3, 0),
            new AggregateRanking("Response B", 3.0, 3, 0));

    @Test
    void shouldKeepTopRankedForMinimal() {
        assertThat(TokenTierSelector.select(TokenTier.MINIMAL, responses, aggregate, labels))
                .extracting(ModelResponse::backendId).containsExactly("gemini");
    }

    @Test
    void shouldKeepTopTwoForStandard() {
        assertThat(TokenTierSelector.select(TokenTier.STANDARD, responses, aggregate, labels))
                .extracting(ModelResponse::backendId).containsExactly("gemini", "gpt");
    }

    @Test
    void shouldKeepAllRankedForComprehensive() {
        assertThat(TokenTierSelector.select(TokenTier.COMPREHENSIVE, responses, aggregate, labels))
                .extracting(ModelResponse::backendId).containsExactly("gemini", "gpt", "claude");
    }

    @Test
    void shouldUseSelectionOrderWithoutStage2() {
        assertThat(TokenTierSelector.select(TokenTier.STANDARD, responses, List.of(), null))
                .extracting(ModelResponse::backendId).containsExactly("gpt", "claude");
    }

    @Test
    void shouldAppendUnrankedResponsesAfterRankedOnes() {
        List<AggregateRanking> partial = List.of(new AggregateRanking("Response B", 1.0, 1, 0));

        assertThat(TokenTierSelector.rankedOrder(responses, partial, labels))
                .extracting(ModelResponse::backendId).containsExactly("claude", "gpt", "gemini");
    }

    @Test
    void shouldNotExceedAvailableResponses() {
        assertThat(TokenTierSelector.select(TokenTier.STANDARD, List.of(response("gpt")), List.of(), null))
                .hasSize(1);
    }

    private static ModelResponse response(String backendId) {
        return ModelResponse.success(backendId, "answer from " + backendId, 10, 20, 100L, 0.001, false);
    }
}
