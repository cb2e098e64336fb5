package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.JudgeVerdict;
import com.phillippitts.council.domain.Recommendation;
import com.phillippitts.council.exception.ParseFailureException;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class VerdictParserTest {

    @Test
    void shouldParseFullVerdict() {
        String reply = """
                ACCURACY SCORE: 8
                COMPLETENESS SCORE: 6
                COHERENCE SCORE: 10
                CONCERNS:
                - Cites a 2019 figure as current
                - Omits the ECB's dual mandate debate
                RECOMMENDATION: REVISE
                REASONING: Mostly sound but dated in places.
                """;

        JudgeVerdict verdict = VerdictParser.parse("claude", reply, 0.7);

        assertThat(verdict.available()).isTrue();
        assertThat(verdict.judgeBackendId()).isEqualTo("claude");
        assertThat(verdict.scores().get("accuracy")).isCloseTo(0.8, within(1e-9));
        assertThat(verdict.scores().get("completeness")).isCloseTo(0.6, within(1e-9));
        assertThat(verdict.scores().get("coherence")).isCloseTo(1.0, within(1e-9));
        assertThat(verdict.concerns()).containsExactly(
                "Cites a 2019 figure as current", "Omits the ECB's dual mandate debate");
        assertThat(verdict.recommendation()).isEqualTo(Recommendation.REVISE);
        assertThat(verdict.reasoning()).isEqualTo("Mostly sound but dated in places.");
    }

    @Test
    void shouldTreatNoneAsNoConcerns() {
        String reply = "ACCURACY SCORE: 9\nCONCERNS:\n- None\nRECOMMENDATION: APPROVE";

        JudgeVerdict verdict = VerdictParser.parse("claude", reply, 0.7);

        assertThat(verdict.concerns()).isEmpty();
        assertThat(verdict.recommendation()).isEqualTo(Recommendation.APPROVE);
    }

    @Test
    void shouldMapEscalateToRevise() {
        assertThat(VerdictParser.parse("claude", "RECOMMENDATION: ESCALATE", 0.7).recommendation())
                .isEqualTo(Recommendation.REVISE);
    }

    @Test
    void shouldDeriveRecommendationFromMeanScoreWhenMissing() {
        String high = "ACCURACY SCORE: 8\nCOMPLETENESS SCORE: 7\nCOHERENCE SCORE: 9";
        String low = "ACCURACY SCORE: 5\nCOMPLETENESS SCORE: 6\nCOHERENCE SCORE: 7";

        assertThat(VerdictParser.parse("claude", high, 0.7).recommendation()).isEqualTo(Recommendation.APPROVE);
        assertThat(VerdictParser.parse("claude", low, 0.7).recommendation()).isEqualTo(Recommendation.REVISE);
    }

    @Test
    void shouldClampScoresAboveScale() {
        JudgeVerdict verdict = VerdictParser.parse("claude", "ACCURACY SCORE: 12", 0.7);

        assertThat(verdict.scores().get("accuracy")).isEqualTo(1.0);
    }

    @Test
    void shouldRejectReplyWithoutScoresOrRecommendation() {
        assertThatThrownBy(() -> VerdictParser.parse("claude", "Looks fine to me.", 0.7))
                .isInstanceOf(ParseFailureException.class);
    }

    @Test
    void shouldRejectBlankReply() {
        assertThatThrownBy(() -> VerdictParser.parse("claude", "  ", 0.7))
                .isInstanceOf(ParseFailureException.class);
    }
}
