package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.PeerRanking;
import com.phillippitts.council.domain.SynthesisResult;
import com.phillippitts.council.domain.TokenTier;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import com.phillippitts.council.service.governor.CallPurpose;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Stage3: the synthesizer backend writes the final answer from the tier-selected candidates.
 */
@Component
class SynthesisStage {

    private static final Logger LOG = LogManager.getLogger(SynthesisStage.class);

    private final BackendCaller caller;
    private final StageFanOut fanOut;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;

    SynthesisStage(BackendCaller caller, StageFanOut fanOut, CouncilProperties councilProperties,
                   PipelineProperties pipelineProperties) {
        this.caller = caller;
        this.fanOut = fanOut;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * @param result     the synthesis, or null when the synthesizer failed
     * @param candidates responses handed to the synthesizer, best first
     */
    record Outcome(SynthesisResult result, List<ModelResponse> candidates, String failure) {
    }

    /**
     * @param review Stage2 outcome, or null when Stage2 did not run
     * @param style  workspace style instructions, or null
     */
    Outcome synthesize(RunContext ctx, String synthesizer, TokenTier tier, List<ModelResponse> successful,
                       PeerReviewStage.Outcome review, String context, String style) {
        AnonymizationMap labels = review != null
                ? review.labels()
                : AnonymizationMap.assign(successful.stream().map(ModelResponse::backendId).toList(), false, 0L);
        List<AggregateRanking> aggregate = review != null ? review.aggregate() : List.of();
        List<PeerRanking> rationale = review != null
                ? review.rankings().stream().filter(PeerRanking::parseable).toList()
                : List.of();

        List<ModelResponse> candidates = TokenTierSelector.select(tier, successful, aggregate, labels);
        List<String> candidateLabels = candidates.stream().map(r -> labels.labelOf(r.backendId())).toList();
        String prompt = PromptTemplates.synthesis(ctx.query().text(), tier, candidateLabels, candidates,
                aggregate, rationale, context, style);

        Duration deadline = pipelineProperties.getStage3Timeout();
        CompletionParams params = new CompletionParams(councilProperties.getMaxCompletionTokens(),
                councilProperties.getTemperature(), deadline);
        Map<String, ModelResponse> done = fanOut.run("Stage3", List.of(synthesizer), backend -> {
            try {
                return caller.call(ctx, CallPurpose.STAGE3, backend, List.of(ChatMessage.user(prompt)), params);
            } catch (AdmissionDeniedException e) {
                LOG.warn("Synthesis skipped: {}", e.getMessage());
                return null;
            }
        }, backend -> ModelResponse.failure(backend, FailureKind.REJECTED, "council executor saturated", 0L),
                deadline, null);

        ModelResponse reply = done.get(synthesizer);
        if (reply == null || !reply.success()) {
            String failure = reply == null ? "no synthesis within deadline or budget" : reply.error();
            LOG.warn("Synthesis by {} failed: {}", synthesizer, failure);
            return new Outcome(null, candidates, failure);
        }
        LOG.info("Synthesis by {} done: tier={}, candidates={}", synthesizer, tier, candidates.size());
        return new Outcome(new SynthesisResult(synthesizer, reply.text(), tier, candidates.size()), candidates, null);
    }
}
