package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.AggregateRanking;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.domain.PeerRanking;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.service.events.LifecycleEventType;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import com.phillippitts.council.service.governor.CallPurpose;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Stage2: every surviving backend ranks all surviving responses under opaque labels.
 *
 * <p>Raters see their own response like any other. Failed calls produce no ranking;
 * replies without a usable ranking are kept with an empty label list and ignored by
 * aggregation.
 */
@Component
class PeerReviewStage {

    private static final Logger LOG = LogManager.getLogger(PeerReviewStage.class);

    private final BackendCaller caller;
    private final StageFanOut fanOut;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;

    PeerReviewStage(BackendCaller caller, StageFanOut fanOut, CouncilProperties councilProperties,
                    PipelineProperties pipelineProperties) {
        this.caller = caller;
        this.fanOut = fanOut;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
    }

    record Outcome(AnonymizationMap labels, List<PeerRanking> rankings, List<AggregateRanking> aggregate) {
    }

    Outcome review(RunContext ctx, List<ModelResponse> successful) {
        List<String> survivors = successful.stream().map(ModelResponse::backendId).toList();
        AnonymizationMap labels = AnonymizationMap.assign(survivors, pipelineProperties.isShuffleLabels(),
                ctx.queryId().hashCode());

        List<String> labelOrder = labels.labels();
        List<String> texts = new ArrayList<>(labelOrder.size());
        for (String label : labelOrder) {
            String backend = labels.backendOf(label).orElseThrow();
            texts.add(successful.stream().filter(r -> r.backendId().equals(backend)).findFirst()
                    .orElseThrow().text());
        }
        List<ChatMessage> messages = List.of(ChatMessage.user(
                PromptTemplates.peerReview(ctx.query().text(), labelOrder, texts)));

        Duration deadline = pipelineProperties.getStage2Timeout();
        CompletionParams params = new CompletionParams(councilProperties.getMaxCompletionTokens(),
                councilProperties.getTemperature(), deadline);

        Map<String, PeerRanking> accepted = fanOut.run("Stage2", survivors, rater -> {
            ModelResponse reply;
            try {
                reply = caller.call(ctx, CallPurpose.STAGE2, rater, messages, params);
            } catch (AdmissionDeniedException e) {
                LOG.warn("Stage2 rater {} skipped: {}", rater, e.getMessage());
                return null;
            }
            if (!reply.success()) {
                LOG.warn("Stage2 rater {} failed: kind={}", rater, reply.failureKind());
                return null;
            }
            List<String> order = RankingParser.parse(reply.text(), labelOrder);
            if (order.isEmpty()) {
                LOG.info("Stage2 rater {} returned no parseable ranking; discarded", rater);
            }
            return new PeerRanking(rater, order, reply.text());
        }, deadline, ranking -> ctx.emitter().emit(LifecycleEventType.STAGE2_RANKING,
                "rater", ranking.raterBackendId(),
                "labels", ranking.labels(),
                "parseable", ranking.parseable()));

        List<PeerRanking> rankings = List.copyOf(accepted.values());
        List<AggregateRanking> aggregate = RankingAggregator.aggregate(rankings);
        LOG.info("Stage2 finished: {} rankings, {} parseable, aggregate={}", rankings.size(),
                rankings.stream().filter(PeerRanking::parseable).count(),
                aggregate.stream().map(AggregateRanking::label).toList());
        return new Outcome(labels, rankings, aggregate);
    }
}
