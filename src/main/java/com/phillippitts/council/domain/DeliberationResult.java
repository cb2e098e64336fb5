package com.phillippitts.council.domain;

import java.util.List;
import java.util.Objects;

/**
 * Everything a finished pipeline run produced.
 *
 * <p>The anonymization map used during peer review is not part of the result; rankings are
 * reported by label only.
 *
 * @param queryId          id of the query
 * @param decision         routing decision
 * @param tools            tool invocations in catalog-priority order
 * @param stage1           every Stage1 response in selection order, failures included
 * @param peerRankings     Stage2 rankings, parseable or not
 * @param aggregateRanking aggregate over parseable rankings, best first
 * @param synthesis        Stage3 result, null when skipped or failed
 * @param verdict          Stage4 verdict, null when the judge did not run
 * @param finalAnswer      text returned to the user
 * @param degraded         true when the answer falls back to a raw Stage1 response
 * @param path             states visited, in order
 * @param costSummary      ledger totals for the query
 */
public record DeliberationResult(
        String queryId,
        IntentDecision decision,
        List<ToolInvocation> tools,
        List<ModelResponse> stage1,
        List<PeerRanking> peerRankings,
        List<AggregateRanking> aggregateRanking,
        SynthesisResult synthesis,
        JudgeVerdict verdict,
        String finalAnswer,
        boolean degraded,
        List<PipelineState> path,
        QueryCostSummary costSummary
) {

    public DeliberationResult {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(decision, "decision");
        tools = tools == null ? List.of() : List.copyOf(tools);
        stage1 = List.copyOf(stage1);
        peerRankings = peerRankings == null ? List.of() : List.copyOf(peerRankings);
        aggregateRanking = aggregateRanking == null ? List.of() : List.copyOf(aggregateRanking);
        Objects.requireNonNull(finalAnswer, "finalAnswer");
        path = List.copyOf(path);
    }

    public List<ModelResponse> successfulResponses() {
        return stage1.stream().filter(ModelResponse::success).toList();
    }
}
