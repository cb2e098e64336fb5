package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.domain.JudgeVerdict;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.ParseFailureException;
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
 * Stage4: an independent backend scores the final answer. Never fails the run; any problem
 * yields an unavailable verdict.
 */
@Component
class JudgeStage {

    private static final Logger LOG = LogManager.getLogger(JudgeStage.class);

    private final BackendCaller caller;
    private final StageFanOut fanOut;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;

    JudgeStage(BackendCaller caller, StageFanOut fanOut, CouncilProperties councilProperties,
               PipelineProperties pipelineProperties) {
        this.caller = caller;
        this.fanOut = fanOut;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * @param labels label map from Stage2, or null to label responses in selection order
     */
    JudgeVerdict judge(RunContext ctx, String judge, List<ModelResponse> successful, AnonymizationMap labels,
                       String finalAnswer) {
        AnonymizationMap map = labels != null
                ? labels
                : AnonymizationMap.assign(successful.stream().map(ModelResponse::backendId).toList(), false, 0L);
        List<String> responseLabels = successful.stream().map(r -> map.labelOf(r.backendId())).toList();
        String prompt = PromptTemplates.judge(ctx.query().text(), responseLabels, successful, finalAnswer);

        Duration deadline = pipelineProperties.getStage4Timeout();
        CompletionParams params = new CompletionParams(councilProperties.getMaxCompletionTokens(), 0.0, deadline);
        Map<String, ModelResponse> done = fanOut.run("Stage4", List.of(judge), backend -> {
            try {
                return caller.call(ctx, CallPurpose.STAGE4, backend, List.of(ChatMessage.user(prompt)), params);
            } catch (AdmissionDeniedException e) {
                return ModelResponse.failure(backend, FailureKind.ADMISSION_DENIED,
                        e.getMessage(), 0L);
            }
        }, backend -> ModelResponse.failure(backend, FailureKind.REJECTED, "council executor saturated", 0L),
                deadline, null);

        ModelResponse reply = done.get(judge);
        if (reply == null) {
            LOG.warn("Judge {} missed the {} ms deadline", judge, deadline.toMillis());
            return JudgeVerdict.unavailable(judge, "no verdict within " + deadline.toMillis() + " ms");
        }
        if (!reply.success()) {
            LOG.warn("Judge {} failed: kind={}", judge, reply.failureKind());
            return JudgeVerdict.unavailable(judge, "judge call failed: " + reply.failureKind());
        }
        try {
            JudgeVerdict verdict = VerdictParser.parse(judge, reply.text(), pipelineProperties.getJudgeApproveThreshold());
            LOG.info("Judge {} verdict: {} scores={}", judge, verdict.recommendation(), verdict.scores());
            return verdict;
        } catch (ParseFailureException e) {
            LOG.warn("Judge {} reply unparseable: {}", judge, e.getMessage());
            return JudgeVerdict.unavailable(judge, "unparseable verdict");
        }
    }
}
