package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import com.phillippitts.council.service.governor.CallPurpose;
import com.phillippitts.council.service.governor.CostEstimator;
import com.phillippitts.council.util.LogSanitizer;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Keeps tool and RAG context within {@code council.pipeline.context-cap-tokens}.
 *
 * <p>Context above {@code council.pipeline.summarize-threshold-tokens} is summarized by the
 * low-cost summarizer backend; if that is not configured or fails, the context is truncated
 * instead. The result never exceeds the cap.
 */
@Component
class ContextCompressor {

    private static final Logger LOG = LogManager.getLogger(ContextCompressor.class);

    private final BackendCaller caller;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;

    ContextCompressor(BackendCaller caller, CouncilProperties councilProperties,
                      PipelineProperties pipelineProperties) {
        this.caller = caller;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
    }

    String compress(RunContext ctx, String context) {
        if (context == null || context.isBlank()) {
            return "";
        }
        int capChars = pipelineProperties.getContextCapTokens() * CostEstimator.CHARS_PER_TOKEN;
        int tokens = CostEstimator.estimateTokens(context);
        if (tokens <= pipelineProperties.getSummarizeThresholdTokens()) {
            return LogSanitizer.truncate(context, capChars);
        }
        String summarizer = councilProperties.getSummarizerBackend();
        if (summarizer == null || summarizer.isBlank()) {
            LOG.debug("No summarizer configured; truncating {} tokens of context", tokens);
            return LogSanitizer.truncate(context, capChars);
        }
        CompletionParams params = new CompletionParams(councilProperties.getSummaryMaxTokens(), 0.2,
                pipelineProperties.getStage1Timeout());
        try {
            ModelResponse summary = caller.call(ctx, CallPurpose.SUMMARIZE, summarizer,
                    List.of(ChatMessage.user(PromptTemplates.summarize(ctx.query().text(), context))), params);
            if (summary.success() && !summary.text().isBlank()) {
                LOG.debug("Context summarized from ~{} to ~{} tokens", tokens,
                        CostEstimator.estimateTokens(summary.text()));
                return LogSanitizer.truncate(summary.text().strip(), capChars);
            }
            LOG.warn("Context summarization failed (kind={}); truncating instead", summary.failureKind());
        } catch (AdmissionDeniedException e) {
            LOG.warn("Context summarization denied by budget; truncating instead: {}", e.getMessage());
        }
        return LogSanitizer.truncate(context, capChars);
    }
}
