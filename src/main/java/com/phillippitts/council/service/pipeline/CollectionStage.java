package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.config.properties.CouncilProperties;
import com.phillippitts.council.config.properties.PipelineProperties;
import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.domain.ModelResponse;
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
import java.util.concurrent.atomic.AtomicReference;

/**
 * Stage1: sends the augmented question to every selected backend concurrently.
 *
 * <p>Every selected backend appears exactly once in the outcome, in selection order: its
 * response, its failure, or a {@link FailureKind#STAGE_DEADLINE} failure when it missed the
 * stage deadline.
 */
@Component
class CollectionStage {

    private static final Logger LOG = LogManager.getLogger(CollectionStage.class);

    private final BackendCaller caller;
    private final StageFanOut fanOut;
    private final CouncilProperties councilProperties;
    private final PipelineProperties pipelineProperties;

    CollectionStage(BackendCaller caller, StageFanOut fanOut, CouncilProperties councilProperties,
                    PipelineProperties pipelineProperties) {
        this.caller = caller;
        this.fanOut = fanOut;
        this.councilProperties = councilProperties;
        this.pipelineProperties = pipelineProperties;
    }

    /**
     * Outcome of Stage1.
     *
     * @param responses one entry per selected backend, in selection order
     * @param denial    first admission denial seen, or null
     */
    record Outcome(List<ModelResponse> responses, AdmissionDeniedException denial) {

        List<ModelResponse> successful() {
            return responses.stream().filter(ModelResponse::success).toList();
        }
    }

    Outcome collect(RunContext ctx, String prompt) {
        Duration deadline = pipelineProperties.getStage1Timeout();
        CompletionParams params = new CompletionParams(councilProperties.getMaxCompletionTokens(),
                councilProperties.getTemperature(), deadline);
        List<ChatMessage> messages = List.of(ChatMessage.user(prompt));
        AtomicReference<AdmissionDeniedException> denial = new AtomicReference<>();
        List<String> backends = ctx.decision().backends();

        Map<String, ModelResponse> accepted = fanOut.run("Stage1", backends, backend -> {
            try {
                return caller.call(ctx, CallPurpose.STAGE1, backend, messages, params);
            } catch (AdmissionDeniedException e) {
                denial.compareAndSet(null, e);
                return ModelResponse.failure(backend, FailureKind.ADMISSION_DENIED, e.getMessage(), 0L);
            }
        }, backend -> ModelResponse.failure(backend, FailureKind.REJECTED, "council executor saturated", 0L),
                deadline, r -> ctx.emitter().emit(LifecycleEventType.STAGE1_RESPONSE,
                "backend", r.backendId(),
                "success", r.success(),
                "text", r.success() ? r.text() : null,
                "failureKind", r.success() ? null : r.failureKind().name(),
                "latencyMs", r.latencyMs(),
                "cost", r.cost(),
                "cached", r.cached()));

        List<ModelResponse> responses = new ArrayList<>(backends.size());
        for (String backend : backends) {
            ModelResponse r = accepted.get(backend);
            if (r == null) {
                r = ModelResponse.failure(backend, FailureKind.STAGE_DEADLINE,
                        "no response within " + deadline.toMillis() + " ms", deadline.toMillis());
            }
            if (!r.success()) {
                LOG.warn("Stage1 backend {} excluded: kind={}, error={}", backend, r.failureKind(), r.error());
            }
            responses.add(r);
        }
        return new Outcome(responses, denial.get());
    }
}
