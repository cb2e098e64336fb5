package com.phillippitts.council.service.pipeline;

import com.phillippitts.council.domain.FailureKind;
import com.phillippitts.council.domain.ModelResponse;
import com.phillippitts.council.exception.AdmissionDeniedException;
import com.phillippitts.council.exception.BackendFailureException;
import com.phillippitts.council.exception.ConfigurationException;
import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;
import com.phillippitts.council.service.governor.CallPurpose;
import com.phillippitts.council.service.governor.CostGovernor;
import com.phillippitts.council.service.governor.PricedCall;
import com.phillippitts.council.util.TimeUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.List;

/**
 * Makes one governed backend call on behalf of a stage and turns backend failures into failed
 * {@link ModelResponse}s. Admission denials propagate so that stages can tell budget
 * exhaustion apart from provider trouble.
 */
@Component
class BackendCaller {

    private static final Logger LOG = LogManager.getLogger(BackendCaller.class);

    private final CostGovernor governor;

    BackendCaller(CostGovernor governor) {
        this.governor = governor;
    }

    /**
     * @throws AdmissionDeniedException if the call would exceed a budget
     * @throws ConfigurationException   if no gateway is configured or the backend is unknown
     */
    ModelResponse call(RunContext ctx, CallPurpose purpose, String backendId, List<ChatMessage> messages,
                       CompletionParams params) {
        long t0 = System.nanoTime();
        try {
            return governor.call(new PricedCall(ctx.queryId(), ctx.query().workspace(), purpose, backendId,
                    messages, params)).toResponse(backendId);
        } catch (BackendFailureException e) {
            return ModelResponse.failure(backendId, e.getKind(), e.getMessage(), TimeUtils.elapsedMillis(t0));
        } catch (AdmissionDeniedException | ConfigurationException e) {
            throw e;
        } catch (RuntimeException e) {
            LOG.error("{} call to {} failed unexpectedly", purpose, backendId, e);
            return ModelResponse.failure(backendId, FailureKind.UNKNOWN,
                    e.getClass().getSimpleName() + ": " + e.getMessage(), TimeUtils.elapsedMillis(t0));
        }
    }
}
