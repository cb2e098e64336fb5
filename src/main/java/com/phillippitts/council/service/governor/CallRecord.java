package com.phillippitts.council.service.governor;

import com.phillippitts.council.domain.FailureKind;

/**
 * Outcome of a dispatched call, handed to {@link CostLedger#record} to become a
 * {@link LedgerEntry}.
 */
record CallRecord(
        String workspace,
        CallPurpose purpose,
        String backendId,
        int promptTokens,
        int completionTokens,
        long latencyMs,
        double cost,
        boolean success,
        FailureKind failureKind
) {

    static CallRecord success(PricedCall call, int promptTokens, int completionTokens, long latencyMs, double cost) {
        return new CallRecord(call.workspace(), call.purpose(), call.backendId(),
                promptTokens, completionTokens, latencyMs, cost, true, null);
    }

    static CallRecord failure(PricedCall call, long latencyMs, FailureKind kind) {
        return new CallRecord(call.workspace(), call.purpose(), call.backendId(),
                0, 0, latencyMs, 0.0, false, kind);
    }
}
