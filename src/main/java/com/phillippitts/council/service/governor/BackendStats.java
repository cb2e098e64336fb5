package com.phillippitts.council.service.governor;

/**
 * Totals of one backend over a trailing window.
 *
 * @param successRate     successful calls over all calls, 0 when there were none
 * @param averageLatencyMs mean latency of all calls, failed ones included
 */
public record BackendStats(
        String backendId,
        double totalCost,
        int calls,
        int failedCalls,
        double successRate,
        double averageLatencyMs,
        long totalTokens
) {
}
