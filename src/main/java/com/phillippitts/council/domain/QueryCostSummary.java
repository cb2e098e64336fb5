package com.phillippitts.council.domain;

/**
 * Cost and latency totals of one query, derived from the ledger when the run ends.
 */
public record QueryCostSummary(
        String queryId,
        double totalCost,
        int pricedCalls,
        int failedCalls,
        long totalTokens,
        long elapsedMs
) {
}
