package com.phillippitts.council.service.governor;

import com.phillippitts.council.domain.FailureKind;

import java.time.Instant;
import java.util.List;

/**
 * Append-only record of one priced call. Never mutated after it is written.
 *
 * <p>{@code balances} holds the query and day balances immediately after this entry was
 * appended.
 */
public record LedgerEntry(
        long sequence,
        Instant timestamp,
        String queryId,
        String workspace,
        CallPurpose purpose,
        String backendId,
        int promptTokens,
        int completionTokens,
        long latencyMs,
        double cost,
        boolean success,
        FailureKind failureKind,
        List<BudgetBalance> balances
) {

    public LedgerEntry {
        balances = List.copyOf(balances);
    }

    public int totalTokens() {
        return promptTokens + completionTokens;
    }
}
