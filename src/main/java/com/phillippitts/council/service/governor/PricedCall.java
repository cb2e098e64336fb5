package com.phillippitts.council.service.governor;

import com.phillippitts.council.service.gateway.ChatMessage;
import com.phillippitts.council.service.gateway.CompletionParams;

import java.util.List;
import java.util.Objects;

/**
 * A backend call submitted to the {@link CostGovernor}.
 *
 * @param queryId   query the call is charged to
 * @param workspace workspace of the query
 * @param purpose   stage or helper that makes the call
 * @param backendId target backend
 * @param messages  fully resolved prompt
 * @param params    generation parameters
 */
public record PricedCall(
        String queryId,
        String workspace,
        CallPurpose purpose,
        String backendId,
        List<ChatMessage> messages,
        CompletionParams params
) {

    public PricedCall {
        Objects.requireNonNull(queryId, "queryId");
        Objects.requireNonNull(purpose, "purpose");
        Objects.requireNonNull(backendId, "backendId");
        if (messages == null || messages.isEmpty()) {
            throw new IllegalArgumentException("messages must not be empty");
        }
        messages = List.copyOf(messages);
        Objects.requireNonNull(params, "params");
    }
}
