package com.phillippitts.council.service.gateway;

import com.phillippitts.council.exception.BackendFailureException;

import java.util.List;

/**
 * Uniform call contract to any model backend.
 *
 * <p>Backend ids are opaque strings resolved by the implementation. Implementations must be
 * thread-safe: the pipeline calls them concurrently from the council executor. They are never
 * called directly by pipeline code; every call goes through
 * {@link com.phillippitts.council.service.governor.CostGovernor}.
 */
public interface ModelGateway {

    /**
     * Sends the messages to the backend and waits for its completion.
     *
     * @param backendId opaque backend id, e.g. "openai/gpt-5.1"
     * @param messages  fully resolved conversation
     * @param params    generation parameters
     * @return completion text and token usage
     * @throws BackendFailureException if the call fails; {@link BackendFailureException#getKind()}
     *                                 classifies the failure
     */
    GatewayCompletion complete(String backendId, List<ChatMessage> messages, CompletionParams params);
}
