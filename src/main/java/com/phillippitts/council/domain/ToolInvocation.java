package com.phillippitts.council.domain;

import java.util.Map;
import java.util.Objects;

/**
 * Result or failure of one tool call.
 *
 * @param toolId      catalog id of the tool
 * @param parameters  parameters the tool was invoked with
 * @param content     textual result; null on failure
 * @param failureKind failure kind; null on success
 * @param error       failure message; null on success
 * @param latencyMs   wall-clock latency
 * @param cost        cost reported by the tool (zero for non-priced tools)
 */
public record ToolInvocation(
        String toolId,
        Map<String, Object> parameters,
        String content,
        ToolFailureKind failureKind,
        String error,
        long latencyMs,
        double cost
) {

    public ToolInvocation {
        Objects.requireNonNull(toolId, "toolId");
        parameters = parameters == null ? Map.of() : Map.copyOf(parameters);
        if ((content == null) == (failureKind == null)) {
            throw new IllegalArgumentException("Exactly one of content or failureKind must be set for " + toolId);
        }
    }

    public static ToolInvocation success(String toolId, Map<String, Object> parameters, String content,
                                         long latencyMs, double cost) {
        return new ToolInvocation(toolId, parameters, content, null, null, latencyMs, cost);
    }

    public static ToolInvocation failure(String toolId, Map<String, Object> parameters, ToolFailureKind kind,
                                         String error, long latencyMs) {
        return new ToolInvocation(toolId, parameters, null, kind, error, latencyMs, 0.0);
    }

    public boolean success() {
        return failureKind == null;
    }
}
